package com.syncpipeline.model.error;

/**
 * Structural defect found in one record before any side effect.
 * {@code index} is the record's position in the submitted batch.
 */
public sealed interface ValidationError extends PipelineError {

    int index();

    record InvalidFormat(int index) implements ValidationError {
        @Override
        public String description() {
            return "Invalid record format at index " + index;
        }
    }

    record MissingField(String fieldName, int index) implements ValidationError {
        @Override
        public String description() {
            return "Missing required field '" + fieldName + "' at index " + index;
        }
    }

    record InvalidDate(String rawValue, int index) implements ValidationError {
        @Override
        public String description() {
            return "Invalid date format '" + rawValue + "' at index " + index;
        }
    }

    record InvalidEmail(String rawValue, int index) implements ValidationError {
        @Override
        public String description() {
            return "Invalid email address '" + rawValue + "' at index " + index;
        }
    }
}
