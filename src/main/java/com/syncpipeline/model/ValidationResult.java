package com.syncpipeline.model;

import com.syncpipeline.model.error.ValidationError;

import java.util.List;

/**
 * Outcome of validating a whole batch. Valid exactly when there are no errors.
 */
public record ValidationResult(List<ValidationError> errors) {

    public ValidationResult {
        errors = List.copyOf(errors);
    }

    public boolean isValid() {
        return errors.isEmpty();
    }
}
