package com.syncpipeline.repository;

import com.syncpipeline.model.error.ProcessingError;

/**
 * Raised by a {@link RecordStore} when a chunk could not be persisted.
 */
public class StorageException extends Exception {

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Storage-level reason for the failure.
     */
    public ProcessingError reason() {
        return new ProcessingError.StorageSaveFailed(this);
    }
}
