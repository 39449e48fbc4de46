package com.syncpipeline.repository;

import com.syncpipeline.model.error.ProcessingError;
import lombok.Getter;

/**
 * Raised by stores that enforce unique record ids.
 */
@Getter
public class DuplicateKeyException extends StorageException {

    private final String key;

    public DuplicateKeyException(String key) {
        super("Duplicate key: " + key);
        this.key = key;
    }

    @Override
    public ProcessingError reason() {
        return new ProcessingError.DuplicateKey(key);
    }
}
