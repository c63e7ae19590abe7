package com.example.reference_oracle.error;

/**
 * The persisted state could not be read, decoded or written.
 */
public class StateStorageException extends RuntimeException {

    public StateStorageException(String message) {
        super(message);
    }

    public StateStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
