package com.koni.uns.domain.exception;

/**
 * Exception thrown when a storage call fails with a non-retryable error.
 * It is propagated to the caller without any retry attempt.
 */
public class FatalStorageException extends RuntimeException {
    
    public FatalStorageException(String message) {
        super(message);
    }
    
    public FatalStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
