package com.koni.uns.domain.exception;

/**
 * Exception thrown when a storage call keeps failing with a retryable condition
 * (lock contention, locked database, disposed context) after the retry budget is spent.
 */
public class TransientStorageException extends RuntimeException {
    
    public TransientStorageException(String message) {
        super(message);
    }
    
    public TransientStorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
