package com.koni.uns.domain.exception;

/**
 * Exception thrown when an operation targets a connection, topic or namespace id
 * that is not known to the system.
 */
public class NotFoundException extends RuntimeException {
    
    public NotFoundException(String message) {
        super(message);
    }
    
    public NotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
