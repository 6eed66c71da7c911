package com.koni.uns.domain.exception;

/**
 * Exception thrown when a configuration or request is rejected before any state change.
 * Covers malformed connection configurations, duplicate ids, unsupported connection types
 * and hierarchy paths that reference undefined levels.
 */
public class ValidationException extends RuntimeException {
    
    public ValidationException(String message) {
        super(message);
    }
    
    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
