package com.koni.uns.domain.exception;

/**
 * Exception thrown when outbound data is routed to a connection that is not Connected.
 */
public class NotConnectedException extends RuntimeException {
    
    public NotConnectedException(String message) {
        super(message);
    }
    
    public NotConnectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
