package com.aether.model;

/**
 * Base exception for node kind registration failures.
 */
public class KindRegistrationException extends RuntimeException {
    
    public KindRegistrationException(String message) {
        super(message);
    }
    
    public KindRegistrationException(String message, String kind) {
        super(message + " (kind: " + kind + ")");
    }
}
