package com.aether.model;

/**
 * Thrown when a kind tag is registered twice.
 */
public class DuplicateKindException extends KindRegistrationException {
    
    public DuplicateKindException(String kind) {
        super("Node kind is already registered", kind);
    }
}
