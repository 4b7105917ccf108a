package com.aether.model;

/**
 * Thrown when attempting to register after the registry is frozen.
 */
public class RegistryFrozenException extends KindRegistrationException {
    
    public RegistryFrozenException(String kind) {
        super("Node registry is frozen - no further registrations allowed", kind);
    }
}
