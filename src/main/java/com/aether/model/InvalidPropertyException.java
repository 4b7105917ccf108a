package com.aether.model;

import java.util.UUID;

/**
 * Thrown when a property, binding or action edit does not fit the node's kind.
 */
public class InvalidPropertyException extends StructuralException {
    
    private final String property;
    
    public InvalidPropertyException(UUID nodeId, String property, String reason) {
        super(String.format("Invalid edit of '%s' on node %s: %s", property, nodeId, reason), nodeId);
        this.property = property;
    }
    
    public String getProperty() {
        return property;
    }
}
