package com.aether.model;

import java.util.UUID;

/**
 * Thrown when an operation that needs a parent is applied to the root.
 */
public class RootOperationException extends StructuralException {
    
    public RootOperationException(UUID rootId, String operation) {
        super(String.format("Cannot %s the root node", operation), rootId);
    }
}
