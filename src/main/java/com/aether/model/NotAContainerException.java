package com.aether.model;

import java.util.UUID;

/**
 * Thrown when children are added under a node whose kind has none.
 */
public class NotAContainerException extends StructuralException {
    
    public NotAContainerException(UUID nodeId, String kind) {
        super(String.format("Node %s of kind '%s' cannot hold children", nodeId, kind), nodeId);
    }
}
