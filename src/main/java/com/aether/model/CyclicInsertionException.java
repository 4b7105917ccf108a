package com.aether.model;

import java.util.UUID;

/**
 * Thrown when a node would be moved under itself or one of its descendants.
 */
public class CyclicInsertionException extends StructuralException {
    
    public CyclicInsertionException(UUID nodeId, UUID targetParentId) {
        super(String.format("Node %s cannot be placed under its own descendant %s", nodeId, targetParentId), nodeId);
    }
}
