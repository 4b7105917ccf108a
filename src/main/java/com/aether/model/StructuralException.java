package com.aether.model;

import java.util.UUID;

/**
 * Base exception for rejected tree mutations.
 * 
 * Every structural check runs before the tree is touched, so a caller that
 * receives one of these can rely on the document being unchanged.
 */
public class StructuralException extends Exception {
    
    private final UUID nodeId;
    
    public StructuralException(String message, UUID nodeId) {
        super(message);
        this.nodeId = nodeId;
    }
    
    /**
     * Gets the node the failed operation addressed.
     * 
     * @return the node id, or null if not applicable
     */
    public UUID getNodeId() {
        return nodeId;
    }
}
