package com.aether.model;

import java.util.UUID;

/**
 * Thrown when an id does not address a node of the tree.
 */
public class NodeNotFoundException extends StructuralException {
    
    public NodeNotFoundException(UUID nodeId) {
        super("No node with id " + nodeId, nodeId);
    }
}
