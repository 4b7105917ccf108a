package com.aether.model;

import java.util.UUID;

/**
 * Thrown when a subtree carries an id that is already used in the tree.
 */
public class DuplicateNodeIdException extends StructuralException {
    
    public DuplicateNodeIdException(UUID nodeId) {
        super("Node id is already present in the tree: " + nodeId, nodeId);
    }
}
