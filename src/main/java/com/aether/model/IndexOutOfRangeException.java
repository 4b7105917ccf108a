package com.aether.model;

import java.util.UUID;

/**
 * Thrown when an insertion index is past the end of a child list.
 */
public class IndexOutOfRangeException extends StructuralException {
    
    private final int index;
    private final int childCount;
    
    public IndexOutOfRangeException(UUID parentId, int index, int childCount) {
        super(String.format("Index %d is out of range for node %s with %d children",
            index, parentId, childCount), parentId);
        this.index = index;
        this.childCount = childCount;
    }
    
    public int getIndex() {
        return index;
    }
    
    public int getChildCount() {
        return childCount;
    }
}
