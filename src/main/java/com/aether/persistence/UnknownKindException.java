package com.aether.persistence;

/**
 * Thrown when a node record names a kind no factory is registered for.
 */
public class UnknownKindException extends DocumentFormatException {
    
    private final String kind;
    
    public UnknownKindException(String kind, String path) {
        super(String.format("Unknown node kind '%s'", kind), path);
        this.kind = kind;
    }
    
    public String getKind() {
        return kind;
    }
}
