package com.aether.persistence;

/**
 * Thrown when a node record fails its kind's field schema.
 */
public class MalformedFieldsException extends DocumentFormatException {
    
    private final String kind;
    
    public MalformedFieldsException(String kind, String message, String path) {
        super(String.format("Malformed fields for kind '%s': %s", kind, message), path);
        this.kind = kind;
    }
    
    public MalformedFieldsException(String kind, String message, String path, Throwable cause) {
        super(String.format("Malformed fields for kind '%s': %s", kind, message), path, cause);
        this.kind = kind;
    }
    
    public String getKind() {
        return kind;
    }
}
