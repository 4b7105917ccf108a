package com.aether.persistence;

/**
 * Base exception for documents that cannot be loaded.
 * 
 * Loading never yields a partially populated document: any of these aborts the load.
 */
public class DocumentFormatException extends Exception {
    
    private final String path;
    
    public DocumentFormatException(String message) {
        this(message, null, null);
    }
    
    public DocumentFormatException(String message, String path) {
        this(message, path, null);
    }
    
    public DocumentFormatException(String message, String path, Throwable cause) {
        super(path != null ? message + " at " + path : message, cause);
        this.path = path;
    }
    
    /**
     * Gets the location inside the document, e.g. {@code root.children[2].fields}.
     * 
     * @return the path, or null when the whole document is affected
     */
    public String getPath() {
        return path;
    }
}
