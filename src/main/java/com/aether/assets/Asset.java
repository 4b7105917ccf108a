package com.aether.assets;

import java.nio.file.Path;
import java.util.Objects;
import java.util.UUID;

/**
 * A named reference to a file outside the document.
 */
public record Asset(
    UUID id,
    String name,
    AssetType type,
    String path
) {
    
    public Asset {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(path, "path");
    }
    
    /**
     * Gets the file name component of the source path.
     * 
     * @return file name, or the asset name if the path has none
     */
    public String fileName() {
        Path fileName = Path.of(path).getFileName();
        return fileName != null ? fileName.toString() : name;
    }
}
