package com.aether.assets;

/**
 * Kinds of external resources a project can reference.
 */
public enum AssetType {
    IMAGE("image"),
    AUDIO("audio"),
    DATA("data");
    
    private final String wireName;
    
    AssetType(String wireName) {
        this.wireName = wireName;
    }
    
    public String wireName() {
        return wireName;
    }
    
    public static AssetType fromWireName(String wireName) {
        for (AssetType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown asset type: " + wireName);
    }
}
