package com.aether.assets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Name-keyed registry of the assets a document refers to.
 */
public class AssetRegistry {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(AssetRegistry.class);
    
    private final Map<String, Asset> assets = new TreeMap<>();
    
    /**
     * Adds or replaces an asset.
     * 
     * @param name the lookup name
     * @param type the asset kind
     * @param path source path of the resource
     * @return the stored asset
     */
    public Asset add(String name, AssetType type, String path) {
        return add(new Asset(UUID.randomUUID(), name, type, path));
    }
    
    public Asset add(Asset asset) {
        if (asset.name().isBlank()) {
            throw new IllegalArgumentException("Asset name must not be blank");
        }
        Asset previous = assets.put(asset.name(), asset);
        if (previous != null) {
            LOGGER.debug("Replaced asset {} ({} -> {})", asset.name(), previous.path(), asset.path());
        }
        return asset;
    }
    
    public Optional<Asset> remove(String name) {
        return Optional.ofNullable(assets.remove(name));
    }
    
    public Optional<Asset> get(String name) {
        return Optional.ofNullable(assets.get(name));
    }
    
    public boolean contains(String name) {
        return assets.containsKey(name);
    }
    
    /**
     * Lists the image assets in name order.
     * 
     * @return image assets
     */
    public List<Asset> images() {
        List<Asset> images = new ArrayList<>();
        for (Asset asset : assets.values()) {
            if (asset.type() == AssetType.IMAGE) {
                images.add(asset);
            }
        }
        return images;
    }
    
    public List<String> names() {
        return new ArrayList<>(assets.keySet());
    }
    
    public List<Asset> all() {
        return new ArrayList<>(assets.values());
    }
    
    public int size() {
        return assets.size();
    }
    
    public AssetRegistry copy() {
        AssetRegistry copy = new AssetRegistry();
        copy.assets.putAll(assets);
        return copy;
    }
}
