package com.aether.codegen;

/**
 * An asset file the exported project needs next to its sources.
 *
 * @param assetName registry name of the asset
 * @param sourcePath path the asset was registered with
 * @param targetPath path inside the generated project
 */
public record AssetCopy(
    String assetName,
    String sourcePath,
    String targetPath
) {}
