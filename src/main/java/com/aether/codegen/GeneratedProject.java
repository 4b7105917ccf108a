package com.aether.codegen;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The output of one generation run: source files keyed by relative path, assets to
 * copy alongside them, and the report of everything that degraded.
 *
 * Values are immutable and safe to hand to another thread.
 */
public final class GeneratedProject {

    private static final Logger LOGGER = LoggerFactory.getLogger(GeneratedProject.class);

    private final Map<String, String> files;
    private final List<AssetCopy> assets;
    private final GenerationReport report;

    public GeneratedProject(Map<String, String> files, List<AssetCopy> assets, GenerationReport report) {
        this.files = Collections.unmodifiableMap(new LinkedHashMap<>(files));
        this.assets = List.copyOf(assets);
        this.report = report;
    }

    /**
     * Gets the generated files in output order.
     *
     * @return relative path to file content
     */
    public Map<String, String> files() {
        return files;
    }

    public Optional<String> file(String path) {
        return Optional.ofNullable(files.get(path));
    }

    public List<String> paths() {
        return new ArrayList<>(files.keySet());
    }

    public List<AssetCopy> assets() {
        return assets;
    }

    public GenerationReport report() {
        return report;
    }

    /**
     * Writes the source files below a directory, creating it as needed. Assets are not copied.
     *
     * @param directory the output directory
     * @return the written paths
     * @throws IOException if a file cannot be written
     */
    public List<Path> writeFiles(Path directory) throws IOException {
        List<Path> written = new ArrayList<>();
        for (Map.Entry<String, String> entry : files.entrySet()) {
            Path target = directory.resolve(entry.getKey()).normalize();
            if (!target.startsWith(directory.normalize())) {
                throw new IOException("Refusing to write outside the output directory: " + entry.getKey());
            }
            Files.createDirectories(target.getParent());
            Files.writeString(target, entry.getValue(), StandardCharsets.UTF_8);
            written.add(target);
            LOGGER.debug("Wrote {}", target);
        }
        return written;
    }
}
