package com.aether.cli;

import com.aether.binding.Diagnostic;
import com.aether.binding.DiagnosticCode;
import com.aether.codegen.AssetCopy;
import com.aether.codegen.CodeGenerator;
import com.aether.codegen.GeneratedProject;
import com.aether.model.Document;
import com.aether.persistence.DocumentFormatException;
import com.aether.persistence.ProjectStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Exports a saved project as a runnable browser project.
 *
 * Exit codes: 0 on success, 1 when the project cannot be loaded or written, 2 when
 * {@code strict} is set and generation or asset copying reported warnings. Asset paths
 * in the project are resolved against the directory of the project file; an asset
 * whose file is missing is skipped with a {@code MISSING_ASSET} warning.
 */
public class ExportCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ExportCommand.class);

    public static final int OK = 0;
    public static final int FAILED = 1;
    public static final int WARNINGS = 2;

    private final ProjectStore store;
    private final CodeGenerator generator;
    private final Path projectFile;
    private final Path outputDir;
    private final boolean dryRun;
    private final boolean strict;

    public ExportCommand(
            ProjectStore store,
            CodeGenerator generator,
            Path projectFile,
            Path outputDir,
            boolean dryRun,
            boolean strict) {
        this.store = store;
        this.generator = generator;
        this.projectFile = projectFile;
        this.outputDir = outputDir;
        this.dryRun = dryRun;
        this.strict = strict;
    }

    @Override
    public Integer call() {
        LOGGER.info("Exporting {} to {}", projectFile, outputDir);

        GeneratedProject project;
        try {
            Document document = store.load(projectFile);
            project = generator.generate(document);
        } catch (IOException | DocumentFormatException e) {
            LOGGER.error("Cannot load {}: {}", projectFile, e.getMessage());
            return FAILED;
        }

        for (Diagnostic diagnostic : project.report().diagnostics()) {
            LOGGER.warn("{}", diagnostic);
        }

        List<Diagnostic> assetProblems = new ArrayList<>();
        if (dryRun) {
            for (Map.Entry<String, String> file : project.files().entrySet()) {
                LOGGER.info("Would write: {} ({} chars)", outputDir.resolve(file.getKey()), file.getValue().length());
            }
            for (AssetCopy asset : project.assets()) {
                Path source = sourceOf(asset);
                if (Files.isRegularFile(source)) {
                    LOGGER.info("Would copy: {} -> {}", source, outputDir.resolve(asset.targetPath()));
                } else {
                    assetProblems.add(missing(asset, source));
                }
            }
            LOGGER.info("Dry run completed - no files were written");
        } else {
            try {
                createOutputDirectory();
                project.writeFiles(outputDir);
                assetProblems.addAll(copyAssets(project));
            } catch (IOException e) {
                LOGGER.error("Export failed: {}", e.getMessage());
                return FAILED;
            }
            LOGGER.info("Export completed. Wrote {} files and {} of {} assets to {}",
                project.files().size(), project.assets().size() - assetProblems.size(),
                project.assets().size(), outputDir);
        }

        if (strict && !project.report().isClean()) {
            LOGGER.error("Generated with warnings: {}", project.report().flags());
            return WARNINGS;
        }
        if (strict && !assetProblems.isEmpty()) {
            LOGGER.error("{} asset(s) could not be copied", assetProblems.size());
            return WARNINGS;
        }
        return OK;
    }

    private void createOutputDirectory() throws IOException {
        if (Files.exists(outputDir)) {
            if (!Files.isDirectory(outputDir)) {
                throw new IOException("Output path exists but is not a directory: " + outputDir);
            }
        } else {
            Files.createDirectories(outputDir);
            LOGGER.debug("Created output directory: {}", outputDir);
        }
    }

    private List<Diagnostic> copyAssets(GeneratedProject project) throws IOException {
        List<Diagnostic> problems = new ArrayList<>();
        for (AssetCopy asset : project.assets()) {
            Path source = sourceOf(asset);
            Path target = outputDir.resolve(asset.targetPath()).normalize();
            if (!target.startsWith(outputDir.normalize())) {
                throw new IOException("Refusing to copy outside the output directory: " + asset.targetPath());
            }
            if (!Files.isRegularFile(source)) {
                problems.add(missing(asset, source));
                continue;
            }
            Files.createDirectories(target.getParent());
            Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
            LOGGER.debug("Copied asset {} -> {}", source, target);
        }
        return problems;
    }

    private Path sourceOf(AssetCopy asset) {
        return projectFile.toAbsolutePath().getParent().resolve(asset.sourcePath());
    }

    private static Diagnostic missing(AssetCopy asset, Path source) {
        Diagnostic diagnostic = Diagnostic.warn(DiagnosticCode.MISSING_ASSET,
            String.format("Asset '%s' not found at %s", asset.assetName(), source)).at(null, asset.assetName());
        LOGGER.warn("{}", diagnostic);
        return diagnostic;
    }
}
