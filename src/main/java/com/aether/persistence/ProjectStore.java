package com.aether.persistence;

import com.aether.model.Document;
import com.aether.variables.Identifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Handles project files on disk.
 *
 * Projects live in a directory as {@code <name>.aether.json}. Individual files can
 * also be saved and loaded by path. Saves go through a temporary file so a crash
 * mid-write never truncates an existing project.
 */
public class ProjectStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProjectStore.class);

    public static final String EXTENSION = ".aether.json";

    private final DocumentSerializer serializer;
    private final Path directory;

    /**
     * Creates a store for the given directory.
     *
     * @param serializer the document serializer
     * @param directory base directory for project files
     */
    public ProjectStore(DocumentSerializer serializer, Path directory) {
        this.serializer = serializer;
        this.directory = directory;
    }

    public Path directory() {
        return directory;
    }

    /**
     * Gets the file a named project is stored in.
     *
     * @param projectName the project name
     * @return the file path
     */
    public Path pathFor(String projectName) {
        return directory.resolve(Identifiers.packageName(projectName) + EXTENSION);
    }

    /**
     * Saves a document under its project name.
     *
     * @param document the document
     * @return the written file
     * @throws IOException if the file cannot be written
     */
    public Path save(Document document) throws IOException {
        Path file = pathFor(document.getProjectName());
        save(document, file);
        return file;
    }

    /**
     * Saves a document to a file.
     *
     * @param document the document
     * @param file target file
     * @throws IOException if the file cannot be written
     */
    public void save(Document document, Path file) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = Files.createTempFile(parent, file.getFileName().toString(), ".tmp");
        try {
            Files.write(temp, serializer.serialize(document));
            Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
            LOGGER.info("Saved project '{}' to {}", document.getProjectName(), file);
        } catch (IOException e) {
            Files.deleteIfExists(temp);
            LOGGER.error("Failed to save project '{}' to {}: {}", document.getProjectName(), file, e.getMessage());
            throw e;
        }
    }

    /**
     * Loads a named project from the store directory.
     *
     * @param projectName the project name
     * @return the document
     * @throws IOException if the file cannot be read
     * @throws DocumentFormatException if the file is not a valid document
     */
    public Document load(String projectName) throws IOException, DocumentFormatException {
        return load(pathFor(projectName));
    }

    /**
     * Loads a project file.
     *
     * @param file the file
     * @return the document
     * @throws NoSuchFileException if the file does not exist
     * @throws IOException if the file cannot be read
     * @throws DocumentFormatException if the file is not a valid document
     */
    public Document load(Path file) throws IOException, DocumentFormatException {
        byte[] data = Files.readAllBytes(file);
        try {
            Document document = serializer.deserialize(data);
            LOGGER.info("Loaded project '{}' from {}", document.getProjectName(), file);
            return document;
        } catch (DocumentFormatException e) {
            LOGGER.error("Failed to load {}: {}", file, e.getMessage());
            throw e;
        }
    }

    /**
     * Lists the project files in the store directory.
     *
     * @return file names without extension, sorted
     * @throws IOException if the directory cannot be read
     */
    public List<String> list() throws IOException {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        List<String> names = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + EXTENSION)) {
            for (Path file : stream) {
                String fileName = file.getFileName().toString();
                names.add(fileName.substring(0, fileName.length() - EXTENSION.length()));
            }
        }
        Collections.sort(names);
        return names;
    }

    /**
     * Deletes a named project.
     *
     * @param projectName the project name
     * @return true if a file was deleted
     * @throws IOException if deletion fails
     */
    public boolean delete(String projectName) throws IOException {
        boolean deleted = Files.deleteIfExists(pathFor(projectName));
        if (deleted) {
            LOGGER.info("Deleted project '{}'", projectName);
        }
        return deleted;
    }
}
