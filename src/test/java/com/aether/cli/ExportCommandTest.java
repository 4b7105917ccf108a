package com.aether.cli;

import com.aether.assets.AssetType;
import com.aether.binding.FragmentValidator;
import com.aether.codegen.CodeGenerator;
import com.aether.model.Binding;
import com.aether.model.Document;
import com.aether.model.DocumentTemplates;
import com.aether.model.Node;
import com.aether.model.NodeRegistry;
import com.aether.model.PropertyValue;
import com.aether.persistence.DocumentSerializer;
import com.aether.persistence.ProjectStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ExportCommand.
 */
public class ExportCommandTest {

    @TempDir
    Path tempDir;

    private final NodeRegistry registry = NodeRegistry.standard();
    private ProjectStore store;
    private CodeGenerator generator;
    private Path outputDir;

    @BeforeEach
    void setUp() {
        store = new ProjectStore(new DocumentSerializer(registry), tempDir);
        generator = new CodeGenerator(FragmentValidator.permissive());
        outputDir = tempDir.resolve("out");
    }

    @Test
    void testExport_WritesProject() throws Exception {
        Path projectFile = save(DocumentTemplates.counterApp(registry));

        int code = new ExportCommand(store, generator, projectFile, outputDir, false, false).call();

        assertEquals(ExportCommand.OK, code);
        assertTrue(Files.isRegularFile(outputDir.resolve("package.json")));
        assertTrue(Files.readString(outputDir.resolve(CodeGenerator.ENTRY_MODULE)).contains("state.onButton1Clicked();"));
        assertTrue(Files.readString(outputDir.resolve(CodeGenerator.STATE_MODULE)).contains("this.counter = 0;"));
    }

    @Test
    void testExport_DryRunWritesNothing() throws Exception {
        Path projectFile = save(DocumentTemplates.counterApp(registry));

        int code = new ExportCommand(store, generator, projectFile, outputDir, true, false).call();

        assertEquals(ExportCommand.OK, code);
        assertFalse(Files.exists(outputDir));
    }

    @Test
    void testExport_MissingProject() {
        int code = new ExportCommand(store, generator, tempDir.resolve("nope.aether.json"), outputDir, false, false)
            .call();

        assertEquals(ExportCommand.FAILED, code);
    }

    @Test
    void testExport_OutputPathIsAFile() throws Exception {
        Path projectFile = save(DocumentTemplates.counterApp(registry));
        Files.writeString(outputDir, "taken");

        int code = new ExportCommand(store, generator, projectFile, outputDir, false, false).call();

        assertEquals(ExportCommand.FAILED, code);
    }

    @Test
    void testExport_StrictReportsWarnings() throws Exception {
        Document document = DocumentTemplates.counterApp(registry);
        Node label = document.tree().root().children().get(1);
        document.tree().setBinding(label.getId(), "text", Binding.variable("missing"));
        Path projectFile = save(document);

        assertEquals(ExportCommand.OK,
            new ExportCommand(store, generator, projectFile, outputDir, false, false).call());
        assertEquals(ExportCommand.WARNINGS,
            new ExportCommand(store, generator, projectFile, tempDir.resolve("strict"), false, true).call());
        assertTrue(Files.exists(tempDir.resolve("strict").resolve(CodeGenerator.ENTRY_MODULE)));
    }

    @Test
    void testExport_CopiesAssets() throws Exception {
        Files.createDirectories(tempDir.resolve("images"));
        Files.write(tempDir.resolve("images/logo.png"), new byte[] {1, 2, 3});
        Path projectFile = save(withLogo());

        int code = new ExportCommand(store, generator, projectFile, outputDir, false, true).call();

        assertEquals(ExportCommand.OK, code);
        assertArrayEquals(new byte[] {1, 2, 3}, Files.readAllBytes(outputDir.resolve("assets/logo.png")));
    }

    @Test
    void testExport_MissingAssetSourceIsSkipped() throws Exception {
        Path projectFile = save(withLogo());

        int code = new ExportCommand(store, generator, projectFile, outputDir, false, false).call();

        assertEquals(ExportCommand.OK, code);
        assertTrue(Files.isRegularFile(outputDir.resolve("package.json")));
        assertTrue(Files.isRegularFile(outputDir.resolve(CodeGenerator.ENTRY_MODULE)));
        assertTrue(Files.isRegularFile(outputDir.resolve(CodeGenerator.STATE_MODULE)));
        assertFalse(Files.exists(outputDir.resolve("assets/logo.png")));
    }

    @Test
    void testExport_MissingAssetSourceIsAWarningWhenStrict() throws Exception {
        Path projectFile = save(withLogo());

        assertEquals(ExportCommand.WARNINGS,
            new ExportCommand(store, generator, projectFile, outputDir, false, true).call());
        assertTrue(Files.isRegularFile(outputDir.resolve(CodeGenerator.STATE_MODULE)));
        assertEquals(ExportCommand.WARNINGS,
            new ExportCommand(store, generator, projectFile, tempDir.resolve("dry"), true, true).call());
        assertFalse(Files.exists(tempDir.resolve("dry")));
    }

    private Document withLogo() throws Exception {
        Document document = DocumentTemplates.counterApp(registry);
        document.assets().add("logo", AssetType.IMAGE, "images/logo.png");
        Node image = registry.create("image");
        image.setProperty("asset", PropertyValue.ofAsset("logo"));
        document.tree().appendChild(document.tree().root().getId(), image);
        return document;
    }

    private Path save(Document document) throws Exception {
        Path file = tempDir.resolve("app" + ProjectStore.EXTENSION);
        store.save(document, file);
        return file;
    }
}
