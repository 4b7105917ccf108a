package com.aether.cli;

import com.aether.config.ConfigService;
import com.aether.model.Binding;
import com.aether.model.Document;
import com.aether.model.DocumentTemplates;
import com.aether.model.Node;
import com.aether.model.NodeRegistry;
import com.aether.persistence.DocumentSerializer;
import com.aether.persistence.ProjectStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the command line front end.
 */
public class AetherCliTest {

    @TempDir
    Path tempDir;

    private ByteArrayOutputStream buffer;
    private AetherCli cli;

    @BeforeEach
    void setUp() throws Exception {
        buffer = new ByteArrayOutputStream();
        cli = new AetherCli(new PrintStream(buffer, true, StandardCharsets.UTF_8));
        writeConfig("{\"fragmentValidation\": false}");
    }

    @Test
    void testNoArguments_PrintsUsage() {
        assertEquals(AetherCli.USAGE, cli.run(new String[0]));
        assertTrue(output().contains("Usage:"));
    }

    @Test
    void testUnknownCommandAndOption() {
        assertEquals(AetherCli.USAGE, cli.run(new String[] {"publish", "app.aether.json"}));
        assertTrue(output().contains("Unknown command: publish"));
        assertEquals(AetherCli.USAGE, cli.run(new String[] {"export", "app.aether.json", "--force"}));
        assertTrue(output().contains("Unknown option: --force"));
    }

    @Test
    void testNew_CreatesProjectFromTemplate() throws Exception {
        Path file = tempDir.resolve("form" + ProjectStore.EXTENSION);

        int code = cli.run(new String[] {"new", "form", file.toString()});

        assertEquals(ExportCommand.OK, code);
        assertTrue(Files.isRegularFile(file));
        assertTrue(output().contains("from template 'form'"));
    }

    @Test
    void testNew_UnknownTemplate() {
        int code = cli.run(new String[] {"new", "wizard", tempDir.resolve("x.aether.json").toString()});

        assertEquals(AetherCli.USAGE, code);
        assertTrue(output().contains("Available: empty, counter, form, dashboard"));
    }

    @Test
    void testCheck_CleanAndProblems() throws Exception {
        Path clean = save("clean", DocumentTemplates.counterApp(NodeRegistry.standard()));
        assertEquals(ExportCommand.OK, cli.run(new String[] {"check", clean.toString()}));
        assertTrue(output().contains("No problems found"));

        Path broken = save("broken", dangling());
        assertEquals(ExportCommand.WARNINGS, cli.run(new String[] {"check", broken.toString()}));
        assertTrue(output().contains("DANGLING_BINDING"));
        assertTrue(output().contains("1 problem(s) found"));
    }

    @Test
    void testCheck_MissingFile() {
        int code = cli.run(new String[] {"check", tempDir.resolve("gone.aether.json").toString()});

        assertEquals(ExportCommand.FAILED, code);
        assertTrue(output().contains("Cannot load"));
    }

    @Test
    void testExport_DefaultsToConfiguredDirectory() throws Exception {
        writeConfig("{\"fragmentValidation\": false, \"exportDirectory\": \"web\"}");
        Path file = save("app", DocumentTemplates.counterApp(NodeRegistry.standard()));

        int code = cli.run(new String[] {"export", file.toString()});

        assertEquals(ExportCommand.OK, code);
        assertTrue(Files.isRegularFile(tempDir.resolve("web/src/main.js")));
        assertTrue(output().contains("Exported to"));
    }

    @Test
    void testExport_ExplicitDirectoryAndStrict() throws Exception {
        Path file = save("broken", dangling());
        Path out = tempDir.resolve("explicit");

        int code = cli.run(new String[] {"export", file.toString(), out.toString(), "--strict"});

        assertEquals(ExportCommand.WARNINGS, code);
        assertTrue(Files.isRegularFile(out.resolve("package.json")));
        assertTrue(output().contains("Export finished with code 2"));
    }

    @Test
    void testInvalidConfiguration() throws Exception {
        writeConfig("{\"historyCapacity\": 0}");
        Path file = save("app", DocumentTemplates.counterApp(NodeRegistry.standard()));

        int code = cli.run(new String[] {"check", file.toString()});

        assertEquals(ExportCommand.FAILED, code);
        assertTrue(output().contains("Invalid configuration"));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void testValidate_RunsConfiguredCommand() throws Exception {
        Path file = save("app", DocumentTemplates.counterApp(NodeRegistry.standard()));

        writeConfig("{\"fragmentValidation\": false, \"validationCommand\": \"true\"}");
        assertEquals(ExportCommand.OK, cli.run(new String[] {"validate", file.toString()}));
        assertTrue(output().contains("Validation passed"));

        writeConfig("{\"fragmentValidation\": false, \"validationCommand\": \"false\"}");
        assertEquals(ExportCommand.FAILED, cli.run(new String[] {"validate", file.toString()}));
        assertTrue(output().contains("Validation failed"));
    }

    private Document dangling() throws Exception {
        Document document = DocumentTemplates.counterApp(NodeRegistry.standard());
        Node label = document.tree().root().children().get(1);
        document.tree().setBinding(label.getId(), "text", Binding.variable("missing"));
        return document;
    }

    private Path save(String name, Document document) throws Exception {
        Path file = tempDir.resolve(name + ProjectStore.EXTENSION);
        new ProjectStore(new DocumentSerializer(NodeRegistry.standard()), tempDir).save(document, file);
        return file;
    }

    private void writeConfig(String json) throws Exception {
        Files.writeString(tempDir.resolve(ConfigService.FILE_NAME), json);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }
}
