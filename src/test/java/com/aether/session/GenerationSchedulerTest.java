package com.aether.session;

import com.aether.binding.FragmentValidator;
import com.aether.codegen.CodeGenerator;
import com.aether.codegen.GeneratedProject;
import com.aether.config.DesignerConfig;
import com.aether.model.Document;
import com.aether.model.DocumentTemplates;
import com.aether.model.NodeRegistry;
import com.aether.model.PropertyValue;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GenerationScheduler.
 */
public class GenerationSchedulerTest {

    private GenerationScheduler scheduler;

    @AfterEach
    void tearDown() {
        if (scheduler != null) {
            scheduler.close();
        }
    }

    @Test
    void testRequest_Completes() throws Exception {
        scheduler = new GenerationScheduler(new CodeGenerator(FragmentValidator.permissive()), 0);
        Document document = DocumentTemplates.counterApp(NodeRegistry.standard());

        GeneratedProject project = scheduler.request(document).get(10, TimeUnit.SECONDS);

        assertTrue(project.file(CodeGenerator.STATE_MODULE).orElseThrow().contains("onButton1Clicked"));
    }

    @Test
    void testFromConfig_UsesConfiguredDebounce() throws Exception {
        DesignerConfig defaults = DesignerConfig.defaults();
        DesignerConfig config = new DesignerConfig(defaults.historyCapacity(), 0, defaults.validationCommand(),
            defaults.validationTimeoutSeconds(), defaults.exportDirectory(), false);
        scheduler = GenerationScheduler.fromConfig(new CodeGenerator(FragmentValidator.permissive()), config);

        GeneratedProject project = scheduler.request(DocumentTemplates.counterApp(NodeRegistry.standard()))
            .get(10, TimeUnit.SECONDS);

        assertEquals(3, project.files().size());
    }

    @Test
    void testNewerRequest_SupersedesOlder() throws Exception {
        scheduler = new GenerationScheduler(new CodeGenerator(FragmentValidator.permissive()), 500);
        Document document = DocumentTemplates.counterApp(NodeRegistry.standard());
        UUID headingId = document.tree().root().children().get(0).getId();

        CompletableFuture<GeneratedProject> first = scheduler.request(document);
        document.tree().setProperty(headingId, "text", PropertyValue.ofString("Second"));
        CompletableFuture<GeneratedProject> second = scheduler.request(document);

        GeneratedProject latest = second.get(10, TimeUnit.SECONDS);
        assertTrue(first.isCancelled());
        assertTrue(latest.file(CodeGenerator.ENTRY_MODULE).orElseThrow().contains("'Second'"));
    }

    @Test
    void testRequest_WorksOnSnapshot() throws Exception {
        scheduler = new GenerationScheduler(new CodeGenerator(FragmentValidator.permissive()), 200);
        Document document = DocumentTemplates.counterApp(NodeRegistry.standard());
        UUID headingId = document.tree().root().children().get(0).getId();

        CompletableFuture<GeneratedProject> future = scheduler.request(document);
        document.tree().setProperty(headingId, "text", PropertyValue.ofString("Edited later"));

        String main = future.get(10, TimeUnit.SECONDS).file(CodeGenerator.ENTRY_MODULE).orElseThrow();
        assertTrue(main.contains("'Counter App'"));
        assertFalse(main.contains("Edited later"));
    }

    @Test
    void testCancelPending() {
        scheduler = new GenerationScheduler(new CodeGenerator(FragmentValidator.permissive()), 5000);

        CompletableFuture<GeneratedProject> future =
            scheduler.request(DocumentTemplates.empty(NodeRegistry.standard()));
        scheduler.cancelPending();

        assertTrue(future.isCancelled());
    }

    @Test
    void testNegativeDebounce() {
        assertThrows(IllegalArgumentException.class,
            () -> new GenerationScheduler(new CodeGenerator(FragmentValidator.permissive()), -1));
    }
}
