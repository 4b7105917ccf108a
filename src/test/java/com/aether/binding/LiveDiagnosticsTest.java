package com.aether.binding;

import com.aether.model.Binding;
import com.aether.model.Document;
import com.aether.model.DocumentTemplates;
import com.aether.model.Node;
import com.aether.model.NodeEvent;
import com.aether.model.NodeRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Unit tests for LiveDiagnostics.
 */
public class LiveDiagnosticsTest {

    private FragmentValidator validator;
    private LiveDiagnostics diagnostics;
    private Document document;

    @BeforeEach
    void setUp() {
        validator = mock(FragmentValidator.class);
        diagnostics = new LiveDiagnostics(new BindingResolver(validator));
        document = DocumentTemplates.counterApp(NodeRegistry.standard());
    }

    @Test
    void testRefresh_CleanDocument() {
        assertTrue(diagnostics.refresh(document).isEmpty());
        assertEquals(0, diagnostics.count());
    }

    @Test
    void testRefresh_ProblemsAreWarnings() throws Exception {
        Node label = document.tree().root().children().get(1);
        document.tree().setBinding(label.getId(), "text", Binding.variable("missing"));

        Map<UUID, List<Diagnostic>> byNode = diagnostics.refresh(document);

        assertEquals(1, byNode.size());
        Diagnostic warning = diagnostics.forNode(label.getId()).get(0);
        assertEquals(Severity.WARN, warning.severity());
        assertEquals(DiagnosticCode.DANGLING_BINDING, warning.code());
        assertEquals(1, diagnostics.count());
    }

    @Test
    void testCheckFragment_KeepsLastValidSource() {
        UUID id = document.tree().root().children().get(2).getId();
        when(validator.checkStatements("this.counter = 1;")).thenReturn(SyntaxCheck.ok());
        when(validator.checkStatements("this.counter =")).thenReturn(SyntaxCheck.failed("Expected expression", 1));

        LiveDiagnostics.FragmentStatus first = diagnostics.checkFragment(id, NodeEvent.CLICKED, "this.counter =");
        diagnostics.checkFragment(id, NodeEvent.CLICKED, "this.counter = 1;");
        LiveDiagnostics.FragmentStatus later = diagnostics.checkFragment(id, NodeEvent.CLICKED, "this.counter =");

        assertFalse(first.valid());
        assertEquals(LiveDiagnostics.INVALID_PLACEHOLDER, first.effectiveSource());
        assertEquals(DiagnosticCode.INVALID_FRAGMENT, first.diagnostic().code());
        assertEquals(Severity.WARN, first.diagnostic().severity());
        assertEquals("this.counter = 1;", later.effectiveSource());
        assertEquals("clicked", later.diagnostic().subject());
    }

    @Test
    void testRefresh_ForgetsRemovedNodes() throws Exception {
        UUID id = document.tree().root().children().get(2).getId();
        when(validator.checkStatements("this.counter = 1;")).thenReturn(SyntaxCheck.ok());
        diagnostics.checkFragment(id, NodeEvent.CLICKED, "this.counter = 1;");

        document.tree().remove(id);
        diagnostics.refresh(document);

        assertTrue(diagnostics.lastValidFragment(id, NodeEvent.CLICKED).isEmpty());
    }
}
