package com.aether.model;

import com.aether.variables.VariableType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

public class DocumentTest {

    private Document document;
    private UUID labelId;
    private UUID buttonId;

    @BeforeEach
    void setUp() throws Exception {
        document = DocumentTemplates.counterApp(NodeRegistry.standard());
        labelId = document.tree().root().children().get(1).getId();
        buttonId = document.tree().root().children().get(2).getId();
    }

    @Test
    void testRenameVariable_RewritesBindingsAndActions() throws Exception {
        Node extra = document.registry().create("button");
        extra.setAction(NodeEvent.CLICKED, new Action.SetVariable("counter", "0"));
        document.tree().appendChild(document.tree().root().getId(), extra);

        int rewritten = document.renameVariable("counter", "clicks");

        assertEquals(3, rewritten);
        assertTrue(document.variables().contains("clicks"));
        assertFalse(document.variables().contains("counter"));
        assertEquals(Binding.variable("clicks"), document.tree().find(labelId).binding("text").orElseThrow());
        assertEquals(new Action.IncrementVariable("clicks"),
            document.tree().find(buttonId).action(NodeEvent.CLICKED).orElseThrow());
        assertEquals(new Action.SetVariable("clicks", "0"), extra.action(NodeEvent.CLICKED).orElseThrow());
    }

    @Test
    void testRenameVariable_InvalidNameChangesNothing() throws Exception {
        assertThrows(IllegalArgumentException.class, () -> document.renameVariable("counter", "not valid"));

        assertTrue(document.variables().contains("counter"));
        assertEquals(Binding.variable("counter"), document.tree().find(labelId).binding("text").orElseThrow());
    }

    @Test
    void testRemoveVariable_LeavesReferencesDangling() throws Exception {
        assertTrue(document.removeVariable("counter").isPresent());

        assertEquals(Binding.variable("counter"), document.tree().find(labelId).binding("text").orElseThrow());
    }

    @Test
    void testSelection_PrunedToExistingNodes() throws Exception {
        document.select(labelId);
        document.addToSelection(buttonId);
        assertEquals(Set.of(labelId, buttonId), document.selection());

        document.tree().remove(labelId);

        assertEquals(Set.of(buttonId), document.selection());
        assertThrows(NodeNotFoundException.class, () -> document.select(UUID.randomUUID()));
    }

    @Test
    void testCopy_IsIndependent() throws Exception {
        Document copy = document.copy();

        copy.setProjectName("Other");
        copy.variables().define("extra", VariableType.BOOLEAN, false);
        copy.tree().remove(labelId);

        assertEquals("Counter App", document.getProjectName());
        assertFalse(document.variables().contains("extra"));
        assertTrue(document.tree().contains(labelId));
        assertEquals(document.tree().preOrderIds().subList(0, 1), copy.tree().preOrderIds().subList(0, 1));
    }
}
