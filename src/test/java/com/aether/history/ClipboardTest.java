package com.aether.history;

import com.aether.model.Document;
import com.aether.model.DocumentTemplates;
import com.aether.model.Node;
import com.aether.model.NodeNotFoundException;
import com.aether.model.NodeRegistry;
import com.aether.model.NotAContainerException;
import com.aether.persistence.DocumentFormatException;
import com.aether.persistence.DocumentSerializer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Clipboard.
 */
public class ClipboardTest {

    private Clipboard clipboard;
    private Document document;

    @BeforeEach
    void setUp() {
        clipboard = new Clipboard(new DocumentSerializer(NodeRegistry.standard()), new SubtreeDuplicator());
        document = DocumentTemplates.counterApp(NodeRegistry.standard());
    }

    @Test
    void testCopyPaste_TwiceGivesDistinctIds() throws Exception {
        Node button = document.tree().root().children().get(2);
        clipboard.copy(document.tree(), button.getId());

        Node first = clipboard.paste(document.tree(), null);
        Node second = clipboard.paste(document.tree(), document.tree().root().getId());

        assertEquals(5, document.tree().root().children().size());
        assertNotEquals(first.getId(), second.getId());
        assertNotEquals(button.getId(), first.getId());
        assertTrue(first.sameStructure(button, false));
        assertSame(second, document.tree().root().children().get(4));
    }

    @Test
    void testCopy_SnapshotIgnoresLaterEdits() throws Exception {
        Node button = document.tree().root().children().get(2);
        clipboard.copy(document.tree(), button.getId());

        document.tree().remove(button.getId());
        Node pasted = clipboard.paste(document.tree(), null);

        assertEquals("Increment", pasted.property("text").asString());
    }

    @Test
    void testPaste_Empty() {
        assertFalse(clipboard.hasContent());
        assertThrows(IllegalStateException.class, () -> clipboard.paste(document.tree(), null));
    }

    @Test
    void testPaste_IntoLeaf() throws Exception {
        Node label = document.tree().root().children().get(0);
        clipboard.copy(document.tree(), label.getId());

        assertThrows(NotAContainerException.class, () -> clipboard.paste(document.tree(), label.getId()));
        assertEquals(3, document.tree().root().children().size());
    }

    @Test
    void testPaste_ForeignPayload() {
        clipboard.setPayload("{\"schemaVersion\": 1, \"node\": {\"kind\": \"teleporter\", \"id\": \""
            + UUID.randomUUID() + "\"}}");

        assertThrows(DocumentFormatException.class, () -> clipboard.paste(document.tree(), null));
    }

    @Test
    void testCopy_UnknownNode() {
        assertThrows(NodeNotFoundException.class, () -> clipboard.copy(document.tree(), UUID.randomUUID()));
        assertTrue(clipboard.payload().isEmpty());
    }

    @Test
    void testClear() throws Exception {
        clipboard.copy(document.tree(), document.tree().root().getId());

        clipboard.clear();

        assertFalse(clipboard.hasContent());
    }
}
