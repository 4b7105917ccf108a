package com.aether.history;

import com.aether.model.Document;
import com.aether.model.DocumentTemplates;
import com.aether.model.NodeRegistry;
import com.aether.model.PropertyValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for HistoryEngine.
 */
public class HistoryEngineTest {

    private Document document;
    private UUID labelId;

    @BeforeEach
    void setUp() {
        document = DocumentTemplates.counterApp(NodeRegistry.standard());
        labelId = document.tree().root().children().get(0).getId();
    }

    @Test
    void testEmptyHistory() {
        HistoryEngine history = new HistoryEngine();

        assertFalse(history.canUndo());
        assertFalse(history.canRedo());
        assertTrue(history.undo(document).isEmpty());
        assertTrue(history.redo(document).isEmpty());
        assertEquals(HistoryEngine.DEFAULT_CAPACITY, history.capacity());
    }

    @Test
    void testUndoRestoresRecordedState() throws Exception {
        HistoryEngine history = new HistoryEngine();

        history.record(document, "Set text");
        Document edited = edit(document, "Edited");
        Document undone = history.undo(edited).orElseThrow();

        assertEquals("Counter App", text(undone));
        assertTrue(history.canRedo());
        assertEquals("Set text", history.redoDescription().orElseThrow());
    }

    @Test
    void testRedoAfterUndoReturnsEditedState() throws Exception {
        HistoryEngine history = new HistoryEngine();
        history.record(document, "Set text");
        Document edited = edit(document, "Edited");

        Document undone = history.undo(edited).orElseThrow();
        Document redone = history.redo(undone).orElseThrow();

        assertEquals("Edited", text(redone));
        assertTrue(redone.tree().root().sameStructure(edited.tree().root(), true));
        assertEquals(1, history.undoDepth());
        assertEquals(0, history.redoDepth());
    }

    @Test
    void testRecordClearsRedo() throws Exception {
        HistoryEngine history = new HistoryEngine();
        history.record(document, "First");
        Document edited = edit(document, "One");
        Document undone = history.undo(edited).orElseThrow();

        history.record(undone, "Second");

        assertFalse(history.canRedo());
        assertEquals("Second", history.undoDescription().orElseThrow());
    }

    @Test
    void testSnapshotsAreIsolatedFromLaterEdits() throws Exception {
        HistoryEngine history = new HistoryEngine();
        history.record(document, "Set text");

        document.tree().setProperty(labelId, "text", PropertyValue.ofString("Mutated after record"));
        Document undone = history.undo(document).orElseThrow();

        assertEquals("Counter App", text(undone));
    }

    @Test
    void testCapacityEvictsOldest() throws Exception {
        HistoryEngine history = new HistoryEngine(3);
        Document current = document;
        for (int i = 1; i <= 5; i++) {
            history.record(current, "Step " + i);
            current = edit(current, "Text " + i);
        }

        assertEquals(3, history.undoDepth());
        Document oldest = current;
        while (history.canUndo()) {
            oldest = history.undo(oldest).orElseThrow();
        }
        assertEquals("Text 2", text(oldest));
    }

    @Test
    void testClear() {
        HistoryEngine history = new HistoryEngine();
        history.record(document);

        history.clear();

        assertFalse(history.canUndo());
        assertTrue(history.undoDescription().isEmpty());
    }

    @Test
    void testInvalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new HistoryEngine(0));
    }

    private Document edit(Document source, String text) throws Exception {
        Document copy = source.copy();
        copy.tree().setProperty(labelId, "text", PropertyValue.ofString(text));
        return copy;
    }

    private String text(Document doc) throws Exception {
        return doc.tree().find(labelId).property("text").asString();
    }
}
