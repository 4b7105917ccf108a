package com.aether.history;

import com.aether.model.Document;
import com.aether.model.DocumentTemplates;
import com.aether.model.Node;
import com.aether.model.NodeRegistry;
import org.junit.jupiter.api.Test;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for SubtreeDuplicator.
 */
public class SubtreeDuplicatorTest {

    private final Document document = DocumentTemplates.dashboard(NodeRegistry.standard());

    @Test
    void testDuplicate_FreshIdsSameStructure() throws Exception {
        Node row = document.tree().root().children().get(1);

        Node copy = new SubtreeDuplicator().duplicate(document.tree(), row.getId());

        assertTrue(copy.sameStructure(row, false));
        assertFalse(copy.isAttached());
        Set<UUID> ids = new HashSet<>();
        collect(copy, ids);
        assertEquals(3, ids.size());
        for (UUID id : ids) {
            assertFalse(document.tree().contains(id));
        }
    }

    @Test
    void testDuplicate_KeepsBindings() throws Exception {
        Node row = document.tree().root().children().get(1);

        Node copy = new SubtreeDuplicator().duplicate(document.tree(), row.getId());

        assertEquals(row.children().get(1).bindings(), copy.children().get(1).bindings());
    }

    @Test
    void testDuplicate_SkipsIdsAlreadyInUse() throws Exception {
        Node label = document.tree().root().children().get(0);
        UUID taken = document.tree().root().getId();
        UUID fresh = UUID.fromString("aaaaaaaa-0000-0000-0000-000000000001");
        Deque<UUID> ids = new ArrayDeque<>(List.of(taken, label.getId(), fresh));

        Node copy = new SubtreeDuplicator(ids::poll).duplicate(document.tree(), label.getId());

        assertEquals(fresh, copy.getId());
    }

    @Test
    void testDuplicate_IdSourceExhausted() {
        Node label = document.tree().root().children().get(0);
        UUID taken = label.getId();

        SubtreeDuplicator duplicator = new SubtreeDuplicator(() -> taken);

        assertThrows(IllegalStateException.class, () -> duplicator.duplicate(document.tree(), taken));
    }

    private static void collect(Node node, Set<UUID> ids) {
        ids.add(node.getId());
        if (node.isContainer()) {
            for (Node child : node.children()) {
                collect(child, ids);
            }
        }
    }
}
