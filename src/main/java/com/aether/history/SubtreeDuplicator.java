package com.aether.history;

import com.aether.model.DocumentTree;
import com.aether.model.Node;
import com.aether.model.NodeNotFoundException;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Copies subtrees for copy/paste and duplicate.
 *
 * Every node of the copy gets a new id, not just its root, so the copy can be
 * inserted into the same tree without breaking id uniqueness. Structure,
 * properties, bindings and actions are kept.
 */
public class SubtreeDuplicator {

    private final Supplier<UUID> idSource;

    public SubtreeDuplicator() {
        this(UUID::randomUUID);
    }

    /**
     * Creates a duplicator with a custom id source, e.g. a deterministic one for tests.
     *
     * @param idSource supplier of candidate ids
     */
    public SubtreeDuplicator(Supplier<UUID> idSource) {
        this.idSource = Objects.requireNonNull(idSource, "idSource");
    }

    /**
     * Duplicates a node of a tree.
     *
     * @param tree the tree
     * @param id the subtree root
     * @return a detached copy with ids unused in the tree
     * @throws NodeNotFoundException if no node has that id
     */
    public Node duplicate(DocumentTree tree, UUID id) throws NodeNotFoundException {
        return duplicate(tree.find(id), tree);
    }

    /**
     * Duplicates a subtree so it can go into {@code target}.
     *
     * @param source the subtree
     * @param target the tree the copy is meant for, or null
     * @return a detached copy whose ids collide neither with the target nor with each other
     */
    public Node duplicate(Node source, DocumentTree target) {
        Set<UUID> issued = new HashSet<>();
        return source.copyWithFreshIds(() -> {
            for (int attempt = 0; attempt < 1000; attempt++) {
                UUID candidate = idSource.get();
                if (candidate != null && (target == null || !target.contains(candidate)) && issued.add(candidate)) {
                    return candidate;
                }
            }
            throw new IllegalStateException("Id source keeps returning ids that are already in use");
        });
    }
}
