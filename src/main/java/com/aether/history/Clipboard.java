package com.aether.history;

import com.aether.model.DocumentTree;
import com.aether.model.Node;
import com.aether.model.NodeNotFoundException;
import com.aether.model.StructuralException;
import com.aether.persistence.DocumentFormatException;
import com.aether.persistence.DocumentSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.UUID;

/**
 * Copy/paste of subtrees through the interchange format.
 *
 * The payload is plain serialized JSON, so it can also travel through the system
 * clipboard. Pasting always assigns fresh ids.
 */
public class Clipboard {

    private static final Logger LOGGER = LoggerFactory.getLogger(Clipboard.class);

    private final DocumentSerializer serializer;
    private final SubtreeDuplicator duplicator;
    private String payload;

    public Clipboard(DocumentSerializer serializer, SubtreeDuplicator duplicator) {
        this.serializer = serializer;
        this.duplicator = duplicator;
    }

    /**
     * Copies a subtree.
     *
     * @param tree the tree
     * @param id the subtree root
     * @throws NodeNotFoundException if no node has that id
     */
    public void copy(DocumentTree tree, UUID id) throws NodeNotFoundException {
        payload = serializer.serializeNode(tree.find(id));
        LOGGER.debug("Copied subtree {}", id);
    }

    public Optional<String> payload() {
        return Optional.ofNullable(payload);
    }

    /**
     * Replaces the clipboard content, e.g. with text from the system clipboard.
     *
     * @param newPayload serialized node payload
     */
    public void setPayload(String newPayload) {
        this.payload = newPayload;
    }

    public boolean hasContent() {
        return payload != null;
    }

    public void clear() {
        payload = null;
    }

    /**
     * Pastes the clipboard content as the last child of a container.
     *
     * @param tree the tree to paste into
     * @param parentId the container, or null for the root
     * @return the inserted node
     * @throws IllegalStateException if the clipboard is empty
     * @throws DocumentFormatException if the payload is not a valid node
     * @throws StructuralException if the target cannot take the node
     */
    public Node paste(DocumentTree tree, UUID parentId) throws DocumentFormatException, StructuralException {
        if (payload == null) {
            throw new IllegalStateException("Clipboard is empty");
        }
        Node copy = duplicator.duplicate(serializer.deserializeNode(payload), tree);
        UUID target = parentId != null ? parentId : tree.root().getId();
        tree.appendChild(target, copy);
        LOGGER.debug("Pasted {} into {}", copy, target);
        return copy;
    }
}
