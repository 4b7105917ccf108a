package com.aether.session;

import com.aether.config.DesignerConfig;
import com.aether.history.Clipboard;
import com.aether.history.HistoryEngine;
import com.aether.history.SubtreeDuplicator;
import com.aether.model.Action;
import com.aether.model.Binding;
import com.aether.model.Document;
import com.aether.model.Node;
import com.aether.model.NodeEvent;
import com.aether.model.NodeNotFoundException;
import com.aether.model.PropertyValue;
import com.aether.model.RootOperationException;
import com.aether.model.StructuralException;
import com.aether.persistence.DocumentFormatException;
import com.aether.persistence.DocumentSerializer;
import com.aether.variables.VariableType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The editing boundary around one open document.
 *
 * Every mutation goes through {@link #apply(String, Edit)}: the document is
 * snapshotted, the edit runs, and only if it succeeds is the snapshot recorded in
 * the history. A failing edit is rolled back to the snapshot, so the document and
 * the history are exactly as before the call.
 *
 * Not thread-safe; all calls come from the editing thread.
 */
public class EditorSession {

    private static final Logger LOGGER = LoggerFactory.getLogger(EditorSession.class);

    private Document document;
    private final HistoryEngine history;
    private final Clipboard clipboard;
    private final SubtreeDuplicator duplicator;
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    public EditorSession(Document document, HistoryEngine history, DocumentSerializer serializer) {
        this(document, history, serializer, new SubtreeDuplicator());
    }

    public EditorSession(Document document, HistoryEngine history, DocumentSerializer serializer,
                         SubtreeDuplicator duplicator) {
        this.document = Objects.requireNonNull(document, "document");
        this.history = history;
        this.duplicator = duplicator;
        this.clipboard = new Clipboard(serializer, duplicator);
    }

    /**
     * Opens a session with the history capacity from the configuration.
     *
     * @param document the document to edit
     * @param serializer serializer for clipboard payloads
     * @param config designer settings
     * @return the session
     */
    public static EditorSession open(Document document, DocumentSerializer serializer, DesignerConfig config) {
        return new EditorSession(document, new HistoryEngine(config.historyCapacity()), serializer);
    }

    public Document document() {
        return document;
    }

    public HistoryEngine history() {
        return history;
    }

    public Clipboard clipboard() {
        return clipboard;
    }

    public void addListener(SessionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(SessionListener listener) {
        listeners.remove(listener);
    }

    /**
     * Applies an edit with undo support.
     *
     * @param description what the edit does
     * @param edit the mutation
     * @throws StructuralException if the edit is rejected; nothing changed then
     */
    public void apply(String description, Edit edit) throws StructuralException {
        Document before = document.copy();
        try {
            edit.apply(document);
        } catch (StructuralException | RuntimeException e) {
            document = before;
            LOGGER.debug("Rejected '{}': {}", description, e.getMessage());
            throw e;
        }
        history.record(before, description);
        notifyListeners(description);
    }

    /**
     * Replaces the whole document, e.g. after opening a file. History is cleared.
     *
     * @param replacement the new document
     */
    public void replaceDocument(Document replacement) {
        document = Objects.requireNonNull(replacement, "replacement");
        history.clear();
        notifyListeners("Open " + replacement.getProjectName());
    }

    public Optional<Document> undo() {
        String description = history.undoDescription().orElse("edit");
        Optional<Document> previous = history.undo(document);
        previous.ifPresent(restored -> {
            document = restored;
            notifyListeners("Undo: " + description);
        });
        return previous;
    }

    public Optional<Document> redo() {
        String description = history.redoDescription().orElse("edit");
        Optional<Document> next = history.redo(document);
        next.ifPresent(restored -> {
            document = restored;
            notifyListeners("Redo: " + description);
        });
        return next;
    }

    // Common edits

    /**
     * Creates a node of a kind and inserts it.
     *
     * @param parentId the container
     * @param index position among the children
     * @param tag the kind tag
     * @return the id of the new node
     * @throws StructuralException if the insertion is rejected
     */
    public UUID insert(UUID parentId, int index, String tag) throws StructuralException {
        Node node = document.registry().create(tag);
        apply("Add " + document.registry().require(tag).displayName(),
            doc -> doc.tree().insertChild(parentId, index, node));
        return node.getId();
    }

    public UUID append(UUID parentId, String tag) throws StructuralException {
        int index = document.tree().find(parentId).children().size();
        return insert(parentId, index, tag);
    }

    public void remove(UUID id) throws StructuralException {
        apply("Delete", doc -> doc.tree().remove(id));
    }

    public void move(UUID id, UUID newParentId, int index) throws StructuralException {
        apply("Move", doc -> doc.tree().reparent(id, newParentId, index));
    }

    public void moveUp(UUID id) throws StructuralException {
        apply("Move up", doc -> doc.tree().moveUp(id));
    }

    public void moveDown(UUID id) throws StructuralException {
        apply("Move down", doc -> doc.tree().moveDown(id));
    }

    public void setProperty(UUID id, String property, PropertyValue value) throws StructuralException {
        apply("Set " + property, doc -> doc.tree().setProperty(id, property, value));
    }

    public void bind(UUID id, String property, Binding binding) throws StructuralException {
        apply("Bind " + property, doc -> doc.tree().setBinding(id, property, binding));
    }

    public void unbind(UUID id, String property) throws StructuralException {
        apply("Unbind " + property, doc -> doc.tree().clearBinding(id, property));
    }

    public void setAction(UUID id, NodeEvent event, Action action) throws StructuralException {
        apply("Set " + event.wireName() + " action", doc -> doc.tree().setAction(id, event, action));
    }

    public void clearAction(UUID id, NodeEvent event) throws StructuralException {
        apply("Clear " + event.wireName() + " action", doc -> doc.tree().clearAction(id, event));
    }

    public void defineVariable(String name, VariableType type, Object defaultValue) throws StructuralException {
        apply("Add variable " + name, doc -> doc.variables().define(name, type, defaultValue));
    }

    /**
     * Renames a variable and every reference to it.
     *
     * @param oldName current name
     * @param newName new name
     * @throws StructuralException never in practice; invalid names raise {@link IllegalArgumentException}
     */
    public void renameVariable(String oldName, String newName) throws StructuralException {
        apply("Rename variable " + oldName, doc -> doc.renameVariable(oldName, newName));
    }

    public void removeVariable(String name) throws StructuralException {
        apply("Delete variable " + name, doc -> doc.removeVariable(name));
    }

    public void changeRootKind(String tag) throws StructuralException {
        apply("Change root layout", doc -> doc.tree().replaceRootKind(tag));
    }

    /**
     * Inserts a fresh-id copy of a node right after it.
     *
     * @param id the node to duplicate
     * @return id of the copy
     * @throws StructuralException if the node is the root or does not exist
     */
    public UUID duplicate(UUID id) throws StructuralException {
        Node copy = duplicator.duplicate(document.tree(), id);
        apply("Duplicate", doc -> {
            Node parent = doc.tree().parentOf(id)
                .orElseThrow(() -> new RootOperationException(id, "duplicate"));
            doc.tree().insertChild(parent.getId(), doc.tree().indexOf(id) + 1, copy);
        });
        return copy.getId();
    }

    public void copy(UUID id) throws NodeNotFoundException {
        clipboard.copy(document.tree(), id);
    }

    /**
     * Copies a node to the clipboard and deletes it.
     *
     * @param id the node
     * @throws StructuralException if the node is the root or does not exist
     */
    public void cut(UUID id) throws StructuralException {
        Optional<String> previous = clipboard.payload();
        clipboard.copy(document.tree(), id);
        try {
            apply("Cut", doc -> doc.tree().remove(id));
        } catch (StructuralException e) {
            clipboard.setPayload(previous.orElse(null));
            throw e;
        }
    }

    /**
     * Pastes the clipboard into a container.
     *
     * @param parentId the container, or null for the root
     * @return id of the pasted node
     * @throws DocumentFormatException if the clipboard payload is invalid
     * @throws StructuralException if the container cannot take it
     */
    public UUID paste(UUID parentId) throws DocumentFormatException, StructuralException {
        UUID[] pasted = new UUID[1];
        try {
            apply("Paste", doc -> {
                try {
                    pasted[0] = clipboard.paste(doc.tree(), parentId).getId();
                } catch (DocumentFormatException e) {
                    throw new IllegalStateException(e);
                }
            });
        } catch (IllegalStateException e) {
            if (e.getCause() instanceof DocumentFormatException) {
                throw (DocumentFormatException) e.getCause();
            }
            throw e;
        }
        return pasted[0];
    }

    public void select(UUID id) throws NodeNotFoundException {
        document.select(id);
    }

    private void notifyListeners(String description) {
        for (SessionListener listener : listeners) {
            listener.documentChanged(document, description);
        }
    }
}
