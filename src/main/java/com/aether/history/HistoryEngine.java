package com.aether.history;

import com.aether.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Optional;

/**
 * Linear undo/redo over full document snapshots.
 *
 * Callers record the state before each mutation. Undo hands back the most recent
 * snapshot and keeps the current state for redo; recording after an undo discards
 * the redo entries. At most {@code capacity} past entries are kept, the oldest
 * being evicted first.
 *
 * Single-threaded: owned by the editing thread together with the document.
 */
public class HistoryEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(HistoryEngine.class);

    public static final int DEFAULT_CAPACITY = 50;

    private final int capacity;
    private final Deque<HistoryEntry> past = new ArrayDeque<>();
    private final Deque<HistoryEntry> future = new ArrayDeque<>();

    public HistoryEngine() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * Creates a history.
     *
     * @param capacity maximum number of undo steps, at least 1
     */
    public HistoryEngine(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("History capacity must be at least 1, got " + capacity);
        }
        this.capacity = capacity;
    }

    /**
     * Records the state before a mutation.
     *
     * @param before the document as it is now; it is deep-copied
     */
    public void record(Document before) {
        record(before, "edit");
    }

    /**
     * Records the state before a described mutation.
     *
     * @param before the document as it is now; it is deep-copied
     * @param description what the coming mutation does, for undo menus
     */
    public void record(Document before, String description) {
        past.push(new HistoryEntry(description, before.copy()));
        future.clear();
        trim();
        LOGGER.debug("Recorded '{}' ({} undo steps)", description, past.size());
    }

    /**
     * Steps back.
     *
     * @param current the current document, kept for redo
     * @return the previous state, or empty if there is nothing to undo
     */
    public Optional<Document> undo(Document current) {
        HistoryEntry entry = past.poll();
        if (entry == null) {
            return Optional.empty();
        }
        future.push(new HistoryEntry(entry.description(), current.copy()));
        LOGGER.debug("Undo '{}'", entry.description());
        return Optional.of(entry.snapshot().copy());
    }

    /**
     * Steps forward again after an undo.
     *
     * @param current the current document, kept for undo
     * @return the state after the undone mutation, or empty if there is nothing to redo
     */
    public Optional<Document> redo(Document current) {
        HistoryEntry entry = future.poll();
        if (entry == null) {
            return Optional.empty();
        }
        past.push(new HistoryEntry(entry.description(), current.copy()));
        trim();
        LOGGER.debug("Redo '{}'", entry.description());
        return Optional.of(entry.snapshot().copy());
    }

    public boolean canUndo() {
        return !past.isEmpty();
    }

    public boolean canRedo() {
        return !future.isEmpty();
    }

    public Optional<String> undoDescription() {
        return Optional.ofNullable(past.peek()).map(HistoryEntry::description);
    }

    public Optional<String> redoDescription() {
        return Optional.ofNullable(future.peek()).map(HistoryEntry::description);
    }

    public int undoDepth() {
        return past.size();
    }

    public int redoDepth() {
        return future.size();
    }

    public int capacity() {
        return capacity;
    }

    public void clear() {
        past.clear();
        future.clear();
    }

    private void trim() {
        while (past.size() > capacity) {
            HistoryEntry evicted = past.removeLast();
            LOGGER.debug("Evicted oldest history entry '{}'", evicted.description());
        }
    }
}
