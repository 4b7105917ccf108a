package com.aether.session;

import com.aether.model.Document;

/**
 * Notified on the editing thread after the session's document changed.
 */
public interface SessionListener {

    /**
     * Called after an edit, undo, redo or document replacement.
     *
     * @param document the current document
     * @param description what happened, e.g. {@code "Undo: Add button"}
     */
    void documentChanged(Document document, String description);
}
