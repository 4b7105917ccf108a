package com.aether.history;

import com.aether.model.Document;

/**
 * A document snapshot and the edit it precedes. The snapshot is never handed out
 * directly, only copies of it.
 */
public record HistoryEntry(
    String description,
    Document snapshot
) {}
