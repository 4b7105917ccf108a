package com.aether.codegen;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for speculative generation. The generator polls it
 * between nodes; cancelling never leaves anything to clean up.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * Aborts the current generation if cancellation was requested.
     *
     * @throws GenerationCancelledException if cancelled
     */
    public void throwIfCancelled() {
        if (cancelled.get()) {
            throw new GenerationCancelledException();
        }
    }
}
