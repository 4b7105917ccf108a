package com.aether.session;

import com.aether.codegen.CancellationToken;
import com.aether.codegen.CodeGenerator;
import com.aether.codegen.GeneratedProject;
import com.aether.codegen.GenerationCancelledException;
import com.aether.config.DesignerConfig;
import com.aether.model.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs speculative code generation in the background while the user edits.
 *
 * Each request is debounced; a newer request cancels the one before it, whether it
 * is still waiting or already running. The document is copied on the caller's
 * thread, so editing can continue while generation works on the copy. Futures of
 * superseded requests complete cancelled.
 */
public class GenerationScheduler implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(GenerationScheduler.class);

    private final CodeGenerator generator;
    private final long debounceMillis;
    private final ScheduledExecutorService executor;
    private Pending pending;

    public GenerationScheduler(CodeGenerator generator, long debounceMillis) {
        if (debounceMillis < 0) {
            throw new IllegalArgumentException("Debounce must not be negative: " + debounceMillis);
        }
        this.generator = generator;
        this.debounceMillis = debounceMillis;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "aether-generation");
            thread.setDaemon(true);
            return thread;
        });
    }

    public static GenerationScheduler fromConfig(CodeGenerator generator, DesignerConfig config) {
        return new GenerationScheduler(generator, config.generationDebounceMillis());
    }

    /**
     * Schedules generation of the document's current state.
     *
     * @param document the document; copied before this method returns
     * @return future completing with the project, or cancelled if superseded
     */
    public synchronized CompletableFuture<GeneratedProject> request(Document document) {
        Document snapshot = document.copy();
        cancelPending();
        CancellationToken token = new CancellationToken();
        CompletableFuture<GeneratedProject> result = new CompletableFuture<>();
        ScheduledFuture<?> task = executor.schedule(() -> run(snapshot, token, result),
            debounceMillis, TimeUnit.MILLISECONDS);
        pending = new Pending(token, task, result);
        LOGGER.debug("Scheduled generation of '{}' in {}ms", snapshot.getProjectName(), debounceMillis);
        return result;
    }

    /**
     * Cancels the latest request if it has not completed yet.
     */
    public synchronized void cancelPending() {
        if (pending != null) {
            pending.token.cancel();
            pending.task.cancel(false);
            if (pending.result.cancel(false)) {
                LOGGER.debug("Cancelled superseded generation request");
            }
            pending = null;
        }
    }

    private void run(Document snapshot, CancellationToken token, CompletableFuture<GeneratedProject> result) {
        if (token.isCancelled()) {
            result.cancel(false);
            return;
        }
        try {
            result.complete(generator.generate(snapshot, token));
        } catch (GenerationCancelledException e) {
            result.cancel(false);
        } catch (RuntimeException e) {
            LOGGER.error("Background generation of '{}' failed", snapshot.getProjectName(), e);
            result.completeExceptionally(e);
        }
    }

    @Override
    public void close() {
        cancelPending();
        executor.shutdownNow();
    }

    private static final class Pending {
        final CancellationToken token;
        final ScheduledFuture<?> task;
        final CompletableFuture<GeneratedProject> result;

        Pending(CancellationToken token, ScheduledFuture<?> task, CompletableFuture<GeneratedProject> result) {
            this.token = token;
            this.task = task;
            this.result = result;
        }
    }
}
