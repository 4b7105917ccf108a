package com.aether.validation;

import com.aether.codegen.GeneratedProject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;

/**
 * Runs a command line tool over every script of a generated project.
 *
 * The project is written to a fresh temporary directory and the command is run
 * once per {@code .js} file, in file order, stopping at the first failure. A
 * {@code {file}} argument is replaced by the script path; without one the path is
 * appended. Each run is bounded by the timeout, after which the process is killed.
 */
public class ProcessValidator implements ExternalValidator, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessValidator.class);

    public static final String FILE_PLACEHOLDER = "{file}";

    private final List<String> command;
    private final Duration timeout;
    private final ExecutorService executor;

    public ProcessValidator(List<String> command, Duration timeout) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Validation command must not be empty");
        }
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("Timeout must be positive: " + timeout);
        }
        this.command = List.copyOf(command);
        this.timeout = timeout;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "aether-validation");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Creates a validator from a whitespace separated command line such as {@code node --check}.
     *
     * @param commandLine the command line
     * @param timeout per-script timeout
     * @return the validator
     */
    public static ProcessValidator fromCommandLine(String commandLine, Duration timeout) {
        List<String> parts = new ArrayList<>(Arrays.asList(commandLine.trim().split("\\s+")));
        parts.removeIf(String::isEmpty);
        return new ProcessValidator(parts, timeout);
    }

    public List<String> command() {
        return command;
    }

    @Override
    public CompletableFuture<ValidationOutcome> validate(GeneratedProject project) {
        CompletableFuture<ValidationOutcome> result = new CompletableFuture<>();
        AtomicReference<Process> running = new AtomicReference<>();
        result.whenComplete((outcome, error) -> {
            if (result.isCancelled()) {
                Process process = running.get();
                if (process != null) {
                    process.destroyForcibly();
                }
            }
        });
        executor.execute(() -> {
            try {
                ValidationOutcome outcome = run(project, result, running);
                result.complete(outcome);
            } catch (IOException e) {
                LOGGER.error("Validation could not run: {}", e.getMessage());
                result.completeExceptionally(e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                result.complete(ValidationOutcome.cancelled());
            }
        });
        return result;
    }

    private ValidationOutcome run(GeneratedProject project, CompletableFuture<ValidationOutcome> result,
                                  AtomicReference<Process> running) throws IOException, InterruptedException {
        Path workDir = Files.createTempDirectory("aether-validate");
        try {
            project.writeFiles(workDir);
            StringBuilder output = new StringBuilder();
            for (String path : project.paths()) {
                if (!path.endsWith(".js")) {
                    continue;
                }
                if (result.isDone()) {
                    return ValidationOutcome.cancelled();
                }
                List<String> invocation = commandFor(workDir.resolve(path).toString());
                LOGGER.debug("Running {}", invocation);

                ProcessBuilder builder = new ProcessBuilder(invocation);
                builder.directory(workDir.toFile());
                builder.redirectErrorStream(true);
                Process process = builder.start();
                running.set(process);

                ByteArrayOutputStream captured = new ByteArrayOutputStream();
                Thread drain = new Thread(() -> copy(process.getInputStream(), captured), "aether-validation-output");
                drain.setDaemon(true);
                drain.start();

                boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
                if (!finished) {
                    process.destroyForcibly();
                    process.waitFor(5, TimeUnit.SECONDS);
                }
                drain.join(5000);
                running.set(null);
                output.append(captured.toString(StandardCharsets.UTF_8));

                if (result.isCancelled()) {
                    return ValidationOutcome.cancelled();
                }
                if (!finished) {
                    LOGGER.warn("Validation of {} timed out after {}", path, timeout);
                    return ValidationOutcome.timedOut(output.toString());
                }
                if (process.exitValue() != 0) {
                    LOGGER.info("Validation of {} failed with exit code {}", path, process.exitValue());
                    return ValidationOutcome.failed(output.toString());
                }
            }
            return ValidationOutcome.passed(output.toString());
        } finally {
            deleteRecursively(workDir);
        }
    }

    List<String> commandFor(String file) {
        List<String> invocation = new ArrayList<>();
        boolean substituted = false;
        for (String part : command) {
            if (part.contains(FILE_PLACEHOLDER)) {
                invocation.add(part.replace(FILE_PLACEHOLDER, file));
                substituted = true;
            } else {
                invocation.add(part);
            }
        }
        if (!substituted) {
            invocation.add(file);
        }
        return invocation;
    }

    private static void copy(InputStream in, ByteArrayOutputStream out) {
        try (in) {
            in.transferTo(out);
        } catch (IOException e) {
            LOGGER.debug("Output stream closed early: {}", e.getMessage());
        }
    }

    private static void deleteRecursively(Path directory) {
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.delete(path);
                } catch (IOException e) {
                    LOGGER.warn("Failed to delete: {}", path, e);
                }
            });
        } catch (IOException e) {
            LOGGER.warn("Failed to clean up {}", directory, e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
