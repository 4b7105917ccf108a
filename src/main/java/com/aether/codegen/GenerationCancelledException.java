package com.aether.codegen;

/**
 * Thrown out of a generation run whose {@link CancellationToken} was cancelled.
 */
public class GenerationCancelledException extends RuntimeException {

    public GenerationCancelledException() {
        super("Generation cancelled");
    }
}
