package com.aether.validation;

import com.aether.codegen.GeneratedProject;

import java.util.concurrent.CompletableFuture;

/**
 * Checks generated output with a tool outside the designer.
 *
 * Implementations work on the immutable {@link GeneratedProject} only and never
 * see the document, so they may run on any thread.
 */
public interface ExternalValidator {

    /**
     * Starts validating a project.
     *
     * @param project the generated project
     * @return the outcome; cancelling the future stops the check
     */
    CompletableFuture<ValidationOutcome> validate(GeneratedProject project);
}
