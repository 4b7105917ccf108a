package com.aether.validation;

import java.util.Objects;

/**
 * Result of running an external check over a generated project.
 *
 * @param status how the run ended
 * @param output combined tool output, possibly empty
 */
public record ValidationOutcome(
    Status status,
    String output
) {

    public enum Status {
        PASSED,
        FAILED,
        TIMED_OUT,
        CANCELLED
    }

    public ValidationOutcome {
        Objects.requireNonNull(status, "status");
        output = output == null ? "" : output;
    }

    public static ValidationOutcome passed(String output) {
        return new ValidationOutcome(Status.PASSED, output);
    }

    public static ValidationOutcome failed(String output) {
        return new ValidationOutcome(Status.FAILED, output);
    }

    public static ValidationOutcome timedOut(String output) {
        return new ValidationOutcome(Status.TIMED_OUT, output);
    }

    public static ValidationOutcome cancelled() {
        return new ValidationOutcome(Status.CANCELLED, "");
    }

    public boolean passed() {
        return status == Status.PASSED;
    }
}
