package com.aether.binding;

import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of resolving a binding or action: a value, or the diagnostic that explains
 * why there is none. Resolution failures are values so callers decide how to surface them.
 *
 * @param <T> the resolved type
 */
public record Resolution<T>(
    T value,
    Diagnostic diagnostic
) {

    public Resolution {
        if ((value == null) == (diagnostic == null)) {
            throw new IllegalArgumentException("Exactly one of value and diagnostic must be set");
        }
    }

    public static <T> Resolution<T> success(T value) {
        return new Resolution<>(value, null);
    }

    public static <T> Resolution<T> failure(Diagnostic diagnostic) {
        return new Resolution<>(null, diagnostic);
    }

    public boolean isSuccess() {
        return value != null;
    }

    public Optional<T> asOptional() {
        return Optional.ofNullable(value);
    }

    public Optional<Diagnostic> problem() {
        return Optional.ofNullable(diagnostic);
    }

    public T orElse(T fallback) {
        return value != null ? value : fallback;
    }

    public <R> Resolution<R> map(Function<T, R> mapper) {
        return value != null ? success(mapper.apply(value)) : failure(diagnostic);
    }
}
