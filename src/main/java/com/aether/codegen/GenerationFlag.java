package com.aether.codegen;

/**
 * Status markers of a generated project that did not come out clean.
 */
public enum GenerationFlag {
    /** Some binding, action or asset was replaced by a fallback. */
    GENERATED_WITH_WARNINGS,
    /** At least one file is emitted as rendered, without formatting. */
    FORMATTING_DEGRADED
}
