package com.aether.binding;

/**
 * Stable identifiers of the recoverable problems resolution and generation report.
 */
public enum DiagnosticCode {
    /** A binding or action names a variable the store does not hold. */
    DANGLING_BINDING,
    /** A variable does not fit the property or action it is used with. */
    TYPE_MISMATCH,
    /** A code fragment is not syntactically valid. */
    INVALID_FRAGMENT,
    /** An asset name does not resolve to a registered asset. */
    MISSING_ASSET,
    /** A generated file could not be formatted and was emitted unformatted. */
    FORMATTING_DEGRADED
}
