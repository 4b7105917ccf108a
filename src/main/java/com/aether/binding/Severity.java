package com.aether.binding;

/**
 * How much a diagnostic matters to the person editing.
 */
public enum Severity {
    ERROR,
    WARN,
    INFO
}
