package com.aether.config;

/**
 * Exception thrown when a configuration value breaks the schema.
 */
public class ConfigValidationException extends Exception {

    private final String field;

    public ConfigValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    /**
     * Gets the offending key.
     *
     * @return the field name, or null for whole-file problems
     */
    public String getField() {
        return field;
    }
}
