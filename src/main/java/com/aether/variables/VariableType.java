package com.aether.variables;

import java.util.Locale;

/**
 * Value kinds a document variable can hold.
 * 
 * Integers are carried as {@link Long}, floats as {@link Double}.
 */
public enum VariableType {
    STRING("string"),
    INTEGER("integer"),
    FLOAT("float"),
    BOOLEAN("boolean");
    
    private final String wireName;
    
    VariableType(String wireName) {
        this.wireName = wireName;
    }
    
    /**
     * Gets the stable name used in persisted documents.
     * 
     * @return the wire name
     */
    public String wireName() {
        return wireName;
    }
    
    public boolean isNumeric() {
        return this == INTEGER || this == FLOAT;
    }
    
    /**
     * Gets the zero value for this type.
     * 
     * @return empty string, 0, 0.0 or false
     */
    public Object zeroValue() {
        return switch (this) {
            case STRING -> "";
            case INTEGER -> 0L;
            case FLOAT -> 0.0d;
            case BOOLEAN -> Boolean.FALSE;
        };
    }
    
    /**
     * Parses a textual literal into a value of this type.
     * 
     * @param text the literal text
     * @return the typed value
     * @throws IllegalArgumentException if the text is not a literal of this type
     */
    public Object parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("Cannot parse null as " + wireName);
        }
        String trimmed = text.trim();
        try {
            return switch (this) {
                case STRING -> text;
                case INTEGER -> Long.parseLong(trimmed);
                case FLOAT -> requireFinite(Double.parseDouble(trimmed));
                case BOOLEAN -> parseBoolean(trimmed);
            };
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                String.format("'%s' is not a valid %s literal", text, wireName), e);
        }
    }
    
    // NaN and infinities have no JSON form
    private double requireFinite(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(String.format("%s is not a finite %s", value, wireName));
        }
        return value;
    }

    /**
     * Normalizes a Java value to the canonical representation of this type.
     * Strings are parsed, integral numbers widen to float, nothing narrows.
     * 
     * @param value the raw value
     * @return the canonical value
     * @throws IllegalArgumentException if the value does not fit this type
     */
    public Object coerce(Object value) {
        if (value == null) {
            return zeroValue();
        }
        if (value instanceof String && this != STRING) {
            return parse((String) value);
        }
        switch (this) {
            case STRING:
                if (value instanceof String) {
                    return value;
                }
                break;
            case INTEGER:
                if (value instanceof Long || value instanceof Integer
                        || value instanceof Short || value instanceof Byte) {
                    return ((Number) value).longValue();
                }
                break;
            case FLOAT:
                if (value instanceof Number) {
                    return requireFinite(((Number) value).doubleValue());
                }
                break;
            case BOOLEAN:
                if (value instanceof Boolean) {
                    return value;
                }
                break;
        }
        throw new IllegalArgumentException(
            String.format("Value %s (%s) is not a valid %s", value, value.getClass().getSimpleName(), wireName));
    }
    
    /**
     * Looks up a type by its wire name.
     * 
     * @param wireName the persisted name
     * @return the matching type
     * @throws IllegalArgumentException if no type has that name
     */
    public static VariableType fromWireName(String wireName) {
        for (VariableType type : values()) {
            if (type.wireName.equals(wireName)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown variable type: " + wireName);
    }
    
    private static Boolean parseBoolean(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        if (lower.equals("true")) {
            return Boolean.TRUE;
        }
        if (lower.equals("false")) {
            return Boolean.FALSE;
        }
        throw new IllegalArgumentException(String.format("'%s' is not a valid boolean literal", text));
    }
}
