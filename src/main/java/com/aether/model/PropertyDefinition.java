package com.aether.model;

import java.util.Objects;

/**
 * Declaration of one property of a node kind.
 * 
 * @param name property name, unique within the kind
 * @param defaultValue value a freshly created node starts with; also fixes the type
 * @param bindable whether the property may be bound to a variable
 */
public record PropertyDefinition(
    String name,
    PropertyValue defaultValue,
    boolean bindable
) {
    
    public PropertyDefinition {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(defaultValue, "defaultValue");
    }
    
    public PropertyType type() {
        return defaultValue.type();
    }
    
    public static PropertyDefinition bindable(String name, PropertyValue defaultValue) {
        return new PropertyDefinition(name, defaultValue, true);
    }
    
    public static PropertyDefinition fixed(String name, PropertyValue defaultValue) {
        return new PropertyDefinition(name, defaultValue, false);
    }
}
