package com.aether.variables;

import java.util.Objects;

/**
 * A named, typed application variable.
 * 
 * The default value is always stored in the canonical form of its type.
 */
public record Variable(
    String name,
    VariableType type,
    Object defaultValue
) {
    
    public Variable {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        defaultValue = type.coerce(defaultValue);
    }
    
    public Variable withName(String newName) {
        return new Variable(newName, type, defaultValue);
    }
    
    public Variable withDefaultValue(Object newDefault) {
        return new Variable(name, type, newDefault);
    }
}
