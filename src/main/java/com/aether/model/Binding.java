package com.aether.model;

import java.util.Objects;

/**
 * Indirection of a property to either an inline literal or a named variable.
 */
public interface Binding {
    
    /**
     * Binding to a fixed value.
     */
    record Literal(PropertyValue value) implements Binding {
        public Literal {
            Objects.requireNonNull(value, "value");
        }
    }
    
    /**
     * Binding to a variable of the document's variable store.
     */
    record VariableRef(String variableName) implements Binding {
        public VariableRef {
            Objects.requireNonNull(variableName, "variableName");
        }
    }
    
    static Binding literal(PropertyValue value) {
        return new Literal(value);
    }
    
    static Binding variable(String variableName) {
        return new VariableRef(variableName);
    }
}
