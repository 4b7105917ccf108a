package com.aether.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Effect attached to a node event.
 */
public interface Action {
    
    /**
     * Gets the variable this action writes, if any.
     * 
     * @return the variable name
     */
    default Optional<String> variableName() {
        return Optional.empty();
    }
    
    /**
     * Returns a copy that targets {@code newName} when this action targets {@code oldName}.
     * 
     * @param oldName the name being replaced
     * @param newName the replacement
     * @return the rewritten action, or this one if unaffected
     */
    default Action renameVariable(String oldName, String newName) {
        return this;
    }
    
    /**
     * Adds one to a numeric variable.
     */
    record IncrementVariable(String variable) implements Action {
        public IncrementVariable {
            Objects.requireNonNull(variable, "variable");
        }
        
        @Override
        public Optional<String> variableName() {
            return Optional.of(variable);
        }
        
        @Override
        public Action renameVariable(String oldName, String newName) {
            return variable.equals(oldName) ? new IncrementVariable(newName) : this;
        }
    }
    
    /**
     * Assigns a literal or an expression to a variable.
     */
    record SetVariable(String variable, String value) implements Action {
        public SetVariable {
            Objects.requireNonNull(variable, "variable");
            Objects.requireNonNull(value, "value");
        }
        
        @Override
        public Optional<String> variableName() {
            return Optional.of(variable);
        }
        
        @Override
        public Action renameVariable(String oldName, String newName) {
            return variable.equals(oldName) ? new SetVariable(newName, value) : this;
        }
    }
    
    /**
     * Raw target-language statements, executed with {@code this} bound to the app state.
     */
    record InlineCode(String source) implements Action {
        public InlineCode {
            Objects.requireNonNull(source, "source");
        }
    }
}
