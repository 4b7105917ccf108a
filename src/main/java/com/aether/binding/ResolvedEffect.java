package com.aether.binding;

import com.aether.codegen.ast.JsAst;
import com.aether.variables.Variable;

import java.util.Objects;

/**
 * Typed description of what an event handler does, after the action was checked
 * against the variable store.
 */
public interface ResolvedEffect {

    /**
     * Adds one to a numeric variable.
     */
    record Increment(Variable variable) implements ResolvedEffect {
        public Increment {
            Objects.requireNonNull(variable, "variable");
        }
    }

    /**
     * Stores a value into a variable.
     *
     * @param variable the target variable
     * @param value a literal, or a syntax-checked expression evaluated with {@code this} as the state
     */
    record Assign(Variable variable, JsAst.Expression value) implements ResolvedEffect {
        public Assign {
            Objects.requireNonNull(variable, "variable");
            Objects.requireNonNull(value, "value");
        }
    }

    /**
     * Runs syntax-checked statements with {@code this} as the state.
     */
    record Inline(String source) implements ResolvedEffect {
        public Inline {
            Objects.requireNonNull(source, "source");
        }
    }
}
