package com.aether.binding;

import com.aether.model.PropertyValue;
import com.aether.variables.Variable;

import java.util.Objects;
import java.util.Optional;

/**
 * A property reduced to a literal of the property's type.
 *
 * @param value the literal; for a bound property, the variable's default converted to the property type
 * @param variable the variable the property follows, or null for a plain literal
 */
public record ResolvedValue(
    PropertyValue value,
    Variable variable
) {

    public ResolvedValue {
        Objects.requireNonNull(value, "value");
    }

    public static ResolvedValue literal(PropertyValue value) {
        return new ResolvedValue(value, null);
    }

    public boolean isBound() {
        return variable != null;
    }

    public Optional<Variable> boundVariable() {
        return Optional.ofNullable(variable);
    }
}
