package com.aether.binding;

import com.aether.codegen.ast.JsAst;
import com.aether.model.Action;
import com.aether.model.Binding;
import com.aether.model.Node;
import com.aether.model.NodeEvent;
import com.aether.model.PropertyType;
import com.aether.model.PropertyValue;
import com.aether.variables.Identifiers;
import com.aether.variables.Variable;
import com.aether.variables.VariableStore;
import com.aether.variables.VariableType;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Resolves property bindings and event actions against a variable store.
 *
 * Nothing here throws for a bad binding or action: failures come back as a
 * {@link Resolution} carrying a {@link Diagnostic}, and the caller chooses between
 * warning and substituting a fallback.
 */
public class BindingResolver {

    private static final Pattern NUMBER_LITERAL =
        Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");
    private static final Pattern QUOTED_LITERAL = Pattern.compile("'[^']*'|\"[^\"]*\"");

    private final FragmentValidator validator;

    public BindingResolver(FragmentValidator validator) {
        this.validator = Objects.requireNonNull(validator, "validator");
    }

    public FragmentValidator validator() {
        return validator;
    }

    /**
     * Resolves one property of a node.
     *
     * @param node the node
     * @param property the property name
     * @param variables the variable store
     * @return the literal value, or DANGLING_BINDING / TYPE_MISMATCH
     * @throws IllegalArgumentException if the node has no such property
     */
    public Resolution<ResolvedValue> resolveProperty(Node node, String property, VariableStore variables) {
        PropertyValue own = node.property(property);
        Optional<Binding> binding = node.binding(property);
        if (binding.isEmpty()) {
            return Resolution.success(ResolvedValue.literal(own));
        }
        if (binding.get() instanceof Binding.Literal) {
            PropertyValue literal = ((Binding.Literal) binding.get()).value();
            if (literal.type() != own.type()) {
                return Resolution.failure(Diagnostic.error(DiagnosticCode.TYPE_MISMATCH,
                    String.format("Literal binding is %s but the property is %s", literal.type(), own.type()))
                    .at(node.getId(), property));
            }
            return Resolution.success(ResolvedValue.literal(literal));
        }

        String name = ((Binding.VariableRef) binding.get()).variableName();
        Optional<Variable> variable = variables.get(name);
        if (variable.isEmpty()) {
            return Resolution.failure(Diagnostic.error(DiagnosticCode.DANGLING_BINDING,
                String.format("Property is bound to undefined variable '%s'", name))
                .at(node.getId(), property));
        }
        Optional<PropertyValue> converted = convert(variable.get(), own.type());
        if (converted.isEmpty()) {
            return Resolution.failure(Diagnostic.error(DiagnosticCode.TYPE_MISMATCH,
                String.format("Variable '%s' is %s and cannot feed a %s property",
                    name, variable.get().type().wireName(), own.type()))
                .at(node.getId(), property));
        }
        return Resolution.success(new ResolvedValue(converted.get(), variable.get()));
    }

    /**
     * Checks whether a variable of the given type may feed a property of the given type.
     *
     * @param variableType the variable type
     * @param propertyType the property type
     * @return true if a binding between them resolves
     */
    public static boolean isCompatible(VariableType variableType, PropertyType propertyType) {
        switch (propertyType) {
            case STRING:
                return true;
            case INTEGER:
                return variableType == VariableType.INTEGER;
            case FLOAT:
                return variableType.isNumeric();
            case BOOLEAN:
                return variableType == VariableType.BOOLEAN;
            default:
                return false;
        }
    }

    private static Optional<PropertyValue> convert(Variable variable, PropertyType target) {
        if (!isCompatible(variable.type(), target)) {
            return Optional.empty();
        }
        Object value = variable.defaultValue();
        switch (target) {
            case STRING:
                return Optional.of(PropertyValue.ofString(displayText(value)));
            case INTEGER:
                return Optional.of(PropertyValue.ofInteger((Long) value));
            case FLOAT:
                return Optional.of(PropertyValue.ofFloat(((Number) value).doubleValue()));
            case BOOLEAN:
                return Optional.of(PropertyValue.ofBoolean((Boolean) value));
            default:
                return Optional.empty();
        }
    }

    private static String displayText(Object value) {
        if (value instanceof Double) {
            return BigDecimal.valueOf((Double) value).stripTrailingZeros().toPlainString();
        }
        return String.valueOf(value);
    }

    /**
     * Resolves an action to a typed effect.
     *
     * @param action the action
     * @param variables the variable store
     * @return the effect, or DANGLING_BINDING / TYPE_MISMATCH / INVALID_FRAGMENT
     */
    public Resolution<ResolvedEffect> resolveAction(Action action, VariableStore variables) {
        if (action instanceof Action.InlineCode) {
            String source = ((Action.InlineCode) action).source();
            SyntaxCheck check = validator.checkStatements(source);
            if (!check.valid()) {
                return Resolution.failure(invalidFragment(check));
            }
            return Resolution.success(new ResolvedEffect.Inline(source));
        }

        String name = action.variableName()
            .orElseThrow(() -> new IllegalArgumentException("Unsupported action: " + action));
        Optional<Variable> target = variables.get(name);
        if (target.isEmpty()) {
            return Resolution.failure(Diagnostic.error(DiagnosticCode.DANGLING_BINDING,
                String.format("Action targets undefined variable '%s'", name)));
        }
        Variable variable = target.get();

        if (action instanceof Action.IncrementVariable) {
            if (!variable.type().isNumeric()) {
                return Resolution.failure(Diagnostic.error(DiagnosticCode.TYPE_MISMATCH,
                    String.format("Cannot increment %s variable '%s'", variable.type().wireName(), name)));
            }
            return Resolution.success(new ResolvedEffect.Increment(variable));
        }
        if (action instanceof Action.SetVariable) {
            return resolveAssignment(variable, ((Action.SetVariable) action).value());
        }
        throw new IllegalArgumentException("Unsupported action: " + action);
    }

    /*
     * Numeric and boolean targets take a literal of their own type or an expression.
     * A literal of another type is a mismatch. String targets take a quoted literal or
     * an expression; anything else is treated as plain text.
     */
    private Resolution<ResolvedEffect> resolveAssignment(Variable variable, String text) {
        String trimmed = text.trim();
        if (variable.type() == VariableType.STRING) {
            if (isOtherLiteral(trimmed) || Identifiers.isValid(trimmed) || trimmed.isEmpty()) {
                return Resolution.success(new ResolvedEffect.Assign(variable, JsAst.str(text)));
            }
            if (validator.checkExpression(trimmed).valid()) {
                return Resolution.success(new ResolvedEffect.Assign(variable, new JsAst.Raw(trimmed)));
            }
            return Resolution.success(new ResolvedEffect.Assign(variable, JsAst.str(text)));
        }

        try {
            Object value = variable.type().parse(trimmed);
            return Resolution.success(new ResolvedEffect.Assign(variable, JsAst.literalOf(value)));
        } catch (IllegalArgumentException e) {
            if (isOtherLiteral(trimmed) || QUOTED_LITERAL.matcher(trimmed).matches()) {
                return Resolution.failure(Diagnostic.error(DiagnosticCode.TYPE_MISMATCH,
                    String.format("'%s' is not a %s value for variable '%s'",
                        trimmed, variable.type().wireName(), variable.name())));
            }
        }
        SyntaxCheck check = validator.checkExpression(trimmed);
        if (!check.valid()) {
            return Resolution.failure(invalidFragment(check));
        }
        return Resolution.success(new ResolvedEffect.Assign(variable, new JsAst.Raw(trimmed)));
    }

    private static boolean isOtherLiteral(String text) {
        return NUMBER_LITERAL.matcher(text).matches() || text.equals("true") || text.equals("false");
    }

    private static Diagnostic invalidFragment(SyntaxCheck check) {
        String where = check.line() > 0 ? " (line " + check.line() + ")" : "";
        return Diagnostic.error(DiagnosticCode.INVALID_FRAGMENT, check.message() + where);
    }

    /**
     * Collects every resolution problem of one node: bindings first, in property
     * declaration order, then actions in event order.
     *
     * @param node the node
     * @param variables the variable store
     * @return diagnostics located at the node
     */
    public List<Diagnostic> diagnose(Node node, VariableStore variables) {
        List<Diagnostic> diagnostics = new ArrayList<>();
        for (String property : node.properties().keySet()) {
            resolveProperty(node, property, variables).problem().ifPresent(diagnostics::add);
        }
        for (Map.Entry<NodeEvent, Action> entry : node.actions().entrySet()) {
            resolveAction(entry.getValue(), variables).problem()
                .ifPresent(d -> diagnostics.add(d.at(node.getId(), entry.getKey().wireName())));
        }
        return diagnostics;
    }
}
