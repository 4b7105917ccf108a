package com.aether.codegen.ast;

import com.aether.model.PropertyValue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Intermediate representation of generated JavaScript.
 *
 * Only the constructs the generator needs are modelled. Text that has already been
 * syntax-checked (inline fragments, assignment expressions) enters as {@link Raw}
 * or {@link RawStatements} and is emitted unchanged.
 */
public final class JsAst {

    private JsAst() {}

    /** Marker for expression nodes. */
    public interface Expression {}

    /** Marker for statement and module-level nodes. */
    public interface Statement {}

    // Expressions

    public record Identifier(String name) implements Expression {
        public Identifier {
            Objects.requireNonNull(name, "name");
        }
    }

    public record StringLiteral(String value) implements Expression {
        public StringLiteral {
            Objects.requireNonNull(value, "value");
        }
    }

    /** A numeric literal, stored as its canonical source text. */
    public record NumberLiteral(String text) implements Expression {}

    public record BooleanLiteral(boolean value) implements Expression {}

    public record ArrayLiteral(List<Expression> items) implements Expression {
        public ArrayLiteral {
            items = List.copyOf(items);
        }
    }

    public record Member(Expression target, String property) implements Expression {}

    public record Call(Expression callee, List<Expression> arguments) implements Expression {
        public Call {
            arguments = List.copyOf(arguments);
        }
    }

    public record New(Expression callee, List<Expression> arguments) implements Expression {
        public New {
            arguments = List.copyOf(arguments);
        }
    }

    public record Binary(Expression left, String operator, Expression right) implements Expression {}

    public record Unary(String operator, Expression operand) implements Expression {}

    /** Arrow function with a block body. */
    public record Arrow(List<String> parameters, List<Statement> body) implements Expression {
        public Arrow {
            parameters = List.copyOf(parameters);
            body = List.copyOf(body);
        }
    }

    /** Expression source that was validated before it entered the tree. */
    public record Raw(String source) implements Expression {}

    // Statements

    public record Const(String name, Expression initializer) implements Statement {}

    public record Let(String name, Expression initializer) implements Statement {}

    public record ExpressionStatement(Expression expression) implements Statement {}

    /** Assignment with {@code =} or a compound operator such as {@code +=}. */
    public record Assignment(Expression target, String operator, Expression value) implements Statement {}

    public record If(Expression condition, List<Statement> thenBranch) implements Statement {
        public If {
            thenBranch = List.copyOf(thenBranch);
        }
    }

    public record ForOf(String variable, Expression iterable, List<Statement> body) implements Statement {
        public ForOf {
            body = List.copyOf(body);
        }
    }

    /** Statements that were validated before they entered the tree. */
    public record RawStatements(String source) implements Statement {}

    /** Line comment; line breaks in the text become separate comment lines. */
    public record Comment(String text) implements Statement {}

    public record Blank() implements Statement {}

    // Module level

    public record Import(List<String> names, String from) implements Statement {
        public Import {
            names = List.copyOf(names);
        }
    }

    public record FunctionDeclaration(String name, List<String> parameters, List<Statement> body)
            implements Statement {
        public FunctionDeclaration {
            parameters = List.copyOf(parameters);
            body = List.copyOf(body);
        }
    }

    public record Method(String name, List<Statement> body) {
        public Method {
            body = List.copyOf(body);
        }
    }

    public record ClassDeclaration(String name, boolean exported, List<Method> methods) implements Statement {
        public ClassDeclaration {
            methods = List.copyOf(methods);
        }
    }

    public record Module(List<Statement> body) {
        public Module {
            body = List.copyOf(body);
        }
    }

    // Factories

    public static Identifier id(String name) {
        return new Identifier(name);
    }

    public static StringLiteral str(String value) {
        return new StringLiteral(value);
    }

    public static NumberLiteral num(long value) {
        return new NumberLiteral(Long.toString(value));
    }

    public static NumberLiteral num(double value) {
        if (Double.isNaN(value)) {
            return new NumberLiteral("NaN");
        }
        if (Double.isInfinite(value)) {
            return new NumberLiteral(value > 0 ? "Infinity" : "-Infinity");
        }
        return new NumberLiteral(BigDecimal.valueOf(value).stripTrailingZeros().toPlainString());
    }

    public static BooleanLiteral bool(boolean value) {
        return new BooleanLiteral(value);
    }

    public static Member member(Expression target, String property) {
        return new Member(target, property);
    }

    public static Member member(String target, String property) {
        return new Member(id(target), property);
    }

    public static Call call(Expression callee, Expression... arguments) {
        return new Call(callee, List.of(arguments));
    }

    /**
     * Builds {@code target.method(arguments)}.
     *
     * @param target the receiver
     * @param method the method name
     * @param arguments call arguments
     * @return the call expression
     */
    public static Call invoke(Expression target, String method, Expression... arguments) {
        return new Call(member(target, method), List.of(arguments));
    }

    public static Statement exec(Expression expression) {
        return new ExpressionStatement(expression);
    }

    public static Statement assign(Expression target, Expression value) {
        return new Assignment(target, "=", value);
    }

    public static Arrow arrow(List<Statement> body) {
        return new Arrow(List.of(), body);
    }

    /**
     * Converts a property literal to the matching expression.
     *
     * @param value the literal
     * @return the expression
     */
    public static Expression literal(PropertyValue value) {
        switch (value.type()) {
            case INTEGER:
                return num(value.asLong());
            case FLOAT:
                return num(value.asDouble());
            case BOOLEAN:
                return bool(value.asBoolean());
            case STRING_LIST:
                List<Expression> items = new ArrayList<>();
                for (String item : value.asStringList()) {
                    items.add(str(item));
                }
                return new ArrayLiteral(items);
            case STRING:
            case ASSET:
            default:
                return str(value.asString());
        }
    }

    /**
     * Converts a variable value ({@link String}, {@link Long}, {@link Double} or
     * {@link Boolean}) to the matching literal.
     *
     * @param value the canonical value
     * @return the literal expression
     */
    public static Expression literalOf(Object value) {
        if (value instanceof Long) {
            return num((Long) value);
        }
        if (value instanceof Double) {
            return num((Double) value);
        }
        if (value instanceof Boolean) {
            return bool((Boolean) value);
        }
        return str(String.valueOf(value));
    }
}
