package com.aether.codegen.ast;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Renders {@link JsAst} to JavaScript source.
 *
 * Output is one construct per line with no indentation; layout is left to
 * {@link com.aether.codegen.SourceFormatter}. Rendering is a pure function of the tree.
 */
public final class JsRenderer {

    private static final Pattern SIMPLE_EXPRESSION = Pattern.compile("[A-Za-z0-9_$.]+");
    private static final Pattern LINE_BREAK = Pattern.compile("\r\n|[\r\n\u2028\u2029]");

    private JsRenderer() {}

    /**
     * Renders a whole module.
     *
     * @param module the module
     * @return source text ending with a newline
     */
    public static String render(JsAst.Module module) {
        StringBuilder out = new StringBuilder();
        for (JsAst.Statement statement : module.body()) {
            statement(statement, out);
        }
        return out.toString();
    }

    /**
     * Renders a list of statements.
     *
     * @param statements the statements
     * @return source text, one line per statement
     */
    public static String render(List<JsAst.Statement> statements) {
        StringBuilder out = new StringBuilder();
        for (JsAst.Statement statement : statements) {
            statement(statement, out);
        }
        return out.toString();
    }

    private static void statement(JsAst.Statement statement, StringBuilder out) {
        if (statement instanceof JsAst.Const) {
            JsAst.Const c = (JsAst.Const) statement;
            line(out, "const " + c.name() + " = " + expression(c.initializer()) + ";");
        } else if (statement instanceof JsAst.Let) {
            JsAst.Let l = (JsAst.Let) statement;
            line(out, "let " + l.name() + " = " + expression(l.initializer()) + ";");
        } else if (statement instanceof JsAst.ExpressionStatement) {
            line(out, expression(((JsAst.ExpressionStatement) statement).expression()) + ";");
        } else if (statement instanceof JsAst.Assignment) {
            JsAst.Assignment a = (JsAst.Assignment) statement;
            line(out, expression(a.target()) + " " + a.operator() + " " + operand(a.value()) + ";");
        } else if (statement instanceof JsAst.If) {
            JsAst.If i = (JsAst.If) statement;
            line(out, "if (" + expression(i.condition()) + ") {");
            block(i.thenBranch(), out);
            line(out, "}");
        } else if (statement instanceof JsAst.ForOf) {
            JsAst.ForOf f = (JsAst.ForOf) statement;
            line(out, "for (const " + f.variable() + " of " + expression(f.iterable()) + ") {");
            block(f.body(), out);
            line(out, "}");
        } else if (statement instanceof JsAst.RawStatements) {
            for (String rawLine : LINE_BREAK.split(((JsAst.RawStatements) statement).source(), -1)) {
                line(out, rawLine);
            }
        } else if (statement instanceof JsAst.Comment) {
            for (String commentLine : LINE_BREAK.split(((JsAst.Comment) statement).text(), -1)) {
                line(out, commentLine.isBlank() ? "//" : "// " + commentLine.strip());
            }
        } else if (statement instanceof JsAst.Blank) {
            line(out, "");
        } else if (statement instanceof JsAst.Import) {
            JsAst.Import i = (JsAst.Import) statement;
            line(out, "import { " + String.join(", ", i.names()) + " } from " + quote(i.from()) + ";");
        } else if (statement instanceof JsAst.FunctionDeclaration) {
            JsAst.FunctionDeclaration f = (JsAst.FunctionDeclaration) statement;
            line(out, "function " + f.name() + "(" + String.join(", ", f.parameters()) + ") {");
            block(f.body(), out);
            line(out, "}");
        } else if (statement instanceof JsAst.ClassDeclaration) {
            classDeclaration((JsAst.ClassDeclaration) statement, out);
        } else {
            throw new IllegalArgumentException("Unsupported statement: " + statement);
        }
    }

    private static void classDeclaration(JsAst.ClassDeclaration declaration, StringBuilder out) {
        line(out, (declaration.exported() ? "export " : "") + "class " + declaration.name() + " {");
        boolean first = true;
        for (JsAst.Method method : declaration.methods()) {
            if (!first) {
                line(out, "");
            }
            first = false;
            line(out, method.name() + "() {");
            block(method.body(), out);
            line(out, "}");
        }
        line(out, "}");
    }

    private static void block(List<JsAst.Statement> statements, StringBuilder out) {
        for (JsAst.Statement statement : statements) {
            statement(statement, out);
        }
    }

    /**
     * Renders an expression. Arrow bodies span several lines.
     *
     * @param expression the expression
     * @return source text
     */
    public static String expression(JsAst.Expression expression) {
        if (expression instanceof JsAst.Identifier) {
            return ((JsAst.Identifier) expression).name();
        }
        if (expression instanceof JsAst.StringLiteral) {
            return quote(((JsAst.StringLiteral) expression).value());
        }
        if (expression instanceof JsAst.NumberLiteral) {
            return ((JsAst.NumberLiteral) expression).text();
        }
        if (expression instanceof JsAst.BooleanLiteral) {
            return String.valueOf(((JsAst.BooleanLiteral) expression).value());
        }
        if (expression instanceof JsAst.ArrayLiteral) {
            return "[" + arguments(((JsAst.ArrayLiteral) expression).items()) + "]";
        }
        if (expression instanceof JsAst.Member) {
            JsAst.Member m = (JsAst.Member) expression;
            return receiver(m.target()) + "." + m.property();
        }
        if (expression instanceof JsAst.Call) {
            JsAst.Call c = (JsAst.Call) expression;
            return receiver(c.callee()) + "(" + arguments(c.arguments()) + ")";
        }
        if (expression instanceof JsAst.New) {
            JsAst.New n = (JsAst.New) expression;
            return "new " + receiver(n.callee()) + "(" + arguments(n.arguments()) + ")";
        }
        if (expression instanceof JsAst.Binary) {
            JsAst.Binary b = (JsAst.Binary) expression;
            return operand(b.left()) + " " + b.operator() + " " + operand(b.right());
        }
        if (expression instanceof JsAst.Unary) {
            JsAst.Unary u = (JsAst.Unary) expression;
            return u.operator() + operand(u.operand());
        }
        if (expression instanceof JsAst.Arrow) {
            JsAst.Arrow a = (JsAst.Arrow) expression;
            StringBuilder body = new StringBuilder();
            block(a.body(), body);
            return "(" + String.join(", ", a.parameters()) + ") => {\n" + body + "}";
        }
        if (expression instanceof JsAst.Raw) {
            return ((JsAst.Raw) expression).source();
        }
        throw new IllegalArgumentException("Unsupported expression: " + expression);
    }

    private static String arguments(List<JsAst.Expression> arguments) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(expression(arguments.get(i)));
        }
        return sb.toString();
    }

    private static String receiver(JsAst.Expression expression) {
        if (expression instanceof JsAst.Identifier
                || expression instanceof JsAst.Member
                || expression instanceof JsAst.Call) {
            return expression(expression);
        }
        return parenthesize(expression(expression));
    }

    private static String operand(JsAst.Expression expression) {
        if (expression instanceof JsAst.Binary) {
            return "(" + expression(expression) + ")";
        }
        if (expression instanceof JsAst.Raw) {
            String source = ((JsAst.Raw) expression).source().strip();
            return SIMPLE_EXPRESSION.matcher(source).matches() ? source : parenthesize(source);
        }
        return expression(expression);
    }

    // A trailing line comment must not swallow the closing parenthesis.
    private static String parenthesize(String source) {
        return source.indexOf('/') >= 0 ? "(" + source + "\n)" : "(" + source + ")";
    }

    /**
     * Quotes text as a single-quoted JavaScript string literal.
     *
     * @param value raw text
     * @return the literal, including quotes
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 2).append('\'');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\'' -> sb.append("\\'");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '\u2028' -> sb.append("\\u2028");
                case '\u2029' -> sb.append("\\u2029");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('\'').toString();
    }

    private static void line(StringBuilder out, String text) {
        out.append(text).append('\n');
    }
}
