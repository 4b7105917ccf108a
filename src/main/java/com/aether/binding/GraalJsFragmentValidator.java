package com.aether.binding;

import org.graalvm.polyglot.Context;
import org.graalvm.polyglot.Engine;
import org.graalvm.polyglot.EnvironmentAccess;
import org.graalvm.polyglot.HostAccess;
import org.graalvm.polyglot.PolyglotException;
import org.graalvm.polyglot.Source;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * JavaScript syntax checks backed by GraalJS.
 *
 * Sources are only ever parsed with {@link Context#parse(Source)}, never evaluated.
 * Fragments are parsed inside two different wrappers; text that escapes one wrapper
 * (for example by closing the function early) breaks the other one. Both wrappers
 * are strict, as the generated ES modules are.
 *
 * One engine is shared; every check runs in its own short-lived context, so an
 * instance may be used from the editing thread and from background generation at once.
 */
public class GraalJsFragmentValidator implements FragmentValidator, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(GraalJsFragmentValidator.class);

    private static final String MODULE_MIME_TYPE = "application/javascript+module";

    private static final String[] STATEMENT_WRAPPERS = {
        "'use strict'; (function () {\n%s\n})",
        "'use strict'; function fragment() {\n%s\n}"
    };

    private static final String[] EXPRESSION_WRAPPERS = {
        "'use strict'; (\n%s\n);",
        "'use strict'; [\n%s\n];"
    };

    private final Engine engine;

    public GraalJsFragmentValidator() {
        this.engine = Engine.newBuilder("js")
            .option("engine.WarnInterpreterOnly", "false")
            .build();
    }

    @Override
    public SyntaxCheck checkStatements(String source) {
        return checkWrapped(source, STATEMENT_WRAPPERS, "fragment.js");
    }

    @Override
    public SyntaxCheck checkExpression(String source) {
        if (source == null || source.isBlank()) {
            return SyntaxCheck.failed("Expression is empty", 0);
        }
        return checkWrapped(source, EXPRESSION_WRAPPERS, "expression.js");
    }

    @Override
    public SyntaxCheck checkModule(String source, String name) {
        Source module = Source.newBuilder("js", source, name)
            .mimeType(MODULE_MIME_TYPE)
            .buildLiteral();
        return parse(module, 0);
    }

    private SyntaxCheck checkWrapped(String source, String[] wrappers, String name) {
        if (source == null) {
            return SyntaxCheck.failed("Fragment is missing", 0);
        }
        for (String wrapper : wrappers) {
            Source wrapped = Source.newBuilder("js", String.format(wrapper, source), name).buildLiteral();
            SyntaxCheck check = parse(wrapped, 1);
            if (!check.valid()) {
                return check;
            }
        }
        return SyntaxCheck.ok();
    }

    private SyntaxCheck parse(Source source, int prefixLines) {
        try (Context context = Context.newBuilder("js")
                .engine(engine)
                .allowHostAccess(HostAccess.NONE)
                .allowHostClassLookup(className -> false)
                .allowIO(false)
                .allowCreateThread(false)
                .allowNativeAccess(false)
                .allowEnvironmentAccess(EnvironmentAccess.NONE)
                .build()) {
            context.parse(source);
            return SyntaxCheck.ok();
        } catch (PolyglotException e) {
            int line = 0;
            if (e.getSourceLocation() != null) {
                line = Math.max(1, e.getSourceLocation().getStartLine() - prefixLines);
            }
            if (!e.isSyntaxError()) {
                LOGGER.warn("Unexpected parser failure for {}: {}", source.getName(), e.getMessage());
            }
            return SyntaxCheck.failed(stripLocation(e.getMessage()), line);
        }
    }

    // GraalJS prefixes messages with "<name>:<line>:<col> "
    private static String stripLocation(String message) {
        if (message == null) {
            return "Syntax error";
        }
        int space = message.indexOf(' ');
        if (space > 0 && message.substring(0, space).matches(".*:\\d+:\\d+")) {
            return message.substring(space + 1);
        }
        return message;
    }

    @Override
    public void close() {
        engine.close();
    }
}
