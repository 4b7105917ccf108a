package com.aether.model.kinds;

import com.aether.codegen.LoweringContext;
import com.aether.codegen.ast.JsAst;
import com.aether.model.NodeEvent;
import com.aether.model.NodeKind;
import com.aether.model.PropertyDefinition;
import com.aether.model.PropertyType;
import com.aether.variables.Variable;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Base for kinds that lower to a single DOM element.
 *
 * Lowering always has the same shape: create the element, let the kind configure
 * it, append the lowered children, attach event listeners, then append the element
 * to its parent. Subclasses only fill in {@link #configure}.
 */
public abstract class ElementKind extends NodeKind {

    private final String htmlTag;

    protected ElementKind(String tag, String displayName, boolean container, String htmlTag,
                          List<PropertyDefinition> properties, Set<NodeEvent> events) {
        super(tag, displayName, container, properties, events);
        this.htmlTag = htmlTag;
    }

    public String htmlTag() {
        return htmlTag;
    }

    @Override
    public final List<JsAst.Statement> lower(LoweringContext context) {
        List<JsAst.Statement> out = new ArrayList<>();
        JsAst.Identifier element = context.element();
        out.add(new JsAst.Const(context.elementName(),
            JsAst.invoke(JsAst.id("document"), "createElement", JsAst.str(htmlTag))));
        out.add(JsAst.assign(JsAst.member(element, "className"), JsAst.str("ae-" + tag().replace('_', '-'))));
        configure(context, out);
        out.addAll(context.children());
        out.addAll(context.eventListeners());
        out.addAll(context.placeholders());
        out.add(JsAst.exec(JsAst.invoke(context.parent(), "appendChild", element)));
        return out;
    }

    /**
     * Emits the statements that set up the element after it was created.
     *
     * @param context the lowering context
     * @param out statements to append to
     */
    protected abstract void configure(LoweringContext context, List<JsAst.Statement> out);

    /**
     * Emits {@code element.style.<property> = value}.
     */
    protected static void style(LoweringContext context, List<JsAst.Statement> out, String property,
                                JsAst.Expression value) {
        out.add(JsAst.assign(JsAst.member(JsAst.member(context.element(), "style"), property), value));
    }

    protected static void set(List<JsAst.Statement> out, JsAst.Expression target, String property,
                              JsAst.Expression value) {
        out.add(JsAst.assign(JsAst.member(target, property), value));
    }

    /**
     * Emits a listener that writes user input back into the variable a property is
     * bound to. Does nothing for literal properties or variables the input cannot hold.
     *
     * @param context the lowering context
     * @param out statements to append to
     * @param target the element that emits the DOM event
     * @param domEvent the DOM event to listen for
     * @param property the bound property
     * @param rawValue expression reading the input's current value
     * @param rerender whether to re-render afterwards when no change handler does it already
     */
    protected static void syncToState(LoweringContext context, List<JsAst.Statement> out, JsAst.Expression target,
                                      String domEvent, String property, JsAst.Expression rawValue,
                                      boolean rerender) {
        Optional<Variable> variable = context.boundVariable(property);
        if (variable.isEmpty()) {
            return;
        }
        JsAst.Expression converted;
        switch (variable.get().type()) {
            case INTEGER -> converted = JsAst.invoke(JsAst.id("Math"), "round", JsAst.call(JsAst.id("Number"), rawValue));
            case FLOAT -> converted = JsAst.call(JsAst.id("Number"), rawValue);
            case BOOLEAN -> converted = context.literal(property).type() == PropertyType.BOOLEAN
                ? rawValue
                : new JsAst.Binary(rawValue, "===", JsAst.str("true"));
            default -> converted = rawValue;
        }
        List<JsAst.Statement> body = new ArrayList<>();
        body.add(JsAst.assign(JsAst.member(context.state(), variable.get().name()), converted));
        if (rerender && context.handler(NodeEvent.CHANGED).isEmpty()) {
            body.add(context.rerender());
        }
        out.add(context.listen(target, domEvent, body));
    }

    protected static JsAst.Expression pixels(long value) {
        return JsAst.str(value + "px");
    }
}
