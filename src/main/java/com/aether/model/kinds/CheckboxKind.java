package com.aether.model.kinds;

import com.aether.codegen.LoweringContext;
import com.aether.codegen.ast.JsAst;
import com.aether.model.NodeEvent;
import com.aether.model.PropertyDefinition;
import com.aether.model.PropertyValue;

import java.util.List;
import java.util.Set;

/**
 * A labelled checkbox, lowered to a {@code label} wrapping the input and its caption.
 */
public final class CheckboxKind extends ElementKind {

    public CheckboxKind() {
        super("checkbox", "Checkbox", false, "label", List.of(
            PropertyDefinition.bindable("text", PropertyValue.ofString("Checkbox")),
            PropertyDefinition.bindable("checked", PropertyValue.ofBoolean(false))),
            Set.of(NodeEvent.CHANGED));
    }

    @Override
    protected void configure(LoweringContext context, List<JsAst.Statement> out) {
        JsAst.Identifier input = JsAst.id(context.helperName("Input"));
        out.add(new JsAst.Const(input.name(),
            JsAst.invoke(JsAst.id("document"), "createElement", JsAst.str("input"))));
        set(out, input, "type", JsAst.str("checkbox"));
        set(out, input, "checked", context.value("checked"));
        syncToState(context, out, input, "change", "checked", JsAst.member(input, "checked"), true);
        out.add(JsAst.exec(JsAst.invoke(context.element(), "append", input, context.value("text"))));
    }
}
