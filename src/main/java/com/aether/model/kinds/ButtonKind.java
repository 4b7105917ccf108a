package com.aether.model.kinds;

import com.aether.codegen.LoweringContext;
import com.aether.codegen.ast.JsAst;
import com.aether.model.NodeEvent;
import com.aether.model.PropertyDefinition;
import com.aether.model.PropertyValue;

import java.util.List;
import java.util.Set;

public final class ButtonKind extends ElementKind {

    public ButtonKind() {
        super("button", "Button", false, "button", List.of(
            PropertyDefinition.bindable("text", PropertyValue.ofString("Button")),
            PropertyDefinition.bindable("enabled", PropertyValue.ofBoolean(true))),
            Set.of(NodeEvent.CLICKED, NodeEvent.DOUBLE_CLICKED, NodeEvent.HOVERED,
                NodeEvent.FOCUSED, NodeEvent.LOST_FOCUS));
    }

    @Override
    protected void configure(LoweringContext context, List<JsAst.Statement> out) {
        set(out, context.element(), "type", JsAst.str("button"));
        set(out, context.element(), "textContent", context.value("text"));
        if (context.boundVariable("enabled").isPresent()) {
            set(out, context.element(), "disabled", new JsAst.Unary("!", context.value("enabled")));
        } else if (!context.literal("enabled").asBoolean()) {
            set(out, context.element(), "disabled", JsAst.bool(true));
        }
    }
}
