package com.aether.model.kinds;

import com.aether.codegen.LoweringContext;
import com.aether.codegen.ast.JsAst;
import com.aether.model.NodeEvent;
import com.aether.model.PropertyDefinition;
import com.aether.model.PropertyValue;

import java.util.List;
import java.util.Set;

/**
 * Static or variable-driven text.
 */
public final class LabelKind extends ElementKind {

    public LabelKind() {
        super("label", "Label", false, "span", List.of(
            PropertyDefinition.bindable("text", PropertyValue.ofString("Label"))),
            Set.of(NodeEvent.CLICKED, NodeEvent.HOVERED));
    }

    @Override
    protected void configure(LoweringContext context, List<JsAst.Statement> out) {
        set(out, context.element(), "textContent", context.value("text"));
    }
}
