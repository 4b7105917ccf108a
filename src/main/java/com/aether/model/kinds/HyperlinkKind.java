package com.aether.model.kinds;

import com.aether.codegen.LoweringContext;
import com.aether.codegen.ast.JsAst;
import com.aether.model.NodeEvent;
import com.aether.model.PropertyDefinition;
import com.aether.model.PropertyValue;

import java.util.List;
import java.util.Set;

public final class HyperlinkKind extends ElementKind {

    public HyperlinkKind() {
        super("hyperlink", "Hyperlink", false, "a", List.of(
            PropertyDefinition.bindable("text", PropertyValue.ofString("Link")),
            PropertyDefinition.fixed("url", PropertyValue.ofString("https://example.com"))),
            Set.of(NodeEvent.CLICKED));
    }

    @Override
    protected void configure(LoweringContext context, List<JsAst.Statement> out) {
        set(out, context.element(), "textContent", context.value("text"));
        set(out, context.element(), "href", JsAst.str(context.literal("url").asString()));
    }
}
