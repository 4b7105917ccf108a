package com.aether.model.kinds;

import com.aether.codegen.LoweringContext;
import com.aether.codegen.ast.JsAst;
import com.aether.model.NodeEvent;
import com.aether.model.PropertyDefinition;
import com.aether.model.PropertyValue;

import java.util.List;
import java.util.Set;

/**
 * Single-line text input. A bound value is written back to its variable on every keystroke.
 */
public final class TextEditKind extends ElementKind {

    public TextEditKind() {
        super("text_edit", "Text Edit", false, "input", List.of(
            PropertyDefinition.bindable("value", PropertyValue.ofString("")),
            PropertyDefinition.fixed("hint", PropertyValue.ofString(""))),
            Set.of(NodeEvent.CHANGED, NodeEvent.FOCUSED, NodeEvent.LOST_FOCUS));
    }

    @Override
    protected void configure(LoweringContext context, List<JsAst.Statement> out) {
        set(out, context.element(), "type", JsAst.str("text"));
        set(out, context.element(), "value", context.value("value"));
        String hint = context.literal("hint").asString();
        if (!hint.isEmpty()) {
            set(out, context.element(), "placeholder", JsAst.str(hint));
        }
        // no re-render while typing, it would drop the focus
        syncToState(context, out, context.element(), "input", "value",
            JsAst.member(context.element(), "value"), false);
    }
}
