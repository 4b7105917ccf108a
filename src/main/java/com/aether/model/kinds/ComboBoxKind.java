package com.aether.model.kinds;

import com.aether.codegen.LoweringContext;
import com.aether.codegen.ast.JsAst;
import com.aether.model.NodeEvent;
import com.aether.model.PropertyDefinition;
import com.aether.model.PropertyValue;

import java.util.List;
import java.util.Set;

/**
 * Drop-down choice between fixed options. The selection is the option text.
 */
public final class ComboBoxKind extends ElementKind {

    public ComboBoxKind() {
        super("combo_box", "Combo Box", false, "select", List.of(
            PropertyDefinition.fixed("options", PropertyValue.ofStringList(List.of("Option 1", "Option 2"))),
            PropertyDefinition.bindable("selected", PropertyValue.ofString("Option 1"))),
            Set.of(NodeEvent.CHANGED));
    }

    @Override
    protected void configure(LoweringContext context, List<JsAst.Statement> out) {
        JsAst.Identifier option = JsAst.id("option");
        JsAst.Identifier item = JsAst.id("item");
        out.add(new JsAst.ForOf(option.name(), JsAst.literal(context.literal("options")), List.of(
            new JsAst.Const(item.name(), JsAst.invoke(JsAst.id("document"), "createElement", JsAst.str("option"))),
            JsAst.assign(JsAst.member(item, "value"), option),
            JsAst.assign(JsAst.member(item, "textContent"), option),
            JsAst.exec(JsAst.invoke(context.element(), "appendChild", item)))));
        set(out, context.element(), "value", context.value("selected"));
        syncToState(context, out, context.element(), "change", "selected",
            JsAst.member(context.element(), "value"), true);
    }
}
