package com.aether.model.kinds;

import com.aether.codegen.LoweringContext;
import com.aether.codegen.ast.JsAst;
import com.aether.model.PropertyDefinition;
import com.aether.model.PropertyValue;

import java.util.List;
import java.util.Set;

/**
 * Progress indicator for a fraction between 0 and 1.
 */
public final class ProgressBarKind extends ElementKind {

    public ProgressBarKind() {
        super("progress_bar", "Progress Bar", false, "progress", List.of(
            PropertyDefinition.bindable("value", PropertyValue.ofFloat(0.5))),
            Set.of());
    }

    @Override
    protected void configure(LoweringContext context, List<JsAst.Statement> out) {
        set(out, context.element(), "max", JsAst.num(1L));
        set(out, context.element(), "value", context.value("value"));
    }
}
