package com.aether.model.kinds;

import com.aether.codegen.LoweringContext;
import com.aether.codegen.ast.JsAst;

import java.util.List;
import java.util.Set;

public final class SeparatorKind extends ElementKind {

    public SeparatorKind() {
        super("separator", "Separator", false, "hr", List.of(), Set.of());
    }

    @Override
    protected void configure(LoweringContext context, List<JsAst.Statement> out) {
        // nothing beyond the element itself
    }
}
