package com.aether.model.kinds;

import com.aether.codegen.LoweringContext;
import com.aether.codegen.ast.JsAst;
import com.aether.model.Node;
import com.aether.model.NodeEvent;
import com.aether.model.PropertyDefinition;
import com.aether.model.PropertyValue;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Range input between {@code min} and {@code max}.
 */
public final class SliderKind extends ElementKind {

    public SliderKind() {
        super("slider", "Slider", false, "input", List.of(
            PropertyDefinition.fixed("min", PropertyValue.ofFloat(0.0)),
            PropertyDefinition.fixed("max", PropertyValue.ofFloat(100.0)),
            PropertyDefinition.fixed("step", PropertyValue.ofFloat(1.0)),
            PropertyDefinition.bindable("value", PropertyValue.ofFloat(50.0))),
            Set.of(NodeEvent.CHANGED));
    }

    @Override
    public Optional<String> checkFields(Node node) {
        double min = node.property("min").asDouble();
        double max = node.property("max").asDouble();
        if (min > max) {
            return Optional.of(String.format("min %s is greater than max %s",
                node.property("min").displayText(), node.property("max").displayText()));
        }
        if (node.property("step").asDouble() <= 0) {
            return Optional.of("step must be positive");
        }
        return Optional.empty();
    }

    @Override
    protected void configure(LoweringContext context, List<JsAst.Statement> out) {
        set(out, context.element(), "type", JsAst.str("range"));
        set(out, context.element(), "min", JsAst.literal(context.literal("min")));
        set(out, context.element(), "max", JsAst.literal(context.literal("max")));
        set(out, context.element(), "step", JsAst.literal(context.literal("step")));
        set(out, context.element(), "value", context.value("value"));
        syncToState(context, out, context.element(), "change", "value",
            JsAst.member(context.element(), "value"), true);
    }
}
