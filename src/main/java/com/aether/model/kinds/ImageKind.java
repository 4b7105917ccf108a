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
 * Image from the asset registry. An unresolved asset leaves the element without a source.
 */
public final class ImageKind extends ElementKind {

    public ImageKind() {
        super("image", "Image", false, "img", List.of(
            PropertyDefinition.fixed("asset", PropertyValue.ofAsset("")),
            PropertyDefinition.fixed("width", PropertyValue.ofInteger(0))),
            Set.of(NodeEvent.CLICKED, NodeEvent.HOVERED));
    }

    @Override
    public Optional<String> checkFields(Node node) {
        if (node.property("width").asLong() < 0) {
            return Optional.of("width must not be negative");
        }
        return Optional.empty();
    }

    @Override
    protected void configure(LoweringContext context, List<JsAst.Statement> out) {
        Optional<String> path = context.assetPath("asset");
        if (path.isPresent()) {
            set(out, context.element(), "src", JsAst.str(path.get()));
        }
        set(out, context.element(), "alt", JsAst.str(context.literal("asset").asString()));
        long width = context.literal("width").asLong();
        if (width > 0) {
            set(out, context.element(), "width", JsAst.num(width));
        }
    }
}
