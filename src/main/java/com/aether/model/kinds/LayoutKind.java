package com.aether.model.kinds;

import com.aether.codegen.LoweringContext;
import com.aether.codegen.ast.JsAst;
import com.aether.model.Node;
import com.aether.model.PropertyDefinition;
import com.aether.model.PropertyValue;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Containers that arrange their children in a row, a column, a grid or a scrollable column.
 */
public final class LayoutKind extends ElementKind {

    enum Arrangement {
        COLUMN,
        ROW,
        GRID,
        SCROLL
    }

    private final Arrangement arrangement;

    private LayoutKind(String tag, String displayName, Arrangement arrangement, List<PropertyDefinition> properties) {
        super(tag, displayName, true, "div", properties, Set.of());
        this.arrangement = arrangement;
    }

    public static LayoutKind vertical() {
        return new LayoutKind("vertical_layout", "Vertical Layout", Arrangement.COLUMN, List.of(
            PropertyDefinition.fixed("spacing", PropertyValue.ofInteger(8))));
    }

    public static LayoutKind horizontal() {
        return new LayoutKind("horizontal_layout", "Horizontal Layout", Arrangement.ROW, List.of(
            PropertyDefinition.fixed("spacing", PropertyValue.ofInteger(8))));
    }

    public static LayoutKind grid() {
        return new LayoutKind("grid_layout", "Grid Layout", Arrangement.GRID, List.of(
            PropertyDefinition.fixed("columns", PropertyValue.ofInteger(2)),
            PropertyDefinition.fixed("spacing", PropertyValue.ofInteger(8))));
    }

    public static LayoutKind scroll() {
        return new LayoutKind("scroll_area", "Scroll Area", Arrangement.SCROLL, List.of(
            PropertyDefinition.fixed("maxHeight", PropertyValue.ofInteger(300))));
    }

    @Override
    public Optional<String> checkFields(Node node) {
        if (node.hasProperty("spacing") && node.property("spacing").asLong() < 0) {
            return Optional.of("spacing must not be negative");
        }
        if (arrangement == Arrangement.GRID && node.property("columns").asLong() < 1) {
            return Optional.of("columns must be at least 1");
        }
        if (arrangement == Arrangement.SCROLL && node.property("maxHeight").asLong() < 1) {
            return Optional.of("maxHeight must be at least 1");
        }
        return Optional.empty();
    }

    @Override
    protected void configure(LoweringContext context, List<JsAst.Statement> out) {
        switch (arrangement) {
            case COLUMN, ROW -> {
                style(context, out, "display", JsAst.str("flex"));
                style(context, out, "flexDirection", JsAst.str(arrangement == Arrangement.ROW ? "row" : "column"));
                style(context, out, "gap", pixels(context.literal("spacing").asLong()));
            }
            case GRID -> {
                style(context, out, "display", JsAst.str("grid"));
                style(context, out, "gridTemplateColumns",
                    JsAst.str("repeat(" + context.literal("columns").asLong() + ", 1fr)"));
                style(context, out, "gap", pixels(context.literal("spacing").asLong()));
            }
            case SCROLL -> {
                style(context, out, "overflowY", JsAst.str("auto"));
                style(context, out, "maxHeight", pixels(context.literal("maxHeight").asLong()));
            }
        }
    }
}
