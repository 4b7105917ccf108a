package com.aether.model.kinds;

import com.aether.model.NodeRegistry;

/**
 * The kinds every registry starts with, in palette order.
 */
public final class StandardKinds {

    private StandardKinds() {}

    /**
     * Registers all built-in kinds.
     *
     * @param registry an unfrozen registry
     */
    public static void registerAll(NodeRegistry registry) {
        registry.register(LayoutKind.vertical());
        registry.register(LayoutKind.horizontal());
        registry.register(LayoutKind.grid());
        registry.register(LayoutKind.scroll());
        registry.register(new LabelKind());
        registry.register(new ButtonKind());
        registry.register(new TextEditKind());
        registry.register(new CheckboxKind());
        registry.register(new SliderKind());
        registry.register(new ProgressBarKind());
        registry.register(new ImageKind());
        registry.register(new SeparatorKind());
        registry.register(new ComboBoxKind());
        registry.register(new HyperlinkKind());
    }
}
