package com.aether.model;

import com.aether.assets.AssetRegistry;
import com.aether.variables.VariableStore;
import com.aether.variables.VariableType;

import java.util.List;

/**
 * Starter documents offered when a new project is created.
 */
public final class DocumentTemplates {

    public static final List<String> NAMES = List.of("empty", "counter", "form", "dashboard");

    private DocumentTemplates() {}

    /**
     * Creates a template by name.
     *
     * @param name one of {@link #NAMES}
     * @param registry the registry to build nodes from
     * @return the new document
     * @throws IllegalArgumentException if no template has that name
     */
    public static Document byName(String name, NodeRegistry registry) {
        return switch (name) {
            case "empty" -> empty(registry);
            case "counter" -> counterApp(registry);
            case "form" -> contactForm(registry);
            case "dashboard" -> dashboard(registry);
            default -> throw new IllegalArgumentException(
                "Unknown template '" + name + "', expected one of " + NAMES);
        };
    }

    /**
     * An untitled project holding an empty vertical layout.
     *
     * @param registry the registry to build nodes from
     * @return the new document
     */
    public static Document empty(NodeRegistry registry) {
        return assemble("Untitled", registry.create("vertical_layout"), registry, new VariableStore());
    }

    /**
     * A heading, a label bound to {@code counter} and a button incrementing it.
     *
     * @param registry the registry to build nodes from
     * @return the new document
     */
    public static Document counterApp(NodeRegistry registry) {
        Node root = registry.create("vertical_layout");
        root.addChild(label(registry, "Counter App"));

        Node counterLabel = label(registry, "Count: 0");
        counterLabel.setBinding("text", Binding.variable("counter"));
        root.addChild(counterLabel);

        Node button = registry.create("button");
        button.setProperty("text", PropertyValue.ofString("Increment"));
        button.setAction(NodeEvent.CLICKED, new Action.IncrementVariable("counter"));
        root.addChild(button);

        VariableStore variables = new VariableStore();
        variables.define("counter", VariableType.INTEGER, 0L);
        return assemble("Counter App", root, registry, variables);
    }

    /**
     * Name and email fields bound to string variables, and a submit button.
     *
     * @param registry the registry to build nodes from
     * @return the new document
     */
    public static Document contactForm(NodeRegistry registry) {
        Node root = registry.create("vertical_layout");
        root.addChild(label(registry, "Contact Form"));
        root.addChild(label(registry, "Name:"));
        root.addChild(boundField(registry, "name"));
        root.addChild(label(registry, "Email:"));
        root.addChild(boundField(registry, "email"));

        Node submit = registry.create("button");
        submit.setProperty("text", PropertyValue.ofString("Submit"));
        root.addChild(submit);

        VariableStore variables = new VariableStore();
        variables.define("name", VariableType.STRING, "");
        variables.define("email", VariableType.STRING, "");
        return assemble("Contact Form", root, registry, variables);
    }

    /**
     * Two metric rows, each a label next to a progress bar bound to a float variable.
     *
     * @param registry the registry to build nodes from
     * @return the new document
     */
    public static Document dashboard(NodeRegistry registry) {
        Node root = registry.create("vertical_layout");
        root.addChild(label(registry, "Dashboard"));
        root.addChild(metricRow(registry, "CPU Usage:", "cpuUsage", 0.45));
        root.addChild(metricRow(registry, "Memory Usage:", "memoryUsage", 0.60));

        VariableStore variables = new VariableStore();
        variables.define("cpuUsage", VariableType.FLOAT, 0.45);
        variables.define("memoryUsage", VariableType.FLOAT, 0.60);
        return assemble("Dashboard", root, registry, variables);
    }

    private static Node metricRow(NodeRegistry registry, String caption, String variable, double value) {
        Node row = registry.create("horizontal_layout");
        row.addChild(label(registry, caption));
        Node bar = registry.create("progress_bar");
        bar.setProperty("value", PropertyValue.ofFloat(value));
        bar.setBinding("value", Binding.variable(variable));
        row.addChild(bar);
        return row;
    }

    private static Node label(NodeRegistry registry, String text) {
        Node label = registry.create("label");
        label.setProperty("text", PropertyValue.ofString(text));
        return label;
    }

    private static Node boundField(NodeRegistry registry, String variable) {
        Node field = registry.create("text_edit");
        field.setBinding("value", Binding.variable(variable));
        return field;
    }

    private static Document assemble(String name, Node root, NodeRegistry registry, VariableStore variables) {
        try {
            return new Document(name, new DocumentTree(registry, root), variables, new AssetRegistry());
        } catch (StructuralException e) {
            throw new IllegalStateException("Template '" + name + "' is inconsistent", e);
        }
    }
}
