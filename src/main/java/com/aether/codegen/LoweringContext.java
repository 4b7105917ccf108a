package com.aether.codegen;

import com.aether.binding.ResolvedValue;
import com.aether.codegen.ast.JsAst;
import com.aether.model.Node;
import com.aether.model.NodeEvent;
import com.aether.model.PropertyType;
import com.aether.model.PropertyValue;
import com.aether.variables.Variable;
import com.aether.variables.VariableType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything a {@link com.aether.model.NodeKind} needs to lower one node.
 *
 * Properties arrive resolved (failed bindings already replaced by the node's own
 * literal), children arrive lowered in child order, and every event whose action
 * resolved has a handler method name on the generated state class.
 */
public final class LoweringContext {

    static final String STATE = "state";
    static final String ROOT = "root";
    static final String RENDER = "render";

    private final Node node;
    private final String elementName;
    private final JsAst.Expression parent;
    private final Map<String, ResolvedValue> properties;
    private final Map<String, String> assetPaths;
    private final List<JsAst.Statement> children;
    private final Map<NodeEvent, String> handlers;
    private final List<JsAst.Statement> placeholders;

    LoweringContext(Node node, String elementName, JsAst.Expression parent,
                    Map<String, ResolvedValue> properties, Map<String, String> assetPaths,
                    List<JsAst.Statement> children, Map<NodeEvent, String> handlers,
                    List<JsAst.Statement> placeholders) {
        this.node = node;
        this.elementName = elementName;
        this.parent = parent;
        this.properties = properties;
        this.assetPaths = assetPaths;
        this.children = children;
        this.handlers = handlers;
        this.placeholders = placeholders;
    }

    public Node node() {
        return node;
    }

    /**
     * Gets the local variable name the element is created under, e.g. {@code button1}.
     *
     * @return the element name
     */
    public String elementName() {
        return elementName;
    }

    public JsAst.Identifier element() {
        return JsAst.id(elementName);
    }

    /**
     * Gets a name derived from the element name for a helper local.
     *
     * @param suffix the suffix, e.g. {@code Input}
     * @return the helper name
     */
    public String helperName(String suffix) {
        return elementName + suffix;
    }

    public JsAst.Expression parent() {
        return parent;
    }

    public JsAst.Identifier state() {
        return JsAst.id(STATE);
    }

    /**
     * Gets the resolved literal of a property.
     *
     * @param property the property name
     * @return the literal
     */
    public PropertyValue literal(String property) {
        ResolvedValue value = properties.get(property);
        if (value == null) {
            throw new IllegalArgumentException("Kind '" + node.getKind() + "' has no property '" + property + "'");
        }
        return value.value();
    }

    /**
     * Gets the variable a property follows at runtime.
     *
     * @param property the property name
     * @return the variable, empty for literal properties
     */
    public Optional<Variable> boundVariable(String property) {
        literal(property);
        return properties.get(property).boundVariable();
    }

    /**
     * Gets the expression that yields a property's value at render time: a read of
     * the bound state field, converted where the property is text, or the literal.
     *
     * @param property the property name
     * @return the value expression
     */
    public JsAst.Expression value(String property) {
        PropertyValue literal = literal(property);
        Optional<Variable> variable = boundVariable(property);
        if (variable.isEmpty()) {
            return JsAst.literal(literal);
        }
        JsAst.Expression read = JsAst.member(state(), variable.get().name());
        if (literal.type() == PropertyType.STRING && variable.get().type() != VariableType.STRING) {
            return JsAst.call(JsAst.id("String"), read);
        }
        return read;
    }

    /**
     * Gets the exported path of an asset property.
     *
     * @param property an asset property
     * @return relative path inside the generated project, empty if unset or missing
     */
    public Optional<String> assetPath(String property) {
        return Optional.ofNullable(assetPaths.get(property));
    }

    public List<JsAst.Statement> children() {
        return children;
    }

    /**
     * Gets the state method handling an event.
     *
     * @param event the event
     * @return the handler name, empty if the node has no resolved action for it
     */
    public Optional<String> handler(NodeEvent event) {
        return Optional.ofNullable(handlers.get(event));
    }

    public Map<NodeEvent, String> handlers() {
        return Collections.unmodifiableMap(handlers);
    }

    /**
     * Gets comments standing in for actions that could not be resolved.
     *
     * @return placeholder comments
     */
    public List<JsAst.Statement> placeholders() {
        return placeholders;
    }

    public JsAst.Statement rerender() {
        return JsAst.exec(JsAst.call(JsAst.id(RENDER), JsAst.id(ROOT)));
    }

    /**
     * Builds {@code target.addEventListener(domEvent, () => { body });}.
     *
     * @param target the element listened on
     * @param domEvent the DOM event name
     * @param body listener statements
     * @return the statement
     */
    public JsAst.Statement listen(JsAst.Expression target, String domEvent, List<JsAst.Statement> body) {
        return JsAst.exec(JsAst.invoke(target, "addEventListener", JsAst.str(domEvent), JsAst.arrow(body)));
    }

    /**
     * Builds the listeners that call the state handlers of this node and re-render.
     *
     * @return one listener per handled event, in event order
     */
    public List<JsAst.Statement> eventListeners() {
        List<JsAst.Statement> listeners = new ArrayList<>();
        for (Map.Entry<NodeEvent, String> entry : handlers.entrySet()) {
            listeners.add(listen(element(), entry.getKey().domEvent(), List.of(
                JsAst.exec(JsAst.invoke(state(), entry.getValue())),
                rerender())));
        }
        return listeners;
    }
}
