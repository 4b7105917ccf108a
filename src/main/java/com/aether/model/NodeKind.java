package com.aether.model;

import com.aether.binding.BindingResolver;
import com.aether.binding.ResolvedValue;
import com.aether.binding.Resolution;
import com.aether.codegen.LoweringContext;
import com.aether.codegen.ast.JsAst;
import com.aether.persistence.MalformedFieldsException;
import com.aether.variables.VariableStore;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Everything the system knows about one kind of node.
 *
 * A kind is registered under its tag in a {@link NodeRegistry}; the tree only stores
 * the tag, so new kinds never require a change to the serializer, the resolver or
 * the generator. Subclasses declare their properties and events and implement
 * {@link #lower(LoweringContext)}. Field serialization is driven by the property
 * declarations and can be overridden where a kind needs more than a type check.
 */
public abstract class NodeKind {

    private final String tag;
    private final String displayName;
    private final boolean container;
    private final List<PropertyDefinition> properties;
    private final Set<NodeEvent> events;

    protected NodeKind(String tag, String displayName, boolean container,
                       List<PropertyDefinition> properties, Set<NodeEvent> events) {
        this.tag = tag;
        this.displayName = displayName;
        this.container = container;
        this.properties = List.copyOf(properties);
        this.events = events.isEmpty()
            ? Collections.unmodifiableSet(EnumSet.noneOf(NodeEvent.class))
            : Collections.unmodifiableSet(EnumSet.copyOf(events));
    }

    /**
     * Gets the stable tag used in persisted documents. Renaming it breaks old files.
     *
     * @return the kind tag
     */
    public String tag() {
        return tag;
    }

    public String displayName() {
        return displayName;
    }

    public boolean isContainer() {
        return container;
    }

    public List<PropertyDefinition> properties() {
        return properties;
    }

    public Optional<PropertyDefinition> propertyDefinition(String name) {
        for (PropertyDefinition definition : properties) {
            if (definition.name().equals(name)) {
                return Optional.of(definition);
            }
        }
        return Optional.empty();
    }

    public Set<NodeEvent> events() {
        return events;
    }

    public boolean supports(NodeEvent event) {
        return events.contains(event);
    }

    /**
     * Creates a default-initialized node with a random id.
     *
     * @return the new, detached node
     */
    public Node create() {
        return create(UUID.randomUUID());
    }

    /**
     * Creates a default-initialized node.
     *
     * @param id the node id
     * @return the new, detached node
     */
    public Node create(UUID id) {
        Node node = new Node(id, tag, container);
        for (PropertyDefinition definition : properties) {
            node.defineProperty(definition.name(), definition.defaultValue());
        }
        return node;
    }

    /**
     * Writes the kind-specific fields of a node: declared properties in declaration
     * order, followed by preserved unknown fields.
     *
     * @param node the node
     * @param fields the target object
     */
    public void writeFields(Node node, JsonObject fields) {
        for (PropertyDefinition definition : properties) {
            fields.add(definition.name(), node.property(definition.name()).toJson());
        }
        for (Map.Entry<String, JsonElement> extra : node.extraFields().entrySet()) {
            fields.add(extra.getKey(), extra.getValue().deepCopy());
        }
    }

    /**
     * Reads the kind-specific fields into a freshly created node. Missing fields keep
     * their defaults, unknown fields are preserved opaquely.
     *
     * @param node a node created by this kind
     * @param fields the persisted fields
     * @param path location used in error messages
     * @throws MalformedFieldsException if a field has the wrong type or the kind's own check fails
     */
    public void readFields(Node node, JsonObject fields, String path) throws MalformedFieldsException {
        for (Map.Entry<String, JsonElement> entry : fields.entrySet()) {
            Optional<PropertyDefinition> definition = propertyDefinition(entry.getKey());
            if (definition.isEmpty()) {
                node.putExtraField(entry.getKey(), entry.getValue());
                continue;
            }
            try {
                node.setProperty(entry.getKey(), PropertyValue.fromJson(definition.get().type(), entry.getValue()));
            } catch (IllegalArgumentException e) {
                throw new MalformedFieldsException(tag,
                    String.format("field '%s' %s", entry.getKey(), e.getMessage()), path, e);
            }
        }
        Optional<String> problem = checkFields(node);
        if (problem.isPresent()) {
            throw new MalformedFieldsException(tag, problem.get(), path);
        }
    }

    /**
     * Checks constraints across the fields of a node beyond their types.
     *
     * @param node the node
     * @return a description of the violated constraint, if any
     */
    public Optional<String> checkFields(Node node) {
        return Optional.empty();
    }

    /**
     * Resolves every declared property of a node against the variable store.
     *
     * @param node the node
     * @param resolver the resolver
     * @param variables the variable store
     * @return resolutions keyed by property name, in declaration order
     */
    public Map<String, Resolution<ResolvedValue>> resolveProperties(Node node, BindingResolver resolver,
                                                                    VariableStore variables) {
        Map<String, Resolution<ResolvedValue>> resolved = new LinkedHashMap<>();
        for (PropertyDefinition definition : properties) {
            resolved.put(definition.name(), resolver.resolveProperty(node, definition.name(), variables));
        }
        return resolved;
    }

    /**
     * Lowers a node whose properties, children and actions are already resolved.
     *
     * @param context the lowering context of the node
     * @return statements that build the node and attach it to its parent
     */
    public abstract List<JsAst.Statement> lower(LoweringContext context);

    @Override
    public String toString() {
        return "NodeKind[" + tag + "]";
    }
}
