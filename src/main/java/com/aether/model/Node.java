package com.aether.model;

import com.google.gson.JsonElement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * One element of the document tree.
 *
 * A node carries its kind as a plain tag; everything kind-specific lives in the
 * {@link NodeKind} registered for that tag. The set of property names and their
 * types is fixed when the kind creates the node, so property writes are checked
 * here without consulting the registry.
 *
 * Children can only be added directly while the node is detached. Once a node
 * belongs to a {@link DocumentTree}, structural edits go through the tree so its
 * id index stays consistent.
 */
public final class Node {

    private final UUID id;
    private final String kind;
    private final Map<String, PropertyValue> properties = new LinkedHashMap<>();
    private final Map<String, Binding> bindings = new LinkedHashMap<>();
    private final Map<NodeEvent, Action> actions = new EnumMap<>(NodeEvent.class);
    private final List<Node> children;
    private final Map<String, JsonElement> extraFields = new LinkedHashMap<>();

    DocumentTree owner;

    Node(UUID id, String kind, boolean container) {
        this.id = Objects.requireNonNull(id, "id");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.children = container ? new ArrayList<>() : null;
    }

    public UUID getId() {
        return id;
    }

    public String getKind() {
        return kind;
    }

    public boolean isContainer() {
        return children != null;
    }

    public boolean isAttached() {
        return owner != null;
    }

    // Properties

    void defineProperty(String name, PropertyValue value) {
        properties.put(name, value);
    }

    public boolean hasProperty(String name) {
        return properties.containsKey(name);
    }

    /**
     * Gets a property literal.
     *
     * @param name the property name
     * @return the current value
     * @throws IllegalArgumentException if the kind has no such property
     */
    public PropertyValue property(String name) {
        PropertyValue value = properties.get(name);
        if (value == null) {
            throw new IllegalArgumentException(String.format("Kind '%s' has no property '%s'", kind, name));
        }
        return value;
    }

    /**
     * Sets a property literal. The value must have the declared type.
     *
     * @param name the property name
     * @param value the new value
     * @throws IllegalArgumentException if the property is unknown or the type differs
     */
    public void setProperty(String name, PropertyValue value) {
        PropertyValue current = property(name);
        if (current.type() != value.type()) {
            throw new IllegalArgumentException(String.format(
                "Property '%s' of kind '%s' is %s, not %s", name, kind, current.type(), value.type()));
        }
        properties.put(name, value);
    }

    public Map<String, PropertyValue> properties() {
        return Collections.unmodifiableMap(properties);
    }

    // Bindings

    public Optional<Binding> binding(String property) {
        return Optional.ofNullable(bindings.get(property));
    }

    /**
     * Binds a property.
     *
     * @param property the property name
     * @param binding the binding
     * @throws IllegalArgumentException if the kind has no such property
     */
    public void setBinding(String property, Binding binding) {
        property(property);
        bindings.put(property, Objects.requireNonNull(binding, "binding"));
    }

    public Optional<Binding> removeBinding(String property) {
        return Optional.ofNullable(bindings.remove(property));
    }

    public Map<String, Binding> bindings() {
        return Collections.unmodifiableMap(bindings);
    }

    // Actions

    public Optional<Action> action(NodeEvent event) {
        return Optional.ofNullable(actions.get(event));
    }

    public void setAction(NodeEvent event, Action action) {
        actions.put(Objects.requireNonNull(event, "event"), Objects.requireNonNull(action, "action"));
    }

    public Optional<Action> removeAction(NodeEvent event) {
        return Optional.ofNullable(actions.remove(event));
    }

    public Map<NodeEvent, Action> actions() {
        return Collections.unmodifiableMap(actions);
    }

    // Children

    /**
     * Gets the children in order.
     *
     * @return unmodifiable child list, empty for leaf kinds
     */
    public List<Node> children() {
        return children == null ? List.of() : Collections.unmodifiableList(children);
    }

    /**
     * Appends a child while building a detached subtree.
     *
     * @param child the child to append
     * @throws IllegalStateException if this node is already part of a tree, or the child is
     * @throws UnsupportedOperationException if this node is not a container
     */
    public void addChild(Node child) {
        if (children == null) {
            throw new UnsupportedOperationException(String.format("Kind '%s' cannot hold children", kind));
        }
        if (owner != null || child.owner != null) {
            throw new IllegalStateException("Attached nodes must be edited through their DocumentTree");
        }
        children.add(child);
    }

    List<Node> mutableChildren() {
        return children;
    }

    // Forward-compatible fields

    /**
     * Gets kind fields this version does not know about, kept so they survive a save.
     *
     * @return unmodifiable map of field name to raw JSON
     */
    public Map<String, JsonElement> extraFields() {
        return Collections.unmodifiableMap(extraFields);
    }

    public void putExtraField(String name, JsonElement value) {
        extraFields.put(name, value.deepCopy());
    }

    // Copies

    /**
     * Deep-copies this subtree keeping every id.
     *
     * @return a detached copy
     */
    public Node deepCopy() {
        return copy(() -> null);
    }

    /**
     * Deep-copies this subtree giving every node, not only the root, a new id.
     *
     * @param idSource supplier of fresh ids
     * @return a detached copy
     */
    public Node copyWithFreshIds(Supplier<UUID> idSource) {
        Objects.requireNonNull(idSource, "idSource");
        return copy(() -> Objects.requireNonNull(idSource.get(), "idSource returned null"));
    }

    private Node copy(Supplier<UUID> idSource) {
        UUID newId = idSource.get();
        Node copy = new Node(newId != null ? newId : id, kind, isContainer());
        copy.properties.putAll(properties);
        copy.bindings.putAll(bindings);
        copy.actions.putAll(actions);
        for (Map.Entry<String, JsonElement> extra : extraFields.entrySet()) {
            copy.extraFields.put(extra.getKey(), extra.getValue().deepCopy());
        }
        if (children != null) {
            for (Node child : children) {
                copy.children.add(child.copy(idSource));
            }
        }
        return copy;
    }

    /**
     * Compares two subtrees field by field.
     *
     * @param other the subtree to compare with
     * @param compareIds whether ids must match too
     * @return true if kind, properties, bindings, actions, extras and children are equal
     */
    public boolean sameStructure(Node other, boolean compareIds) {
        if (other == null) {
            return false;
        }
        if (compareIds && !id.equals(other.id)) {
            return false;
        }
        if (!kind.equals(other.kind)
                || !properties.equals(other.properties)
                || !bindings.equals(other.bindings)
                || !actions.equals(other.actions)
                || !extraFields.equals(other.extraFields)
                || isContainer() != other.isContainer()) {
            return false;
        }
        if (children != null) {
            if (children.size() != other.children.size()) {
                return false;
            }
            for (int i = 0; i < children.size(); i++) {
                if (!children.get(i).sameStructure(other.children.get(i), compareIds)) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return kind + "[" + id + "]";
    }
}
