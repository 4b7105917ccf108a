package com.aether.model;

import com.google.gson.JsonElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * A rooted tree of nodes with an id index.
 *
 * The tree keeps an id-to-node map and an id-to-parent map that are updated on
 * every structural change, so lookups, parent queries and ancestry checks never
 * walk the whole tree. All checks of an operation run before the first write;
 * a method that throws has left the tree exactly as it was.
 *
 * Not thread-safe: a tree belongs to the single editing thread.
 */
public class DocumentTree {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentTree.class);

    private final NodeRegistry registry;
    private Node root;
    private final Map<UUID, Node> index = new HashMap<>();
    private final Map<UUID, Node> parents = new HashMap<>();

    /**
     * Creates a tree around a detached root.
     *
     * @param registry the registry the node kinds come from
     * @param root the root node, which must be a container
     * @throws DuplicateNodeIdException if the subtree repeats an id
     * @throws NotAContainerException if the root kind holds no children
     */
    public DocumentTree(NodeRegistry registry, Node root) throws DuplicateNodeIdException, NotAContainerException {
        this.registry = registry;
        if (!root.isContainer()) {
            throw new NotAContainerException(root.getId(), root.getKind());
        }
        if (root.isAttached()) {
            throw new IllegalArgumentException("Root node already belongs to a tree");
        }
        requireFreshIds(root, new HashSet<>());
        this.root = root;
        indexSubtree(root, null);
    }

    public NodeRegistry registry() {
        return registry;
    }

    public Node root() {
        return root;
    }

    /**
     * Finds a node by id.
     *
     * @param id the node id
     * @return the node
     * @throws NodeNotFoundException if no node has that id
     */
    public Node find(UUID id) throws NodeNotFoundException {
        Node node = index.get(id);
        if (node == null) {
            throw new NodeNotFoundException(id);
        }
        return node;
    }

    public Optional<Node> lookup(UUID id) {
        return Optional.ofNullable(index.get(id));
    }

    public boolean contains(UUID id) {
        return index.containsKey(id);
    }

    /**
     * Gets the parent of a node.
     *
     * @param id the node id
     * @return the parent, empty for the root
     * @throws NodeNotFoundException if no node has that id
     */
    public Optional<Node> parentOf(UUID id) throws NodeNotFoundException {
        find(id);
        return Optional.ofNullable(parents.get(id));
    }

    /**
     * Gets the position of a node among its siblings.
     *
     * @param id the node id
     * @return the child index, or -1 for the root
     * @throws NodeNotFoundException if no node has that id
     */
    public int indexOf(UUID id) throws NodeNotFoundException {
        Node node = find(id);
        Node parent = parents.get(id);
        return parent == null ? -1 : parent.mutableChildren().indexOf(node);
    }

    /**
     * Checks whether {@code candidate} lies inside the subtree rooted at {@code ancestor}.
     * A node counts as inside its own subtree.
     *
     * @param candidate possible descendant
     * @param ancestor possible ancestor
     * @return true if candidate is ancestor or below it
     */
    public boolean isInSubtree(UUID candidate, UUID ancestor) {
        UUID current = candidate;
        while (current != null) {
            if (current.equals(ancestor)) {
                return true;
            }
            Node parent = parents.get(current);
            current = parent == null ? null : parent.getId();
        }
        return false;
    }

    /**
     * Inserts a detached subtree under a container.
     *
     * @param parentId the container id
     * @param position index among the existing children, at most the child count
     * @param node the detached subtree
     * @throws NodeNotFoundException if the parent does not exist
     * @throws NotAContainerException if the parent holds no children
     * @throws IndexOutOfRangeException if position is negative or past the end
     * @throws CyclicInsertionException if the node is the parent or one of its ancestors
     * @throws DuplicateNodeIdException if an id of the subtree is already in the tree
     */
    public void insertChild(UUID parentId, int position, Node node) throws StructuralException {
        Node parent = find(parentId);
        if (!parent.isContainer()) {
            throw new NotAContainerException(parentId, parent.getKind());
        }
        int childCount = parent.mutableChildren().size();
        if (position < 0 || position > childCount) {
            throw new IndexOutOfRangeException(parentId, position, childCount);
        }
        if (node.owner == this && isInSubtree(parentId, node.getId())) {
            throw new CyclicInsertionException(node.getId(), parentId);
        }
        if (node.isAttached()) {
            throw new DuplicateNodeIdException(node.getId());
        }
        requireFreshIds(node, new HashSet<>());

        parent.mutableChildren().add(position, node);
        indexSubtree(node, parent);
        LOGGER.debug("Inserted {} under {} at {}", node, parent, position);
    }

    /**
     * Appends a detached subtree as the last child of a container.
     *
     * @param parentId the container id
     * @param node the detached subtree
     * @throws StructuralException as for {@link #insertChild(UUID, int, Node)}
     */
    public void appendChild(UUID parentId, Node node) throws StructuralException {
        Node parent = find(parentId);
        insertChild(parentId, parent.children().size(), node);
    }

    /**
     * Detaches a subtree and hands it back to the caller.
     *
     * @param id the subtree root
     * @return the detached subtree
     * @throws NodeNotFoundException if no node has that id
     * @throws RootOperationException if id is the root
     */
    public Node remove(UUID id) throws StructuralException {
        Node node = find(id);
        Node parent = parents.get(id);
        if (parent == null) {
            throw new RootOperationException(id, "remove");
        }
        parent.mutableChildren().remove(node);
        unindexSubtree(node);
        LOGGER.debug("Removed {} from {}", node, parent);
        return node;
    }

    /**
     * Moves a node to a new parent and position. For a move inside the same parent the
     * position refers to the child list without the moved node.
     *
     * @param id the node to move
     * @param newParentId the target container
     * @param position target index
     * @throws StructuralException if any check fails; the tree is then unchanged
     */
    public void reparent(UUID id, UUID newParentId, int position) throws StructuralException {
        Node node = find(id);
        Node newParent = find(newParentId);
        Node oldParent = parents.get(id);
        if (oldParent == null) {
            throw new RootOperationException(id, "move");
        }
        if (!newParent.isContainer()) {
            throw new NotAContainerException(newParentId, newParent.getKind());
        }
        if (isInSubtree(newParentId, id)) {
            throw new CyclicInsertionException(id, newParentId);
        }
        int available = newParent.mutableChildren().size() - (oldParent == newParent ? 1 : 0);
        if (position < 0 || position > available) {
            throw new IndexOutOfRangeException(newParentId, position, available);
        }

        oldParent.mutableChildren().remove(node);
        newParent.mutableChildren().add(position, node);
        parents.put(id, newParent);
        LOGGER.debug("Moved {} from {} to {} at {}", node, oldParent, newParent, position);
    }

    /**
     * Swaps a node with its previous sibling.
     *
     * @param id the node id
     * @return false if the node is the root or already first
     * @throws NodeNotFoundException if no node has that id
     */
    public boolean moveUp(UUID id) throws NodeNotFoundException {
        return shift(id, -1);
    }

    /**
     * Swaps a node with its next sibling.
     *
     * @param id the node id
     * @return false if the node is the root or already last
     * @throws NodeNotFoundException if no node has that id
     */
    public boolean moveDown(UUID id) throws NodeNotFoundException {
        return shift(id, 1);
    }

    /**
     * Moves a node so it sits directly before a sibling-to-be.
     *
     * @param id the node to move
     * @param beforeId the node to insert in front of
     * @throws StructuralException if any check fails
     */
    public void moveBefore(UUID id, UUID beforeId) throws StructuralException {
        moveNextTo(id, beforeId, 0);
    }

    /**
     * Moves a node so it sits directly after a sibling-to-be.
     *
     * @param id the node to move
     * @param afterId the node to insert behind
     * @throws StructuralException if any check fails
     */
    public void moveAfter(UUID id, UUID afterId) throws StructuralException {
        moveNextTo(id, afterId, 1);
    }

    private void moveNextTo(UUID id, UUID anchorId, int offset) throws StructuralException {
        find(id);
        Node anchorParent = parents.get(find(anchorId).getId());
        if (anchorParent == null) {
            throw new RootOperationException(anchorId, "place a sibling next to");
        }
        if (id.equals(anchorId)) {
            return;
        }
        if (isInSubtree(anchorParent.getId(), id)) {
            throw new CyclicInsertionException(id, anchorParent.getId());
        }
        List<Node> siblings = anchorParent.mutableChildren();
        int anchorIndex = siblings.indexOf(index.get(anchorId));
        int currentIndex = siblings.indexOf(index.get(id));
        int target = anchorIndex + offset;
        if (currentIndex >= 0 && currentIndex < target) {
            target--;
        }
        reparent(id, anchorParent.getId(), target);
    }

    private boolean shift(UUID id, int delta) throws NodeNotFoundException {
        Node node = find(id);
        Node parent = parents.get(id);
        if (parent == null) {
            return false;
        }
        List<Node> siblings = parent.mutableChildren();
        int current = siblings.indexOf(node);
        int target = current + delta;
        if (target < 0 || target >= siblings.size()) {
            return false;
        }
        siblings.remove(current);
        siblings.add(target, node);
        return true;
    }

    /**
     * Sets a property literal after checking it against the kind.
     *
     * @param id the node id
     * @param property the property name
     * @param value the new value
     * @throws NodeNotFoundException if no node has that id
     * @throws InvalidPropertyException if the property is unknown, mistyped or violates a kind constraint
     */
    public void setProperty(UUID id, String property, PropertyValue value) throws StructuralException {
        Node node = find(id);
        NodeKind kind = registry.kindOf(node);
        PropertyDefinition definition = kind.propertyDefinition(property)
            .orElseThrow(() -> new InvalidPropertyException(id, property, "unknown property of " + kind.tag()));
        if (definition.type() != value.type()) {
            throw new InvalidPropertyException(id, property,
                String.format("expected %s but got %s", definition.type(), value.type()));
        }
        PropertyValue previous = node.property(property);
        node.setProperty(property, value);
        Optional<String> problem = kind.checkFields(node);
        if (problem.isPresent()) {
            node.setProperty(property, previous);
            throw new InvalidPropertyException(id, property, problem.get());
        }
    }

    /**
     * Binds a property of a node.
     *
     * @param id the node id
     * @param property the property name
     * @param binding the binding
     * @throws InvalidPropertyException if the property is unknown or not bindable, or a literal has the wrong type
     */
    public void setBinding(UUID id, String property, Binding binding) throws StructuralException {
        Node node = find(id);
        NodeKind kind = registry.kindOf(node);
        PropertyDefinition definition = kind.propertyDefinition(property)
            .orElseThrow(() -> new InvalidPropertyException(id, property, "unknown property of " + kind.tag()));
        if (!definition.bindable()) {
            throw new InvalidPropertyException(id, property, "property cannot be bound");
        }
        if (binding instanceof Binding.Literal
                && ((Binding.Literal) binding).value().type() != definition.type()) {
            throw new InvalidPropertyException(id, property, "literal binding must be " + definition.type());
        }
        node.setBinding(property, binding);
    }

    public Optional<Binding> clearBinding(UUID id, String property) throws NodeNotFoundException {
        return find(id).removeBinding(property);
    }

    /**
     * Attaches an action to an event of a node.
     *
     * @param id the node id
     * @param event the event
     * @param action the action
     * @throws InvalidPropertyException if the kind does not declare the event
     */
    public void setAction(UUID id, NodeEvent event, Action action) throws StructuralException {
        Node node = find(id);
        NodeKind kind = registry.kindOf(node);
        if (!kind.supports(event)) {
            throw new InvalidPropertyException(id, event.wireName(), kind.tag() + " does not emit this event");
        }
        node.setAction(event, action);
    }

    public Optional<Action> clearAction(UUID id, NodeEvent event) throws NodeNotFoundException {
        return find(id).removeAction(event);
    }

    /**
     * Replaces the root with a node of another container kind, keeping id, children,
     * extra fields and every property the two kinds share by name and type.
     *
     * @param tag the new root kind
     * @throws NotAContainerException if the kind holds no children
     * @throws InvalidPropertyException if the kept properties break a constraint of the new kind
     */
    public void replaceRootKind(String tag) throws StructuralException {
        NodeKind kind = registry.require(tag);
        if (!kind.isContainer()) {
            throw new NotAContainerException(root.getId(), tag);
        }
        if (kind.tag().equals(root.getKind())) {
            return;
        }
        Node replacement = kind.create(root.getId());
        for (PropertyDefinition definition : kind.properties()) {
            if (root.hasProperty(definition.name())
                    && root.property(definition.name()).type() == definition.type()) {
                replacement.setProperty(definition.name(), root.property(definition.name()));
            }
        }
        for (Map.Entry<String, JsonElement> extra : root.extraFields().entrySet()) {
            if (kind.propertyDefinition(extra.getKey()).isEmpty()) {
                replacement.putExtraField(extra.getKey(), extra.getValue());
            }
        }
        Optional<String> problem = kind.checkFields(replacement);
        if (problem.isPresent()) {
            throw new InvalidPropertyException(root.getId(), tag, problem.get());
        }
        replacement.mutableChildren().addAll(root.mutableChildren());
        root.mutableChildren().clear();
        root.owner = null;
        Node previous = root;
        root = replacement;
        replacement.owner = this;
        index.put(replacement.getId(), replacement);
        for (Node child : replacement.mutableChildren()) {
            parents.put(child.getId(), replacement);
        }
        LOGGER.debug("Replaced root kind {} -> {}", previous.getKind(), tag);
    }

    /**
     * Lists every node in depth-first pre-order.
     *
     * @return nodes in tree order
     */
    public List<Node> preOrder() {
        List<Node> nodes = new ArrayList<>(index.size());
        collect(root, nodes);
        return nodes;
    }

    public List<UUID> preOrderIds() {
        List<UUID> ids = new ArrayList<>(index.size());
        for (Node node : preOrder()) {
            ids.add(node.getId());
        }
        return ids;
    }

    public int size() {
        return index.size();
    }

    public Set<UUID> ids() {
        return java.util.Collections.unmodifiableSet(index.keySet());
    }

    /**
     * Deep-copies the tree keeping all ids.
     *
     * @return an independent tree
     */
    public DocumentTree copy() {
        try {
            return new DocumentTree(registry, root.deepCopy());
        } catch (StructuralException e) {
            throw new IllegalStateException("Copy of a consistent tree failed its own checks", e);
        }
    }

    private void collect(Node node, List<Node> nodes) {
        nodes.add(node);
        for (Node child : node.children()) {
            collect(child, nodes);
        }
    }

    private void requireFreshIds(Node node, Set<UUID> seen) throws DuplicateNodeIdException {
        if (index.containsKey(node.getId()) || !seen.add(node.getId())) {
            throw new DuplicateNodeIdException(node.getId());
        }
        for (Node child : node.children()) {
            requireFreshIds(child, seen);
        }
    }

    private void indexSubtree(Node node, Node parent) {
        node.owner = this;
        index.put(node.getId(), node);
        if (parent != null) {
            parents.put(node.getId(), parent);
        }
        for (Node child : node.children()) {
            indexSubtree(child, node);
        }
    }

    private void unindexSubtree(Node node) {
        node.owner = null;
        index.remove(node.getId());
        parents.remove(node.getId());
        for (Node child : node.children()) {
            unindexSubtree(child);
        }
    }
}
