package com.aether.model;

import com.aether.model.kinds.StandardKinds;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Maps kind tags to the {@link NodeKind} that creates, serializes and lowers them.
 * 
 * A registry is filled once at startup and then frozen; documents only ever read
 * from it. {@link #standard()} is the process-wide registry holding the built-in kinds.
 */
public class NodeRegistry {
    
    private static final Logger LOGGER = LoggerFactory.getLogger(NodeRegistry.class);
    
    private static volatile NodeRegistry standard;
    
    private final Map<String, NodeKind> kinds = new LinkedHashMap<>();
    private volatile boolean frozen = false;
    
    /**
     * Gets the frozen registry of built-in kinds, building it on first use.
     * 
     * @return the standard registry
     */
    public static NodeRegistry standard() {
        NodeRegistry registry = standard;
        if (registry == null) {
            synchronized (NodeRegistry.class) {
                registry = standard;
                if (registry == null) {
                    registry = withStandardKinds();
                    registry.freeze();
                    standard = registry;
                }
            }
        }
        return registry;
    }
    
    /**
     * Creates an unfrozen registry pre-filled with the built-in kinds, for callers
     * that add kinds of their own before freezing.
     * 
     * @return a new registry
     */
    public static NodeRegistry withStandardKinds() {
        NodeRegistry registry = new NodeRegistry();
        StandardKinds.registerAll(registry);
        return registry;
    }
    
    /**
     * Registers a kind.
     * 
     * @param kind the kind
     * @throws RegistryFrozenException if the registry is frozen
     * @throws DuplicateKindException if the tag is taken
     */
    public synchronized void register(NodeKind kind) {
        if (frozen) {
            throw new RegistryFrozenException(kind.tag());
        }
        if (kinds.containsKey(kind.tag())) {
            throw new DuplicateKindException(kind.tag());
        }
        kinds.put(kind.tag(), kind);
        LOGGER.debug("Registered node kind '{}'", kind.tag());
    }
    
    public Optional<NodeKind> find(String tag) {
        return Optional.ofNullable(kinds.get(tag));
    }
    
    /**
     * Gets a kind that must be registered.
     * 
     * @param tag the kind tag
     * @return the kind
     * @throws IllegalArgumentException if no kind has that tag
     */
    public NodeKind require(String tag) {
        NodeKind kind = kinds.get(tag);
        if (kind == null) {
            throw new IllegalArgumentException("Unknown node kind: " + tag);
        }
        return kind;
    }
    
    /**
     * Gets the kind of a node.
     * 
     * @param node the node
     * @return its kind
     */
    public NodeKind kindOf(Node node) {
        return require(node.getKind());
    }
    
    public boolean contains(String tag) {
        return kinds.containsKey(tag);
    }
    
    public Node create(String tag) {
        return require(tag).create();
    }
    
    public Node create(String tag, UUID id) {
        return require(tag).create(id);
    }
    
    /**
     * Lists the registered tags in registration order.
     * 
     * @return the tags
     */
    public List<String> tags() {
        return new ArrayList<>(kinds.keySet());
    }
    
    public void freeze() {
        if (!frozen) {
            frozen = true;
            LOGGER.debug("Node registry frozen with {} kinds", kinds.size());
        }
    }
    
    public boolean isFrozen() {
        return frozen;
    }
}
