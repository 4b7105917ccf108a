package com.aether.persistence;

import com.aether.assets.Asset;
import com.aether.assets.AssetRegistry;
import com.aether.assets.AssetType;
import com.aether.model.Action;
import com.aether.model.Binding;
import com.aether.model.Document;
import com.aether.model.DocumentTree;
import com.aether.model.DuplicateNodeIdException;
import com.aether.model.Node;
import com.aether.model.NodeEvent;
import com.aether.model.NodeKind;
import com.aether.model.NodeRegistry;
import com.aether.model.PropertyDefinition;
import com.aether.model.PropertyValue;
import com.aether.model.StructuralException;
import com.aether.variables.Variable;
import com.aether.variables.VariableStore;
import com.aether.variables.VariableType;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Converts documents to and from their versioned JSON interchange form.
 *
 * Every node is written as {@code {kind, id, fields, bindings, events, children}}.
 * The kind tag is looked up in the {@link NodeRegistry} and the kind reads and
 * writes its own fields, so new kinds need no change here. Fields a kind does not
 * declare are carried through opaquely.
 *
 * Loading either returns a complete document or throws; it never yields a partial one.
 */
public class DocumentSerializer {

    private static final Logger LOGGER = LoggerFactory.getLogger(DocumentSerializer.class);

    /** Format version written by this build. */
    public static final int CURRENT_SCHEMA_VERSION = 1;

    /** Deepest child nesting a loaded document may have. */
    public static final int MAX_NESTING_DEPTH = 256;

    private final Gson gson;
    private final NodeRegistry registry;

    public DocumentSerializer(NodeRegistry registry) {
        this.registry = registry;
        this.gson = new GsonBuilder()
            .setPrettyPrinting()
            .disableHtmlEscaping()
            .create();
    }

    public NodeRegistry registry() {
        return registry;
    }

    // Writing

    /**
     * Serializes a document to UTF-8 JSON.
     *
     * @param document the document
     * @return the encoded bytes
     */
    public byte[] serialize(Document document) {
        return toJson(document).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * Serializes a document to JSON text.
     *
     * @param document the document
     * @return pretty-printed JSON
     */
    public String toJson(Document document) {
        JsonObject root = new JsonObject();
        root.addProperty("schemaVersion", CURRENT_SCHEMA_VERSION);
        root.addProperty("projectName", document.getProjectName());

        JsonArray variables = new JsonArray();
        for (Variable variable : document.variables().all()) {
            JsonObject entry = new JsonObject();
            entry.addProperty("name", variable.name());
            entry.addProperty("type", variable.type().wireName());
            entry.add("value", variableValue(variable.defaultValue()));
            variables.add(entry);
        }
        root.add("variables", variables);

        JsonArray assets = new JsonArray();
        for (Asset asset : document.assets().all()) {
            JsonObject entry = new JsonObject();
            entry.addProperty("id", asset.id().toString());
            entry.addProperty("name", asset.name());
            entry.addProperty("type", asset.type().wireName());
            entry.addProperty("path", asset.path());
            assets.add(entry);
        }
        root.add("assets", assets);

        root.add("root", writeNode(document.tree().root()));
        return gson.toJson(root);
    }

    /**
     * Serializes a detached or attached subtree, e.g. as a clipboard payload.
     *
     * @param node the subtree root
     * @return JSON text with its own version envelope
     */
    public String serializeNode(Node node) {
        JsonObject envelope = new JsonObject();
        envelope.addProperty("schemaVersion", CURRENT_SCHEMA_VERSION);
        envelope.add("node", writeNode(node));
        return gson.toJson(envelope);
    }

    private JsonObject writeNode(Node node) {
        NodeKind kind = registry.kindOf(node);
        JsonObject record = new JsonObject();
        record.addProperty("kind", kind.tag());
        record.addProperty("id", node.getId().toString());

        JsonObject fields = new JsonObject();
        kind.writeFields(node, fields);
        record.add("fields", fields);

        if (!node.bindings().isEmpty()) {
            JsonObject bindings = new JsonObject();
            for (Map.Entry<String, Binding> entry : node.bindings().entrySet()) {
                JsonObject binding = new JsonObject();
                if (entry.getValue() instanceof Binding.VariableRef) {
                    binding.addProperty("variable", ((Binding.VariableRef) entry.getValue()).variableName());
                } else {
                    binding.add("literal", ((Binding.Literal) entry.getValue()).value().toJson());
                }
                bindings.add(entry.getKey(), binding);
            }
            record.add("bindings", bindings);
        }

        if (!node.actions().isEmpty()) {
            JsonObject events = new JsonObject();
            for (Map.Entry<NodeEvent, Action> entry : node.actions().entrySet()) {
                events.add(entry.getKey().wireName(), writeAction(entry.getValue()));
            }
            record.add("events", events);
        }

        if (node.isContainer()) {
            JsonArray children = new JsonArray();
            for (Node child : node.children()) {
                children.add(writeNode(child));
            }
            record.add("children", children);
        }
        return record;
    }

    private static JsonObject writeAction(Action action) {
        JsonObject json = new JsonObject();
        if (action instanceof Action.IncrementVariable) {
            json.addProperty("type", "increment_variable");
            json.addProperty("variable", ((Action.IncrementVariable) action).variable());
        } else if (action instanceof Action.SetVariable) {
            Action.SetVariable set = (Action.SetVariable) action;
            json.addProperty("type", "set_variable");
            json.addProperty("variable", set.variable());
            json.addProperty("value", set.value());
        } else if (action instanceof Action.InlineCode) {
            json.addProperty("type", "inline_code");
            json.addProperty("code", ((Action.InlineCode) action).source());
        } else {
            throw new IllegalArgumentException("Unsupported action: " + action);
        }
        return json;
    }

    private static JsonElement variableValue(Object value) {
        if (value instanceof Boolean) {
            return new JsonPrimitive((Boolean) value);
        }
        if (value instanceof Number) {
            return new JsonPrimitive((Number) value);
        }
        return new JsonPrimitive(String.valueOf(value));
    }

    // Reading

    /**
     * Deserializes a document from UTF-8 JSON.
     *
     * @param data the encoded bytes
     * @return the document
     * @throws DocumentFormatException if the data is not a valid document
     */
    public Document deserialize(byte[] data) throws DocumentFormatException {
        return fromJson(new String(data, StandardCharsets.UTF_8));
    }

    /**
     * Deserializes a document from JSON text.
     *
     * @param json the JSON text
     * @return the document
     * @throws UnknownKindException if a node kind is not registered
     * @throws MalformedFieldsException if a node fails its kind's schema
     * @throws VersionMismatchException if the document is newer than this build
     * @throws DocumentFormatException for any other structural problem
     */
    public Document fromJson(String json) throws DocumentFormatException {
        JsonObject root = parseEnvelope(json);

        String projectName = optionalString(root, "projectName", "").orElse("Untitled");
        VariableStore variables = readVariables(root);
        AssetRegistry assets = readAssets(root);

        JsonElement rootNode = root.get("root");
        if (rootNode == null || !rootNode.isJsonObject()) {
            throw new DocumentFormatException("Document has no root node", "root");
        }
        Node node = readNode(rootNode.getAsJsonObject(), "root", new HashSet<>(), 0);
        try {
            Document document = new Document(projectName, new DocumentTree(registry, node), variables, assets);
            LOGGER.debug("Deserialized document '{}' with {} nodes", projectName, document.tree().size());
            return document;
        } catch (StructuralException e) {
            throw new DocumentFormatException(e.getMessage(), "root", e);
        }
    }

    /**
     * Deserializes a subtree written by {@link #serializeNode(Node)}. Ids are kept.
     *
     * @param json the payload
     * @return a detached subtree
     * @throws DocumentFormatException if the payload is not a valid node
     */
    public Node deserializeNode(String json) throws DocumentFormatException {
        JsonObject envelope = parseEnvelope(json);
        JsonElement node = envelope.get("node");
        if (node == null || !node.isJsonObject()) {
            throw new DocumentFormatException("Payload has no node", "node");
        }
        return readNode(node.getAsJsonObject(), "node", new HashSet<>(), 0);
    }

    private JsonObject parseEnvelope(String json) throws DocumentFormatException {
        JsonObject root;
        try {
            root = gson.fromJson(json, JsonObject.class);
        } catch (JsonParseException e) {
            throw new DocumentFormatException("Invalid JSON: " + e.getMessage(), null, e);
        }
        if (root == null) {
            throw new DocumentFormatException("Empty document");
        }
        JsonElement version = root.get("schemaVersion");
        if (version == null || !version.isJsonPrimitive() || !version.getAsJsonPrimitive().isNumber()) {
            throw new DocumentFormatException("Missing or non-numeric schemaVersion", "schemaVersion");
        }
        BigDecimal schemaVersion = version.getAsBigDecimal();
        if (schemaVersion.stripTrailingZeros().scale() > 0) {
            throw new DocumentFormatException("Non-integral schemaVersion " + schemaVersion, "schemaVersion");
        }
        BigInteger found = schemaVersion.toBigIntegerExact();
        if (found.compareTo(BigInteger.valueOf(CURRENT_SCHEMA_VERSION)) > 0) {
            throw new VersionMismatchException(found, CURRENT_SCHEMA_VERSION);
        }
        if (found.signum() <= 0) {
            throw new DocumentFormatException("Invalid schemaVersion " + found, "schemaVersion");
        }
        return root;
    }

    private VariableStore readVariables(JsonObject root) throws DocumentFormatException {
        VariableStore store = new VariableStore();
        JsonArray entries = optionalArray(root, "variables", "variables");
        for (int i = 0; i < entries.size(); i++) {
            String path = "variables[" + i + "]";
            JsonObject entry = object(entries.get(i), path);
            try {
                String name = requiredString(entry, "name", path);
                VariableType type = VariableType.fromWireName(requiredString(entry, "type", path));
                store.define(new Variable(name, type, variableValue(entry.get("value"), type)));
            } catch (IllegalArgumentException e) {
                throw new DocumentFormatException(e.getMessage(), path, e);
            }
        }
        return store;
    }

    private static Object variableValue(JsonElement element, VariableType type) {
        if (element == null || element.isJsonNull()) {
            return type.zeroValue();
        }
        if (!element.isJsonPrimitive()) {
            throw new IllegalArgumentException("Variable value must be a primitive");
        }
        JsonPrimitive primitive = element.getAsJsonPrimitive();
        switch (type) {
            case INTEGER:
                if (primitive.isNumber()) {
                    try {
                        return primitive.getAsBigDecimal().longValueExact();
                    } catch (ArithmeticException e) {
                        throw new IllegalArgumentException("Not an integer: " + primitive, e);
                    }
                }
                break;
            case FLOAT:
                if (primitive.isNumber()) {
                    return primitive.getAsDouble();
                }
                break;
            case BOOLEAN:
                if (primitive.isBoolean()) {
                    return primitive.getAsBoolean();
                }
                break;
            case STRING:
                if (primitive.isString()) {
                    return primitive.getAsString();
                }
                break;
        }
        // older files stored every value as text
        return type.parse(primitive.getAsString());
    }

    private AssetRegistry readAssets(JsonObject root) throws DocumentFormatException {
        AssetRegistry registry = new AssetRegistry();
        JsonArray entries = optionalArray(root, "assets", "assets");
        for (int i = 0; i < entries.size(); i++) {
            String path = "assets[" + i + "]";
            JsonObject entry = object(entries.get(i), path);
            try {
                UUID id = optionalString(entry, "id", path).map(UUID::fromString).orElseGet(UUID::randomUUID);
                registry.add(new Asset(id,
                    requiredString(entry, "name", path),
                    AssetType.fromWireName(requiredString(entry, "type", path)),
                    requiredString(entry, "path", path)));
            } catch (IllegalArgumentException e) {
                throw new DocumentFormatException(e.getMessage(), path, e);
            }
        }
        return registry;
    }

    private Node readNode(JsonObject record, String path, Set<UUID> seenIds, int depth)
            throws DocumentFormatException {
        if (depth > MAX_NESTING_DEPTH) {
            throw new DocumentFormatException("Nodes are nested deeper than " + MAX_NESTING_DEPTH + " levels", path);
        }
        String tag = requiredString(record, "kind", path);
        Optional<NodeKind> found = registry.find(tag);
        if (found.isEmpty()) {
            throw new UnknownKindException(tag, path);
        }
        NodeKind kind = found.get();

        UUID id;
        try {
            id = UUID.fromString(requiredString(record, "id", path));
        } catch (IllegalArgumentException e) {
            throw new DocumentFormatException("Invalid node id", path + ".id", e);
        }
        if (!seenIds.add(id)) {
            throw new DocumentFormatException(new DuplicateNodeIdException(id).getMessage(), path + ".id");
        }

        Node node = kind.create(id);
        JsonElement fields = record.get("fields");
        if (fields != null && !fields.isJsonNull()) {
            if (!fields.isJsonObject()) {
                throw new MalformedFieldsException(tag, "fields must be an object", path + ".fields");
            }
            kind.readFields(node, fields.getAsJsonObject(), path + ".fields");
        }

        readBindings(record, node, kind, path);
        readEvents(record, node, kind, path);

        JsonElement children = record.get("children");
        if (children != null && !children.isJsonNull()) {
            if (!kind.isContainer()) {
                throw new MalformedFieldsException(tag, "kind cannot hold children", path + ".children");
            }
            if (!children.isJsonArray()) {
                throw new MalformedFieldsException(tag, "children must be an array", path + ".children");
            }
            JsonArray array = children.getAsJsonArray();
            for (int i = 0; i < array.size(); i++) {
                String childPath = path + ".children[" + i + "]";
                node.addChild(readNode(object(array.get(i), childPath), childPath, seenIds, depth + 1));
            }
        }
        return node;
    }

    private static void readBindings(JsonObject record, Node node, NodeKind kind, String path)
            throws DocumentFormatException {
        JsonElement bindings = record.get("bindings");
        if (bindings == null || bindings.isJsonNull()) {
            return;
        }
        String bindingsPath = path + ".bindings";
        if (!bindings.isJsonObject()) {
            throw new MalformedFieldsException(kind.tag(), "bindings must be an object", bindingsPath);
        }
        for (Map.Entry<String, JsonElement> entry : bindings.getAsJsonObject().entrySet()) {
            String entryPath = bindingsPath + "." + entry.getKey();
            Optional<PropertyDefinition> definition = kind.propertyDefinition(entry.getKey());
            if (definition.isEmpty() || !definition.get().bindable()) {
                throw new MalformedFieldsException(kind.tag(),
                    "property '" + entry.getKey() + "' cannot be bound", entryPath);
            }
            JsonObject binding = object(entry.getValue(), entryPath);
            if (binding.has("variable")) {
                node.setBinding(entry.getKey(), Binding.variable(requiredString(binding, "variable", entryPath)));
            } else if (binding.has("literal")) {
                try {
                    PropertyValue literal = PropertyValue.fromJson(definition.get().type(), binding.get("literal"));
                    node.setBinding(entry.getKey(), Binding.literal(literal));
                } catch (IllegalArgumentException e) {
                    throw new MalformedFieldsException(kind.tag(), "literal " + e.getMessage(), entryPath, e);
                }
            } else {
                throw new MalformedFieldsException(kind.tag(), "binding needs 'variable' or 'literal'", entryPath);
            }
        }
    }

    private static void readEvents(JsonObject record, Node node, NodeKind kind, String path)
            throws DocumentFormatException {
        JsonElement events = record.get("events");
        if (events == null || events.isJsonNull()) {
            return;
        }
        String eventsPath = path + ".events";
        if (!events.isJsonObject()) {
            throw new MalformedFieldsException(kind.tag(), "events must be an object", eventsPath);
        }
        for (Map.Entry<String, JsonElement> entry : events.getAsJsonObject().entrySet()) {
            String entryPath = eventsPath + "." + entry.getKey();
            NodeEvent event;
            try {
                event = NodeEvent.fromWireName(entry.getKey());
            } catch (IllegalArgumentException e) {
                throw new MalformedFieldsException(kind.tag(), e.getMessage(), entryPath, e);
            }
            if (!kind.supports(event)) {
                throw new MalformedFieldsException(kind.tag(), "kind does not emit " + event.wireName(), entryPath);
            }
            node.setAction(event, readAction(object(entry.getValue(), entryPath), kind, entryPath));
        }
    }

    private static Action readAction(JsonObject json, NodeKind kind, String path) throws DocumentFormatException {
        String type = requiredString(json, "type", path);
        switch (type) {
            case "increment_variable":
                return new Action.IncrementVariable(requiredString(json, "variable", path));
            case "set_variable":
                return new Action.SetVariable(requiredString(json, "variable", path),
                    requiredString(json, "value", path));
            case "inline_code":
                return new Action.InlineCode(requiredString(json, "code", path));
            default:
                throw new MalformedFieldsException(kind.tag(), "unknown action type '" + type + "'", path);
        }
    }

    // JSON helpers

    private static JsonObject object(JsonElement element, String path) throws DocumentFormatException {
        if (element == null || !element.isJsonObject()) {
            throw new DocumentFormatException("Expected an object", path);
        }
        return element.getAsJsonObject();
    }

    private static JsonArray optionalArray(JsonObject object, String key, String path) throws DocumentFormatException {
        JsonElement element = object.get(key);
        if (element == null || element.isJsonNull()) {
            return new JsonArray();
        }
        if (!element.isJsonArray()) {
            throw new DocumentFormatException("Expected an array", path);
        }
        return element.getAsJsonArray();
    }

    private static String requiredString(JsonObject object, String key, String path) throws DocumentFormatException {
        JsonElement element = object.get(key);
        if (element == null || !element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new DocumentFormatException("Missing or non-string '" + key + "'", path);
        }
        return element.getAsString();
    }

    private static Optional<String> optionalString(JsonObject object, String key, String path)
            throws DocumentFormatException {
        if (!object.has(key) || object.get(key).isJsonNull()) {
            return Optional.empty();
        }
        return Optional.of(requiredString(object, key, path));
    }
}
