package com.aether.persistence;

import com.aether.assets.AssetType;
import com.aether.model.Action;
import com.aether.model.Document;
import com.aether.model.DocumentTemplates;
import com.aether.model.Node;
import com.aether.model.NodeEvent;
import com.aether.model.NodeRegistry;
import com.aether.model.PropertyValue;
import com.aether.variables.VariableType;
import com.google.gson.JsonParser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.math.BigInteger;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for DocumentSerializer.
 */
public class DocumentSerializerTest {

    private static final String LABEL_ID = "11111111-1111-1111-1111-111111111111";
    private static final String ROOT_ID = "00000000-0000-0000-0000-000000000001";

    private final DocumentSerializer serializer = new DocumentSerializer(NodeRegistry.standard());

    @Test
    void testRoundTrip_PreservesEverything() throws Exception {
        // Given
        Document document = DocumentTemplates.counterApp(NodeRegistry.standard());
        document.variables().define("title", VariableType.STRING, "Hi");
        document.variables().define("ratio", VariableType.FLOAT, 0.25);
        document.variables().define("on", VariableType.BOOLEAN, true);
        document.assets().add("logo", AssetType.IMAGE, "images/logo.png");
        Node image = document.registry().create("image");
        image.setProperty("asset", PropertyValue.ofAsset("logo"));
        Node combo = document.registry().create("combo_box");
        combo.setProperty("options", PropertyValue.ofStringList(List.of("A", "B")));
        combo.setAction(NodeEvent.CHANGED, new Action.InlineCode("console.log('x');\nthis.on = !this.on;"));
        document.tree().appendChild(document.tree().root().getId(), image);
        document.tree().appendChild(document.tree().root().getId(), combo);

        // When
        Document loaded = serializer.deserialize(serializer.serialize(document));

        // Then
        assertEquals(document.getProjectName(), loaded.getProjectName());
        assertTrue(document.tree().root().sameStructure(loaded.tree().root(), true));
        assertEquals(document.variables().all(), loaded.variables().all());
        assertEquals(document.assets().all(), loaded.assets().all());
        assertArrayEquals(serializer.serialize(document), serializer.serialize(loaded));
    }

    @Test
    void testSerialize_IsDeterministic() {
        Document document = DocumentTemplates.dashboard(NodeRegistry.standard());

        assertEquals(serializer.toJson(document), serializer.toJson(document.copy()));
    }

    @Test
    void testSerialize_NodeRecordShape() {
        Document document = DocumentTemplates.counterApp(NodeRegistry.standard());

        var root = JsonParser.parseString(serializer.toJson(document)).getAsJsonObject();
        var rootNode = root.getAsJsonObject("root");
        var button = rootNode.getAsJsonArray("children").get(2).getAsJsonObject();

        assertEquals(DocumentSerializer.CURRENT_SCHEMA_VERSION, root.get("schemaVersion").getAsInt());
        assertEquals("vertical_layout", rootNode.get("kind").getAsString());
        assertEquals("button", button.get("kind").getAsString());
        assertEquals("Increment", button.getAsJsonObject("fields").get("text").getAsString());
        assertEquals("increment_variable",
            button.getAsJsonObject("events").getAsJsonObject("clicked").get("type").getAsString());
        assertFalse(button.has("children"));
        assertFalse(button.has("bindings"));
    }

    @Test
    void testDeserialize_UnknownKind() {
        String json = document("""
            {"kind": "hologram", "id": "%s", "fields": {}}
            """.formatted(LABEL_ID));

        UnknownKindException e = assertThrows(UnknownKindException.class, () -> serializer.fromJson(json));
        assertEquals("hologram", e.getKind());
        assertEquals("root.children[0]", e.getPath());
    }

    @Test
    void testDeserialize_MalformedFields() {
        String json = document("""
            {"kind": "label", "id": "%s", "fields": {"text": 42}}
            """.formatted(LABEL_ID));

        MalformedFieldsException e = assertThrows(MalformedFieldsException.class, () -> serializer.fromJson(json));
        assertEquals("label", e.getKind());
    }

    @Test
    void testDeserialize_KindConstraintViolation() {
        String json = document("""
            {"kind": "slider", "id": "%s", "fields": {"min": 10.0, "max": 1.0}}
            """.formatted(LABEL_ID));

        assertThrows(MalformedFieldsException.class, () -> serializer.fromJson(json));
    }

    @Test
    void testDeserialize_ChildrenOnLeaf() {
        String json = document("""
            {"kind": "label", "id": "%s", "fields": {}, "children": []}
            """.formatted(LABEL_ID));

        assertThrows(MalformedFieldsException.class, () -> serializer.fromJson(json));
    }

    @Test
    void testDeserialize_BindingOnFixedProperty() {
        String json = """
            {"schemaVersion": 1, "projectName": "P",
             "root": {"kind": "vertical_layout", "id": "%s", "fields": {},
                      "bindings": {"spacing": {"variable": "gap"}}, "children": []}}
            """.formatted(ROOT_ID);

        assertThrows(MalformedFieldsException.class, () -> serializer.fromJson(json));
    }

    @Test
    void testDeserialize_DuplicateIds() {
        String json = document("""
            {"kind": "label", "id": "%1$s", "fields": {}},
            {"kind": "label", "id": "%1$s", "fields": {}}
            """.formatted(LABEL_ID));

        DocumentFormatException e = assertThrows(DocumentFormatException.class, () -> serializer.fromJson(json));
        assertEquals("root.children[1].id", e.getPath());
    }

    @ParameterizedTest
    @ValueSource(strings = {"99", "4294967297", "18446744073709551617"})
    void testDeserialize_NewerVersion(String version) {
        String json = withVersion(version);

        VersionMismatchException e = assertThrows(VersionMismatchException.class, () -> serializer.fromJson(json));
        assertEquals(new BigInteger(version), e.getFoundVersion());
        assertEquals(DocumentSerializer.CURRENT_SCHEMA_VERSION, e.getSupportedVersion());
    }

    @ParameterizedTest
    @ValueSource(strings = {"1.9", "0.5", "0", "-1"})
    void testDeserialize_InvalidVersion(String version) {
        String json = withVersion(version);

        DocumentFormatException e = assertThrows(DocumentFormatException.class, () -> serializer.fromJson(json));
        assertFalse(e instanceof VersionMismatchException);
        assertEquals("schemaVersion", e.getPath());
    }

    @Test
    void testDeserialize_IntegralVersionWithFraction() throws Exception {
        assertEquals("P", serializer.fromJson(withVersion("1.0")).getProjectName());
    }

    @Test
    void testDeserialize_NestingTooDeep() {
        StringBuilder json = new StringBuilder("""
            {"schemaVersion": 1, "projectName": "P", "root": \
            """);
        int levels = DocumentSerializer.MAX_NESTING_DEPTH + 10;
        for (int i = 0; i < levels; i++) {
            json.append("{\"kind\": \"vertical_layout\", \"id\": \"").append(new UUID(0, i + 1))
                .append("\", \"fields\": {}, \"children\": [");
        }
        json.append("]}".repeat(levels)).append('}');

        DocumentFormatException e = assertThrows(DocumentFormatException.class,
            () -> serializer.fromJson(json.toString()));
        assertTrue(e.getMessage().contains("nested deeper"));
    }

    @Test
    void testFloatFields_StayFinite() throws Exception {
        Document document = DocumentTemplates.empty(NodeRegistry.standard());
        Node slider = document.registry().create("slider");
        document.tree().appendChild(document.tree().root().getId(), slider);

        assertThrows(IllegalArgumentException.class,
            () -> document.tree().setProperty(slider.getId(), "value", PropertyValue.ofFloat(Double.NaN)));
        assertThrows(IllegalArgumentException.class,
            () -> document.variables().define("ratio", VariableType.FLOAT, Double.POSITIVE_INFINITY));

        document.tree().setProperty(slider.getId(), "value", PropertyValue.ofFloat(-Double.MAX_VALUE));
        document.tree().setProperty(slider.getId(), "min", PropertyValue.ofFloat(-Double.MAX_VALUE));
        Document loaded = serializer.deserialize(serializer.serialize(document));

        assertTrue(document.tree().root().sameStructure(loaded.tree().root(), true));
        assertEquals(-Double.MAX_VALUE, loaded.tree().root().children().get(0).property("value").asDouble());
    }

    @Test
    void testDeserialize_MissingVersionOrGarbage() {
        assertThrows(DocumentFormatException.class, () -> serializer.fromJson("{\"projectName\": \"P\"}"));
        assertThrows(DocumentFormatException.class, () -> serializer.fromJson("not json at all {"));
        assertThrows(DocumentFormatException.class, () -> serializer.fromJson(""));
    }

    @Test
    void testDeserialize_LegacyTextVariableValues() throws Exception {
        String json = """
            {"schemaVersion": 1, "projectName": "P",
             "variables": [{"name": "count", "type": "integer", "value": "5"},
                           {"name": "flag", "type": "boolean", "value": "true"}],
             "root": {"kind": "vertical_layout", "id": "%s", "fields": {}, "children": []}}
            """.formatted(ROOT_ID);

        Document document = serializer.fromJson(json);

        assertEquals(5L, document.variables().require("count").defaultValue());
        assertEquals(Boolean.TRUE, document.variables().require("flag").defaultValue());
    }

    @Test
    void testExtraFields_WrittenBackVerbatim() throws Exception {
        String json = document("""
            {"kind": "label", "id": "%s", "fields": {"text": "Hi", "tooltip": {"text": "later", "delay": 3}}}
            """.formatted(LABEL_ID));

        Document document = serializer.fromJson(json);
        Node label = document.tree().root().children().get(0);
        var written = JsonParser.parseString(serializer.toJson(document)).getAsJsonObject()
            .getAsJsonObject("root").getAsJsonArray("children").get(0).getAsJsonObject().getAsJsonObject("fields");

        assertEquals("Hi", label.property("text").asString());
        assertTrue(label.extraFields().containsKey("tooltip"));
        assertEquals(JsonParser.parseString("{\"text\": \"later\", \"delay\": 3}"), written.get("tooltip"));
    }

    @Test
    void testNodePayload_KeepsIds() throws Exception {
        Document document = DocumentTemplates.counterApp(NodeRegistry.standard());
        Node button = document.tree().root().children().get(2);

        Node copy = serializer.deserializeNode(serializer.serializeNode(button));

        assertTrue(copy.sameStructure(button, true));
        assertFalse(copy.isAttached());
    }

    private static String withVersion(String version) {
        return """
            {"schemaVersion": %s, "projectName": "P",
             "root": {"kind": "vertical_layout", "id": "%s", "fields": {}, "children": []}}
            """.formatted(version, ROOT_ID);
    }

    private static String document(String children) {
        return """
            {"schemaVersion": 1, "projectName": "P",
             "root": {"kind": "vertical_layout", "id": "%s", "fields": {}, "children": [%s]}}
            """.formatted(ROOT_ID, children);
    }
}
