package com.aether.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads the designer configuration.
 *
 * The file is optional: a missing file yields the defaults. Present keys are
 * validated against {@link DesignerConfig#SCHEMA}; unknown keys are logged and
 * ignored.
 */
public class ConfigService {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConfigService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String FILE_NAME = "aether.json";

    private final Path configDir;

    public ConfigService(Path configDir) {
        this.configDir = configDir;
    }

    public Path configFile() {
        return configDir.resolve(FILE_NAME);
    }

    /**
     * Loads and validates the configuration.
     *
     * @return the configuration
     * @throws ConfigLoadException if the file exists but cannot be read or parsed
     * @throws ConfigValidationException if a value breaks the schema
     */
    public DesignerConfig load() throws ConfigLoadException, ConfigValidationException {
        Path configFile = configFile();
        Map<String, Object> config = new LinkedHashMap<>();

        if (Files.exists(configFile)) {
            JsonNode root;
            try {
                root = MAPPER.readTree(Files.readString(configFile));
            } catch (JsonProcessingException e) {
                throw new ConfigLoadException(
                    String.format("Config file '%s' is not valid JSON: %s", configFile, e.getOriginalMessage()), e);
            } catch (IOException e) {
                throw new ConfigLoadException(String.format("Failed to read config file '%s'", configFile), e);
            }
            if (root == null || !root.isObject()) {
                throw new ConfigLoadException(String.format("Config file '%s' must hold a JSON object", configFile));
            }

            Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!DesignerConfig.SCHEMA.declares(field.getKey())) {
                    LOGGER.warn("Ignoring unknown config key '{}' in {}", field.getKey(), configFile);
                    continue;
                }
                config.put(field.getKey(), convertJsonNode(field.getValue()));
            }
            LOGGER.debug("Loaded config from {}", configFile);
        } else {
            LOGGER.debug("No config file at {}, using defaults", configFile);
        }

        DesignerConfig.SCHEMA.validate(config);
        DesignerConfig designerConfig = DesignerConfig.fromValidated(config);
        LOGGER.info("Configuration loaded: {}", designerConfig);
        return designerConfig;
    }

    /**
     * Converts a JsonNode to a plain Java value.
     */
    private Object convertJsonNode(JsonNode node) {
        if (node.isTextual()) {
            return node.asText();
        } else if (node.isNumber()) {
            if (node.isInt()) {
                return node.asInt();
            } else if (node.isLong()) {
                return node.asLong();
            } else {
                return node.asDouble();
            }
        } else if (node.isBoolean()) {
            return node.asBoolean();
        } else if (node.isNull()) {
            return null;
        } else if (node.isArray()) {
            List<Object> array = new ArrayList<>();
            for (JsonNode element : node) {
                array.add(convertJsonNode(element));
            }
            return array;
        } else if (node.isObject()) {
            Map<String, Object> object = new LinkedHashMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                object.put(field.getKey(), convertJsonNode(field.getValue()));
            }
            return object;
        }
        return null;
    }
}
