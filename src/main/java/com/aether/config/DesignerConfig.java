package com.aether.config;

import com.aether.history.HistoryEngine;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Settings of the designer, read once at startup.
 *
 * @param historyCapacity undo steps kept
 * @param generationDebounceMillis quiet period before speculative generation starts
 * @param validationCommand command line run on each generated script
 * @param validationTimeoutSeconds limit per validation run
 * @param exportDirectory default output directory of exports
 * @param fragmentValidation whether inline code is parse-checked
 */
public record DesignerConfig(
    int historyCapacity,
    long generationDebounceMillis,
    String validationCommand,
    int validationTimeoutSeconds,
    String exportDirectory,
    boolean fragmentValidation
) {

    public static final String HISTORY_CAPACITY = "historyCapacity";
    public static final String GENERATION_DEBOUNCE_MILLIS = "generationDebounceMillis";
    public static final String VALIDATION_COMMAND = "validationCommand";
    public static final String VALIDATION_TIMEOUT_SECONDS = "validationTimeoutSeconds";
    public static final String EXPORT_DIRECTORY = "exportDirectory";
    public static final String FRAGMENT_VALIDATION = "fragmentValidation";

    public static final ConfigSchema SCHEMA = new ConfigSchema(schemaFields());

    private static Map<String, ConfigSchema.FieldDefinition> schemaFields() {
        Map<String, ConfigSchema.FieldDefinition> fields = new LinkedHashMap<>();
        fields.put(HISTORY_CAPACITY, ConfigSchema.FieldDefinition.builder(ConfigSchema.FieldType.INTEGER)
            .defaultValue(HistoryEngine.DEFAULT_CAPACITY).min(1).build());
        fields.put(GENERATION_DEBOUNCE_MILLIS, ConfigSchema.FieldDefinition.builder(ConfigSchema.FieldType.INTEGER)
            .defaultValue(300).min(0).build());
        fields.put(VALIDATION_COMMAND, ConfigSchema.FieldDefinition.builder(ConfigSchema.FieldType.STRING)
            .defaultValue("node --check").pattern(".*\\S.*").build());
        fields.put(VALIDATION_TIMEOUT_SECONDS, ConfigSchema.FieldDefinition.builder(ConfigSchema.FieldType.INTEGER)
            .defaultValue(30).min(1).build());
        fields.put(EXPORT_DIRECTORY, ConfigSchema.FieldDefinition.builder(ConfigSchema.FieldType.STRING)
            .defaultValue("generated").pattern(".*\\S.*").build());
        fields.put(FRAGMENT_VALIDATION, ConfigSchema.FieldDefinition.builder(ConfigSchema.FieldType.BOOLEAN)
            .defaultValue(true).build());
        return fields;
    }

    public static DesignerConfig defaults() {
        Map<String, Object> values = new LinkedHashMap<>();
        try {
            SCHEMA.validate(values);
        } catch (ConfigValidationException e) {
            throw new IllegalStateException("Built-in defaults are invalid", e);
        }
        return fromValidated(values);
    }

    /**
     * Builds a config from values that already passed {@link #SCHEMA}.
     *
     * @param values validated values with defaults applied
     * @return the config
     */
    static DesignerConfig fromValidated(Map<String, Object> values) {
        return new DesignerConfig(
            ((Number) values.get(HISTORY_CAPACITY)).intValue(),
            ((Number) values.get(GENERATION_DEBOUNCE_MILLIS)).longValue(),
            (String) values.get(VALIDATION_COMMAND),
            ((Number) values.get(VALIDATION_TIMEOUT_SECONDS)).intValue(),
            (String) values.get(EXPORT_DIRECTORY),
            (Boolean) values.get(FRAGMENT_VALIDATION));
    }

    public Duration validationTimeout() {
        return Duration.ofSeconds(validationTimeoutSeconds);
    }
}
