package com.aether.config;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed description of the keys a configuration file may contain.
 *
 * Fields keep declaration order so that defaults and error messages come out the
 * same way on every run.
 */
public class ConfigSchema {

    private final Map<String, FieldDefinition> fields;

    public ConfigSchema(Map<String, FieldDefinition> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    /**
     * Validates configuration values and fills in defaults for missing keys.
     *
     * @param config values read from the file; missing defaults are added in place
     * @throws ConfigValidationException if a value has the wrong type or breaks a constraint
     */
    public void validate(Map<String, Object> config) throws ConfigValidationException {
        for (Map.Entry<String, FieldDefinition> entry : fields.entrySet()) {
            String fieldName = entry.getKey();
            FieldDefinition fieldDef = entry.getValue();

            Object value = config.get(fieldName);
            if (value == null) {
                if (fieldDef.defaultValue() != null) {
                    config.put(fieldName, fieldDef.defaultValue());
                } else if (fieldDef.required()) {
                    throw new ConfigValidationException(fieldName,
                        String.format("Required field '%s' is missing", fieldName));
                }
                continue;
            }
            fieldDef.validate(fieldName, value);
        }
    }

    public boolean declares(String fieldName) {
        return fields.containsKey(fieldName);
    }

    public Map<String, FieldDefinition> getFields() {
        return fields;
    }

    /**
     * Definition of a configuration field.
     */
    public static class FieldDefinition {
        private final FieldType type;
        private final boolean required;
        private final Object defaultValue;
        private final Number minValue;
        private final Number maxValue;
        private final String pattern;

        private FieldDefinition(Builder builder) {
            this.type = builder.type;
            this.required = builder.required;
            this.defaultValue = builder.defaultValue;
            this.minValue = builder.minValue;
            this.maxValue = builder.maxValue;
            this.pattern = builder.pattern;
        }

        public static Builder builder(FieldType type) {
            return new Builder().type(type);
        }

        /**
         * Validates a field value.
         *
         * @param fieldName the key, for messages
         * @param value the value read from the file
         * @throws ConfigValidationException if the value is not acceptable
         */
        public void validate(String fieldName, Object value) throws ConfigValidationException {
            if (!type.isValid(value)) {
                throw new ConfigValidationException(fieldName,
                    String.format("Field '%s' expected %s, got %s",
                        fieldName, type.name(), value.getClass().getSimpleName()));
            }

            if (value instanceof Number) {
                double numValue = ((Number) value).doubleValue();
                if (minValue != null && numValue < minValue.doubleValue()) {
                    throw new ConfigValidationException(fieldName,
                        String.format("Field '%s' value %s is below minimum %s", fieldName, value, minValue));
                }
                if (maxValue != null && numValue > maxValue.doubleValue()) {
                    throw new ConfigValidationException(fieldName,
                        String.format("Field '%s' value %s is above maximum %s", fieldName, value, maxValue));
                }
            }

            if (value instanceof String && pattern != null && !((String) value).matches(pattern)) {
                throw new ConfigValidationException(fieldName,
                    String.format("Field '%s' value '%s' does not match pattern '%s'", fieldName, value, pattern));
            }
        }

        public FieldType type() { return type; }
        public boolean required() { return required; }
        public Object defaultValue() { return defaultValue; }
        public Number minValue() { return minValue; }
        public Number maxValue() { return maxValue; }
        public String pattern() { return pattern; }

        /**
         * Builder for field definitions.
         */
        public static class Builder {
            private FieldType type;
            private boolean required = false;
            private Object defaultValue;
            private Number minValue;
            private Number maxValue;
            private String pattern;

            public Builder type(FieldType type) {
                this.type = type;
                return this;
            }

            public Builder required(boolean required) {
                this.required = required;
                return this;
            }

            public Builder defaultValue(Object defaultValue) {
                this.defaultValue = defaultValue;
                return this;
            }

            public Builder min(Number minValue) {
                this.minValue = minValue;
                return this;
            }

            public Builder max(Number maxValue) {
                this.maxValue = maxValue;
                return this;
            }

            public Builder pattern(String pattern) {
                this.pattern = pattern;
                return this;
            }

            public FieldDefinition build() {
                if (type == null) {
                    throw new IllegalStateException("Field type is required");
                }
                return new FieldDefinition(this);
            }
        }
    }

    /**
     * Supported field types.
     */
    public enum FieldType {
        STRING,
        INTEGER,
        NUMBER,
        BOOLEAN;

        public boolean isValid(Object value) {
            if (value == null) {
                return false;
            }
            switch (this) {
                case STRING:
                    return value instanceof String;
                case INTEGER:
                    return value instanceof Integer || value instanceof Long;
                case NUMBER:
                    return value instanceof Number;
                case BOOLEAN:
                    return value instanceof Boolean;
                default:
                    return false;
            }
        }
    }
}
