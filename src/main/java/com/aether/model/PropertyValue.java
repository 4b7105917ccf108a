package com.aether.model;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonPrimitive;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An immutable, typed property literal.
 */
public record PropertyValue(
    PropertyType type,
    Object value
) {
    
    public PropertyValue {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(value, "value");
        switch (type) {
            case STRING, ASSET -> requireType(type, value, String.class);
            case INTEGER -> requireType(type, value, Long.class);
            case FLOAT -> {
                requireType(type, value, Double.class);
                if (!Double.isFinite((Double) value)) {
                    throw new IllegalArgumentException("FLOAT value must be finite, got " + value);
                }
            }
            case BOOLEAN -> requireType(type, value, Boolean.class);
            case STRING_LIST -> {
                requireType(type, value, List.class);
                List<String> copy = new ArrayList<>();
                for (Object item : (List<?>) value) {
                    requireType(type, item, String.class);
                    copy.add((String) item);
                }
                value = List.copyOf(copy);
            }
        }
    }
    
    public static PropertyValue ofString(String value) {
        return new PropertyValue(PropertyType.STRING, value);
    }
    
    public static PropertyValue ofInteger(long value) {
        return new PropertyValue(PropertyType.INTEGER, value);
    }
    
    public static PropertyValue ofFloat(double value) {
        return new PropertyValue(PropertyType.FLOAT, value);
    }
    
    public static PropertyValue ofBoolean(boolean value) {
        return new PropertyValue(PropertyType.BOOLEAN, value);
    }
    
    public static PropertyValue ofAsset(String assetName) {
        return new PropertyValue(PropertyType.ASSET, assetName);
    }
    
    public static PropertyValue ofStringList(List<String> values) {
        return new PropertyValue(PropertyType.STRING_LIST, values);
    }
    
    public String asString() {
        return (String) value;
    }
    
    public long asLong() {
        return (Long) value;
    }
    
    public double asDouble() {
        return type == PropertyType.INTEGER ? ((Long) value).doubleValue() : (Double) value;
    }
    
    public boolean asBoolean() {
        return (Boolean) value;
    }
    
    @SuppressWarnings("unchecked")
    public List<String> asStringList() {
        return (List<String>) value;
    }
    
    /**
     * Renders the value the way a user would read it.
     * 
     * @return display text
     */
    public String displayText() {
        return switch (type) {
            case FLOAT -> BigDecimal.valueOf((Double) value).stripTrailingZeros().toPlainString();
            case STRING_LIST -> String.join(", ", asStringList());
            default -> String.valueOf(value);
        };
    }
    
    /**
     * Converts the value to its persisted JSON form.
     * 
     * @return the JSON element
     */
    public JsonElement toJson() {
        switch (type) {
            case STRING:
            case ASSET:
                return new JsonPrimitive((String) value);
            case INTEGER:
                return new JsonPrimitive((Long) value);
            case FLOAT:
                return new JsonPrimitive((Double) value);
            case BOOLEAN:
                return new JsonPrimitive((Boolean) value);
            case STRING_LIST:
            default:
                JsonArray array = new JsonArray();
                for (String item : asStringList()) {
                    array.add(item);
                }
                return array;
        }
    }
    
    /**
     * Reads a persisted value of the given type.
     * 
     * @param type the expected type
     * @param element the JSON element
     * @return the typed value
     * @throws IllegalArgumentException if the element does not hold a value of that type
     */
    public static PropertyValue fromJson(PropertyType type, JsonElement element) {
        if (element == null || element.isJsonNull()) {
            throw new IllegalArgumentException("expected " + type + " but was null");
        }
        switch (type) {
            case STRING:
            case ASSET:
                if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isString()) {
                    return new PropertyValue(type, element.getAsString());
                }
                break;
            case INTEGER:
                if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber()) {
                    BigDecimal number = element.getAsBigDecimal();
                    try {
                        return ofInteger(number.longValueExact());
                    } catch (ArithmeticException e) {
                        throw new IllegalArgumentException("expected INTEGER but was " + element, e);
                    }
                }
                break;
            case FLOAT:
                if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isNumber()) {
                    return ofFloat(element.getAsDouble());
                }
                break;
            case BOOLEAN:
                if (element.isJsonPrimitive() && element.getAsJsonPrimitive().isBoolean()) {
                    return ofBoolean(element.getAsBoolean());
                }
                break;
            case STRING_LIST:
                if (element.isJsonArray()) {
                    List<String> items = new ArrayList<>();
                    for (JsonElement item : element.getAsJsonArray()) {
                        if (!item.isJsonPrimitive() || !item.getAsJsonPrimitive().isString()) {
                            throw new IllegalArgumentException("expected string list item but was " + item);
                        }
                        items.add(item.getAsString());
                    }
                    return ofStringList(items);
                }
                break;
        }
        throw new IllegalArgumentException("expected " + type + " but was " + element);
    }
    
    private static void requireType(PropertyType type, Object value, Class<?> javaType) {
        if (!javaType.isInstance(value)) {
            throw new IllegalArgumentException(String.format(
                "%s property cannot hold %s", type, value == null ? "null" : value.getClass().getSimpleName()));
        }
    }
}
