package org.buildlens.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Typed readers over maps parsed from JSON or YAML documents.
 */
public final class ConfigValues {
    private ConfigValues() {
    }

    public static Map<String, Object> normalizeKeys(Map<?, ?> source) {
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : source.entrySet()) {
            normalized.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return normalized;
    }

    public static String readString(Map<String, ?> map, String key) {
        Object value = map.get(key);
        return value instanceof String string ? string : null;
    }

    public static String requireString(Map<String, ?> map, String key) {
        String value = readString(map, key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(key + " must be a non-blank string");
        }
        return value;
    }

    public static Double readDouble(Map<String, ?> map, String key) {
        Object value = map.get(key);
        if (!(value instanceof Number number)) {
            return null;
        }
        return number.doubleValue();
    }

    public static double readDouble(Map<String, ?> map, String key, double defaultValue) {
        Double value = readDouble(map, key);
        return value == null ? defaultValue : value;
    }

    public static int readInt(Map<String, ?> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (!(value instanceof Number number)) {
            return defaultValue;
        }
        return number.intValue();
    }

    public static boolean readBoolean(Map<String, ?> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        return value instanceof Boolean bool ? bool : defaultValue;
    }

    /**
     * Nested object under {@code key}, or null when absent.
     */
    public static Map<String, Object> readMap(Map<String, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof Map<?, ?> child)) {
            throw new IllegalArgumentException(key + " must be an object");
        }
        return normalizeKeys(child);
    }

    public static List<Map<String, Object>> readMapList(Map<String, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> items)) {
            throw new IllegalArgumentException(key + " must be an array");
        }
        List<Map<String, Object>> maps = new ArrayList<>(items.size());
        for (Object item : items) {
            if (!(item instanceof Map<?, ?> child)) {
                throw new IllegalArgumentException(key + " entries must be objects");
            }
            maps.add(normalizeKeys(child));
        }
        return maps;
    }

    public static List<String> readStringList(Map<String, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List<?> items)) {
            throw new IllegalArgumentException(key + " must be an array");
        }
        List<String> strings = new ArrayList<>(items.size());
        for (Object item : items) {
            strings.add(String.valueOf(item));
        }
        return List.copyOf(strings);
    }

    /**
     * Object of numeric values under {@code key}; empty when absent.
     */
    public static Map<String, Double> readNumberMap(Map<String, ?> map, String key) {
        Map<String, Object> child = readMap(map, key);
        if (child == null) {
            return Map.of();
        }
        Map<String, Double> numbers = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : child.entrySet()) {
            if (!(entry.getValue() instanceof Number number)) {
                throw new IllegalArgumentException(key + "." + entry.getKey() + " must be a number");
            }
            numbers.put(entry.getKey(), number.doubleValue());
        }
        return numbers;
    }
}
