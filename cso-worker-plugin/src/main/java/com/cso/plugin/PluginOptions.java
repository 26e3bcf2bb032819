package com.cso.plugin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Lenient accessors for plugin option maps. Options arrive from task parameters and handler
 * code, so scalar values may be strings, numbers or booleans.
 */
public final class PluginOptions {

    private PluginOptions() {
    }

    /** String value, or null when absent or blank. */
    public static String getString(Map<String, Object> options, String key) {
        return getString(options, key, null);
    }

    public static String getString(Map<String, Object> options, String key, String defaultValue) {
        Object v = options != null ? options.get(key) : null;
        if (v == null) return defaultValue;
        String s = v.toString().trim();
        return s.isEmpty() ? defaultValue : s;
    }

    /** Boolean value: {@code true}, {@code "true"}, {@code "1"} and {@code "yes"} are true. */
    public static boolean getBoolean(Map<String, Object> options, String key, boolean defaultValue) {
        Object v = options != null ? options.get(key) : null;
        if (v == null) return defaultValue;
        if (v instanceof Boolean) return (Boolean) v;
        String s = v.toString().trim();
        if (s.isEmpty()) return defaultValue;
        return "true".equalsIgnoreCase(s) || "1".equals(s) || "yes".equalsIgnoreCase(s);
    }

    public static int getInt(Map<String, Object> options, String key, int defaultValue) {
        Object v = options != null ? options.get(key) : null;
        if (v == null) return defaultValue;
        if (v instanceof Number) return ((Number) v).intValue();
        try {
            return Integer.parseInt(v.toString().trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /** List of strings; a single string value becomes a one-element list (comma-separated values are split). */
    public static List<String> getStringList(Map<String, Object> options, String key) {
        Object v = options != null ? options.get(key) : null;
        if (v == null) return List.of();
        List<String> out = new ArrayList<>();
        if (v instanceof Iterable) {
            for (Object o : (Iterable<?>) v) {
                if (o != null && !o.toString().isBlank()) out.add(o.toString().trim());
            }
        } else {
            for (String part : v.toString().split(",")) {
                if (!part.isBlank()) out.add(part.trim());
            }
        }
        return Collections.unmodifiableList(out);
    }

    /** Map of strings; non-map values yield an empty map. Null values are dropped. */
    public static Map<String, String> getStringMap(Map<String, Object> options, String key) {
        Object v = options != null ? options.get(key) : null;
        if (!(v instanceof Map)) return Map.of();
        Map<String, String> out = new LinkedHashMap<>();
        for (Map.Entry<?, ?> e : ((Map<?, ?>) v).entrySet()) {
            if (e.getKey() != null && e.getValue() != null) {
                out.put(e.getKey().toString(), e.getValue().toString());
            }
        }
        return Collections.unmodifiableMap(out);
    }
}
