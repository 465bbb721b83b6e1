package com.blockflow.blockflow_backend.model.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Helpers for the JSON-shaped values stored in parameters and outputs
 * (maps, lists, strings, numbers, booleans, null).
 */
public final class Values {

    private Values() {}

    public static Object deepCopy(Object value) {
        return transform(value, UnaryOperator.identity());
    }

    @SuppressWarnings("unchecked")
    public static Map<String, Object> deepCopyMap(Map<String, Object> value) {
        if (value == null) return new LinkedHashMap<>();
        return (Map<String, Object>) deepCopy(value);
    }

    /**
     * Walks maps and lists recursively, applying {@code onString} to every string leaf.
     * Other scalars are returned as-is. Always returns fresh containers.
     */
    public static Object transform(Object value, UnaryOperator<String> onString) {
        if (value instanceof String s) {
            return onString.apply(s);
        }
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> result = new LinkedHashMap<>();
            map.forEach((k, v) -> result.put(String.valueOf(k), transform(v, onString)));
            return result;
        }
        if (value instanceof List<?> list) {
            List<Object> result = new ArrayList<>(list.size());
            list.forEach(item -> result.add(transform(item, onString)));
            return result;
        }
        return value;
    }

    /** Follows a dotted path ("a.b.0.c") through maps and lists; null when any step is missing. */
    public static Object traversePath(Object root, String path) {
        if (path == null || path.isBlank()) return root;
        Object current = root;
        for (String part : path.split("\\.")) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(part);
            } else if (current instanceof List<?> list) {
                try {
                    int index = Integer.parseInt(part);
                    current = index >= 0 && index < list.size() ? list.get(index) : null;
                } catch (NumberFormatException e) {
                    return null;
                }
            } else {
                return null;
            }
            if (current == null) return null;
        }
        return current;
    }
}
