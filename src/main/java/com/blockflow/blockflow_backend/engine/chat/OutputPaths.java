package com.blockflow.blockflow_backend.engine.chat;

import java.util.List;
import java.util.Map;

/** Dot-path lookup into block outputs; numeric segments index into lists. */
final class OutputPaths {

    private OutputPaths() {}

    static Object resolve(Object root, String path) {
        if (path == null || path.isBlank()) return root;
        Object current = root;
        for (String segment : path.split("\\.")) {
            if (current instanceof Map<?, ?> map) {
                current = map.get(segment);
            } else if (current instanceof List<?> list && !segment.isEmpty() && segment.chars().allMatch(Character::isDigit)) {
                int index = Integer.parseInt(segment);
                current = index < list.size() ? list.get(index) : null;
            } else {
                return null;
            }
            if (current == null) return null;
        }
        return current;
    }
}
