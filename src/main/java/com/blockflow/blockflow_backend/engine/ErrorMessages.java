package com.blockflow.blockflow_backend.engine;

import java.util.Map;

/** Turns whatever an error path produced into a message fit to show a user. */
public final class ErrorMessages {

    public static final String GENERIC = "Workflow execution failed";

    private static final String UNDEFINED_SHAPE = "undefined (undefined)";

    private ErrorMessages() {}

    /**
     * Exception or string message first, then a {@code message} entry, then a nested
     * {@code error} (its message or the string itself). Falls back to {@link #GENERIC}.
     */
    public static String normalize(Object error) {
        if (error instanceof Throwable t) {
            String message = sanitize(t.getMessage());
            if (message != null) return message;
            return t.getCause() != null ? normalize(t.getCause()) : GENERIC;
        }
        if (error instanceof CharSequence text) {
            String message = sanitize(text.toString());
            return message != null ? message : GENERIC;
        }
        if (error instanceof Map<?, ?> record) {
            String message = sanitize(asString(record.get("message")));
            if (message != null) return message;

            Object nested = record.get("error");
            if (nested instanceof Map<?, ?> nestedRecord) {
                message = sanitize(asString(nestedRecord.get("message")));
                if (message != null) return message;
            } else if (nested instanceof CharSequence) {
                message = sanitize(nested.toString());
                if (message != null) return message;
            }
        }
        return GENERIC;
    }

    private static String asString(Object value) {
        return value instanceof CharSequence ? value.toString() : null;
    }

    private static String sanitize(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        if (trimmed.isEmpty() || UNDEFINED_SHAPE.equals(trimmed)) return null;
        return trimmed;
    }
}
