package com.blockflow.blockflow_backend.trigger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Converts example values typed into an input format field to the field's declared type.
 * Values that do not parse are passed through unchanged.
 */
@Component
@RequiredArgsConstructor
public class InputValueCoercer {

    private final ObjectMapper objectMapper;

    public Object coerce(String type, Object value) {
        if (type == null || !(value instanceof String text)) {
            return value;
        }
        return switch (type) {
            case "number" -> parseNumber(text);
            case "boolean" -> parseBoolean(text);
            case "array", "object" -> parseJson(text);
            default -> value;
        };
    }

    private Object parseNumber(String text) {
        String trimmed = text.trim();
        try {
            double number = Double.parseDouble(trimmed);
            if (number == Math.rint(number) && !Double.isInfinite(number) && Math.abs(number) < Long.MAX_VALUE) {
                return (long) number;
            }
            return number;
        } catch (NumberFormatException e) {
            return text;
        }
    }

    private Object parseBoolean(String text) {
        String trimmed = text.trim();
        if ("true".equalsIgnoreCase(trimmed)) return Boolean.TRUE;
        if ("false".equalsIgnoreCase(trimmed)) return Boolean.FALSE;
        return text;
    }

    private Object parseJson(String text) {
        try {
            return objectMapper.readValue(text, Object.class);
        } catch (JsonProcessingException e) {
            return text;
        }
    }
}
