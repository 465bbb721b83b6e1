package com.blockflow.blockflow_backend.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Condition blocks store their branches as a JSON string holding a list of
 * {@code {id, title, value}} entries. Documents use the clean form instead:
 * {@code conditions: { if: "<x.y> > 1", else-if: "...", else: "" }}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConditionInputs {

    static final String CONDITIONS = "conditions";

    private final ObjectMapper objectMapper;

    /** Clean map form → internal JSON list. An {@code else} branch is always present afterwards. */
    public Map<String, Object> expand(String blockId, Map<String, Object> inputs) {
        Map<String, Object> expanded = new LinkedHashMap<>(inputs);
        if (!(expanded.get(CONDITIONS) instanceof Map<?, ?> clean)) {
            return expanded;
        }

        List<Map<String, Object>> conditions = new ArrayList<>();
        clean.forEach((key, value) -> {
            String semanticKey = String.valueOf(key);
            String title = semanticKey.startsWith("else-if") ? "else if" : semanticKey;
            conditions.add(condition(blockId + "-" + semanticKey, title, value != null ? String.valueOf(value) : ""));
        });
        if (!clean.containsKey("else")) {
            conditions.add(condition(blockId + "-else", "else", ""));
        }

        try {
            expanded.put(CONDITIONS, objectMapper.writeValueAsString(conditions));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize conditions for block " + blockId, e);
        }
        return expanded;
    }

    /**
     * Internal JSON list → clean map keyed by title ({@code else-if}, {@code else-if-2}, ...).
     * Branches with a blank value are dropped; an unparseable value is left as it is.
     */
    public Map<String, Object> clean(String blockId, Map<String, Object> inputs) {
        Map<String, Object> cleaned = new LinkedHashMap<>(inputs);
        Object raw = cleaned.get(CONDITIONS);
        if (raw == null) return cleaned;

        TypeReference<List<Map<String, Object>>> listOfConditions = new TypeReference<>() {};
        List<Map<String, Object>> conditions;
        try {
            if (raw instanceof String json) {
                conditions = objectMapper.readValue(json, listOfConditions);
            } else {
                conditions = objectMapper.convertValue(raw, listOfConditions);
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("Failed to clean condition inputs for block {}: {}", blockId, e.getMessage());
            return cleaned;
        }

        Map<String, Object> semantic = new LinkedHashMap<>();
        for (Map<String, Object> condition : conditions) {
            Object title = condition.get("title");
            Object value = condition.get("value");
            if (title == null || value == null) continue;
            String key = title.toString();
            if (key.equals("else if")) {
                long elseIfCount = semantic.keySet().stream().filter(k -> k.startsWith("else-if")).count();
                key = elseIfCount == 0 ? "else-if" : "else-if-" + (elseIfCount + 1);
            }
            String trimmed = value.toString().trim();
            if (!trimmed.isEmpty()) {
                semantic.put(key, trimmed);
            }
        }
        if (semantic.isEmpty()) {
            cleaned.remove(CONDITIONS);
        } else {
            cleaned.put(CONDITIONS, semantic);
        }
        return cleaned;
    }

    private static Map<String, Object> condition(String id, String title, String value) {
        Map<String, Object> condition = new LinkedHashMap<>();
        condition.put("id", id);
        condition.put("title", title);
        condition.put("value", value);
        return condition;
    }
}
