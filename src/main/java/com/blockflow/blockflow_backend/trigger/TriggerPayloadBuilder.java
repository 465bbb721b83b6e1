package com.blockflow.blockflow_backend.trigger;

import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.domain.BlockDescriptor;
import com.blockflow.blockflow_backend.model.domain.BlockRegistry;
import com.blockflow.blockflow_backend.model.graph.Values;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Synthesizes the input a trigger receives when it is run from the editor instead of by a real
 * event.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TriggerPayloadBuilder {

    static final String SAMPLE_PAYLOAD_SUBBLOCK = "samplePayload";
    static final String INPUT_FORMAT_SUBBLOCK = "inputFormat";

    private final BlockRegistry blockRegistry;
    private final InputValueCoercer coercer;
    private final ObjectMapper objectMapper;

    public boolean needsMockPayload(StartBlockPath path) {
        return path == StartBlockPath.EXTERNAL_TRIGGER;
    }

    public boolean usesInputFormat(StartBlockPath path) {
        return path == StartBlockPath.UNIFIED || path == StartBlockPath.SPLIT_API || path == StartBlockPath.SPLIT_INPUT;
    }

    /**
     * Payload for a manual run started at {@code candidate}; null when the path defines none and
     * the caller's input should be used as is.
     */
    public Map<String, Object> build(StartBlockCandidate candidate) {
        if (candidate.path() == StartBlockPath.SCHEDULE_TRIGGER) {
            return new LinkedHashMap<>();
        }
        if (needsMockPayload(candidate.path())) {
            return mockPayload(candidate.block());
        }
        if (usesInputFormat(candidate.path())) {
            Map<String, Object> testInput = inputFormatValues(candidate.block());
            return testInput.isEmpty() ? null : testInput;
        }
        return null;
    }

    /** Block's own sample payload, then the registry sample, then one generated from its outputs. */
    public Map<String, Object> mockPayload(Block block) {
        Map<String, Object> own = readSamplePayload(block);
        if (own != null) return own;

        BlockDescriptor descriptor = blockRegistry.get(block.getType());
        if (!descriptor.samplePayload().isEmpty()) {
            return Values.deepCopyMap(descriptor.samplePayload());
        }
        Map<String, Object> outputs = block.getOutputs() != null && !block.getOutputs().isEmpty()
                ? block.getOutputs() : descriptor.outputs();
        Map<String, Object> generated = new LinkedHashMap<>();
        outputs.forEach((key, schema) -> generated.put(key, sampleFor(schema)));
        return generated;
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> readSamplePayload(Block block) {
        Object raw = block.subBlockValue(SAMPLE_PAYLOAD_SUBBLOCK);
        if (raw instanceof Map<?, ?> map) {
            return Values.deepCopyMap((Map<String, Object>) map);
        }
        if (raw instanceof String json && !json.isBlank()) {
            try {
                Object parsed = objectMapper.readValue(json, Object.class);
                if (parsed instanceof Map<?, ?> map) return (Map<String, Object>) map;
            } catch (JsonProcessingException e) {
                log.warn("Ignoring unparseable sample payload on block {}: {}", block.getId(), e.getOriginalMessage());
            }
        }
        return null;
    }

    private Object sampleFor(Object schema) {
        String type = schema instanceof Map<?, ?> m && m.get("type") != null ? m.get("type").toString()
                : schema != null ? schema.toString() : "any";
        return switch (type) {
            case "string" -> "sample";
            case "number" -> 0;
            case "boolean" -> false;
            case "json", "object" -> new LinkedHashMap<>();
            case "array", "files" -> List.of();
            default -> null;
        };
    }

    /** Field name to coerced example value for every input format field that has a value. */
    public Map<String, Object> inputFormatValues(Block block) {
        Map<String, Object> values = new LinkedHashMap<>();
        if (!(block.subBlockValue(INPUT_FORMAT_SUBBLOCK) instanceof List<?> fields)) {
            return values;
        }
        for (Object item : fields) {
            if (!(item instanceof Map<?, ?> field)) continue;
            Object name = field.get("name");
            if (name == null || name.toString().isBlank() || !field.containsKey("value")) continue;
            Object type = field.get("type");
            values.put(name.toString(), coercer.coerce(type != null ? type.toString() : null, field.get("value")));
        }
        return values;
    }
}
