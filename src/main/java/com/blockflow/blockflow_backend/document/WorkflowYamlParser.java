package com.blockflow.blockflow_backend.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads workflow YAML into a {@link YamlWorkflowDocument} and checks its shape: a root map
 * with {@code version} and {@code blocks}, every block with a string {@code type} and
 * {@code name}, and map-valued {@code inputs}/{@code connections}.
 */
@Component
public class WorkflowYamlParser {

    public record Result(YamlWorkflowDocument document, List<String> errors) {
        public boolean isValid() {
            return document != null && errors.isEmpty();
        }
    }

    private final YAMLMapper yamlMapper = new YAMLMapper();

    public Result parse(String yamlContent) {
        List<String> errors = new ArrayList<>();
        Object root;
        try {
            root = yamlMapper.readValue(yamlContent == null ? "" : yamlContent, Object.class);
        } catch (JsonProcessingException e) {
            errors.add("YAML parsing error: " + e.getOriginalMessage());
            return new Result(null, errors);
        }

        if (!(root instanceof Map<?, ?> rootMap)) {
            errors.add("Invalid YAML: Root must be an object");
            return new Result(null, errors);
        }
        Object version = rootMap.get("version");
        if (version == null || version.toString().isBlank()) {
            errors.add("Missing required field: version");
        }
        if (!(rootMap.get("blocks") instanceof Map<?, ?> rawBlocks)) {
            errors.add("Missing or invalid field: blocks");
            return new Result(null, errors);
        }

        Map<String, YamlBlock> blocks = new LinkedHashMap<>();
        rawBlocks.forEach((key, value) -> {
            String blockId = String.valueOf(key);
            YamlBlock block = readBlock(blockId, value, errors);
            if (block != null) blocks.put(blockId, block);
        });

        if (!errors.isEmpty()) {
            return new Result(null, errors);
        }
        return new Result(new YamlWorkflowDocument(version.toString(), blocks), errors);
    }

    @SuppressWarnings("unchecked")
    private YamlBlock readBlock(String blockId, Object value, List<String> errors) {
        if (!(value instanceof Map<?, ?> raw)) {
            errors.add("Invalid block definition for '" + blockId + "': must be an object");
            return null;
        }
        int errorsBefore = errors.size();
        Object type = raw.get("type");
        Object name = raw.get("name");
        Object inputs = raw.get("inputs");
        Object connections = raw.get("connections");
        Object parentId = raw.get("parentId");

        if (!(type instanceof String t) || t.isBlank()) {
            errors.add("Invalid block '" + blockId + "': missing or invalid 'type' field");
        }
        if (!(name instanceof String n) || n.isBlank()) {
            errors.add("Invalid block '" + blockId + "': missing or invalid 'name' field");
        }
        if (inputs != null && !(inputs instanceof Map)) {
            errors.add("Invalid block '" + blockId + "': 'inputs' must be an object");
        }
        if (connections != null && !(connections instanceof Map)) {
            errors.add("Invalid block '" + blockId + "': 'connections' must be an object");
        }
        if (errors.size() > errorsBefore) return null;

        return YamlBlock.builder()
                .type((String) type)
                .name((String) name)
                .inputs(inputs != null ? new LinkedHashMap<>((Map<String, Object>) inputs) : new LinkedHashMap<>())
                .connections(connections != null ? new LinkedHashMap<>((Map<String, Object>) connections) : new LinkedHashMap<>())
                .parentId(parentId != null ? parentId.toString() : null)
                .build();
    }

    public String write(YamlWorkflowDocument document) {
        try {
            return yamlMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not write workflow YAML", e);
        }
    }
}
