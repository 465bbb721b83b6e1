package com.blockflow.blockflow_backend.document;

import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.domain.BlockType;
import com.blockflow.blockflow_backend.model.domain.SubBlock;
import com.blockflow.blockflow_backend.model.graph.Values;
import com.blockflow.blockflow_backend.model.graph.WorkflowGraph;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Writes a graph as workflow YAML: block ids as keys, non-null parameter values as
 * {@code inputs}, grouped {@code connections} and container settings from block data.
 */
@Component
@RequiredArgsConstructor
public class WorkflowYamlExporter {

    // Layout keys the importer regenerates
    private static final Set<String> CONTAINER_LAYOUT_KEYS = Set.of("width", "height", "type", "parentId", "extent");

    private final WorkflowYamlParser parser;
    private final ConditionInputs conditionInputs;

    public YamlWorkflowDocument toDocument(WorkflowGraph graph) {
        Map<String, YamlBlock> blocks = new LinkedHashMap<>();
        for (Block block : graph.getBlocks().values()) {
            blocks.put(block.getId(), YamlBlock.builder()
                    .type(block.getType() != null ? block.getType().getKey() : null)
                    .name(block.getName())
                    .inputs(inputsOf(block))
                    .connections(BlockConnections.generate(block.getId(), graph.getEdges()))
                    .parentId(block.hasParent() ? block.getParentId() : null)
                    .build());
        }
        return new YamlWorkflowDocument(YamlWorkflowDocument.CURRENT_VERSION, blocks);
    }

    public String export(WorkflowGraph graph) {
        return parser.write(toDocument(graph));
    }

    private Map<String, Object> inputsOf(Block block) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        if (block.isContainer()) {
            if (block.getData() != null) {
                block.getData().forEach((key, value) -> {
                    if (!CONTAINER_LAYOUT_KEYS.contains(key) && value != null) {
                        inputs.put(key, Values.deepCopy(value));
                    }
                });
            }
            return inputs;
        }
        if (block.getSubBlocks() != null) {
            for (SubBlock subBlock : block.getSubBlocks().values()) {
                if (subBlock != null && subBlock.getValue() != null) {
                    inputs.put(subBlock.getId(), Values.deepCopy(subBlock.getValue()));
                }
            }
        }
        if (block.getType() == BlockType.CONDITION) {
            return conditionInputs.clean(block.getId(), inputs);
        }
        return inputs;
    }
}
