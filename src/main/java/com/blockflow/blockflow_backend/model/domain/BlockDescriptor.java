package com.blockflow.blockflow_backend.model.domain;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static description of a block type: parameter schema, output schema and trigger capabilities.
 *
 * @param samplePayload example payload used when a trigger has to be run without a real event
 * @param triggerCapable true when the block can be switched into trigger mode
 */
public record BlockDescriptor(
        BlockType type,
        String displayName,
        List<SubBlockConfig> subBlocks,
        Map<String, Object> outputs,
        Map<String, Object> samplePayload,
        boolean triggerCapable
) {
    public BlockDescriptor {
        subBlocks = subBlocks != null ? List.copyOf(subBlocks) : List.of();
        outputs = outputs != null ? Map.copyOf(outputs) : Map.of();
        samplePayload = samplePayload != null ? Map.copyOf(samplePayload) : Map.of();
    }

    public Optional<SubBlockConfig> subBlock(String id) {
        return subBlocks.stream().filter(sb -> sb.id().equals(id)).findFirst();
    }

    public boolean hasSubBlock(String id) {
        return subBlock(id).isPresent();
    }
}
