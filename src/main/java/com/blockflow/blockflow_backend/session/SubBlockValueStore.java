package com.blockflow.blockflow_backend.session;

import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.graph.Values;
import com.blockflow.blockflow_backend.model.graph.WorkflowGraph;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Parameter values of one workflow, keyed by block id then subblock id. Edits land here first
 * and are overlaid onto the graph's subblocks when a run starts.
 */
public class SubBlockValueStore {

    private final Map<String, Map<String, Object>> values = new ConcurrentHashMap<>();

    public Object get(String blockId, String subBlockId) {
        Map<String, Object> blockValues = values.get(blockId);
        return blockValues != null ? blockValues.get(subBlockId) : null;
    }

    public void set(String blockId, String subBlockId, Object value) {
        values.computeIfAbsent(blockId, id -> new ConcurrentHashMap<>()).put(subBlockId, value);
    }

    public void setAll(Map<String, Map<String, Object>> blockValues) {
        blockValues.forEach((blockId, subValues) -> subValues.forEach((subBlockId, value) -> {
            if (value != null) set(blockId, subBlockId, value);
        }));
    }

    public Map<String, Object> blockValues(String blockId) {
        Map<String, Object> blockValues = values.get(blockId);
        return blockValues != null ? new LinkedHashMap<>(blockValues) : new LinkedHashMap<>();
    }

    public void removeBlock(String blockId) {
        values.remove(blockId);
    }

    public void clear() {
        values.clear();
    }

    /** Copy of {@code graph} with every stored value written into its block's subblocks. */
    public WorkflowGraph mergeSubBlockValues(WorkflowGraph graph) {
        WorkflowGraph merged = graph.copy();
        values.forEach((blockId, subValues) -> {
            Block block = merged.getBlocks().get(blockId);
            if (block == null) return;
            subValues.forEach((subBlockId, value) -> block.setSubBlockValue(subBlockId, Values.deepCopy(value)));
        });
        return merged;
    }
}
