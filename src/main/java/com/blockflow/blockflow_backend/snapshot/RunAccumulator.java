package com.blockflow.blockflow_backend.snapshot;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Block logs, block states and executed ids collected during one in-flight run.
 * Discarded when the run ends; only a successful run turns it into a snapshot.
 */
public class RunAccumulator {

    private final List<BlockLog> blockLogs = Collections.synchronizedList(new ArrayList<>());
    private final Map<String, BlockState> blockStates = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Set<String> executedBlocks = Collections.synchronizedSet(new LinkedHashSet<>());

    public void recordLog(BlockLog log) {
        blockLogs.add(log);
    }

    public void recordState(String blockId, BlockState state) {
        blockStates.put(blockId, state);
    }

    public void markExecuted(String blockId) {
        executedBlocks.add(blockId);
    }

    public List<BlockLog> blockLogs() {
        synchronized (blockLogs) {
            return new ArrayList<>(blockLogs);
        }
    }

    public Map<String, BlockState> blockStates() {
        synchronized (blockStates) {
            return new LinkedHashMap<>(blockStates);
        }
    }

    public Set<String> executedBlocks() {
        synchronized (executedBlocks) {
            return new LinkedHashSet<>(executedBlocks);
        }
    }

    public boolean hasLogs() {
        return !blockLogs.isEmpty();
    }

    public boolean hasBlockError() {
        synchronized (blockLogs) {
            return blockLogs.stream().anyMatch(log -> log.getError() != null && !log.getError().isBlank());
        }
    }
}
