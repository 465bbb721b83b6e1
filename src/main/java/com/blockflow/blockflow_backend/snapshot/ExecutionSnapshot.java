package com.blockflow.blockflow_backend.snapshot;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What has run in a workflow and with what output. The executor uses it to substitute
 * upstream values when a run starts from the middle of the graph.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionSnapshot {

    @Builder.Default
    private Map<String, BlockState> blockStates = new LinkedHashMap<>();

    @Builder.Default
    private Set<String> executedBlocks = new LinkedHashSet<>();

    @Builder.Default
    private List<BlockLog> blockLogs = new ArrayList<>();

    @Builder.Default
    private ExecutionDecisions decisions = new ExecutionDecisions();

    @Builder.Default
    private List<String> completedLoops = new ArrayList<>();

    @Builder.Default
    private List<String> activeExecutionPath = new ArrayList<>();

    public static ExecutionSnapshot empty() {
        return ExecutionSnapshot.builder().build();
    }

    public boolean hasExecuted(String blockId) {
        return executedBlocks.contains(blockId);
    }

    public ExecutionSnapshot copy() {
        return ExecutionSnapshot.builder()
                .blockStates(new LinkedHashMap<>(blockStates))
                .executedBlocks(new LinkedHashSet<>(executedBlocks))
                .blockLogs(new ArrayList<>(blockLogs.stream().map(BlockLog::copy).toList()))
                .decisions(decisions != null ? decisions.copy() : new ExecutionDecisions())
                .completedLoops(new ArrayList<>(completedLoops))
                .activeExecutionPath(new ArrayList<>(activeExecutionPath))
                .build();
    }
}
