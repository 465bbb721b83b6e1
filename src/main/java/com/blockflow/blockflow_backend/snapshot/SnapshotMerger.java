package com.blockflow.blockflow_backend.snapshot;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a finished run into a snapshot. A full run replaces whatever was stored; partial runs
 * (run-until-block, run-from-block) are layered on top of a base snapshot.
 */
public final class SnapshotMerger {

    private SnapshotMerger() {}

    /** Snapshot of a complete run; decisions and completed loops start empty. */
    public static ExecutionSnapshot fromRun(RunAccumulator run) {
        Set<String> executed = run.executedBlocks();
        return ExecutionSnapshot.builder()
                .blockStates(run.blockStates())
                .executedBlocks(executed)
                .blockLogs(run.blockLogs())
                .activeExecutionPath(new ArrayList<>(executed))
                .build();
    }

    /**
     * Layers {@code run} on top of {@code base}: block states overlaid, executed ids unioned,
     * logs appended. Decisions and completed loops of the base are kept. A null base acts as empty.
     */
    public static ExecutionSnapshot merge(ExecutionSnapshot base, RunAccumulator run) {
        ExecutionSnapshot effective = base != null ? base.copy() : ExecutionSnapshot.empty();

        Map<String, BlockState> states = new LinkedHashMap<>(effective.getBlockStates());
        states.putAll(run.blockStates());

        Set<String> executed = new LinkedHashSet<>(effective.getExecutedBlocks());
        executed.addAll(run.executedBlocks());

        List<BlockLog> logs = new ArrayList<>(effective.getBlockLogs());
        logs.addAll(run.blockLogs());

        return effective.toBuilder()
                .blockStates(states)
                .executedBlocks(executed)
                .blockLogs(logs)
                .activeExecutionPath(new ArrayList<>(executed))
                .build();
    }
}
