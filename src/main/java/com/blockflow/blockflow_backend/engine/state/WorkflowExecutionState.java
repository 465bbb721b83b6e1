package com.blockflow.blockflow_backend.engine.state;

import com.blockflow.blockflow_backend.executor.DebugContext;
import com.blockflow.blockflow_backend.executor.DebugExecutor;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable view of one workflow's execution flags. Every store mutation produces a new
 * instance with fresh collections.
 */
@Value
@Builder(toBuilder = true)
public class WorkflowExecutionState {

    @Builder.Default
    ExecutionPhase phase = ExecutionPhase.IDLE;

    @JsonProperty("isExecuting")
    boolean executing;

    @JsonProperty("isDebugging")
    boolean debugging;

    @Builder.Default
    Set<String> activeBlockIds = Set.of();

    @Builder.Default
    List<String> pendingBlocks = List.of();

    // Present only while a debug session is paused
    @JsonIgnore
    DebugExecutor executor;

    DebugContext debugContext;

    /** Block id to the status it ended with in the latest run. */
    @Builder.Default
    Map<String, RunStatus> lastRunPath = Map.of();

    @Builder.Default
    Map<String, RunStatus> lastRunEdges = Map.of();

    public static WorkflowExecutionState initial() {
        return WorkflowExecutionState.builder().build();
    }

    @JsonProperty("hasExecutor")
    public boolean hasExecutor() {
        return executor != null;
    }
}
