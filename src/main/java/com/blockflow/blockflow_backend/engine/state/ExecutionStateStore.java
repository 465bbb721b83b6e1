package com.blockflow.blockflow_backend.engine.state;

import com.blockflow.blockflow_backend.executor.DebugContext;
import com.blockflow.blockflow_backend.executor.DebugExecutor;
import com.blockflow.blockflow_backend.snapshot.ExecutionSnapshot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

/**
 * Per-workflow execution flags, run path and last execution snapshot. Workflows never share
 * state; an unknown workflow reads as {@link WorkflowExecutionState#initial()}.
 */
@Slf4j
@Component
public class ExecutionStateStore {

    private final Map<String, WorkflowExecutionState> workflowExecutions = new ConcurrentHashMap<>();
    private final Map<String, ExecutionSnapshot> lastExecutionSnapshots = new ConcurrentHashMap<>();

    public WorkflowExecutionState getWorkflowExecution(String workflowId) {
        WorkflowExecutionState state = workflowExecutions.get(workflowId);
        return state != null ? state : WorkflowExecutionState.initial();
    }

    /** Starting a run clears the previous run path; stopping keeps it for display. */
    public void setIsExecuting(String workflowId, boolean executing) {
        update(workflowId, state -> {
            WorkflowExecutionState.WorkflowExecutionStateBuilder next = state.toBuilder().executing(executing);
            if (executing) {
                next.lastRunPath(Map.of()).lastRunEdges(Map.of());
            }
            return next.build();
        });
    }

    public void setIsDebugging(String workflowId, boolean debugging) {
        update(workflowId, state -> state.toBuilder().debugging(debugging).build());
    }

    public void setActiveBlocks(String workflowId, Collection<String> blockIds) {
        Set<String> copy = Collections.unmodifiableSet(new LinkedHashSet<>(blockIds));
        update(workflowId, state -> state.toBuilder().activeBlockIds(copy).build());
    }

    public void setPendingBlocks(String workflowId, List<String> blockIds) {
        List<String> copy = blockIds != null ? List.copyOf(blockIds) : List.of();
        update(workflowId, state -> state.toBuilder().pendingBlocks(copy).build());
    }

    public void setExecutor(String workflowId, DebugExecutor executor) {
        update(workflowId, state -> state.toBuilder().executor(executor).build());
    }

    public void setDebugContext(String workflowId, DebugContext context) {
        update(workflowId, state -> state.toBuilder().debugContext(context).build());
    }

    public void setBlockRunStatus(String workflowId, String blockId, RunStatus status) {
        update(workflowId, state -> state.toBuilder().lastRunPath(with(state.getLastRunPath(), blockId, status)).build());
    }

    public void setEdgeRunStatus(String workflowId, String edgeId, RunStatus status) {
        update(workflowId, state -> state.toBuilder().lastRunEdges(with(state.getLastRunEdges(), edgeId, status)).build());
    }

    public void clearRunPath(String workflowId) {
        update(workflowId, state -> state.toBuilder().lastRunPath(Map.of()).lastRunEdges(Map.of()).build());
    }

    /**
     * Moves the workflow to {@code next}.
     *
     * @throws IllegalStateException when the transition table does not allow it
     */
    public void transition(String workflowId, ExecutionPhase next) {
        update(workflowId, state -> {
            state.getPhase().requireTransitionTo(next);
            log.debug("Workflow {} phase {} -> {}", workflowId, state.getPhase(), next);
            return state.toBuilder().phase(next).build();
        });
    }

    /** Clears every debug-only field along with the execution flags and active blocks. */
    public void resetDebugState(String workflowId) {
        update(workflowId, state -> state.toBuilder()
                .executing(false)
                .debugging(false)
                .debugContext(null)
                .executor(null)
                .pendingBlocks(List.of())
                .activeBlockIds(Set.of())
                .build());
    }

    public Optional<ExecutionSnapshot> getLastExecutionSnapshot(String workflowId) {
        return Optional.ofNullable(lastExecutionSnapshots.get(workflowId));
    }

    public void setLastExecutionSnapshot(String workflowId, ExecutionSnapshot snapshot) {
        lastExecutionSnapshots.put(workflowId, snapshot);
    }

    public void clearLastExecutionSnapshot(String workflowId) {
        lastExecutionSnapshots.remove(workflowId);
    }

    public int trackedWorkflowCount() {
        return workflowExecutions.size();
    }

    public int snapshotCount() {
        return lastExecutionSnapshots.size();
    }

    public void reset() {
        workflowExecutions.clear();
        lastExecutionSnapshots.clear();
    }

    private void update(String workflowId, UnaryOperator<WorkflowExecutionState> change) {
        workflowExecutions.compute(workflowId,
                (id, current) -> change.apply(current != null ? current : WorkflowExecutionState.initial()));
    }

    private static Map<String, RunStatus> with(Map<String, RunStatus> current, String key, RunStatus status) {
        Map<String, RunStatus> next = new LinkedHashMap<>(current);
        next.put(key, status);
        return Collections.unmodifiableMap(next);
    }
}
