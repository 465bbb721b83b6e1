package com.blockflow.blockflow_backend.engine;

import com.blockflow.blockflow_backend.engine.state.ExecutionPhase;
import com.blockflow.blockflow_backend.engine.state.ExecutionStateStore;
import com.blockflow.blockflow_backend.engine.state.WorkflowExecutionState;
import com.blockflow.blockflow_backend.executor.DebugContext;
import com.blockflow.blockflow_backend.executor.DebugExecutor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Phase changes of a workflow's run together with the flags that go with them. Every terminal
 * phase passes back to {@link ExecutionPhase#IDLE} with debug-only state cleared.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExecutionStateMachine {

    private final ExecutionStateStore stateStore;

    /**
     * @throws IllegalStateException when a run or debug session is already open
     */
    public void begin(String workflowId, boolean debug) {
        stateStore.transition(workflowId, ExecutionPhase.EXECUTING);
        stateStore.setIsExecuting(workflowId, true);
        stateStore.setIsDebugging(workflowId, debug);
    }

    /** Adopts a paused debug session: its executor, context and the blocks waiting to run. */
    public void pause(String workflowId, DebugExecutor executor, DebugContext context, List<String> pendingBlocks) {
        stateStore.transition(workflowId, ExecutionPhase.AWAITING_STEP);
        stateStore.setIsDebugging(workflowId, true);
        stateStore.setExecutor(workflowId, executor);
        stateStore.setDebugContext(workflowId, context);
        stateStore.setPendingBlocks(workflowId, pendingBlocks);
    }

    public void beginStep(String workflowId) {
        stateStore.transition(workflowId, ExecutionPhase.STEPPING);
    }

    public void beginResume(String workflowId) {
        stateStore.transition(workflowId, ExecutionPhase.RESUMING);
    }

    /**
     * Ends the run in {@code terminal} and returns to idle. Tolerates a run that was already
     * finished elsewhere, e.g. by a cancel racing with completion.
     */
    public void finish(String workflowId, ExecutionPhase terminal) {
        ExecutionPhase current = stateStore.getWorkflowExecution(workflowId).getPhase();
        if (current.canTransitionTo(terminal)) {
            stateStore.transition(workflowId, terminal);
            stateStore.transition(workflowId, ExecutionPhase.IDLE);
        } else if (current.isTerminal()) {
            stateStore.transition(workflowId, ExecutionPhase.IDLE);
        } else if (current != ExecutionPhase.IDLE) {
            log.warn("Workflow {} cannot finish as {} from {}", workflowId, terminal, current);
        }
        stateStore.resetDebugState(workflowId);
    }

    /** Debug state without which step and resume cannot proceed. */
    public boolean hasValidDebugState(String workflowId) {
        WorkflowExecutionState state = stateStore.getWorkflowExecution(workflowId);
        return state.getPhase() == ExecutionPhase.AWAITING_STEP
                && state.hasExecutor()
                && state.getDebugContext() != null
                && !state.getPendingBlocks().isEmpty();
    }

    public WorkflowExecutionState current(String workflowId) {
        return stateStore.getWorkflowExecution(workflowId);
    }
}
