package com.blockflow.blockflow_backend.engine.state;

import com.blockflow.blockflow_backend.executor.DebugContext;
import com.blockflow.blockflow_backend.executor.ExecutionResult;
import com.blockflow.blockflow_backend.snapshot.ExecutionSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionStateStoreTest {

    private ExecutionStateStore store;

    @BeforeEach
    void setUp() {
        store = new ExecutionStateStore();
    }

    @Test
    void unknownWorkflowReadsAsInitialWithoutBeingTracked() {
        WorkflowExecutionState state = store.getWorkflowExecution("wf-1");

        assertThat(state.getPhase()).isEqualTo(ExecutionPhase.IDLE);
        assertThat(state.isExecuting()).isFalse();
        assertThat(state.getActiveBlockIds()).isEmpty();
        assertThat(store.trackedWorkflowCount()).isZero();
    }

    @Test
    @DisplayName("workflows never see each other's flags")
    void isolation() {
        store.setIsExecuting("wf-1", true);
        store.setActiveBlocks("wf-1", List.of("a"));

        assertThat(store.getWorkflowExecution("wf-2").isExecuting()).isFalse();
        assertThat(store.getWorkflowExecution("wf-2").getActiveBlockIds()).isEmpty();
        assertThat(store.getWorkflowExecution("wf-1").getActiveBlockIds()).containsExactly("a");
    }

    @Test
    void activeBlocksAreCopied() {
        List<String> ids = new ArrayList<>(List.of("a"));
        store.setActiveBlocks("wf", ids);
        ids.add("b");

        assertThat(store.getWorkflowExecution("wf").getActiveBlockIds()).isEqualTo(Set.of("a"));
    }

    @Nested
    class RunPath {

        @Test
        void startingARunClearsThePreviousPath() {
            store.setBlockRunStatus("wf", "a", RunStatus.SUCCESS);
            store.setEdgeRunStatus("wf", "e1", RunStatus.SUCCESS);

            store.setIsExecuting("wf", true);

            assertThat(store.getWorkflowExecution("wf").getLastRunPath()).isEmpty();
            assertThat(store.getWorkflowExecution("wf").getLastRunEdges()).isEmpty();
        }

        @Test
        void stoppingKeepsThePathForDisplay() {
            store.setIsExecuting("wf", true);
            store.setBlockRunStatus("wf", "a", RunStatus.ERROR);

            store.setIsExecuting("wf", false);

            assertThat(store.getWorkflowExecution("wf").getLastRunPath()).containsEntry("a", RunStatus.ERROR);
        }
    }

    @Nested
    class DebugState {

        @Test
        void resetClearsDebugOnlyFieldsAndFlags() {
            store.setIsExecuting("wf", true);
            store.setIsDebugging("wf", true);
            store.setExecutor("wf", (pending, context) -> ExecutionResult.builder().success(true).build());
            store.setDebugContext("wf", DebugContext.builder().workflowId("wf").build());
            store.setPendingBlocks("wf", List.of("b"));
            store.setActiveBlocks("wf", List.of("a"));

            store.resetDebugState("wf");

            WorkflowExecutionState state = store.getWorkflowExecution("wf");
            assertThat(state.isExecuting()).isFalse();
            assertThat(state.isDebugging()).isFalse();
            assertThat(state.hasExecutor()).isFalse();
            assertThat(state.getDebugContext()).isNull();
            assertThat(state.getPendingBlocks()).isEmpty();
            assertThat(state.getActiveBlockIds()).isEmpty();
        }

        @Test
        void transitionsFollowTheTable() {
            store.transition("wf", ExecutionPhase.EXECUTING);

            assertThatThrownBy(() -> store.transition("wf", ExecutionPhase.STEPPING))
                    .isInstanceOf(IllegalStateException.class);
            assertThat(store.getWorkflowExecution("wf").getPhase()).isEqualTo(ExecutionPhase.EXECUTING);
        }
    }

    @Test
    void snapshotsArePerWorkflow() {
        ExecutionSnapshot snapshot = ExecutionSnapshot.empty();
        store.setLastExecutionSnapshot("wf-1", snapshot);

        assertThat(store.getLastExecutionSnapshot("wf-1")).containsSame(snapshot);
        assertThat(store.getLastExecutionSnapshot("wf-2")).isEmpty();

        store.clearLastExecutionSnapshot("wf-1");
        assertThat(store.snapshotCount()).isZero();
    }

    @Test
    void resetForgetsEverything() {
        store.setIsExecuting("wf", true);
        store.setLastExecutionSnapshot("wf", ExecutionSnapshot.empty());

        store.reset();

        assertThat(store.trackedWorkflowCount()).isZero();
        assertThat(store.snapshotCount()).isZero();
    }
}
