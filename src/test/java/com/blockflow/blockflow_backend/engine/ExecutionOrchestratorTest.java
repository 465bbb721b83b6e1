package com.blockflow.blockflow_backend.engine;

import com.blockflow.blockflow_backend.config.BlockflowProperties;
import com.blockflow.blockflow_backend.console.TerminalConsoleStore;
import com.blockflow.blockflow_backend.engine.state.ExecutionPhase;
import com.blockflow.blockflow_backend.engine.state.ExecutionStateStore;
import com.blockflow.blockflow_backend.executor.DebugContext;
import com.blockflow.blockflow_backend.executor.DebugExecutor;
import com.blockflow.blockflow_backend.executor.ExecuteFromBlockRequest;
import com.blockflow.blockflow_backend.executor.ExecuteRequest;
import com.blockflow.blockflow_backend.executor.ExecutionAbortedException;
import com.blockflow.blockflow_backend.executor.ExecutionEventListener;
import com.blockflow.blockflow_backend.executor.ExecutionMetadata;
import com.blockflow.blockflow_backend.executor.ExecutionResult;
import com.blockflow.blockflow_backend.executor.ExecutionStreamClient;
import com.blockflow.blockflow_backend.executor.NotificationSink;
import com.blockflow.blockflow_backend.executor.event.BlockCompletedEvent;
import com.blockflow.blockflow_backend.executor.event.BlockStartedEvent;
import com.blockflow.blockflow_backend.executor.event.ExecutionCancelledEvent;
import com.blockflow.blockflow_backend.executor.event.ExecutionCompletedEvent;
import com.blockflow.blockflow_backend.executor.event.ExecutionErrorEvent;
import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.domain.BlockRegistry;
import com.blockflow.blockflow_backend.model.domain.BlockType;
import com.blockflow.blockflow_backend.model.domain.Edge;
import com.blockflow.blockflow_backend.model.graph.WorkflowGraph;
import com.blockflow.blockflow_backend.service.LogPersistenceClient;
import com.blockflow.blockflow_backend.service.WorkflowStateService;
import com.blockflow.blockflow_backend.session.WorkflowSession;
import com.blockflow.blockflow_backend.session.WorkflowSessionRegistry;
import com.blockflow.blockflow_backend.snapshot.ExecutionSnapshot;
import com.blockflow.blockflow_backend.trigger.ExecutionMode;
import com.blockflow.blockflow_backend.trigger.InputValueCoercer;
import com.blockflow.blockflow_backend.trigger.StartBlockClassifier;
import com.blockflow.blockflow_backend.trigger.TriggerPayloadBuilder;
import com.blockflow.blockflow_backend.trigger.TriggerResolver;
import com.blockflow.blockflow_backend.trigger.WorkflowValidationException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExecutionOrchestratorTest {

    private static final String WF = "wf";

    @Mock
    private WorkflowStateService workflowStateService;
    @Mock
    private ExecutionStreamClient streamClient;
    @Mock
    private DebugExecutor debugExecutor;
    @Mock
    private ExecutionEventPublisher publisher;
    @Mock
    private NotificationSink notifications;
    @Mock
    private LogPersistenceClient logPersistence;

    private ExecutionStateStore stateStore;
    private BlockflowProperties properties;
    private WorkflowSession session;
    private ExecutionOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        BlockRegistry registry = new BlockRegistry();
        StartBlockClassifier classifier = new StartBlockClassifier(registry);
        TriggerPayloadBuilder payloadBuilder =
                new TriggerPayloadBuilder(registry, new InputValueCoercer(objectMapper), objectMapper);
        TerminalConsoleStore console = new TerminalConsoleStore();
        stateStore = new ExecutionStateStore();
        properties = new BlockflowProperties();

        WorkflowSessionRegistry sessions = new WorkflowSessionRegistry(workflowStateService);
        session = sessions.open(WF, chain());

        orchestrator = new ExecutionOrchestrator(
                sessions,
                new TriggerResolver(classifier, payloadBuilder),
                classifier,
                payloadBuilder,
                new RunFromBlockGate(registry),
                stateStore,
                new ExecutionStateMachine(stateStore),
                streamClient,
                debugExecutor,
                new BlockEventHandlerFactory(stateStore, console, publisher),
                new ExecutionErrorConsole(console),
                console,
                publisher,
                notifications,
                logPersistence,
                properties);
    }

    // a (start) -> b -> c -> d
    private static WorkflowGraph chain() {
        WorkflowGraph graph = WorkflowGraph.empty();
        graph.addBlock(Block.builder().id("a").type(BlockType.START_TRIGGER).name("Start").build());
        graph.addBlock(Block.builder().id("b").type(BlockType.AGENT).name("Agent 1").build());
        graph.addBlock(Block.builder().id("c").type(BlockType.FUNCTION).name("Function 1").build());
        graph.addBlock(Block.builder().id("d").type(BlockType.AGENT).name("Agent 2").build());
        graph.addEdge(Edge.builder().id("e1").source("a").target("b").build());
        graph.addEdge(Edge.builder().id("e2").source("b").target("c").build());
        graph.addEdge(Edge.builder().id("e3").source("c").target("d").build());
        return graph;
    }

    private static void emitBlock(ExecutionEventListener listener, String blockId, Object output) {
        listener.onBlockStarted(BlockStartedEvent.builder().blockId(blockId).blockName(blockId).blockType("agent").build());
        listener.onBlockCompleted(BlockCompletedEvent.builder()
                .blockId(blockId).blockName(blockId).blockType("agent")
                .output(output).durationMs(5)
                .build());
    }

    private static void emitSuccess(ExecutionEventListener listener) {
        listener.onExecutionCompleted(ExecutionCompletedEvent.builder().success(true).output(Map.of()).duration(20).build());
    }

    /** The executor runs {@code blockIds} in order, each emitting "{id}-{tag}", and completes. */
    private void executorRuns(String tag, String... blockIds) {
        doAnswer(invocation -> {
            ExecutionEventListener listener = invocation.getArgument(1);
            for (String id : blockIds) {
                emitBlock(listener, id, id + "-" + tag);
            }
            emitSuccess(listener);
            return null;
        }).when(streamClient).execute(any(), any());
    }

    private void executorRunsFromBlock(String tag, String... blockIds) {
        doAnswer(invocation -> {
            ExecutionEventListener listener = invocation.getArgument(1);
            for (String id : blockIds) {
                emitBlock(listener, id, id + "-" + tag);
            }
            emitSuccess(listener);
            return null;
        }).when(streamClient).executeFromBlock(any(), any());
    }

    private ExecutionSnapshot snapshot() {
        return stateStore.getLastExecutionSnapshot(WF).orElseThrow();
    }

    private ExecutionPhase phase() {
        return stateStore.getWorkflowExecution(WF).getPhase();
    }

    @Nested
    class FullRun {

        @Test
        @DisplayName("a successful run replaces the snapshot and persists its logs")
        void writesSnapshot() {
            executorRuns("v1", "a", "b", "c", "d");

            ExecutionResult result = orchestrator.run(WF, null, ExecutionMode.MANUAL, false);

            assertThat(result.isSuccess()).isTrue();
            assertThat(snapshot().getExecutedBlocks()).containsExactlyInAnyOrder("a", "b", "c", "d");
            assertThat(snapshot().getBlockStates().get("d").output()).isEqualTo("d-v1");
            assertThat(phase()).isEqualTo(ExecutionPhase.IDLE);
            verify(logPersistence).persistLogs(eq(WF), any(), eq(result));
            verify(publisher).executionFinished(eq(WF), any(), eq("completed"), eq(null));
        }

        @Test
        @DisplayName("the request starts at the resolved trigger and carries the caller input")
        void requestShape() {
            executorRuns("v1", "a");
            ArgumentCaptor<ExecuteRequest> request = ArgumentCaptor.forClass(ExecuteRequest.class);

            orchestrator.run(WF, Map.of("input", "hello"), ExecutionMode.MANUAL, false);

            verify(streamClient).execute(request.capture(), any());
            assertThat(request.getValue().startBlockId()).isEqualTo("a");
            assertThat(request.getValue().input()).isEqualTo(Map.of("input", "hello"));
            assertThat(request.getValue().triggerType()).isEqualTo("manual");
            assertThat(request.getValue().useDraftState()).isTrue();
            assertThat(request.getValue().workflowStateOverride().getBlocks()).containsKeys("a", "b", "c", "d");
        }

        @Test
        @DisplayName("a validation failure never reaches the executor")
        void validationFailure() {
            WorkflowSessionRegistry sessions = new WorkflowSessionRegistry(workflowStateService);
            WorkflowGraph noTrigger = WorkflowGraph.empty();
            noTrigger.addBlock(Block.builder().id("b").type(BlockType.AGENT).name("Agent 1").build());
            sessions.open("lonely", noTrigger);
            ExecutionOrchestrator isolated = withSessions(sessions);

            ExecutionResult result = isolated.run("lonely", null, ExecutionMode.CHAT, false);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError()).isEqualTo("Chat execution requires a Chat Trigger block");
            assertThat(stateStore.getLastExecutionSnapshot("lonely")).isEmpty();
            assertThat(stateStore.getWorkflowExecution("lonely").getPhase()).isEqualTo(ExecutionPhase.IDLE);
            verifyNoInteractions(streamClient, logPersistence);
            verify(notifications).notify(eq("lonely"), eq("error"), any());
        }

        @Test
        @DisplayName("an executor error keeps the previous snapshot")
        void runtimeErrorKeepsSnapshot() {
            executorRuns("v1", "a", "b", "c", "d");
            orchestrator.run(WF, null, ExecutionMode.MANUAL, false);
            doAnswer(invocation -> {
                ExecutionEventListener listener = invocation.getArgument(1);
                emitBlock(listener, "a", "a-v2");
                listener.onExecutionError(new ExecutionErrorEvent("Agent 1 failed: rate limited", 15));
                return null;
            }).when(streamClient).execute(any(), any());

            ExecutionResult result = orchestrator.run(WF, null, ExecutionMode.MANUAL, false);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError()).isEqualTo("Agent 1 failed: rate limited");
            assertThat(snapshot().getBlockStates().get("a").output()).isEqualTo("a-v1");
            assertThat(phase()).isEqualTo(ExecutionPhase.IDLE);
            verify(notifications).notify(WF, "error", "Workflow execution failed: Agent 1 failed: rate limited");
        }

        @Test
        void secondRunWhileExecutingIsRejected() {
            doAnswer(invocation -> {
                assertThatThrownBy(() -> orchestrator.run(WF, null, ExecutionMode.MANUAL, false))
                        .isInstanceOf(IllegalStateException.class);
                emitSuccess(invocation.getArgument(1));
                return null;
            }).when(streamClient).execute(any(), any());

            assertThat(orchestrator.run(WF, null, ExecutionMode.MANUAL, false).isSuccess()).isTrue();
        }

        private ExecutionOrchestrator withSessions(WorkflowSessionRegistry sessions) {
            ObjectMapper objectMapper = new ObjectMapper();
            BlockRegistry registry = new BlockRegistry();
            StartBlockClassifier classifier = new StartBlockClassifier(registry);
            TriggerPayloadBuilder payloadBuilder =
                    new TriggerPayloadBuilder(registry, new InputValueCoercer(objectMapper), objectMapper);
            TerminalConsoleStore console = new TerminalConsoleStore();
            return new ExecutionOrchestrator(sessions, new TriggerResolver(classifier, payloadBuilder), classifier,
                    payloadBuilder, new RunFromBlockGate(registry), stateStore, new ExecutionStateMachine(stateStore),
                    streamClient, debugExecutor, new BlockEventHandlerFactory(stateStore, console, publisher),
                    new ExecutionErrorConsole(console), console, publisher, notifications, logPersistence, properties);
        }
    }

    @Nested
    class PartialRuns {

        @Test
        @DisplayName("full run, run-from c, then run-until b keep a merged snapshot")
        void chainedPartialRuns() {
            executorRuns("v1", "a", "b", "c", "d");
            orchestrator.run(WF, null, ExecutionMode.MANUAL, false);

            executorRunsFromBlock("v2", "c", "d");
            ArgumentCaptor<ExecuteFromBlockRequest> fromRequest = ArgumentCaptor.forClass(ExecuteFromBlockRequest.class);
            assertThat(orchestrator.runFromBlock(WF, "c", null).isSuccess()).isTrue();

            verify(streamClient).executeFromBlock(fromRequest.capture(), any());
            assertThat(fromRequest.getValue().startBlockId()).isEqualTo("c");
            assertThat(fromRequest.getValue().sourceSnapshot().getExecutedBlocks()).contains("a", "b");
            assertThat(snapshot().getBlockStates().get("b").output()).isEqualTo("b-v1");
            assertThat(snapshot().getBlockStates().get("c").output()).isEqualTo("c-v2");
            assertThat(snapshot().getBlockStates().get("d").output()).isEqualTo("d-v2");

            executorRuns("v3", "a", "b");
            ArgumentCaptor<ExecuteRequest> untilRequest = ArgumentCaptor.forClass(ExecuteRequest.class);
            assertThat(orchestrator.runUntilBlock(WF, "b", null).isSuccess()).isTrue();

            verify(streamClient, times(2)).execute(untilRequest.capture(), any());
            assertThat(untilRequest.getValue().stopAfterBlockId()).isEqualTo("b");
            assertThat(snapshot().getExecutedBlocks()).containsExactlyInAnyOrder("a", "b", "c", "d");
            assertThat(snapshot().getBlockStates().get("b").output()).isEqualTo("b-v3");
            assertThat(snapshot().getBlockStates().get("c").output()).isEqualTo("c-v2");
        }

        @Test
        @DisplayName("run-from without a snapshot is refused before anything starts")
        void refusedWithoutSnapshot() {
            assertThatThrownBy(() -> orchestrator.runFromBlock(WF, "c", null))
                    .isInstanceOf(WorkflowValidationException.class);

            verifyNoInteractions(streamClient);
            assertThat(phase()).isEqualTo(ExecutionPhase.IDLE);
        }

        @Test
        @DisplayName("deleting an upstream block refuses run-from even though the snapshot still lists it")
        void deletedUpstreamIsRefused() {
            executorRuns("v1", "a", "b", "c", "d");
            orchestrator.run(WF, null, ExecutionMode.MANUAL, false);
            session.edit(graph -> graph.removeBlock("b"));

            assertThat(snapshot().getExecutedBlocks()).contains("b");
            assertThatThrownBy(() -> orchestrator.runFromBlock(WF, "c", null))
                    .isInstanceOf(WorkflowValidationException.class);
            verify(streamClient, never()).executeFromBlock(any(), any());
        }

        @Test
        @DisplayName("run-until on an unknown block is rejected")
        void runUntilUnknownBlock() {
            assertThatThrownBy(() -> orchestrator.runUntilBlock(WF, "ghost", null))
                    .isInstanceOf(RuntimeException.class);
            verifyNoInteractions(streamClient);
        }

        @Test
        @DisplayName("a stale-snapshot error clears the snapshot and asks for a fresh run")
        void staleSnapshotIsInvalidated() {
            executorRuns("v1", "a", "b", "c", "d");
            orchestrator.run(WF, null, ExecutionMode.MANUAL, false);
            doAnswer(invocation -> {
                ExecutionEventListener listener = invocation.getArgument(1);
                listener.onExecutionError(new ExecutionErrorEvent("Upstream dependency not executed: Agent 1", 3));
                return null;
            }).when(streamClient).executeFromBlock(any(), any());

            ExecutionResult result = orchestrator.runFromBlock(WF, "c", null);

            assertThat(result.isSuccess()).isFalse();
            assertThat(stateStore.getLastExecutionSnapshot(WF)).isEmpty();
            verify(notifications).notify(WF, "error", ExecutionOrchestrator.WORKFLOW_MODIFIED_MESSAGE);
        }

        @Test
        @DisplayName("other run-from errors leave the snapshot in place")
        void ordinaryErrorKeepsSnapshot() {
            executorRuns("v1", "a", "b", "c", "d");
            orchestrator.run(WF, null, ExecutionMode.MANUAL, false);
            doAnswer(invocation -> {
                ExecutionEventListener listener = invocation.getArgument(1);
                listener.onExecutionError(new ExecutionErrorEvent("Function 1 threw", 3));
                return null;
            }).when(streamClient).executeFromBlock(any(), any());

            orchestrator.runFromBlock(WF, "c", null);

            assertThat(stateStore.getLastExecutionSnapshot(WF)).isPresent();
        }
    }

    @Nested
    class Cancellation {

        @Test
        @DisplayName("a user cancel mid-run aborts quietly without a snapshot")
        void userAbort() {
            doAnswer(invocation -> {
                emitBlock(invocation.getArgument(1), "a", "a-v1");
                orchestrator.cancel(WF);
                throw new ExecutionAbortedException(WF);
            }).when(streamClient).execute(any(), any());

            ExecutionResult result = orchestrator.run(WF, null, ExecutionMode.MANUAL, false);

            assertThat(result.isAborted()).isTrue();
            assertThat(stateStore.getLastExecutionSnapshot(WF)).isEmpty();
            assertThat(phase()).isEqualTo(ExecutionPhase.IDLE);
            verify(streamClient).cancel(WF);
            verifyNoInteractions(logPersistence, notifications);
        }

        @Test
        @DisplayName("an executor-side cancel is reported as cancelled")
        void executorCancelled() {
            doAnswer(invocation -> {
                ExecutionEventListener listener = invocation.getArgument(1);
                emitBlock(listener, "a", "a-v1");
                listener.onExecutionCancelled(new ExecutionCancelledEvent(42L));
                return null;
            }).when(streamClient).execute(any(), any());

            ExecutionResult result = orchestrator.run(WF, null, ExecutionMode.MANUAL, false);

            assertThat(result.isCancelled()).isTrue();
            assertThat(result.getMetadata().getDuration()).isEqualTo(42L);
            assertThat(stateStore.getLastExecutionSnapshot(WF)).isEmpty();
            verify(publisher).executionFinished(eq(WF), any(), eq("cancelled"), eq(null));
        }

        @Test
        void cancelWhileIdleOnlyResetsFlags() {
            orchestrator.cancel(WF);

            assertThat(phase()).isEqualTo(ExecutionPhase.IDLE);
            verify(publisher, never()).executionFinished(any(), any(), any(), any());
        }
    }

    @Nested
    class Debugging {

        private ExecutionResult paused(String... pending) {
            return ExecutionResult.builder()
                    .success(true)
                    .metadata(ExecutionMetadata.builder()
                            .debugSession(true)
                            .context(DebugContext.builder().workflowId(WF).executionId("exec-debug").build())
                            .pendingBlocks(List.of(pending))
                            .build())
                    .build();
        }

        private void startPaused() {
            doAnswer(invocation -> {
                ExecutionEventListener listener = invocation.getArgument(1);
                emitBlock(listener, "a", "a-v1");
                listener.onExecutionCompleted(ExecutionCompletedEvent.builder()
                        .success(true)
                        .metadata(ExecutionMetadata.builder()
                                .debugSession(true)
                                .context(DebugContext.builder().workflowId(WF).executionId("exec-debug").build())
                                .pendingBlocks(List.of("b"))
                                .build())
                        .build());
                return null;
            }).when(streamClient).execute(any(), any());
            ExecutionResult result = orchestrator.run(WF, null, ExecutionMode.MANUAL, true);
            assertThat(result.isPausedDebugSession()).isTrue();
        }

        @Test
        @DisplayName("a paused run waits for a step with its pending blocks")
        void pauses() {
            startPaused();

            assertThat(phase()).isEqualTo(ExecutionPhase.AWAITING_STEP);
            assertThat(stateStore.getWorkflowExecution(WF).getPendingBlocks()).containsExactly("b");
            assertThat(stateStore.getLastExecutionSnapshot(WF)).isEmpty();
            verifyNoInteractions(logPersistence);
        }

        @Test
        void stepAdvancesPendingBlocks() {
            startPaused();
            when(debugExecutor.continueExecution(eq(List.of("b")), any())).thenReturn(paused("c"));

            orchestrator.step(WF);

            assertThat(phase()).isEqualTo(ExecutionPhase.AWAITING_STEP);
            assertThat(stateStore.getWorkflowExecution(WF).getPendingBlocks()).containsExactly("c");
        }

        @Test
        @DisplayName("resume runs until nothing is pending")
        void resumeConverges() {
            startPaused();
            ExecutionResult done = ExecutionResult.builder().success(true).build();
            when(debugExecutor.continueExecution(anyList(), any())).thenReturn(paused("c"), paused("d"), done);

            ExecutionResult result = orchestrator.resume(WF);

            assertThat(result).isSameAs(done);
            assertThat(phase()).isEqualTo(ExecutionPhase.IDLE);
            verify(debugExecutor, times(3)).continueExecution(anyList(), any());
            verify(logPersistence).persistLogs(WF, "exec-debug", done);
        }

        @Test
        @DisplayName("resume stops at the iteration ceiling and returns the last result")
        void resumeCeiling() {
            properties.getExecution().setResumeMaxIterations(3);
            startPaused();
            when(debugExecutor.continueExecution(anyList(), any())).thenReturn(paused("b"));

            ExecutionResult result = orchestrator.resume(WF);

            assertThat(result.isPausedDebugSession()).isTrue();
            assertThat(phase()).isEqualTo(ExecutionPhase.IDLE);
            verify(debugExecutor, times(3)).continueExecution(anyList(), any());
        }

        @Test
        @DisplayName("step without a paused session is rejected")
        void stepWithoutSession() {
            assertThatThrownBy(() -> orchestrator.step(WF))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("No paused debug session");
            verifyNoInteractions(debugExecutor);
        }

        @Test
        void failingStepEndsTheSession() {
            startPaused();
            doThrow(new IllegalArgumentException("executor unreachable"))
                    .when(debugExecutor).continueExecution(anyList(), any());

            ExecutionResult result = orchestrator.step(WF);

            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getError()).isEqualTo("executor unreachable");
            assertThat(phase()).isEqualTo(ExecutionPhase.IDLE);
            assertThat(stateStore.getWorkflowExecution(WF).hasExecutor()).isFalse();
        }
    }
}
