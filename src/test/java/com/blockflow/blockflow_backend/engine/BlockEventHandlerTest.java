package com.blockflow.blockflow_backend.engine;

import com.blockflow.blockflow_backend.console.ConsoleEntry;
import com.blockflow.blockflow_backend.console.TerminalConsoleStore;
import com.blockflow.blockflow_backend.engine.state.ExecutionStateStore;
import com.blockflow.blockflow_backend.engine.state.RunStatus;
import com.blockflow.blockflow_backend.model.domain.Edge;
import com.blockflow.blockflow_backend.snapshot.BlockLog;
import com.blockflow.blockflow_backend.snapshot.RunAccumulator;
import com.blockflow.blockflow_backend.executor.event.BlockCompletedEvent;
import com.blockflow.blockflow_backend.executor.event.BlockErrorEvent;
import com.blockflow.blockflow_backend.executor.event.BlockStartedEvent;
import com.blockflow.blockflow_backend.executor.event.ExecutionCancelledEvent;
import com.blockflow.blockflow_backend.executor.event.StreamChunkEvent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class BlockEventHandlerTest {

    private static final String WF = "wf";
    private static final String EXEC = "exec-1";

    @Mock
    private ExecutionEventPublisher publisher;

    private ExecutionStateStore stateStore;
    private TerminalConsoleStore console;
    private RunAccumulator accumulator;

    private final List<Edge> edges = List.of(
            Edge.builder().id("e1").source("start").target("agent").build(),
            Edge.builder().id("e2").source("agent").target("fn").build());

    @BeforeEach
    void setUp() {
        stateStore = new ExecutionStateStore();
        console = new TerminalConsoleStore();
        accumulator = new RunAccumulator();
    }

    private BlockEventHandler handler(BlockEventHandler.Options options) {
        return new BlockEventHandler(WF, EXEC, edges, accumulator, options, stateStore, console, publisher);
    }

    private static BlockStartedEvent started(String blockId) {
        return BlockStartedEvent.builder().blockId(blockId).blockName("Agent 1").blockType("agent").executionOrder(1).build();
    }

    private static BlockCompletedEvent completed(String blockId, String type, Object output) {
        return BlockCompletedEvent.builder()
                .blockId(blockId).blockName(blockId).blockType(type)
                .input(Map.of("prompt", "hi")).output(output).durationMs(12).executionOrder(1)
                .build();
    }

    @Nested
    class UpdateMode {

        private BlockEventHandler handler;

        @BeforeEach
        void setUp() {
            handler = handler(BlockEventHandler.Options.builder().includeStartConsoleEntry(true).build());
        }

        @Test
        void startMarksActiveBlockAndIncomingEdges() {
            handler.onBlockStarted(started("agent"));

            assertThat(stateStore.getWorkflowExecution(WF).getActiveBlockIds()).containsExactly("agent");
            assertThat(stateStore.getWorkflowExecution(WF).getLastRunEdges())
                    .containsEntry("e1", RunStatus.SUCCESS)
                    .doesNotContainKey("e2");
            assertThat(console.entries(WF)).singleElement().satisfies(e -> assertThat(e.isRunning()).isTrue());
            verify(publisher).blockStarted(WF, EXEC, "agent");
        }

        @Test
        void completionFinishesTheRunningLine() {
            handler.onBlockStarted(started("agent"));
            handler.onBlockCompleted(completed("agent", "agent", Map.of("content", "ok")));

            assertThat(stateStore.getWorkflowExecution(WF).getActiveBlockIds()).isEmpty();
            assertThat(stateStore.getWorkflowExecution(WF).getLastRunPath()).containsEntry("agent", RunStatus.SUCCESS);
            assertThat(accumulator.executedBlocks()).containsExactly("agent");
            assertThat(accumulator.blockStates().get("agent").output()).isEqualTo(Map.of("content", "ok"));
            assertThat(accumulator.blockLogs()).singleElement().satisfies(log -> {
                assertThat(log.isSuccess()).isTrue();
                assertThat(log.getDurationMs()).isEqualTo(12);
            });
            ConsoleEntry entry = console.entries(WF).get(0);
            assertThat(console.entries(WF)).hasSize(1);
            assertThat(entry.isRunning()).isFalse();
            assertThat(entry.getSuccess()).isTrue();
            assertThat(entry.getOutput()).isEqualTo(Map.of("content", "ok"));
        }

        @Test
        @DisplayName("loop and parallel completions record state but no log or console line")
        void containersAreNotLogged() {
            handler.onBlockCompleted(completed("loop", "loop", Map.of("results", List.of())));

            assertThat(accumulator.executedBlocks()).containsExactly("loop");
            assertThat(accumulator.blockLogs()).isEmpty();
            assertThat(console.entries(WF)).isEmpty();
        }

        @Test
        void errorRecordsFailedLogAndErrorOutput() {
            handler.onBlockStarted(started("agent"));
            handler.onBlockError(BlockErrorEvent.builder()
                    .blockId("agent").blockName("Agent 1").blockType("agent").error("rate limited").durationMs(3)
                    .build());

            assertThat(stateStore.getWorkflowExecution(WF).getLastRunPath()).containsEntry("agent", RunStatus.ERROR);
            assertThat(accumulator.blockStates().get("agent").output()).isEqualTo(Map.of("error", "rate limited"));
            assertThat(accumulator.blockLogs()).singleElement()
                    .satisfies(log -> assertThat(log.isSuccess()).isFalse())
                    .extracting(BlockLog::getError).isEqualTo("rate limited");
            assertThat(accumulator.hasBlockError()).isTrue();
            assertThat(console.entries(WF).get(0).getError()).isEqualTo("rate limited");
            verify(publisher).blockError(WF, EXEC, "agent", "rate limited");
        }
    }

    @Test
    void addModeWritesOneLinePerCompletion() {
        BlockEventHandler handler = handler(BlockEventHandler.Options.builder()
                .consoleMode(BlockEventHandler.ConsoleMode.ADD)
                .build());

        handler.onBlockStarted(started("agent"));
        handler.onBlockCompleted(completed("agent", "agent", "out"));

        assertThat(console.entries(WF)).singleElement().satisfies(e -> {
            assertThat(e.getSuccess()).isTrue();
            assertThat(e.getBlockName()).isEqualTo("agent");
        });
    }

    @Test
    void completionCallbackFailuresAreContained() {
        List<String> completedIds = new ArrayList<>();
        BlockEventHandler handler = handler(BlockEventHandler.Options.builder()
                .onBlockComplete((blockId, output) -> {
                    completedIds.add(blockId);
                    throw new IllegalStateException("sink closed");
                })
                .build());

        handler.onBlockCompleted(completed("agent", "agent", "a"));
        handler.onBlockCompleted(completed("fn", "function", "b"));

        assertThat(completedIds).containsExactly("agent", "fn");
        assertThat(accumulator.executedBlocks()).containsExactly("agent", "fn");
    }

    @Test
    @DisplayName("the first chunk of a second streaming block is separated by a blank line")
    void streamSeparator() {
        List<String> forwarded = new ArrayList<>();
        BlockEventHandler handler = handler(BlockEventHandler.Options.builder()
                .streamListener((blockId, text) -> forwarded.add(blockId + ":" + text))
                .build());

        handler.onStreamChunk(new StreamChunkEvent("a", "Hel"));
        handler.onStreamChunk(new StreamChunkEvent("a", "lo"));
        handler.onStreamChunk(new StreamChunkEvent("b", "World"));

        assertThat(forwarded).containsExactly("a:Hel", "a:lo", "b:\n\nWorld");
        assertThat(handler.streamedContent("a")).contains("Hello");
        assertThat(handler.hasStreamed("b")).isTrue();
        assertThat(handler.hasStreamed("c")).isFalse();
    }

    @Test
    void remembersTerminalEvents() {
        BlockEventHandler handler = handler(null);

        handler.onExecutionCancelled(new ExecutionCancelledEvent(40L));

        assertThat(handler.cancelledEvent()).isPresent();
        assertThat(handler.completedEvent()).isEmpty();
        assertThat(handler.errorEvent()).isEmpty();
    }
}
