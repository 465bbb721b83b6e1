package com.blockflow.blockflow_backend.engine;

import com.blockflow.blockflow_backend.console.ConsoleEntry;
import com.blockflow.blockflow_backend.console.ConsoleSink;
import com.blockflow.blockflow_backend.console.ConsoleUpdate;
import com.blockflow.blockflow_backend.engine.state.ExecutionStateStore;
import com.blockflow.blockflow_backend.engine.state.RunStatus;
import com.blockflow.blockflow_backend.executor.ExecutionEventListener;
import com.blockflow.blockflow_backend.executor.event.BlockCompletedEvent;
import com.blockflow.blockflow_backend.executor.event.BlockErrorEvent;
import com.blockflow.blockflow_backend.executor.event.BlockStartedEvent;
import com.blockflow.blockflow_backend.executor.event.ExecutionCancelledEvent;
import com.blockflow.blockflow_backend.executor.event.ExecutionCompletedEvent;
import com.blockflow.blockflow_backend.executor.event.ExecutionErrorEvent;
import com.blockflow.blockflow_backend.executor.event.ExecutionStartedEvent;
import com.blockflow.blockflow_backend.executor.event.StreamChunkEvent;
import com.blockflow.blockflow_backend.model.domain.BlockType;
import com.blockflow.blockflow_backend.model.domain.Edge;
import com.blockflow.blockflow_backend.snapshot.BlockLog;
import com.blockflow.blockflow_backend.snapshot.BlockState;
import com.blockflow.blockflow_backend.snapshot.RunAccumulator;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Applies one run's lifecycle events to the workflow's execution state, the console and the
 * run accumulator, and remembers the terminal event the executor ended with.
 */
@Slf4j
public class BlockEventHandler implements ExecutionEventListener {

    static final String STREAM_SEPARATOR = "\n\n";

    public enum ConsoleMode {
        ADD,    // each finished block gets a new console line
        UPDATE  // the running line written at block start is completed in place
    }

    /**
     * @param includeStartConsoleEntry write a running console line when a block starts
     */
    @Builder
    public record Options(ConsoleMode consoleMode,
                          boolean includeStartConsoleEntry,
                          BlockCompletionCallback onBlockComplete,
                          StreamChunkListener streamListener) {
        public Options {
            consoleMode = consoleMode != null ? consoleMode : ConsoleMode.UPDATE;
        }
    }

    private final String workflowId;
    private final String executionId;
    private final List<Edge> edges;
    private final RunAccumulator accumulator;
    private final Options options;
    private final ExecutionStateStore stateStore;
    private final ConsoleSink consoleSink;
    private final ExecutionEventPublisher publisher;

    private final Set<String> activeBlocks = new LinkedHashSet<>();
    private final Map<String, StringBuilder> streamedContent = new LinkedHashMap<>();

    private volatile Instant startTime;
    private volatile ExecutionCompletedEvent completedEvent;
    private volatile ExecutionErrorEvent errorEvent;
    private volatile ExecutionCancelledEvent cancelledEvent;

    BlockEventHandler(String workflowId, String executionId, List<Edge> edges, RunAccumulator accumulator,
                      Options options, ExecutionStateStore stateStore, ConsoleSink consoleSink,
                      ExecutionEventPublisher publisher) {
        this.workflowId = workflowId;
        this.executionId = executionId;
        this.edges = edges != null ? List.copyOf(edges) : List.of();
        this.accumulator = accumulator;
        this.options = options != null ? options : Options.builder().build();
        this.stateStore = stateStore;
        this.consoleSink = consoleSink;
        this.publisher = publisher;
    }

    @Override
    public void onExecutionStarted(ExecutionStartedEvent event) {
        startTime = event.startTime() != null ? event.startTime() : Instant.now();
        log.debug("Executor started execution {} for workflow {}", event.executionId(), workflowId);
    }

    @Override
    public void onBlockStarted(BlockStartedEvent event) {
        updateActive(event.blockId(), true);
        for (Edge edge : edges) {
            if (Objects.equals(edge.getTarget(), event.blockId())) {
                stateStore.setEdgeRunStatus(workflowId, edge.getId(), RunStatus.SUCCESS);
            }
        }
        publisher.blockStarted(workflowId, executionId, event.blockId());

        if (options.includeStartConsoleEntry()) {
            consoleSink.add(ConsoleEntry.builder()
                    .workflowId(workflowId)
                    .executionId(executionId)
                    .blockId(event.blockId())
                    .blockName(BlockLog.nameOrDefault(event.blockName()))
                    .blockType(BlockLog.typeOrDefault(event.blockType()))
                    .startedAt(Instant.now())
                    .executionOrder(event.executionOrder())
                    .running(true)
                    .iterationCurrent(event.iterationCurrent())
                    .iterationTotal(event.iterationTotal())
                    .iterationType(event.iterationType())
                    .build());
        }
    }

    @Override
    public void onBlockCompleted(BlockCompletedEvent event) {
        String blockId = event.blockId();
        updateActive(blockId, false);
        stateStore.setBlockRunStatus(workflowId, blockId, RunStatus.SUCCESS);
        accumulator.markExecuted(blockId);
        accumulator.recordState(blockId, new BlockState(event.output(), true, event.durationMs()));
        publisher.blockCompleted(workflowId, executionId, blockId);

        if (isContainer(event.blockType())) {
            return;
        }

        accumulator.recordLog(BlockLog.builder()
                .blockId(blockId)
                .blockName(BlockLog.nameOrDefault(event.blockName()))
                .blockType(BlockLog.typeOrDefault(event.blockType()))
                .input(event.input() != null ? new LinkedHashMap<>(event.input()) : new LinkedHashMap<>())
                .output(event.output())
                .success(true)
                .durationMs(event.durationMs())
                .startedAt(event.startedAt())
                .endedAt(event.endedAt())
                .executionOrder(event.executionOrder())
                .build());

        if (options.consoleMode() == ConsoleMode.UPDATE) {
            consoleSink.update(workflowId, blockId, executionId, ConsoleUpdate.builder()
                    .input(event.input())
                    .replaceOutput(event.output())
                    .success(true)
                    .durationMs(event.durationMs())
                    .startedAt(event.startedAt())
                    .endedAt(event.endedAt())
                    .running(false)
                    .iterationCurrent(event.iterationCurrent())
                    .iterationTotal(event.iterationTotal())
                    .iterationType(event.iterationType())
                    .build());
        } else {
            consoleSink.add(ConsoleEntry.builder()
                    .workflowId(workflowId)
                    .executionId(executionId)
                    .blockId(blockId)
                    .blockName(BlockLog.nameOrDefault(event.blockName()))
                    .blockType(BlockLog.typeOrDefault(event.blockType()))
                    .input(event.input() != null ? event.input() : Map.of())
                    .output(event.output())
                    .success(true)
                    .durationMs(event.durationMs())
                    .startedAt(event.startedAt())
                    .endedAt(event.endedAt())
                    .executionOrder(event.executionOrder())
                    .iterationCurrent(event.iterationCurrent())
                    .iterationTotal(event.iterationTotal())
                    .iterationType(event.iterationType())
                    .build());
        }

        if (options.onBlockComplete() != null) {
            try {
                options.onBlockComplete().onBlockComplete(blockId, event.output());
            } catch (Exception e) {
                log.error("Block completion callback failed for block {}", blockId, e);
            }
        }
    }

    @Override
    public void onBlockError(BlockErrorEvent event) {
        String blockId = event.blockId();
        updateActive(blockId, false);
        stateStore.setBlockRunStatus(workflowId, blockId, RunStatus.ERROR);
        accumulator.markExecuted(blockId);
        accumulator.recordState(blockId, new BlockState(errorOutput(event.error()), true, event.durationMs()));
        publisher.blockError(workflowId, executionId, blockId, event.error());

        accumulator.recordLog(BlockLog.builder()
                .blockId(blockId)
                .blockName(BlockLog.nameOrDefault(event.blockName()))
                .blockType(BlockLog.typeOrDefault(event.blockType()))
                .input(event.input() != null ? new LinkedHashMap<>(event.input()) : new LinkedHashMap<>())
                .output(new LinkedHashMap<>())
                .success(false)
                .error(event.error())
                .durationMs(event.durationMs())
                .startedAt(event.startedAt())
                .endedAt(event.endedAt())
                .executionOrder(event.executionOrder())
                .build());

        if (options.consoleMode() == ConsoleMode.UPDATE) {
            consoleSink.update(workflowId, blockId, executionId, ConsoleUpdate.builder()
                    .input(event.input())
                    .replaceOutput(Map.of())
                    .success(false)
                    .error(event.error())
                    .durationMs(event.durationMs())
                    .startedAt(event.startedAt())
                    .endedAt(event.endedAt())
                    .running(false)
                    .iterationCurrent(event.iterationCurrent())
                    .iterationTotal(event.iterationTotal())
                    .iterationType(event.iterationType())
                    .build());
        } else {
            consoleSink.add(ConsoleEntry.builder()
                    .workflowId(workflowId)
                    .executionId(executionId)
                    .blockId(blockId)
                    .blockName(BlockLog.nameOrDefault(event.blockName()))
                    .blockType(BlockLog.typeOrDefault(event.blockType()))
                    .input(event.input() != null ? event.input() : Map.of())
                    .output(Map.of())
                    .success(false)
                    .error(event.error())
                    .durationMs(event.durationMs())
                    .startedAt(event.startedAt())
                    .endedAt(event.endedAt())
                    .executionOrder(event.executionOrder())
                    .iterationCurrent(event.iterationCurrent())
                    .iterationTotal(event.iterationTotal())
                    .iterationType(event.iterationType())
                    .build());
        }
    }

    @Override
    public void onStreamChunk(StreamChunkEvent event) {
        String text = bufferChunk(event.blockId(), event.chunk());
        if (options.streamListener() != null) {
            options.streamListener().onChunk(event.blockId(), text);
        }
    }

    @Override
    public void onStreamDone(String blockId) {
        if (options.streamListener() != null) {
            options.streamListener().onStreamDone(blockId);
        }
    }

    @Override
    public void onExecutionCompleted(ExecutionCompletedEvent event) {
        completedEvent = event;
    }

    @Override
    public void onExecutionError(ExecutionErrorEvent event) {
        errorEvent = event;
    }

    @Override
    public void onExecutionCancelled(ExecutionCancelledEvent event) {
        cancelledEvent = event;
    }

    /**
     * Appends {@code chunk} to the block's buffer. The first chunk of a block is prefixed with
     * a blank line when another block has already streamed.
     *
     * @return the text as appended
     */
    synchronized String bufferChunk(String blockId, String chunk) {
        String text = chunk != null ? chunk : "";
        StringBuilder buffer = streamedContent.get(blockId);
        if (buffer == null) {
            buffer = new StringBuilder();
            streamedContent.put(blockId, buffer);
            if (streamedContent.size() > 1) {
                text = STREAM_SEPARATOR + text;
            }
        }
        buffer.append(text);
        return text;
    }

    public synchronized boolean hasStreamed(String blockId) {
        return streamedContent.containsKey(blockId);
    }

    public synchronized boolean hasStreamedAnything() {
        return !streamedContent.isEmpty();
    }

    public synchronized Optional<String> streamedContent(String blockId) {
        StringBuilder buffer = streamedContent.get(blockId);
        return buffer != null ? Optional.of(buffer.toString()) : Optional.empty();
    }

    public synchronized Set<String> activeBlocks() {
        return new LinkedHashSet<>(activeBlocks);
    }

    public RunAccumulator accumulator() {
        return accumulator;
    }

    public String executionId() {
        return executionId;
    }

    public Optional<Instant> startTime() {
        return Optional.ofNullable(startTime);
    }

    public Optional<ExecutionCompletedEvent> completedEvent() {
        return Optional.ofNullable(completedEvent);
    }

    public Optional<ExecutionErrorEvent> errorEvent() {
        return Optional.ofNullable(errorEvent);
    }

    public Optional<ExecutionCancelledEvent> cancelledEvent() {
        return Optional.ofNullable(cancelledEvent);
    }

    private void updateActive(String blockId, boolean active) {
        Set<String> current;
        synchronized (this) {
            if (active) {
                activeBlocks.add(blockId);
            } else {
                activeBlocks.remove(blockId);
            }
            current = new LinkedHashSet<>(activeBlocks);
        }
        stateStore.setActiveBlocks(workflowId, current);
    }

    private static boolean isContainer(String blockType) {
        return BlockType.LOOP.getKey().equals(blockType) || BlockType.PARALLEL.getKey().equals(blockType);
    }

    private static Map<String, Object> errorOutput(String error) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("error", error);
        return output;
    }
}
