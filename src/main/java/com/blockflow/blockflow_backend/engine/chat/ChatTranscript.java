package com.blockflow.blockflow_backend.engine.chat;

import com.blockflow.blockflow_backend.engine.StreamChunkListener;
import com.blockflow.blockflow_backend.executor.ChatStreamSink;
import com.blockflow.blockflow_backend.executor.ExecutionMetadata;
import com.blockflow.blockflow_backend.executor.ExecutionResult;
import com.blockflow.blockflow_backend.snapshot.BlockLog;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * What one chat run writes to its sink: streamed chunks per block, drained concurrently, and
 * the selected outputs of blocks that did not stream. Writes are dropped once cancelled.
 */
@Slf4j
class ChatTranscript implements StreamChunkListener {

    static final String SEPARATOR = "\n\n";

    private final ChatStreamSink sink;
    private final ExecutorService drainExecutor;
    private final ObjectMapper objectMapper;
    private final List<String> selectedOutputs;

    private final Map<String, BlockOutputStream> streams = new ConcurrentHashMap<>();
    private final List<Future<?>> drains = new ArrayList<>();
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final AtomicBoolean wroteAnything = new AtomicBoolean(false);

    ChatTranscript(ChatStreamSink sink, ExecutorService drainExecutor, ObjectMapper objectMapper,
                   List<String> selectedOutputs) {
        this.sink = sink;
        this.drainExecutor = drainExecutor;
        this.objectMapper = objectMapper;
        this.selectedOutputs = selectedOutputs;
    }

    @Override
    public void onChunk(String blockId, String text) {
        streams.computeIfAbsent(blockId, this::openStream).push(text);
    }

    @Override
    public void onStreamDone(String blockId) {
        BlockOutputStream stream = streams.get(blockId);
        if (stream != null) stream.close();
    }

    /** Echoes the selected outputs of a block that produced no stream. */
    void onBlockComplete(String blockId, Object output) throws JsonProcessingException {
        if (streams.containsKey(blockId) || output == null) return;
        for (String outputId : selectedOutputs) {
            String path = pathFor(outputId, blockId);
            if (path == null) continue;
            Object value = OutputPaths.resolve(output, path);
            if (value == null) continue;
            String text = value instanceof String s ? s
                    : objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
            write(blockId, wroteAnything.get() ? SEPARATOR + text : text);
        }
    }

    void cancel() {
        cancelled.set(true);
    }

    boolean isCancelled() {
        return cancelled.get();
    }

    /** Closes every stream and waits for all drain tasks. Safe to call more than once. */
    void awaitDrains() {
        streams.values().forEach(BlockOutputStream::close);
        List<Future<?>> pending;
        synchronized (drains) {
            pending = new ArrayList<>(drains);
        }
        for (Future<?> drain : pending) {
            try {
                drain.get();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for chat streams to drain");
                return;
            } catch (ExecutionException e) {
                log.error("Chat stream drain failed", e.getCause());
            }
        }
    }

    /**
     * Completed result as sent to the chat: drains awaited, source marked, and block logs of
     * streamed blocks ending when their stream did.
     */
    ExecutionResult finish(ExecutionResult result) {
        awaitDrains();
        ExecutionMetadata metadata = result.getMetadata() != null ? result.getMetadata() : new ExecutionMetadata();
        metadata.setSource(ExecutionMetadata.SOURCE_CHAT);
        result.setMetadata(metadata);
        for (BlockLog blockLog : result.getLogs()) {
            BlockOutputStream stream = streams.get(blockLog.getBlockId());
            Instant completedAt = stream != null ? stream.completedAt() : null;
            if (completedAt == null) continue;
            blockLog.setEndedAt(completedAt);
            if (blockLog.getStartedAt() != null) {
                blockLog.setDurationMs(completedAt.toEpochMilli() - blockLog.getStartedAt().toEpochMilli());
            }
        }
        return result;
    }

    private BlockOutputStream openStream(String blockId) {
        BlockOutputStream stream = new BlockOutputStream(blockId);
        Future<?> drain = drainExecutor.submit(() -> {
            stream.drainTo(text -> write(blockId, text));
            return null;
        });
        synchronized (drains) {
            drains.add(drain);
        }
        return stream;
    }

    private void write(String blockId, String text) {
        if (cancelled.get()) return;
        wroteAnything.set(true);
        sink.chunk(blockId, text);
    }

    private static String pathFor(String outputId, String blockId) {
        if (outputId == null || blockId == null) return null;
        if (outputId.startsWith(blockId + "_") || outputId.startsWith(blockId + ".")) {
            return outputId.substring(blockId.length() + 1);
        }
        return null;
    }
}
