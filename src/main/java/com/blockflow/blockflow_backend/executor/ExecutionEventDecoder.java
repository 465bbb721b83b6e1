package com.blockflow.blockflow_backend.executor;

import com.blockflow.blockflow_backend.executor.event.BlockCompletedEvent;
import com.blockflow.blockflow_backend.executor.event.BlockErrorEvent;
import com.blockflow.blockflow_backend.executor.event.BlockStartedEvent;
import com.blockflow.blockflow_backend.executor.event.ExecutionCancelledEvent;
import com.blockflow.blockflow_backend.executor.event.ExecutionCompletedEvent;
import com.blockflow.blockflow_backend.executor.event.ExecutionErrorEvent;
import com.blockflow.blockflow_backend.executor.event.ExecutionStartedEvent;
import com.blockflow.blockflow_backend.executor.event.StreamChunkEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Decodes the executor's server-sent events. Each event is one {@code data:} line holding
 * {@code {"type": "...", "data": {...}}}; {@code data: [DONE]} closes the stream.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExecutionEventDecoder {

    static final String DATA_PREFIX = "data:";
    static final String DONE_MARKER = "[DONE]";

    private final ObjectMapper objectMapper;

    public enum Outcome {
        CONTINUE,   // not a terminal event, keep reading
        TERMINAL,   // completed, error or cancelled was delivered
        DONE        // end-of-stream marker
    }

    /** Decodes one line and delivers the event it carries, if any, to {@code listener}. */
    public Outcome dispatch(String line, ExecutionEventListener listener) {
        if (line == null || !line.startsWith(DATA_PREFIX)) {
            return Outcome.CONTINUE;
        }
        String payload = line.substring(DATA_PREFIX.length()).trim();
        if (payload.isEmpty()) return Outcome.CONTINUE;
        if (DONE_MARKER.equals(payload)) return Outcome.DONE;

        JsonNode event;
        try {
            event = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.warn("Skipping malformed execution event: {}", e.getOriginalMessage());
            return Outcome.CONTINUE;
        }
        String type = event.path("type").asText("");
        JsonNode data = event.path("data");
        try {
            return deliver(type, data, listener);
        } catch (JsonProcessingException e) {
            log.warn("Skipping execution event '{}' with unexpected shape: {}", type, e.getOriginalMessage());
            return Outcome.CONTINUE;
        }
    }

    private Outcome deliver(String type, JsonNode data, ExecutionEventListener listener) throws JsonProcessingException {
        switch (type) {
            case "execution:started" -> listener.onExecutionStarted(read(data, ExecutionStartedEvent.class));
            case "block:started" -> listener.onBlockStarted(read(data, BlockStartedEvent.class));
            case "block:completed" -> listener.onBlockCompleted(read(data, BlockCompletedEvent.class));
            case "block:error" -> listener.onBlockError(read(data, BlockErrorEvent.class));
            case "stream:chunk" -> listener.onStreamChunk(read(data, StreamChunkEvent.class));
            case "stream:done" -> listener.onStreamDone(data.path("blockId").asText(null));
            case "execution:completed" -> {
                listener.onExecutionCompleted(read(data, ExecutionCompletedEvent.class));
                return Outcome.TERMINAL;
            }
            case "execution:error" -> {
                listener.onExecutionError(read(data, ExecutionErrorEvent.class));
                return Outcome.TERMINAL;
            }
            case "execution:cancelled" -> {
                listener.onExecutionCancelled(read(data, ExecutionCancelledEvent.class));
                return Outcome.TERMINAL;
            }
            default -> log.debug("Ignoring execution event of type '{}'", type);
        }
        return Outcome.CONTINUE;
    }

    private <T> T read(JsonNode data, Class<T> type) throws JsonProcessingException {
        return objectMapper.treeToValue(data, type);
    }
}
