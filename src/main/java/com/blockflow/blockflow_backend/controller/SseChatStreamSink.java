package com.blockflow.blockflow_backend.controller;

import com.blockflow.blockflow_backend.executor.ChatStreamSink;
import com.blockflow.blockflow_backend.executor.ExecutionResult;
import com.blockflow.blockflow_backend.executor.UploadErrorListener;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.Map;

/**
 * Writes a chat run to a server-sent-events response. Once the client has gone away or the run
 * has finished, further writes are dropped.
 */
@Slf4j
class SseChatStreamSink implements ChatStreamSink, UploadErrorListener {

    private final SseEmitter emitter;
    private boolean closed;

    SseChatStreamSink(SseEmitter emitter) {
        this.emitter = emitter;
    }

    @Override
    public void chunk(String blockId, String chunk) {
        send("chunk", Map.of("blockId", blockId, "chunk", chunk));
    }

    @Override
    public void finalResult(ExecutionResult result) {
        send("final", Map.of("type", "final", "data", result));
    }

    @Override
    public void cancelled(ExecutionResult result) {
        send("cancelled", Map.of("type", "cancelled", "data", result));
    }

    @Override
    public void onUploadError(String message) {
        send("upload-error", Map.of("error", message));
    }

    @Override
    public synchronized void close() {
        if (closed) return;
        closed = true;
        emitter.complete();
    }

    synchronized boolean isClosed() {
        return closed;
    }

    /** The client disconnected; nothing more can be written. */
    synchronized void detach() {
        closed = true;
    }

    private synchronized void send(String event, Object data) {
        if (closed) return;
        try {
            emitter.send(SseEmitter.event().name(event).data(data, MediaType.APPLICATION_JSON));
        } catch (IOException | IllegalStateException e) {
            log.debug("Chat stream client went away while sending '{}': {}", event, e.getMessage());
            closed = true;
        }
    }
}
