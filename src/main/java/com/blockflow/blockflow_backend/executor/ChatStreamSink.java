package com.blockflow.blockflow_backend.executor;

/** Receives the chat transcript of a run as it streams. */
public interface ChatStreamSink {

    void chunk(String blockId, String chunk);

    void finalResult(ExecutionResult result);

    void cancelled(ExecutionResult result);

    void close();
}
