package com.blockflow.blockflow_backend.engine;

/** Receives streamed block output as it is buffered, separator already applied. */
public interface StreamChunkListener {

    void onChunk(String blockId, String text);

    default void onStreamDone(String blockId) {}
}
