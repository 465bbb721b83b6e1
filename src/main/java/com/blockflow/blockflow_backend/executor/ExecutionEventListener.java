package com.blockflow.blockflow_backend.executor;

import com.blockflow.blockflow_backend.executor.event.BlockCompletedEvent;
import com.blockflow.blockflow_backend.executor.event.BlockErrorEvent;
import com.blockflow.blockflow_backend.executor.event.BlockStartedEvent;
import com.blockflow.blockflow_backend.executor.event.ExecutionCancelledEvent;
import com.blockflow.blockflow_backend.executor.event.ExecutionCompletedEvent;
import com.blockflow.blockflow_backend.executor.event.ExecutionErrorEvent;
import com.blockflow.blockflow_backend.executor.event.ExecutionStartedEvent;
import com.blockflow.blockflow_backend.executor.event.StreamChunkEvent;

/**
 * Callbacks for one run's lifecycle events. Events of a single block arrive in order
 * (started before completed or error); nothing is assumed across blocks.
 */
public interface ExecutionEventListener {

    default void onExecutionStarted(ExecutionStartedEvent event) {}

    default void onBlockStarted(BlockStartedEvent event) {}

    default void onBlockCompleted(BlockCompletedEvent event) {}

    default void onBlockError(BlockErrorEvent event) {}

    default void onStreamChunk(StreamChunkEvent event) {}

    default void onStreamDone(String blockId) {}

    default void onExecutionCompleted(ExecutionCompletedEvent event) {}

    default void onExecutionError(ExecutionErrorEvent event) {}

    default void onExecutionCancelled(ExecutionCancelledEvent event) {}
}
