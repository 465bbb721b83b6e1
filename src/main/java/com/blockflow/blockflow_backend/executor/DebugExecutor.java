package com.blockflow.blockflow_backend.executor;

import java.util.List;

@FunctionalInterface
public interface DebugExecutor {

    /**
     * Runs {@code pendingBlocks} once. The result either carries the next pending blocks in its
     * metadata (the session continues) or is terminal.
     */
    ExecutionResult continueExecution(List<String> pendingBlocks, DebugContext context);
}
