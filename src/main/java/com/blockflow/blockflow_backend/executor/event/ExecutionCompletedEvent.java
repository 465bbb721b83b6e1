package com.blockflow.blockflow_backend.executor.event;

import com.blockflow.blockflow_backend.executor.ExecutionMetadata;
import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * @param metadata set when the executor paused a debug session instead of finishing
 */
@Builder
public record ExecutionCompletedEvent(
        boolean success,
        Map<String, Object> output,
        long duration,
        Instant startTime,
        Instant endTime,
        ExecutionMetadata metadata
) {}
