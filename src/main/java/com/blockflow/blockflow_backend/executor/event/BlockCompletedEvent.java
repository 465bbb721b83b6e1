package com.blockflow.blockflow_backend.executor.event;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

@Builder
public record BlockCompletedEvent(
        String blockId,
        String blockName,
        String blockType,
        Map<String, Object> input,
        Object output,
        long durationMs,
        Instant startedAt,
        Instant endedAt,
        long executionOrder,
        Integer iterationCurrent,
        Integer iterationTotal,
        String iterationType
) {}
