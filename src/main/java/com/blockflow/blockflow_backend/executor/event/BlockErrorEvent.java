package com.blockflow.blockflow_backend.executor.event;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

@Builder
public record BlockErrorEvent(
        String blockId,
        String blockName,
        String blockType,
        Map<String, Object> input,
        String error,
        long durationMs,
        Instant startedAt,
        Instant endedAt,
        long executionOrder,
        Integer iterationCurrent,
        Integer iterationTotal,
        String iterationType
) {}
