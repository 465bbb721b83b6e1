package com.blockflow.blockflow_backend.engine;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TraceSpan(
        String id,
        String name,
        String type,
        String blockId,
        String status,
        long duration,
        Instant startTime,
        Instant endTime,
        Map<String, Object> input,
        Object output,
        List<TraceSpan> children
) {}
