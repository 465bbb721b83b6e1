package com.blockflow.blockflow_backend.console;

import lombok.Builder;

import java.time.Instant;
import java.util.Map;

/**
 * Partial update of a console entry; null components leave the entry's value unchanged.
 *
 * @param replaceOutput replaces the entry's output wholesale instead of merging into it
 */
@Builder
public record ConsoleUpdate(
        Map<String, Object> input,
        Object replaceOutput,
        Boolean success,
        String error,
        Long durationMs,
        Instant startedAt,
        Instant endedAt,
        Boolean running,
        Integer iterationCurrent,
        Integer iterationTotal,
        String iterationType
) {}
