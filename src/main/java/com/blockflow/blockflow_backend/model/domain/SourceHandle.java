package com.blockflow.blockflow_backend.model.domain;

import java.util.Arrays;
import java.util.Optional;

public enum SourceHandle {
    SOURCE("source"),                          // success path
    ERROR("error"),                            // followed when the source block fails
    CONDITION("condition-"),                   // prefix, followed by <blockId>-<conditionId>
    LOOP_START("loop-start-source"),           // into the loop body
    LOOP_END("loop-end-source"),               // after the last iteration
    PARALLEL_START("parallel-start-source"),
    PARALLEL_END("parallel-end-source");

    public static final String TARGET_HANDLE = "target";

    private final String handle;

    SourceHandle(String handle) {
        this.handle = handle;
    }

    public String getHandle() {
        return handle;
    }

    public static String condition(String blockId, String conditionId) {
        return CONDITION.handle + blockId + "-" + conditionId;
    }

    public static Optional<SourceHandle> fromHandle(String handle) {
        if (handle == null || handle.isBlank()) return Optional.of(SOURCE);
        if (handle.startsWith(CONDITION.handle)) return Optional.of(CONDITION);
        return Arrays.stream(values())
                .filter(h -> h != CONDITION && h.handle.equals(handle))
                .findFirst();
    }
}
