package com.blockflow.blockflow_backend.executor.event;

import lombok.Builder;

@Builder
public record BlockStartedEvent(
        String blockId,
        String blockName,
        String blockType,
        long executionOrder,
        Integer iterationCurrent,
        Integer iterationTotal,
        String iterationType
) {}
