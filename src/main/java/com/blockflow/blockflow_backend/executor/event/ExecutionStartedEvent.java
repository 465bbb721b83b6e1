package com.blockflow.blockflow_backend.executor.event;

import java.time.Instant;

public record ExecutionStartedEvent(String executionId, Instant startTime) {}
