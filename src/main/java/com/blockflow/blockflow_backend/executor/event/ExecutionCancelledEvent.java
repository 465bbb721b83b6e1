package com.blockflow.blockflow_backend.executor.event;

public record ExecutionCancelledEvent(Long duration) {}
