package com.blockflow.blockflow_backend.executor.event;

public record ExecutionErrorEvent(String error, long duration) {}
