package com.blockflow.blockflow_backend.executor.event;

public record StreamChunkEvent(String blockId, String chunk) {}
