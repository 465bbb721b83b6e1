package com.blockflow.blockflow_backend.executor;

/** An attachment sent with a chat message. */
public record ChatFile(String name, String contentType, byte[] content) {}
