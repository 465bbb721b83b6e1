package com.blockflow.blockflow_backend.model.domain;

public enum ContainerKind {
    LOOP,
    PARALLEL;

    public static ContainerKind of(BlockType type) {
        if (type == BlockType.LOOP) return LOOP;
        if (type == BlockType.PARALLEL) return PARALLEL;
        throw new IllegalArgumentException("Not a container type: " + type);
    }
}
