package com.blockflow.blockflow_backend.model.domain;

public enum BlockCategory {
    BLOCKS,
    TOOLS,
    TRIGGERS,
    CONTAINERS
}
