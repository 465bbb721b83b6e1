package com.blockflow.blockflow_backend.engine.state;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RunStatus {
    RUNNING,
    SUCCESS,
    ERROR;

    @JsonValue
    public String json() {
        return name().toLowerCase();
    }
}
