package com.blockflow.blockflow_backend.snapshot;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/** Branches taken by routers and conditions, keyed by the deciding block id. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionDecisions {

    private Map<String, String> router = new LinkedHashMap<>();
    private Map<String, String> condition = new LinkedHashMap<>();

    public ExecutionDecisions copy() {
        return new ExecutionDecisions(new LinkedHashMap<>(router), new LinkedHashMap<>(condition));
    }
}
