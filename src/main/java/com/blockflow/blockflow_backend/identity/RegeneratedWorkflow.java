package com.blockflow.blockflow_backend.identity;

import com.blockflow.blockflow_backend.model.graph.WorkflowGraph;

import java.util.Map;

public record RegeneratedWorkflow(WorkflowGraph graph, Map<String, String> idMap) {}
