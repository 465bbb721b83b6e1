package com.blockflow.blockflow_backend.document;

import com.blockflow.blockflow_backend.model.domain.Edge;

import java.util.List;

public record ParsedConnections(List<Edge> edges, List<String> errors, List<String> warnings) {}
