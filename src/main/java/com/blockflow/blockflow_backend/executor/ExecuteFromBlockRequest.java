package com.blockflow.blockflow_backend.executor;

import com.blockflow.blockflow_backend.model.graph.WorkflowGraph;
import com.blockflow.blockflow_backend.snapshot.ExecutionSnapshot;
import lombok.Builder;

/**
 * Body of an execute-from-block call. {@code sourceSnapshot} supplies the outputs of blocks
 * upstream of {@code startBlockId}.
 */
@Builder
public record ExecuteFromBlockRequest(
        String workflowId,
        String executionId,
        String startBlockId,
        ExecutionSnapshot sourceSnapshot,
        Object input,
        WorkflowGraph workflowStateOverride
) {}
