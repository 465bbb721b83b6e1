package com.blockflow.blockflow_backend.executor;

import com.blockflow.blockflow_backend.model.graph.WorkflowGraph;
import lombok.Builder;

import java.util.List;

/**
 * Body of an execute call.
 *
 * @param stopAfterBlockId when set, the executor stops right after this block completes
 * @param workflowStateOverride the draft graph to run instead of the deployed one
 */
@Builder
public record ExecuteRequest(
        String workflowId,
        String executionId,
        String startBlockId,
        Object input,
        List<String> selectedOutputs,
        String triggerType,
        boolean useDraftState,
        boolean isClientSession,
        String stopAfterBlockId,
        boolean debug,
        WorkflowGraph workflowStateOverride
) {}
