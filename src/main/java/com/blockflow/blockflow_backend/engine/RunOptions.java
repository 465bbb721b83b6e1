package com.blockflow.blockflow_backend.engine;

import com.blockflow.blockflow_backend.executor.ExecutionResult;
import com.blockflow.blockflow_backend.trigger.ExecutionMode;
import lombok.Builder;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * How a run from the normal start block is carried out.
 *
 * @param input caller input; when null the trigger's synthesized payload is used
 * @param stopAfterBlockId run-until-block target; its result is merged into the stored snapshot
 * @param executionId pre-minted id, e.g. when files were uploaded for the run beforehand
 * @param beforeFinalize applied to a completed result before it is persisted
 */
@Builder
public record RunOptions(
        ExecutionMode mode,
        Object input,
        boolean debug,
        String stopAfterBlockId,
        List<String> selectedOutputs,
        String executionId,
        BlockCompletionCallback onBlockComplete,
        StreamChunkListener streamListener,
        UnaryOperator<ExecutionResult> beforeFinalize
) {
    public RunOptions {
        mode = mode != null ? mode : ExecutionMode.MANUAL;
        selectedOutputs = selectedOutputs != null ? List.copyOf(selectedOutputs) : List.of();
    }
}
