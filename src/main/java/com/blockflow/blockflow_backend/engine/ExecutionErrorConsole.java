package com.blockflow.blockflow_backend.engine;

import com.blockflow.blockflow_backend.console.ConsoleEntry;
import com.blockflow.blockflow_backend.console.ConsoleSink;
import com.blockflow.blockflow_backend.trigger.WorkflowValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;

/**
 * Writes the execution-level console lines: run errors that no block reported, validation
 * failures before anything ran, and cancellations.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ExecutionErrorConsole {

    static final String VALIDATION_BLOCK_ID = "validation";
    static final String TIMEOUT_BLOCK_ID = "timeout-error";
    static final String EXECUTION_ERROR_BLOCK_ID = "execution-error";
    static final String CANCELLED_BLOCK_ID = "cancelled";
    static final String SERIALIZATION_BLOCK_ID = "serialization";

    private final ConsoleSink consoleSink;

    /**
     * Adds the entry for a run that ended in an error.
     *
     * @param hasBlockLogs false when the run failed before any block executed
     * @param hasBlockError true when some block already wrote its own error line
     * @return the entry, or null when a block error already covers it
     */
    public ConsoleEntry executionError(String workflowId, String executionId, String error, long durationMs,
                                       boolean hasBlockLogs, boolean hasBlockError) {
        consoleSink.cancelRunningEntries(workflowId);
        boolean preExecution = !hasBlockLogs;
        if (!preExecution && hasBlockError) {
            return null;
        }
        String message = error != null && !error.isBlank() ? error : "Execution failed";
        boolean timeout = message.contains("timed out");

        String blockId;
        String blockName;
        if (preExecution) {
            blockId = VALIDATION_BLOCK_ID;
            blockName = "Workflow Validation";
        } else if (timeout) {
            blockId = TIMEOUT_BLOCK_ID;
            blockName = "Timeout Error";
        } else {
            blockId = EXECUTION_ERROR_BLOCK_ID;
            blockName = "Execution Error";
        }
        Instant endedAt = Instant.now();
        return consoleSink.add(ConsoleEntry.builder()
                .workflowId(workflowId)
                .executionId(executionId)
                .blockId(blockId)
                .blockName(blockName)
                .blockType(preExecution ? "validation" : "error")
                .output(Map.of())
                .success(false)
                .error(message)
                .durationMs(durationMs)
                .startedAt(endedAt.minusMillis(durationMs))
                .endedAt(endedAt)
                .executionOrder(preExecution ? 0 : Long.MAX_VALUE)
                .build());
    }

    public ConsoleEntry cancelled(String workflowId, String executionId, long durationMs) {
        consoleSink.cancelRunningEntries(workflowId);
        Instant endedAt = Instant.now();
        return consoleSink.add(ConsoleEntry.builder()
                .workflowId(workflowId)
                .executionId(executionId)
                .blockId(CANCELLED_BLOCK_ID)
                .blockName("Execution Cancelled")
                .blockType("cancelled")
                .output(Map.of())
                .success(false)
                .error("Execution was cancelled")
                .durationMs(durationMs)
                .startedAt(endedAt.minusMillis(durationMs))
                .endedAt(endedAt)
                .executionOrder(Long.MAX_VALUE)
                .build());
    }

    /**
     * Entry for a run that never reached the executor, e.g. because no trigger could be
     * resolved. Validation failures carry the offending block's identity.
     */
    public ConsoleEntry preparationError(String workflowId, String executionId, String error, Throwable cause) {
        String blockId = SERIALIZATION_BLOCK_ID;
        String blockName = "Workflow";
        String blockType = "serializer";
        if (cause instanceof WorkflowValidationException validation) {
            blockId = validation.getBlockId();
            blockName = validation.getBlockName();
            blockType = validation.getBlockType();
        }
        Instant now = Instant.now();
        log.debug("Recording preparation error for workflow {} at block {}", workflowId, blockId);
        return consoleSink.add(ConsoleEntry.builder()
                .workflowId(workflowId)
                .executionId(executionId)
                .blockId(blockId)
                .blockName(blockName)
                .blockType(blockType)
                .output(Map.of())
                .success(false)
                .error(error)
                .durationMs(0L)
                .startedAt(now)
                .endedAt(now)
                .executionOrder(Long.MAX_VALUE)
                .build());
    }
}
