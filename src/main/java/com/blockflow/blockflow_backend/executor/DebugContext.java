package com.blockflow.blockflow_backend.executor;

import com.blockflow.blockflow_backend.snapshot.BlockLog;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executor-side state of a paused debug session. Opaque to the orchestrator apart from the
 * workflow id and the logs collected so far.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DebugContext {

    private String workflowId;

    private String executionId;

    @Builder.Default
    private List<BlockLog> blockLogs = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> state = new LinkedHashMap<>();
}
