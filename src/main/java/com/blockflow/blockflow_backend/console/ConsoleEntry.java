package com.blockflow.blockflow_backend.console;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** One line of the workflow's terminal: a block run, or an execution-level error or cancellation. */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ConsoleEntry {

    private String id;

    private String workflowId;

    private String executionId;

    private String blockId;

    private String blockName;

    private String blockType;

    @Builder.Default
    private Map<String, Object> input = new LinkedHashMap<>();

    private Object output;

    // null while the block is still running
    private Boolean success;

    private String error;

    private Long durationMs;

    private Instant startedAt;

    private Instant endedAt;

    private long executionOrder;

    @JsonProperty("isRunning")
    private boolean running;

    @JsonProperty("isCanceled")
    private boolean canceled;

    private Integer iterationCurrent;

    private Integer iterationTotal;

    private String iterationType;

    private Instant timestamp;
}
