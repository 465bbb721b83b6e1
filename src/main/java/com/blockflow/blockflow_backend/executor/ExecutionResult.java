package com.blockflow.blockflow_backend.executor;

import com.blockflow.blockflow_backend.snapshot.BlockLog;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionResult {

    public static final String STATUS_CANCELLED = "cancelled";
    public static final String STATUS_ABORTED = "aborted";

    private boolean success;

    @Builder.Default
    private Map<String, Object> output = new LinkedHashMap<>();

    private String error;

    @Builder.Default
    private List<BlockLog> logs = new ArrayList<>();

    private ExecutionMetadata metadata;

    // "cancelled" when the executor stopped the run, "aborted" when the user closed the channel
    private String status;

    public static ExecutionResult failure(String error, List<BlockLog> logs) {
        return ExecutionResult.builder()
                .success(false)
                .error(error)
                .logs(logs != null ? new ArrayList<>(logs) : new ArrayList<>())
                .build();
    }

    public static ExecutionResult aborted() {
        return ExecutionResult.builder()
                .success(false)
                .status(STATUS_ABORTED)
                .metadata(ExecutionMetadata.builder().duration(0L).build())
                .build();
    }

    public static ExecutionResult cancelled(Long duration) {
        return ExecutionResult.builder()
                .success(false)
                .status(STATUS_CANCELLED)
                .metadata(ExecutionMetadata.builder().duration(duration).build())
                .build();
    }

    @JsonIgnore
    public boolean isCancelled() {
        return STATUS_CANCELLED.equals(status);
    }

    @JsonIgnore
    public boolean isAborted() {
        return STATUS_ABORTED.equals(status);
    }

    /** True when the executor paused and more blocks are waiting to be stepped. */
    @JsonIgnore
    public boolean isPausedDebugSession() {
        return metadata != null && metadata.isDebugSession() && metadata.hasPendingBlocks();
    }
}
