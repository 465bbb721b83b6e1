package com.blockflow.blockflow_backend.executor;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutionMetadata {

    public static final String SOURCE_CHAT = "chat";

    private Long duration;

    private Instant startTime;

    private Instant endTime;

    @JsonProperty("isDebugSession")
    private boolean debugSession;

    private DebugContext context;

    private List<String> pendingBlocks;

    // "chat" when the run came from the chat panel
    private String source;

    public boolean hasPendingBlocks() {
        return pendingBlocks != null && !pendingBlocks.isEmpty();
    }
}
