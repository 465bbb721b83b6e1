package com.blockflow.blockflow_backend.snapshot;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class BlockLog {

    public static final String UNKNOWN_BLOCK_NAME = "Unknown Block";
    public static final String UNKNOWN_BLOCK_TYPE = "unknown";

    private String blockId;

    @Builder.Default
    private String blockName = UNKNOWN_BLOCK_NAME;

    @Builder.Default
    private String blockType = UNKNOWN_BLOCK_TYPE;

    @Builder.Default
    private Map<String, Object> input = new LinkedHashMap<>();

    private Object output;

    private boolean success;

    private String error;

    private long durationMs;

    private Instant startedAt;

    private Instant endedAt;

    private long executionOrder;

    public static String nameOrDefault(String blockName) {
        return blockName != null && !blockName.isBlank() ? blockName : UNKNOWN_BLOCK_NAME;
    }

    public static String typeOrDefault(String blockType) {
        return blockType != null && !blockType.isBlank() ? blockType : UNKNOWN_BLOCK_TYPE;
    }

    public BlockLog copy() {
        return toBuilder()
                .input(input != null ? new LinkedHashMap<>(input) : new LinkedHashMap<>())
                .build();
    }
}
