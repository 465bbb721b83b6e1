package com.blockflow.blockflow_backend.model.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Edge {

    private String id;

    private String source;

    private String target;

    // Which output of the source this edge leaves from, see SourceHandle
    @Builder.Default
    private String sourceHandle = SourceHandle.SOURCE.getHandle();

    @Builder.Default
    private String targetHandle = SourceHandle.TARGET_HANDLE;

    public Edge copy() {
        return toBuilder().build();
    }
}
