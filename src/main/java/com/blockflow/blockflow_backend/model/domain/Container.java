package com.blockflow.blockflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Loop or parallel container. {@code id} is the container block's id and {@code nodes}
 * are the ids of the blocks whose parentId points at it.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Container {

    private String id;

    private ContainerKind kind;

    @Builder.Default
    private List<String> nodes = new ArrayList<>();

    // Loop: "for" / "forEach"; parallel: "count" / "collection"
    private String mode;

    // Loop iterations or parallel branch count
    private Integer count;

    private Object collection;

    public Container copy() {
        return toBuilder().nodes(new ArrayList<>(nodes)).build();
    }
}
