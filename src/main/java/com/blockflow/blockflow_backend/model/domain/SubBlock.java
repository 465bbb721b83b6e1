package com.blockflow.blockflow_backend.model.domain;

import com.blockflow.blockflow_backend.model.graph.Values;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubBlock {

    private String id;

    // Editor input kind; dynamic inputs imported without a schema default to short-input
    private String type;

    private Object value;

    public SubBlock copy() {
        return new SubBlock(id, type, Values.deepCopy(value));
    }
}
