package com.blockflow.blockflow_backend.model.domain;

import com.blockflow.blockflow_backend.model.graph.Values;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class Block {

    public static final String EXTENT_PARENT = "parent";

    private String id;

    private BlockType type;

    private String name;

    @Builder.Default
    private Position position = Position.ORIGIN;

    /** Id of the enclosing loop/parallel container, if any. */
    private String parentId;

    /** "parent" when the block is constrained to its container. */
    private String extent;

    @Builder.Default
    private boolean enabled = true;

    @Builder.Default
    private boolean locked = false;

    @Builder.Default
    private boolean triggerMode = false;

    @Builder.Default
    private Map<String, SubBlock> subBlocks = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Object> outputs = new LinkedHashMap<>();

    // Container width/height and loop/parallel settings
    @Builder.Default
    private Map<String, Object> data = new LinkedHashMap<>();

    public Object subBlockValue(String subBlockId) {
        SubBlock subBlock = subBlocks != null ? subBlocks.get(subBlockId) : null;
        return subBlock != null ? subBlock.getValue() : null;
    }

    public void setSubBlockValue(String subBlockId, Object value) {
        if (subBlocks == null) subBlocks = new LinkedHashMap<>();
        SubBlock existing = subBlocks.get(subBlockId);
        if (existing != null) {
            existing.setValue(value);
        } else {
            subBlocks.put(subBlockId, new SubBlock(subBlockId, "short-input", value));
        }
    }

    @JsonIgnore
    public boolean isContainer() {
        return type != null && type.isContainer();
    }

    @JsonIgnore
    public boolean hasParent() {
        return parentId != null && !parentId.isBlank();
    }

    public void clearParent() {
        parentId = null;
        extent = null;
    }

    /** Deep copy; parameter values and data maps are not shared with the original. */
    public Block copy() {
        Map<String, SubBlock> copiedSubBlocks = new LinkedHashMap<>();
        if (subBlocks != null) {
            subBlocks.forEach((key, sb) -> copiedSubBlocks.put(key, sb != null ? sb.copy() : null));
        }
        return toBuilder()
                .subBlocks(copiedSubBlocks)
                .outputs(Values.deepCopyMap(outputs))
                .data(Values.deepCopyMap(data))
                .build();
    }
}
