package com.blockflow.blockflow_backend.model.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum BlockType {
    // Triggers
    STARTER("starter", BlockCategory.TRIGGERS),              // legacy single start block
    START_TRIGGER("start_trigger", BlockCategory.TRIGGERS),
    INPUT_TRIGGER("input_trigger", BlockCategory.TRIGGERS),
    MANUAL_TRIGGER("manual_trigger", BlockCategory.TRIGGERS),
    CHAT_TRIGGER("chat_trigger", BlockCategory.TRIGGERS),
    API_TRIGGER("api_trigger", BlockCategory.TRIGGERS),
    WEBHOOK("webhook", BlockCategory.TRIGGERS),
    GENERIC_WEBHOOK("generic_webhook", BlockCategory.TRIGGERS),
    SCHEDULE("schedule", BlockCategory.TRIGGERS),

    // Core blocks
    AGENT("agent", BlockCategory.BLOCKS),
    API("api", BlockCategory.BLOCKS),
    FUNCTION("function", BlockCategory.BLOCKS),
    CONDITION("condition", BlockCategory.BLOCKS),
    ROUTER("router", BlockCategory.BLOCKS),
    EVALUATOR("evaluator", BlockCategory.BLOCKS),
    RESPONSE("response", BlockCategory.BLOCKS),
    SLACK("slack", BlockCategory.TOOLS),                    // can run in trigger mode

    // Containers
    LOOP("loop", BlockCategory.CONTAINERS),
    PARALLEL("parallel", BlockCategory.CONTAINERS);

    private final String key;
    private final BlockCategory category;

    BlockType(String key, BlockCategory category) {
        this.key = key;
        this.category = category;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    public BlockCategory getCategory() {
        return category;
    }

    public boolean isTrigger() {
        return category == BlockCategory.TRIGGERS;
    }

    public boolean isContainer() {
        return category == BlockCategory.CONTAINERS;
    }

    public static Optional<BlockType> fromKey(String key) {
        if (key == null || key.isBlank()) return Optional.empty();
        String trimmed = key.trim();
        return Arrays.stream(values())
                .filter(t -> t.key.equals(trimmed))
                .findFirst();
    }

    @JsonCreator
    public static BlockType fromJson(String key) {
        return fromKey(key)
                .orElseThrow(() -> new IllegalArgumentException("Unknown block type: " + key));
    }
}
