package com.blockflow.blockflow_backend.trigger;

/**
 * How a block can start a run. Determined by block type, falling back to trigger category or
 * trigger mode for blocks that only start runs when an external event arrives.
 */
public enum StartBlockPath {
    UNIFIED,            // start_trigger
    LEGACY_STARTER,     // starter, mode chosen through its startWorkflow value
    SPLIT_INPUT,        // input_trigger
    SPLIT_API,          // api_trigger
    SPLIT_CHAT,         // chat_trigger
    SPLIT_MANUAL,       // manual_trigger
    SCHEDULE_TRIGGER,   // schedule
    EXTERNAL_TRIGGER;   // webhooks, other trigger-category or trigger-mode blocks

    public boolean isLegacy() {
        return this == LEGACY_STARTER;
    }
}
