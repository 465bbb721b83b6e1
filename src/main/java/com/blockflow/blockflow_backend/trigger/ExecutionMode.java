package com.blockflow.blockflow_backend.trigger;

import java.util.List;

/**
 * Entry point of a run. Each mode accepts a fixed set of start paths, listed in rank order.
 */
public enum ExecutionMode {
    CHAT("Chat", List.of(StartBlockPath.UNIFIED, StartBlockPath.SPLIT_CHAT, StartBlockPath.LEGACY_STARTER)),
    MANUAL("Manual", List.of(
            StartBlockPath.UNIFIED,
            StartBlockPath.SPLIT_API,
            StartBlockPath.SPLIT_INPUT,
            StartBlockPath.SPLIT_MANUAL,
            StartBlockPath.SCHEDULE_TRIGGER,
            StartBlockPath.EXTERNAL_TRIGGER,
            StartBlockPath.LEGACY_STARTER)),
    API("API", List.of(StartBlockPath.UNIFIED, StartBlockPath.SPLIT_API, StartBlockPath.SPLIT_INPUT, StartBlockPath.LEGACY_STARTER));

    private final String displayName;
    private final List<StartBlockPath> priorities;

    ExecutionMode(String displayName, List<StartBlockPath> priorities) {
        this.displayName = displayName;
        this.priorities = priorities;
    }

    public List<StartBlockPath> getPriorities() {
        return priorities;
    }

    public boolean accepts(StartBlockPath path) {
        return priorities.contains(path);
    }

    public int rank(StartBlockPath path) {
        int index = priorities.indexOf(path);
        return index < 0 ? Integer.MAX_VALUE : index;
    }

    /** "Chat", "Manual", "API", as used in validation messages. */
    public String displayName() {
        return displayName;
    }
}
