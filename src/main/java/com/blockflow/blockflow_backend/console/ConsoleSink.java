package com.blockflow.blockflow_backend.console;

import java.util.List;

public interface ConsoleSink {

    ConsoleEntry add(ConsoleEntry entry);

    /** Applies {@code update} to the entry written for {@code blockId} in {@code executionId}. */
    void update(String workflowId, String blockId, String executionId, ConsoleUpdate update);

    /** Marks every still-running entry of the workflow as canceled. */
    void cancelRunningEntries(String workflowId);

    List<ConsoleEntry> entries(String workflowId);

    void clear(String workflowId);
}
