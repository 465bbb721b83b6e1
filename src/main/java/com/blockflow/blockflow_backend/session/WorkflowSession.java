package com.blockflow.blockflow_backend.session;

import com.blockflow.blockflow_backend.model.graph.WorkflowGraph;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Everything the editor holds for one open workflow: its graph, parameter values and the run
 * in flight. Graph edits take the edit lock; at most one run is open at a time.
 */
public class WorkflowSession {

    private final String workflowId;
    private final SubBlockValueStore subBlockValues = new SubBlockValueStore();
    private final ReentrantLock editLock = new ReentrantLock();
    private final AtomicReference<ActiveRun> activeRun = new AtomicReference<>();

    private volatile WorkflowGraph graph;

    public WorkflowSession(String workflowId, WorkflowGraph graph) {
        this.workflowId = workflowId;
        this.graph = graph != null ? graph : WorkflowGraph.empty();
    }

    public String workflowId() {
        return workflowId;
    }

    public WorkflowGraph graph() {
        return graph;
    }

    public SubBlockValueStore subBlockValues() {
        return subBlockValues;
    }

    /** Graph with the stored parameter values applied, as handed to the executor. */
    public WorkflowGraph executionGraph() {
        return subBlockValues.mergeSubBlockValues(graph);
    }

    /** Applies {@code edit} to a copy of the graph and swaps it in only if the edit succeeds. */
    public WorkflowGraph edit(Consumer<WorkflowGraph> edit) {
        editLock.lock();
        try {
            WorkflowGraph working = graph.copy();
            edit.accept(working);
            graph = working;
            return working;
        } finally {
            editLock.unlock();
        }
    }

    public void replaceGraph(WorkflowGraph replacement) {
        editLock.lock();
        try {
            graph = replacement;
        } finally {
            editLock.unlock();
        }
    }

    /**
     * @throws IllegalStateException when another run is still open
     */
    public ActiveRun openRun(String executionId) {
        ActiveRun run = new ActiveRun(executionId);
        if (!activeRun.compareAndSet(null, run)) {
            throw new IllegalStateException("Workflow " + workflowId + " is already executing");
        }
        return run;
    }

    public void closeRun(ActiveRun run) {
        activeRun.compareAndSet(run, null);
    }

    public Optional<ActiveRun> activeRun() {
        return Optional.ofNullable(activeRun.get());
    }

    public boolean isCurrentRun(ActiveRun run) {
        return activeRun.get() == run;
    }
}
