package com.blockflow.blockflow_backend.engine.state;

import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Where a workflow's run is in its lifecycle. {@link #allowedTransitions()} is the complete
 * transition table; every phase change goes through {@link #requireTransitionTo(ExecutionPhase)}.
 */
public enum ExecutionPhase {
    IDLE,
    EXECUTING,
    AWAITING_STEP,   // paused debug session, waiting for step or resume
    STEPPING,
    RESUMING,
    COMPLETED,
    ERRORED,
    CANCELLED;

    private static final Map<ExecutionPhase, Set<ExecutionPhase>> TRANSITIONS = Map.of(
            IDLE, EnumSet.of(EXECUTING),
            EXECUTING, EnumSet.of(AWAITING_STEP, COMPLETED, ERRORED, CANCELLED),
            AWAITING_STEP, EnumSet.of(STEPPING, RESUMING, ERRORED, CANCELLED),
            STEPPING, EnumSet.of(AWAITING_STEP, COMPLETED, ERRORED, CANCELLED),
            RESUMING, EnumSet.of(COMPLETED, ERRORED, CANCELLED),
            COMPLETED, EnumSet.of(IDLE),
            ERRORED, EnumSet.of(IDLE),
            CANCELLED, EnumSet.of(IDLE));

    public Set<ExecutionPhase> allowedTransitions() {
        return TRANSITIONS.get(this);
    }

    public boolean canTransitionTo(ExecutionPhase next) {
        return allowedTransitions().contains(next);
    }

    public void requireTransitionTo(ExecutionPhase next) {
        if (!canTransitionTo(next)) {
            throw new IllegalStateException("Illegal execution phase transition " + this + " -> " + next);
        }
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == ERRORED || this == CANCELLED;
    }

    /** True while a run or a debug session is open. */
    public boolean isActive() {
        return this != IDLE && !isTerminal();
    }

    public boolean isDebugPhase() {
        return this == AWAITING_STEP || this == STEPPING || this == RESUMING;
    }
}
