package com.blockflow.blockflow_backend.session;

import java.util.concurrent.atomic.AtomicBoolean;

/** The run currently open in a session; cancellation is cooperative through {@link #cancel()}. */
public final class ActiveRun {

    private final String executionId;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public ActiveRun(String executionId) {
        this.executionId = executionId;
    }

    public String executionId() {
        return executionId;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
