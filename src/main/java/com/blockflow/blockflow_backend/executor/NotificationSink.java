package com.blockflow.blockflow_backend.executor;

/** User-facing notifications raised by the orchestrator. */
@FunctionalInterface
public interface NotificationSink {

    void notify(String workflowId, String level, String message);
}
