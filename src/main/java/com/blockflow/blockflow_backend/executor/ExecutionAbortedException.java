package com.blockflow.blockflow_backend.executor;

/** The execution channel was closed because the user cancelled the run. */
public class ExecutionAbortedException extends RuntimeException {

    public ExecutionAbortedException(String workflowId) {
        super("Execution aborted for workflow " + workflowId);
    }
}
