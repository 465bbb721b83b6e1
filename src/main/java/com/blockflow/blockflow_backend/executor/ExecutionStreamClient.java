package com.blockflow.blockflow_backend.executor;

/**
 * Channel to the streaming executor. Both execute calls block until the executor reports
 * exactly one terminal event (completed, error or cancelled) to the listener.
 */
public interface ExecutionStreamClient {

    /**
     * @throws ExecutionAbortedException when the channel was closed by {@link #cancel(String)}
     * @throws ExecutionTransportException on any other transport failure
     */
    void execute(ExecuteRequest request, ExecutionEventListener listener);

    void executeFromBlock(ExecuteFromBlockRequest request, ExecutionEventListener listener);

    /** Best-effort abort of the channel currently open for {@code workflowId}. */
    void cancel(String workflowId);
}
