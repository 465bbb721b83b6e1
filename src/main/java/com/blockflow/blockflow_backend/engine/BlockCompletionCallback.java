package com.blockflow.blockflow_backend.engine;

/** Hook run after a block's completion has been recorded. Failures are logged, not propagated. */
@FunctionalInterface
public interface BlockCompletionCallback {

    void onBlockComplete(String blockId, Object output) throws Exception;
}
