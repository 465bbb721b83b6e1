package com.blockflow.blockflow_backend.executor;

/** Optional capability of a chat input: told about each attachment that failed to upload. */
@FunctionalInterface
public interface UploadErrorListener {

    void onUploadError(String message);
}
