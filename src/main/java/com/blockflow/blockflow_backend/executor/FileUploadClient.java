package com.blockflow.blockflow_backend.executor;

import java.util.Map;

/** Uploads a chat attachment before the run and returns the stored file descriptor. */
public interface FileUploadClient {

    /**
     * @throws FileUploadException when the upload is rejected
     */
    Map<String, Object> upload(ChatFile file, String workflowId, String executionId);

    class FileUploadException extends RuntimeException {
        public FileUploadException(String message) {
            super(message);
        }
    }
}
