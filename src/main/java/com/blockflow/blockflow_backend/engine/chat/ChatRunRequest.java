package com.blockflow.blockflow_backend.engine.chat;

import com.blockflow.blockflow_backend.executor.ChatFile;
import com.blockflow.blockflow_backend.executor.UploadErrorListener;
import lombok.Builder;

import java.util.List;

/**
 * A chat message to run a workflow with.
 *
 * @param selectedOutputs output ids ({@code blockId_path} or {@code blockId.path}) echoed into the chat
 * @param uploadErrorListener told about attachments that failed to upload, when present
 */
@Builder
public record ChatRunRequest(
        String message,
        String conversationId,
        List<ChatFile> files,
        List<String> selectedOutputs,
        UploadErrorListener uploadErrorListener
) {
    public ChatRunRequest {
        files = files != null ? List.copyOf(files) : List.of();
        selectedOutputs = selectedOutputs != null ? List.copyOf(selectedOutputs) : List.of();
    }
}
