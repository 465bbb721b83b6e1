package com.blockflow.blockflow_backend.engine.chat;

import com.blockflow.blockflow_backend.engine.ErrorMessages;
import com.blockflow.blockflow_backend.engine.ExecutionOrchestrator;
import com.blockflow.blockflow_backend.engine.RunOptions;
import com.blockflow.blockflow_backend.executor.ChatFile;
import com.blockflow.blockflow_backend.executor.ChatStreamSink;
import com.blockflow.blockflow_backend.executor.ExecutionMetadata;
import com.blockflow.blockflow_backend.executor.ExecutionResult;
import com.blockflow.blockflow_backend.executor.FileUploadClient;
import com.blockflow.blockflow_backend.trigger.ExecutionMode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClientException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;

/**
 * Runs a workflow from the chat panel: uploads attachments, streams block output into the
 * chat as it arrives, and ends the transcript with a final or cancelled event.
 */
@Slf4j
@Service
public class ChatExecutionService {

    private final ExecutionOrchestrator orchestrator;
    private final FileUploadClient fileUploadClient;
    private final ExecutorService drainExecutor;
    private final ObjectMapper objectMapper;

    public ChatExecutionService(ExecutionOrchestrator orchestrator,
                                FileUploadClient fileUploadClient,
                                @Qualifier("streamDrainExecutor") ExecutorService drainExecutor,
                                ObjectMapper objectMapper) {
        this.orchestrator = orchestrator;
        this.fileUploadClient = fileUploadClient;
        this.drainExecutor = drainExecutor;
        this.objectMapper = objectMapper;
    }

    /** Blocks until the run has ended and the sink received its last event; always closes the sink. */
    public ExecutionResult run(String workflowId, ChatRunRequest request, ChatStreamSink sink) {
        String executionId = UUID.randomUUID().toString();
        ChatTranscript transcript = new ChatTranscript(sink, drainExecutor, objectMapper, request.selectedOutputs());
        try {
            List<Map<String, Object>> uploaded = uploadFiles(workflowId, executionId, request);

            Map<String, Object> input = new LinkedHashMap<>();
            input.put("input", request.message());
            input.put("conversationId", request.conversationId());
            input.put("files", uploaded);

            ExecutionResult result = orchestrator.execute(workflowId, RunOptions.builder()
                    .mode(ExecutionMode.CHAT)
                    .input(input)
                    .executionId(executionId)
                    .selectedOutputs(request.selectedOutputs())
                    .streamListener(transcript)
                    .onBlockComplete(transcript::onBlockComplete)
                    .beforeFinalize(transcript::finish)
                    .build());

            if (result.isCancelled() || result.isAborted()) {
                transcript.cancel();
                transcript.awaitDrains();
                sink.cancelled(result);
                return result;
            }
            ExecutionResult finalResult = transcript.finish(result);
            sink.finalResult(finalResult);
            return finalResult;
        } catch (RuntimeException e) {
            log.error("Chat run of workflow {} failed", workflowId, e);
            transcript.awaitDrains();
            ExecutionResult failure = ExecutionResult.builder()
                    .success(false)
                    .error(ErrorMessages.normalize(e))
                    .logs(new ArrayList<>())
                    .metadata(ExecutionMetadata.builder().duration(0L).source(ExecutionMetadata.SOURCE_CHAT).build())
                    .build();
            sink.finalResult(failure);
            return failure;
        } finally {
            sink.close();
        }
    }

    /**
     * Uploads sequentially. A failed file is reported to the request's listener and skipped;
     * anything unexpected drops all attachments and the run continues without them.
     */
    private List<Map<String, Object>> uploadFiles(String workflowId, String executionId, ChatRunRequest request) {
        List<Map<String, Object>> uploaded = new ArrayList<>();
        if (request.files().isEmpty()) return uploaded;
        try {
            for (ChatFile file : request.files()) {
                try {
                    uploaded.add(fileUploadClient.upload(file, workflowId, executionId));
                } catch (FileUploadClient.FileUploadException | RestClientException e) {
                    log.error("Upload of {} for workflow {} failed: {}", file.name(), workflowId, e.getMessage());
                    if (request.uploadErrorListener() != null) {
                        request.uploadErrorListener().onUploadError(e.getMessage());
                    }
                }
            }
        } catch (RuntimeException e) {
            log.error("Unexpected error uploading chat files for workflow {}", workflowId, e);
            return new ArrayList<>();
        }
        log.debug("Uploaded {}/{} chat files for workflow {}", uploaded.size(), request.files().size(), workflowId);
        return uploaded;
    }
}
