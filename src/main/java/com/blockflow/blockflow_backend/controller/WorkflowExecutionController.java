package com.blockflow.blockflow_backend.controller;

import com.blockflow.blockflow_backend.console.ConsoleEntry;
import com.blockflow.blockflow_backend.console.ConsoleSink;
import com.blockflow.blockflow_backend.engine.ExecutionOrchestrator;
import com.blockflow.blockflow_backend.engine.chat.ChatExecutionService;
import com.blockflow.blockflow_backend.engine.chat.ChatRunRequest;
import com.blockflow.blockflow_backend.engine.state.ExecutionStateStore;
import com.blockflow.blockflow_backend.engine.state.WorkflowExecutionState;
import com.blockflow.blockflow_backend.executor.ChatFile;
import com.blockflow.blockflow_backend.executor.ExecutionResult;
import com.blockflow.blockflow_backend.snapshot.ExecutionSnapshot;
import com.blockflow.blockflow_backend.trigger.ExecutionMode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.time.Duration;
import java.util.Base64;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;

@Slf4j
@RestController
@RequestMapping("/api/workflows/{workflowId}")
public class WorkflowExecutionController {

    private static final long CHAT_TIMEOUT_MS = Duration.ofMinutes(30).toMillis();

    private final ExecutionOrchestrator orchestrator;
    private final ChatExecutionService chatExecutionService;
    private final ExecutionStateStore stateStore;
    private final ConsoleSink consoleSink;
    private final ExecutorService chatRunExecutor;

    public WorkflowExecutionController(ExecutionOrchestrator orchestrator,
                                       ChatExecutionService chatExecutionService,
                                       ExecutionStateStore stateStore,
                                       ConsoleSink consoleSink,
                                       @Qualifier("chatRunExecutor") ExecutorService chatRunExecutor) {
        this.orchestrator = orchestrator;
        this.chatExecutionService = chatExecutionService;
        this.stateStore = stateStore;
        this.consoleSink = consoleSink;
        this.chatRunExecutor = chatRunExecutor;
    }

    // POST /api/workflows/{id}/run: blocks until the run finishes or pauses
    @PostMapping("/run")
    public ResponseEntity<?> run(@PathVariable String workflowId,
                                 @RequestBody(required = false) RunRequest body) {
        RunRequest request = body != null ? body : new RunRequest(null, null, false);
        ExecutionMode mode;
        try {
            mode = request.mode() != null
                    ? ExecutionMode.valueOf(request.mode().trim().toUpperCase(Locale.ROOT))
                    : ExecutionMode.MANUAL;
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown execution mode: " + request.mode()));
        }
        return ResponseEntity.ok(orchestrator.run(workflowId, request.input(), mode, request.debug()));
    }

    // POST /api/workflows/{id}/chat: streams block output as server-sent events
    @PostMapping("/chat")
    public SseEmitter chat(@PathVariable String workflowId, @RequestBody ChatRequest body) {
        SseEmitter emitter = new SseEmitter(CHAT_TIMEOUT_MS);
        SseChatStreamSink sink = new SseChatStreamSink(emitter);

        Runnable disconnected = () -> {
            if (!sink.isClosed()) {
                sink.detach();
                log.info("Chat client of workflow {} disconnected, cancelling run", workflowId);
                orchestrator.cancel(workflowId);
            }
        };
        emitter.onTimeout(disconnected);
        emitter.onError(error -> disconnected.run());

        ChatRunRequest request = ChatRunRequest.builder()
                .message(body.message())
                .conversationId(body.conversationId())
                .selectedOutputs(body.selectedOutputs())
                .files(decodeFiles(body.files()))
                .uploadErrorListener(sink)
                .build();
        try {
            chatRunExecutor.execute(() -> chatExecutionService.run(workflowId, request, sink));
        } catch (RejectedExecutionException e) {
            emitter.completeWithError(e);
        }
        return emitter;
    }

    // ── Debug ────────────────────────────────────────────────────────────────

    @PostMapping("/step")
    public ExecutionResult step(@PathVariable String workflowId) {
        return orchestrator.step(workflowId);
    }

    @PostMapping("/resume")
    public ExecutionResult resume(@PathVariable String workflowId) {
        return orchestrator.resume(workflowId);
    }

    // ── Partial runs ─────────────────────────────────────────────────────────

    // POST /api/workflows/{id}/blocks/{blockId}/run-from: reuses the last snapshot for upstream outputs
    @PostMapping("/blocks/{blockId}/run-from")
    public ExecutionResult runFrom(@PathVariable String workflowId, @PathVariable String blockId,
                                   @RequestBody(required = false) Map<String, Object> body) {
        return orchestrator.runFromBlock(workflowId, blockId, body != null ? body.get("input") : null);
    }

    @PostMapping("/blocks/{blockId}/run-until")
    public ExecutionResult runUntil(@PathVariable String workflowId, @PathVariable String blockId,
                                    @RequestBody(required = false) Map<String, Object> body) {
        return orchestrator.runUntilBlock(workflowId, blockId, body != null ? body.get("input") : null);
    }

    @PostMapping("/cancel")
    public ResponseEntity<Void> cancel(@PathVariable String workflowId) {
        orchestrator.cancel(workflowId);
        return ResponseEntity.noContent().build();
    }

    // ── State ────────────────────────────────────────────────────────────────

    @GetMapping("/execution-state")
    public WorkflowExecutionState state(@PathVariable String workflowId) {
        return stateStore.getWorkflowExecution(workflowId);
    }

    @GetMapping("/snapshot")
    public ResponseEntity<ExecutionSnapshot> snapshot(@PathVariable String workflowId) {
        return stateStore.getLastExecutionSnapshot(workflowId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/console")
    public List<ConsoleEntry> console(@PathVariable String workflowId) {
        return consoleSink.entries(workflowId);
    }

    @DeleteMapping("/console")
    public ResponseEntity<Void> clearConsole(@PathVariable String workflowId) {
        consoleSink.clear(workflowId);
        return ResponseEntity.noContent().build();
    }

    private static List<ChatFile> decodeFiles(List<ChatFileUpload> uploads) {
        if (uploads == null) return List.of();
        return uploads.stream()
                .map(f -> new ChatFile(f.name(), f.contentType(), Base64.getDecoder().decode(f.data())))
                .toList();
    }

    // ── DTOs ─────────────────────────────────────────────────────────────────

    public record RunRequest(Object input, String mode, boolean debug) {}

    public record ChatRequest(String message, String conversationId, List<String> selectedOutputs,
                              List<ChatFileUpload> files) {}

    // data is base64
    public record ChatFileUpload(String name, String contentType, String data) {}
}
