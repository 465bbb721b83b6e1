package com.blockflow.blockflow_backend.controller;

import com.blockflow.blockflow_backend.model.entity.WorkflowExecutionLog;
import com.blockflow.blockflow_backend.service.ExecutionLogService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/workflows/{workflowId}")
@RequiredArgsConstructor
public class ExecutionLogController {

    private final ExecutionLogService logService;

    // POST /api/workflows/{id}/log: written by LogPersistenceClient after each run
    @PostMapping("/log")
    public ResponseEntity<?> persist(@PathVariable String workflowId, @RequestBody LogRequest body) {
        if (body == null || body.executionId() == null || body.executionId().isBlank() || body.result() == null) {
            return ResponseEntity.badRequest().body(Map.of("error", "executionId and result are required"));
        }
        WorkflowExecutionLog saved = logService.record(workflowId, body.executionId(), body.result());
        return ResponseEntity.ok(Map.of("id", saved.getId().toString()));
    }

    @GetMapping("/logs")
    public List<LogSummary> history(@PathVariable String workflowId) {
        return logService.history(workflowId).stream()
                .map(l -> new LogSummary(l.getId().toString(), l.getExecutionId(), l.isSuccess(),
                        l.getErrorMessage(), l.getTotalDurationMs(),
                        l.getCreatedAt() != null ? l.getCreatedAt().toString() : null))
                .toList();
    }

    public record LogRequest(String executionId, Map<String, Object> result) {}

    public record LogSummary(String id, String executionId, boolean success, String error,
                             Long totalDurationMs, String createdAt) {}
}
