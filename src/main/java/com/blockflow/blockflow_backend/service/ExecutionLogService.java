package com.blockflow.blockflow_backend.service;

import com.blockflow.blockflow_backend.model.entity.WorkflowExecutionLog;
import com.blockflow.blockflow_backend.repository.WorkflowExecutionLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;

/** Stores the results handed over by {@link LogPersistenceClient}. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExecutionLogService {

    private final WorkflowExecutionLogRepository logRepository;

    /** Writing the same execution twice replaces the earlier row. */
    @Transactional
    public WorkflowExecutionLog record(String workflowId, String executionId, Map<String, Object> result) {
        WorkflowExecutionLog entry = logRepository.findFirstByWorkflowIdAndExecutionId(workflowId, executionId)
                .orElseGet(WorkflowExecutionLog::new);
        entry.setWorkflowId(workflowId);
        entry.setExecutionId(executionId);
        entry.setResult(result);
        entry.setSuccess(Boolean.TRUE.equals(result.get("success")));
        Object error = result.get("error");
        entry.setErrorMessage(error != null ? truncate(error.toString()) : null);
        Object totalDuration = result.get("totalDuration");
        entry.setTotalDurationMs(totalDuration instanceof Number n ? n.longValue() : null);
        WorkflowExecutionLog saved = logRepository.save(entry);
        log.info("Stored execution log {} for workflow {} (success={})", executionId, workflowId, saved.isSuccess());
        return saved;
    }

    public List<WorkflowExecutionLog> history(String workflowId) {
        return logRepository.findByWorkflowIdOrderByCreatedAtDesc(workflowId);
    }

    private static String truncate(String message) {
        return message.length() > 4000 ? message.substring(0, 4000) : message;
    }
}
