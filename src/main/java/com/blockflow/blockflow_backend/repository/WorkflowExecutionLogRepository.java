package com.blockflow.blockflow_backend.repository;

import com.blockflow.blockflow_backend.model.entity.WorkflowExecutionLog;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface WorkflowExecutionLogRepository extends JpaRepository<WorkflowExecutionLog, UUID> {
    // Newest first, for the workflow's log panel
    List<WorkflowExecutionLog> findByWorkflowIdOrderByCreatedAtDesc(String workflowId);

    Optional<WorkflowExecutionLog> findFirstByWorkflowIdAndExecutionId(String workflowId, String executionId);
}
