package com.blockflow.blockflow_backend.model.entity;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "workflow_execution_logs")
@Data
public class WorkflowExecutionLog {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "workflow_id", nullable = false)
    private String workflowId;

    @Column(name = "execution_id", nullable = false)
    private String executionId;

    private boolean success;

    @Column(name = "error_message", length = 4000)
    private String errorMessage;

    @Column(name = "total_duration_ms")
    private Long totalDurationMs;

    // Execution result enriched with trace spans
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "result")
    private Map<String, Object> result;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();
}
