package com.blockflow.blockflow_backend.model.entity;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.Map;

@Entity
@Table(name = "workflows")
@Data
public class Workflow {

    // Opaque ids minted by the editor, not generated here
    @Id
    private String id;

    @Column(nullable = false)
    private String name;

    private String description;

    // Serialized WorkflowGraph: blocks, edges, loops, parallels
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "state")
    private Map<String, Object> state;

    @Column(name = "created_at")
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at")
    private Instant updatedAt = Instant.now();

    @PreUpdate
    public void onUpdate() {
        updatedAt = Instant.now();
    }
}
