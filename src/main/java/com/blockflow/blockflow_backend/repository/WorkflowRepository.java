package com.blockflow.blockflow_backend.repository;

import com.blockflow.blockflow_backend.model.entity.Workflow;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface WorkflowRepository extends JpaRepository<Workflow, String> {
    List<Workflow> findAllByOrderByUpdatedAtDesc();
}
