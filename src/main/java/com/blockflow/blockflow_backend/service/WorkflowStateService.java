package com.blockflow.blockflow_backend.service;

import com.blockflow.blockflow_backend.model.entity.Workflow;
import com.blockflow.blockflow_backend.model.graph.WorkflowGraph;
import com.blockflow.blockflow_backend.repository.WorkflowRepository;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/** Loads and stores workflow graphs as JSON on the {@link Workflow} row. */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowStateService {

    private static final TypeReference<Map<String, Object>> JSON_OBJECT = new TypeReference<>() {};

    private final WorkflowRepository workflowRepository;
    private final ObjectMapper objectMapper;

    public Optional<WorkflowGraph> load(String workflowId) {
        return workflowRepository.findById(workflowId).map(this::toGraph);
    }

    public List<Workflow> list() {
        return workflowRepository.findAllByOrderByUpdatedAtDesc();
    }

    public Optional<Workflow> find(String workflowId) {
        return workflowRepository.findById(workflowId);
    }

    @Transactional
    public Workflow create(String name, String description, WorkflowGraph graph) {
        Workflow workflow = new Workflow();
        workflow.setId(UUID.randomUUID().toString());
        workflow.setName(name != null && !name.isBlank() ? name.trim() : "Untitled workflow");
        workflow.setDescription(description);
        workflow.setState(toJson(graph != null ? graph : WorkflowGraph.empty()));
        return workflowRepository.save(workflow);
    }

    /**
     * @throws IllegalArgumentException when no workflow with that id exists
     */
    @Transactional
    public void save(String workflowId, WorkflowGraph graph) {
        Workflow workflow = workflowRepository.findById(workflowId)
                .orElseThrow(() -> new IllegalArgumentException("Workflow not found: " + workflowId));
        workflow.setState(toJson(graph));
        workflowRepository.save(workflow);
        log.debug("Saved workflow {} ({} blocks, {} edges)", workflowId, graph.getBlocks().size(), graph.getEdges().size());
    }

    private WorkflowGraph toGraph(Workflow workflow) {
        if (workflow.getState() == null || workflow.getState().isEmpty()) {
            return WorkflowGraph.empty();
        }
        WorkflowGraph graph = objectMapper.convertValue(workflow.getState(), WorkflowGraph.class);
        graph.rebuildContainers();
        return graph;
    }

    private Map<String, Object> toJson(WorkflowGraph graph) {
        return objectMapper.convertValue(graph, JSON_OBJECT);
    }
}
