package com.blockflow.blockflow_backend.session;

import com.blockflow.blockflow_backend.model.graph.WorkflowGraph;
import com.blockflow.blockflow_backend.service.WorkflowStateService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/** Open workflow sessions, loaded from storage on first use. */
@Slf4j
@Component
@RequiredArgsConstructor
public class WorkflowSessionRegistry {

    private final WorkflowStateService workflowStateService;

    private final Map<String, WorkflowSession> sessions = new ConcurrentHashMap<>();

    /**
     * @throws WorkflowNotFoundException when the workflow is neither open nor stored
     */
    public WorkflowSession session(String workflowId) {
        return sessions.computeIfAbsent(workflowId, id -> {
            WorkflowGraph graph = workflowStateService.load(id)
                    .orElseThrow(() -> new WorkflowNotFoundException(id));
            log.info("Opened session for workflow {} ({} blocks)", id, graph.getBlocks().size());
            return new WorkflowSession(id, graph);
        });
    }

    public Optional<WorkflowSession> find(String workflowId) {
        return Optional.ofNullable(sessions.get(workflowId));
    }

    public WorkflowSession open(String workflowId, WorkflowGraph graph) {
        WorkflowSession session = new WorkflowSession(workflowId, graph);
        sessions.put(workflowId, session);
        return session;
    }

    public void close(String workflowId) {
        sessions.remove(workflowId);
    }
}
