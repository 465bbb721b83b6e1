package com.blockflow.blockflow_backend.controller;

import com.blockflow.blockflow_backend.identity.RegeneratedBlocks;
import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.domain.BlockType;
import com.blockflow.blockflow_backend.model.domain.Edge;
import com.blockflow.blockflow_backend.model.domain.Position;
import com.blockflow.blockflow_backend.model.entity.Workflow;
import com.blockflow.blockflow_backend.model.graph.BlockPathCalculator;
import com.blockflow.blockflow_backend.model.graph.NameNormalizer;
import com.blockflow.blockflow_backend.model.graph.WorkflowGraph;
import com.blockflow.blockflow_backend.service.WorkflowEditService;
import com.blockflow.blockflow_backend.service.WorkflowStateService;
import com.blockflow.blockflow_backend.session.WorkflowSessionRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

@RestController
@RequestMapping("/api/workflows")
@RequiredArgsConstructor
public class WorkflowController {

    private final WorkflowStateService workflowStateService;
    private final WorkflowEditService editService;
    private final WorkflowSessionRegistry sessions;

    // GET /api/workflows: newest first
    @GetMapping
    public List<WorkflowSummary> list() {
        return workflowStateService.list().stream()
                .map(w -> new WorkflowSummary(w.getId(), w.getName(), w.getDescription(),
                        w.getUpdatedAt() != null ? w.getUpdatedAt().toString() : null))
                .toList();
    }

    @PostMapping
    public ResponseEntity<?> create(@RequestBody CreateWorkflowRequest body) {
        if (body == null || body.name() == null || body.name().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "name is required"));
        }
        Workflow created = workflowStateService.create(body.name(), body.description(), body.graph());
        return ResponseEntity.ok(new WorkflowSummary(created.getId(), created.getName(), created.getDescription(),
                created.getUpdatedAt().toString()));
    }

    // GET /api/workflows/{id}: the graph as currently open in the editor, parameter values applied
    @GetMapping("/{workflowId}")
    public WorkflowGraph getGraph(@PathVariable String workflowId) {
        return sessions.session(workflowId).executionGraph();
    }

    @PostMapping("/{workflowId}/duplicate")
    public WorkflowSummary duplicate(@PathVariable String workflowId,
                                     @RequestBody(required = false) Map<String, String> body) {
        Workflow copy = editService.duplicateWorkflow(workflowId, body != null ? body.get("name") : null);
        return new WorkflowSummary(copy.getId(), copy.getName(), copy.getDescription(),
                copy.getUpdatedAt().toString());
    }

    // ── Blocks ───────────────────────────────────────────────────────────────

    @PostMapping("/{workflowId}/blocks")
    public ResponseEntity<?> addBlock(@PathVariable String workflowId, @RequestBody AddBlockRequest body) {
        Optional<BlockType> type = BlockType.fromKey(body.type());
        if (type.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Unknown block type: " + body.type()));
        }
        Block block = editService.addBlock(workflowId, type.get(), body.name(), body.position(), body.parentId());
        return ResponseEntity.ok(block);
    }

    @DeleteMapping("/{workflowId}/blocks/{blockId}")
    public ResponseEntity<Void> removeBlock(@PathVariable String workflowId, @PathVariable String blockId) {
        editService.removeBlock(workflowId, blockId);
        return ResponseEntity.noContent().build();
    }

    @PatchMapping("/{workflowId}/blocks/{blockId}/name")
    public Block rename(@PathVariable String workflowId, @PathVariable String blockId,
                        @RequestBody Map<String, String> body) {
        return editService.renameBlock(workflowId, blockId, body.get("name"));
    }

    @PutMapping("/{workflowId}/blocks/{blockId}/subblocks/{subBlockId}")
    public ResponseEntity<Void> setSubBlockValue(@PathVariable String workflowId, @PathVariable String blockId,
                                                 @PathVariable String subBlockId,
                                                 @RequestBody(required = false) Map<String, Object> body) {
        editService.setSubBlockValue(workflowId, blockId, subBlockId, body != null ? body.get("value") : null);
        return ResponseEntity.noContent().build();
    }

    // GET /api/workflows/{id}/blocks/{blockId}/accessible: blocks whose outputs the block may reference
    @GetMapping("/{workflowId}/blocks/{blockId}/accessible")
    public List<ReferencePrefix> accessible(@PathVariable String workflowId, @PathVariable String blockId) {
        WorkflowGraph graph = sessions.session(workflowId).graph();
        graph.requireBlock(blockId);
        return BlockPathCalculator.accessibleBlockIds(graph, blockId).stream()
                .map(graph.getBlocks()::get)
                .filter(Objects::nonNull)
                .map(b -> new ReferencePrefix(b.getId(), b.getName(), NameNormalizer.normalize(b.getName())))
                .toList();
    }

    @PostMapping("/{workflowId}/blocks/{blockId}/duplicate")
    public Block duplicateBlock(@PathVariable String workflowId, @PathVariable String blockId) {
        return editService.duplicateBlock(workflowId, blockId);
    }

    // POST /api/workflows/{id}/paste: blocks copied from this or another workflow
    @PostMapping("/{workflowId}/paste")
    public PasteResponse paste(@PathVariable String workflowId, @RequestBody PasteRequest body) {
        RegeneratedBlocks pasted = editService.paste(workflowId, body.fragment(), body.subBlockValues(), body.offset());
        return new PasteResponse(pasted.idMap(), List.copyOf(pasted.blocks().keySet()));
    }

    // ── Edges ────────────────────────────────────────────────────────────────

    @PostMapping("/{workflowId}/edges")
    public Edge addEdge(@PathVariable String workflowId, @RequestBody AddEdgeRequest body) {
        return editService.addEdge(workflowId, body.source(), body.target(), body.sourceHandle(), body.targetHandle());
    }

    @DeleteMapping("/{workflowId}/edges/{edgeId}")
    public ResponseEntity<Void> removeEdge(@PathVariable String workflowId, @PathVariable String edgeId) {
        editService.removeEdge(workflowId, edgeId);
        return ResponseEntity.noContent().build();
    }

    // ── DTOs ─────────────────────────────────────────────────────────────────

    public record WorkflowSummary(String id, String name, String description, String updatedAt) {}

    public record CreateWorkflowRequest(String name, String description, WorkflowGraph graph) {}

    public record AddBlockRequest(String type, String name, Position position, String parentId) {}

    public record AddEdgeRequest(String source, String target, String sourceHandle, String targetHandle) {}

    public record PasteRequest(WorkflowGraph fragment,
                               Map<String, Map<String, Object>> subBlockValues,
                               Position offset) {}

    public record ReferencePrefix(String blockId, String name, String prefix) {}

    public record PasteResponse(Map<String, String> idMap, List<String> blockIds) {}
}
