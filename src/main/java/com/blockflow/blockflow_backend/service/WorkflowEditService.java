package com.blockflow.blockflow_backend.service;

import com.blockflow.blockflow_backend.document.ImportPolicy;
import com.blockflow.blockflow_backend.document.ImportResult;
import com.blockflow.blockflow_backend.document.WorkflowYamlExporter;
import com.blockflow.blockflow_backend.document.WorkflowYamlImporter;
import com.blockflow.blockflow_backend.engine.state.ExecutionStateStore;
import com.blockflow.blockflow_backend.identity.IdentityTransformService;
import com.blockflow.blockflow_backend.identity.ReferenceRewriter;
import com.blockflow.blockflow_backend.identity.RegeneratedBlocks;
import com.blockflow.blockflow_backend.identity.RegeneratedWorkflow;
import com.blockflow.blockflow_backend.identity.UniqueNameGenerator;
import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.domain.BlockRegistry;
import com.blockflow.blockflow_backend.model.domain.BlockType;
import com.blockflow.blockflow_backend.model.domain.Edge;
import com.blockflow.blockflow_backend.model.domain.Position;
import com.blockflow.blockflow_backend.model.domain.SourceHandle;
import com.blockflow.blockflow_backend.model.entity.Workflow;
import com.blockflow.blockflow_backend.model.graph.InvalidGraphException;
import com.blockflow.blockflow_backend.model.graph.NameNormalizer;
import com.blockflow.blockflow_backend.model.graph.WorkflowGraph;
import com.blockflow.blockflow_backend.session.WorkflowSession;
import com.blockflow.blockflow_backend.session.WorkflowSessionRegistry;
import com.blockflow.blockflow_backend.trigger.TriggerRules;
import com.blockflow.blockflow_backend.trigger.WorkflowValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Every change to a workflow's structure goes through here: the session's graph is edited
 * as a whole and saved afterwards.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowEditService {

    private final WorkflowSessionRegistry sessions;
    private final WorkflowStateService workflowStateService;
    private final ExecutionStateStore stateStore;
    private final BlockRegistry blockRegistry;
    private final UniqueNameGenerator uniqueNameGenerator;
    private final IdentityTransformService identityTransformService;
    private final WorkflowYamlImporter yamlImporter;
    private final WorkflowYamlExporter yamlExporter;

    // ── Blocks ───────────────────────────────────────────────────────────────

    /**
     * Adds a block of {@code type} with a unique name derived from {@code name} (or the type's
     * display name) and empty parameters.
     *
     * @throws WorkflowValidationException when the workflow already has a trigger of a
     *                                     single-instance kind
     */
    public Block addBlock(String workflowId, BlockType type, String name, Position position, String parentId) {
        WorkflowSession session = sessions.session(workflowId);
        Block[] added = new Block[1];
        session.edit(graph -> {
            if (TriggerRules.wouldViolateSingleInstance(graph.getBlocks().values(), type)) {
                throw new WorkflowValidationException("A workflow can only have one "
                        + blockRegistry.get(type).displayName() + " trigger");
            }
            String baseName = name != null && !name.isBlank() ? name : blockRegistry.get(type).displayName();
            Block block = Block.builder()
                    .id(UUID.randomUUID().toString())
                    .type(type)
                    .name(uniqueNameGenerator.uniqueName(baseName, type, graph.getBlocks().values()))
                    .position(position != null ? position : Position.ORIGIN)
                    .subBlocks(blockRegistry.emptySubBlocks(type))
                    .build();
            if (parentId != null) {
                attachToParent(graph, block, parentId);
            }
            graph.addBlock(block);
            added[0] = block;
        });
        save(session);
        log.info("Added {} block {} ({}) to workflow {}", type.getKey(), added[0].getId(), added[0].getName(), workflowId);
        return added[0];
    }

    public void removeBlock(String workflowId, String blockId) {
        WorkflowSession session = sessions.session(workflowId);
        session.edit(graph -> {
            graph.requireBlock(blockId);
            graph.removeBlock(blockId);
        });
        session.subBlockValues().removeBlock(blockId);
        save(session);
        log.info("Removed block {} from workflow {}", blockId, workflowId);
    }

    /**
     * Renames a block and rewrites every {@code <oldName.path>} reference to it.
     *
     * @throws InvalidGraphException when another block already uses the normalized name
     */
    public Block renameBlock(String workflowId, String blockId, String newName) {
        if (newName == null || newName.isBlank()) {
            throw new InvalidGraphException("Block name must not be blank");
        }
        WorkflowSession session = sessions.session(workflowId);
        Block[] renamed = new Block[1];
        Map<String, String> nameMap = new HashMap<>();
        session.edit(graph -> {
            Block block = graph.requireBlock(blockId);
            String normalized = NameNormalizer.normalize(newName);
            boolean taken = graph.getBlocks().values().stream()
                    .anyMatch(other -> !other.getId().equals(blockId)
                            && Objects.equals(NameNormalizer.normalize(other.getName()), normalized));
            if (taken) {
                throw new InvalidGraphException("A block named '" + newName + "' already exists");
            }
            String oldNormalized = NameNormalizer.normalize(block.getName());
            block.setName(newName.trim());
            if (!oldNormalized.equals(normalized)) {
                nameMap.put(oldNormalized, normalized);
                for (Block other : graph.getBlocks().values()) {
                    if (other.getSubBlocks() == null) continue;
                    other.getSubBlocks().values().forEach(subBlock -> {
                        if (subBlock != null && subBlock.getValue() != null) {
                            subBlock.setValue(ReferenceRewriter.rewriteValue(subBlock.getValue(), nameMap));
                        }
                    });
                }
            }
            renamed[0] = block;
        });
        if (!nameMap.isEmpty()) {
            for (String id : session.graph().getBlocks().keySet()) {
                session.subBlockValues().blockValues(id).forEach((subBlockId, value) ->
                        session.subBlockValues().set(id, subBlockId, ReferenceRewriter.rewriteValue(value, nameMap)));
            }
        }
        save(session);
        return renamed[0];
    }

    public void setSubBlockValue(String workflowId, String blockId, String subBlockId, Object value) {
        WorkflowSession session = sessions.session(workflowId);
        session.graph().requireBlock(blockId);
        session.subBlockValues().set(blockId, subBlockId, value);
        save(session);
    }

    public Block duplicateBlock(String workflowId, String blockId) {
        WorkflowSession session = sessions.session(workflowId);
        Block[] copy = new Block[1];
        session.edit(graph -> {
            Block source = graph.requireBlock(blockId);
            if (TriggerRules.wouldViolateSingleInstance(graph.getBlocks().values(), source.getType())) {
                throw new WorkflowValidationException("A workflow can only have one "
                        + blockRegistry.get(source.getType()).displayName() + " trigger",
                        blockId, source.getType().getKey(), source.getName());
            }
            copy[0] = identityTransformService.duplicateBlock(graph, blockId);
        });
        // The copy carries the source's current parameter values
        session.subBlockValues().blockValues(blockId).forEach((subBlockId, value) -> {
            if (!IdentityTransformService.TRIGGER_RUNTIME_SUBBLOCK_IDS.contains(subBlockId)) {
                session.subBlockValues().set(copy[0].getId(), subBlockId, value);
            }
        });
        save(session);
        return copy[0];
    }

    /**
     * Pastes a copied fragment with fresh ids and names. Edges whose endpoints do not survive
     * are skipped.
     */
    public RegeneratedBlocks paste(String workflowId, WorkflowGraph fragment,
                                   Map<String, Map<String, Object>> subBlockValues, Position offset) {
        WorkflowSession session = sessions.session(workflowId);
        RegeneratedBlocks[] pasted = new RegeneratedBlocks[1];
        session.edit(graph -> pasted[0] = identityTransformService.paste(graph, fragment,
                subBlockValues != null ? subBlockValues : Map.of(),
                offset != null ? offset : identityTransformService.defaultDuplicateOffset()));
        pasted[0].subBlockValues().forEach((blockId, values) ->
                values.forEach((subBlockId, value) -> session.subBlockValues().set(blockId, subBlockId, value)));
        save(session);
        return pasted[0];
    }

    // ── Edges ────────────────────────────────────────────────────────────────

    /**
     * @throws InvalidGraphException when an endpoint is missing or the target is a trigger
     */
    public Edge addEdge(String workflowId, String source, String target, String sourceHandle, String targetHandle) {
        WorkflowSession session = sessions.session(workflowId);
        Edge edge = Edge.builder()
                .source(source)
                .target(target)
                .sourceHandle(sourceHandle != null ? sourceHandle : SourceHandle.SOURCE.getHandle())
                .targetHandle(targetHandle != null ? targetHandle : SourceHandle.TARGET_HANDLE)
                .build();
        session.edit(graph -> graph.addEdge(edge));
        save(session);
        return edge;
    }

    public void removeEdge(String workflowId, String edgeId) {
        WorkflowSession session = sessions.session(workflowId);
        session.edit(graph -> graph.getEdges().removeIf(e -> Objects.equals(e.getId(), edgeId)));
        save(session);
    }

    // ── Documents ────────────────────────────────────────────────────────────

    /**
     * Imports workflow YAML into the open workflow. A failed import leaves the workflow
     * untouched; a successful one replaces its graph, parameter values and last snapshot.
     */
    public ImportResult importYaml(String workflowId, String yaml, ImportPolicy policy) {
        WorkflowSession session = sessions.session(workflowId);
        ImportResult result = yamlImporter.importYaml(yaml, policy, session.executionGraph());
        if (!result.success()) {
            log.warn("YAML import into workflow {} failed: {}", workflowId, result.errors());
            return result;
        }
        session.replaceGraph(result.graph());
        session.subBlockValues().clear();
        if (result.subBlockValues() != null) {
            session.subBlockValues().setAll(result.subBlockValues());
        }
        stateStore.clearLastExecutionSnapshot(workflowId);
        save(session);
        log.info("Imported YAML into workflow {}: {}", workflowId, result.summary());
        return result;
    }

    public String exportYaml(String workflowId) {
        return yamlExporter.export(sessions.session(workflowId).executionGraph());
    }

    /** Stores a copy of the workflow under a new id, with fresh block ids and trigger runtime values cleared. */
    public Workflow duplicateWorkflow(String workflowId, String name) {
        WorkflowSession session = sessions.session(workflowId);
        RegeneratedWorkflow copy = identityTransformService.regenerateWorkflowIds(session.executionGraph(), true);
        String copyName = name != null && !name.isBlank() ? name
                : workflowStateService.find(workflowId).map(w -> w.getName() + " (copy)").orElse("Workflow copy");
        Workflow created = workflowStateService.create(copyName, null, copy.graph());
        log.info("Duplicated workflow {} as {} ({} blocks)", workflowId, created.getId(), copy.idMap().size());
        return created;
    }

    // ── Internals ────────────────────────────────────────────────────────────

    private void attachToParent(WorkflowGraph graph, Block block, String parentId) {
        Block parent = graph.requireBlock(parentId);
        if (!parent.isContainer()) {
            throw new InvalidGraphException("Block '" + parent.getName() + "' is not a loop or parallel");
        }
        if (parent.isLocked()) {
            throw new InvalidGraphException("Container '" + parent.getName() + "' is locked");
        }
        if (block.getType().isTrigger()) {
            throw new InvalidGraphException("Trigger blocks cannot be placed inside a container");
        }
        block.setParentId(parentId);
        block.setExtent(Block.EXTENT_PARENT);
    }

    private void save(WorkflowSession session) {
        workflowStateService.save(session.workflowId(), session.executionGraph());
    }
}
