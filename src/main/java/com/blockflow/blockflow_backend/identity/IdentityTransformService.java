package com.blockflow.blockflow_backend.identity;

import com.blockflow.blockflow_backend.config.BlockflowProperties;
import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.domain.Container;
import com.blockflow.blockflow_backend.model.domain.Edge;
import com.blockflow.blockflow_backend.model.domain.Position;
import com.blockflow.blockflow_backend.model.domain.SubBlock;
import com.blockflow.blockflow_backend.model.graph.InvalidGraphException;
import com.blockflow.blockflow_backend.model.graph.NameNormalizer;
import com.blockflow.blockflow_backend.model.graph.Values;
import com.blockflow.blockflow_backend.model.graph.WorkflowGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Mints new block identities for whole-workflow copies, paste and duplicate, keeping names
 * unique and {@code <name.path>} references pointing at the renamed blocks.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IdentityTransformService {

    /** Values assigned by the trigger runtime that must not follow a block into a copy. */
    public static final Set<String> TRIGGER_RUNTIME_SUBBLOCK_IDS = Set.of("webhookId", "triggerPath");

    private static final double DEFAULT_CONTAINER_WIDTH = 400;
    private static final double CONTAINER_GAP = 50;

    private final BlockflowProperties properties;
    private final UniqueNameGenerator uniqueNameGenerator;

    public Position defaultDuplicateOffset() {
        BlockflowProperties.Identity identity = properties.getIdentity();
        return new Position(identity.getDuplicateOffsetX(), identity.getDuplicateOffsetY());
    }

    // ── Whole workflow ───────────────────────────────────────────────────────────

    public RegeneratedWorkflow regenerateWorkflowIds(WorkflowGraph graph) {
        return regenerateWorkflowIds(graph, true);
    }

    /**
     * Returns an isomorphic copy of {@code graph} in which every block and edge has a new id.
     * Names are kept as they are. A parent outside the graph is dropped along with the extent.
     */
    public RegeneratedWorkflow regenerateWorkflowIds(WorkflowGraph graph, boolean clearTriggerRuntimeValues) {
        Map<String, String> idMap = new LinkedHashMap<>();
        Map<String, Block> newBlocks = new LinkedHashMap<>();

        graph.getBlocks().forEach((oldId, block) -> {
            String newId = UUID.randomUUID().toString();
            idMap.put(oldId, newId);
            Block copy = block.copy();
            copy.setId(newId);
            newBlocks.put(newId, copy);
        });

        for (Block block : newBlocks.values()) {
            if (!block.hasParent()) continue;
            String newParentId = idMap.get(block.getParentId());
            if (newParentId != null) {
                block.setParentId(newParentId);
            } else {
                block.clearParent();
            }
        }
        if (clearTriggerRuntimeValues) {
            newBlocks.values().forEach(this::clearTriggerRuntimeValues);
        }

        WorkflowGraph regenerated = WorkflowGraph.builder()
                .blocks(newBlocks)
                .edges(remapEdges(graph.getEdges(), idMap))
                .loops(remapContainers(graph.getLoops(), idMap))
                .parallels(remapContainers(graph.getParallels(), idMap))
                .build();
        return new RegeneratedWorkflow(regenerated, idMap);
    }

    private void clearTriggerRuntimeValues(Block block) {
        if (block.getSubBlocks() == null) return;
        block.getSubBlocks().forEach((id, subBlock) -> {
            if (subBlock != null && TRIGGER_RUNTIME_SUBBLOCK_IDS.contains(id)) {
                subBlock.setValue(null);
            }
        });
    }

    // ── Paste / duplicate ────────────────────────────────────────────────────────

    /**
     * Regenerates ids for a set of copied blocks about to land in a target graph whose current
     * blocks are {@code existingBlocks}.
     * <p>
     * Positions: a block whose parent is also copied keeps its relative position; a block whose
     * parent already exists in the target gets the offset, unless the offset is larger than the
     * configured contained maximum, in which case the default duplicate offset is used; every
     * other block gets the full offset.
     * <p>
     * Parents: copied parent → its new id; existing unlocked parent → kept; anything else is
     * cleared. A locked container never receives new children.
     */
    public RegeneratedBlocks regenerateBlockIds(Map<String, Block> blocks,
                                                List<Edge> edges,
                                                Map<String, Container> loops,
                                                Map<String, Container> parallels,
                                                Map<String, Map<String, Object>> subBlockValues,
                                                Position positionOffset,
                                                Map<String, Block> existingBlocks,
                                                UniqueNameFunction uniqueNameFn) {
        Map<String, String> idMap = new LinkedHashMap<>();
        Map<String, String> nameMap = new LinkedHashMap<>();
        Map<String, Block> newBlocks = new LinkedHashMap<>();
        Map<String, Map<String, Object>> newSubBlockValues = new LinkedHashMap<>();
        List<Block> namingScope = new ArrayList<>(existingBlocks.values());

        for (Map.Entry<String, Block> entry : blocks.entrySet()) {
            String oldId = entry.getKey();
            Block block = entry.getValue();
            String newId = UUID.randomUUID().toString();
            idMap.put(oldId, newId);

            String newName = uniqueNameFn.uniqueName(block.getName(), block.getType(), namingScope);
            nameMap.put(NameNormalizer.normalize(block.getName()), NameNormalizer.normalize(newName));

            Block copy = block.copy();
            copy.setId(newId);
            copy.setName(newName);
            copy.setPosition(pastePosition(block, blocks, existingBlocks, positionOffset));
            newBlocks.put(newId, copy);
            namingScope.add(copy);

            Map<String, Object> values = subBlockValues != null ? subBlockValues.get(oldId) : null;
            if (values != null) {
                newSubBlockValues.put(newId, Values.deepCopyMap(values));
            }
        }

        for (Block block : newBlocks.values()) {
            if (!block.hasParent()) continue;
            String oldParentId = block.getParentId();
            String newParentId = idMap.get(oldParentId);
            Block existingParent = existingBlocks.get(oldParentId);
            if (newParentId != null) {
                block.setParentId(newParentId);
                block.setExtent(Block.EXTENT_PARENT);
            } else if (existingParent != null && !existingParent.isLocked()) {
                block.setExtent(Block.EXTENT_PARENT);
            } else {
                block.clearParent();
            }
        }

        for (Block block : newBlocks.values()) {
            rewriteSubBlockReferences(block, nameMap);
        }
        newSubBlockValues.values().forEach(values ->
                values.replaceAll((subBlockId, value) -> ReferenceRewriter.rewriteValue(value, nameMap)));

        return new RegeneratedBlocks(
                newBlocks,
                remapEdges(edges, idMap),
                remapContainers(loops, idMap),
                remapContainers(parallels, idMap),
                newSubBlockValues,
                idMap);
    }

    private Position pastePosition(Block block, Map<String, Block> copied,
                                   Map<String, Block> existing, Position offset) {
        Position position = block.getPosition() != null ? block.getPosition() : Position.ORIGIN;
        if (!block.hasParent()) {
            return position.offset(offset);
        }
        if (copied.containsKey(block.getParentId())) {
            return position;
        }
        Block existingParent = existing.get(block.getParentId());
        if (existingParent != null && !existingParent.isLocked()) {
            double max = properties.getIdentity().getMaxContainedOffset();
            boolean viewportSized = Math.abs(offset.x()) > max || Math.abs(offset.y()) > max;
            return position.offset(viewportSized ? defaultDuplicateOffset() : offset);
        }
        return position.offset(offset);
    }

    private void rewriteSubBlockReferences(Block block, Map<String, String> nameMap) {
        if (block.getSubBlocks() == null) return;
        for (SubBlock subBlock : block.getSubBlocks().values()) {
            if (subBlock != null && subBlock.getValue() != null) {
                subBlock.setValue(ReferenceRewriter.rewriteValue(subBlock.getValue(), nameMap));
            }
        }
    }

    /**
     * Pastes a copied fragment into {@code target}: regenerates ids against the target's blocks,
     * then inserts blocks and the edges whose endpoints both exist afterwards.
     */
    public RegeneratedBlocks paste(WorkflowGraph target, WorkflowGraph fragment,
                                   Map<String, Map<String, Object>> subBlockValues, Position positionOffset) {
        RegeneratedBlocks pasted = regenerateBlockIds(
                fragment.getBlocks(), fragment.getEdges(), fragment.getLoops(), fragment.getParallels(),
                subBlockValues, positionOffset, target.getBlocks(), uniqueNameGenerator);

        pasted.blocks().values().forEach(target::addBlock);
        for (Edge edge : pasted.edges()) {
            try {
                target.addEdge(edge);
            } catch (InvalidGraphException e) {
                log.warn("Skipping pasted edge {}: {}", edge.getId(), e.getMessage());
            }
        }
        pasted.subBlockValues().forEach((blockId, values) -> {
            Block block = target.requireBlock(blockId);
            values.forEach(block::setSubBlockValue);
        });
        target.rebuildContainers();
        log.info("Pasted {} blocks and {} edges", pasted.blocks().size(), pasted.edges().size());
        return pasted;
    }

    /**
     * Duplicates one block inside its graph. The copy is unlocked and drops trigger runtime
     * values. Inside a locked container the copy is placed to the right of the container and
     * detached from it; otherwise it sits at the default duplicate offset in the same parent.
     */
    public Block duplicateBlock(WorkflowGraph graph, String blockId) {
        Block source = graph.requireBlock(blockId);
        Block parent = source.hasParent() ? graph.getBlocks().get(source.getParentId()) : null;

        Block copy = source.copy();
        copy.setId(UUID.randomUUID().toString());
        copy.setName(uniqueNameGenerator.uniqueName(source.getName(), source.getType(), graph.getBlocks().values()));
        copy.setLocked(false);
        TRIGGER_RUNTIME_SUBBLOCK_IDS.forEach(copy.getSubBlocks()::remove);

        if (parent != null && parent.isLocked()) {
            Object width = parent.getData() != null ? parent.getData().get("width") : null;
            double containerWidth = width instanceof Number n ? n.doubleValue() : DEFAULT_CONTAINER_WIDTH;
            Position parentPosition = parent.getPosition() != null ? parent.getPosition() : Position.ORIGIN;
            copy.setPosition(new Position(parentPosition.x() + containerWidth + CONTAINER_GAP, parentPosition.y()));
            copy.clearParent();
        } else {
            Position position = source.getPosition() != null ? source.getPosition() : Position.ORIGIN;
            copy.setPosition(position.offset(defaultDuplicateOffset()));
        }

        graph.addBlock(copy);
        log.debug("Duplicated block {} as {} ({})", blockId, copy.getId(), copy.getName());
        return copy;
    }

    // ── Remapping helpers ────────────────────────────────────────────────────────

    private static List<Edge> remapEdges(List<Edge> edges, Map<String, String> idMap) {
        List<Edge> result = new ArrayList<>();
        if (edges == null) return result;
        for (Edge edge : edges) {
            Edge copy = edge.copy();
            copy.setId(UUID.randomUUID().toString());
            copy.setSource(idMap.getOrDefault(edge.getSource(), edge.getSource()));
            copy.setTarget(idMap.getOrDefault(edge.getTarget(), edge.getTarget()));
            result.add(copy);
        }
        return result;
    }

    private static Map<String, Container> remapContainers(Map<String, Container> containers, Map<String, String> idMap) {
        Map<String, Container> result = new LinkedHashMap<>();
        if (containers == null) return result;
        containers.forEach((oldId, container) -> {
            String newId = idMap.getOrDefault(oldId, oldId);
            Container copy = container.copy();
            copy.setId(newId);
            copy.setNodes(new ArrayList<>(container.getNodes().stream()
                    .map(node -> idMap.getOrDefault(node, node))
                    .toList()));
            result.put(newId, copy);
        });
        return result;
    }
}
