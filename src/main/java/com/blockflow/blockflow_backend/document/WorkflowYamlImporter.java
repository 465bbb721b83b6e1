package com.blockflow.blockflow_backend.document;

import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.domain.BlockDescriptor;
import com.blockflow.blockflow_backend.model.domain.BlockRegistry;
import com.blockflow.blockflow_backend.model.domain.BlockType;
import com.blockflow.blockflow_backend.model.domain.Edge;
import com.blockflow.blockflow_backend.model.domain.Position;
import com.blockflow.blockflow_backend.model.domain.SubBlock;
import com.blockflow.blockflow_backend.model.graph.InvalidGraphException;
import com.blockflow.blockflow_backend.model.graph.Values;
import com.blockflow.blockflow_backend.model.graph.WorkflowGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Builds a {@link WorkflowGraph} from workflow YAML.
 * <p>
 * Structural problems (bad YAML, missing type or name, unknown block type) fail the import.
 * References to blocks that are not in the document are reported as warnings: the edge or the
 * parent relationship is dropped and the import carries on.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WorkflowYamlImporter {

    static final double CONTAINER_WIDTH = 500;
    static final double CONTAINER_HEIGHT = 300;

    private final WorkflowYamlParser parser;
    private final ConditionInputs conditionInputs;
    private final BlockRegistry blockRegistry;

    /**
     * @param existing the graph currently open in the editor; only read under {@link ImportPolicy#MERGE}
     */
    public ImportResult importYaml(String yamlContent, ImportPolicy policy, WorkflowGraph existing) {
        WorkflowYamlParser.Result parsed = parser.parse(yamlContent);
        if (!parsed.isValid()) {
            return ImportResult.failed(parsed.errors(), List.of());
        }

        Map<String, YamlBlock> yamlBlocks = parsed.document().getBlocks();
        String existingStartId = policy == ImportPolicy.MERGE ? findStartBlockId(existing) : null;
        if (policy == ImportPolicy.MERGE) {
            yamlBlocks = mergeStartBlocks(yamlBlocks, existingStartId);
        }

        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        validateBlockTypes(yamlBlocks, errors, warnings);

        List<Edge> parsedEdges = new ArrayList<>();
        yamlBlocks.forEach((blockId, block) -> {
            ParsedConnections connections = BlockConnections.parse(blockId, block.getConnections());
            parsedEdges.addAll(connections.edges());
            errors.addAll(connections.errors());
            warnings.addAll(connections.warnings());
        });
        if (!errors.isEmpty()) {
            return ImportResult.failed(errors, warnings);
        }

        Map<String, Position> positions = WorkflowLayoutCalculator.calculate(yamlBlocks.keySet(), parsedEdges);
        List<String> order = sortParentsFirst(yamlBlocks);
        Map<String, String> idMap = createIdMapping(order, yamlBlocks, policy, existingStartId);

        WorkflowGraph graph = WorkflowGraph.empty();
        Map<String, Map<String, Object>> subBlockValues = new LinkedHashMap<>();
        for (String yamlId : order) {
            YamlBlock yamlBlock = yamlBlocks.get(yamlId);
            String actualId = idMap.get(yamlId);
            Block block = toBlock(yamlId, actualId, yamlBlock, positions.getOrDefault(yamlId, new Position(100, 100)));
            if (!block.isContainer()) {
                subBlockValues.put(actualId, Values.deepCopyMap(inputsOf(yamlId, yamlBlock)));
            }
            String yamlParent = yamlBlock.getParentId();
            if (yamlParent != null) {
                String mappedParent = idMap.get(yamlParent);
                if (mappedParent != null) {
                    block.setParentId(mappedParent);
                    block.setExtent(Block.EXTENT_PARENT);
                } else {
                    warnings.add("Block '" + yamlId + "' references non-existent parent block '" + yamlParent + "'");
                    log.warn("Parent block not found for mapping: {}", yamlParent);
                }
            }
            graph.getBlocks().put(actualId, block);
        }

        for (Edge edge : parsedEdges) {
            String source = idMap.get(edge.getSource());
            String target = idMap.get(edge.getTarget());
            if (source == null || target == null) {
                warnings.add("Block '" + edge.getSource() + "' references non-existent target block '" + edge.getTarget() + "'");
                log.warn("Skipping edge - missing blocks: {} -> {}", edge.getSource(), edge.getTarget());
                continue;
            }
            try {
                graph.addEdge(edge.toBuilder().id(UUID.randomUUID().toString()).source(source).target(target).build());
            } catch (InvalidGraphException e) {
                warnings.add(e.getMessage());
                log.warn("Skipping edge {} -> {}: {}", edge.getSource(), edge.getTarget(), e.getMessage());
            }
        }
        graph.rebuildContainers();

        long starterCount = graph.getBlocks().values().stream().filter(b -> b.getType() == BlockType.STARTER).count();
        int total = graph.getBlocks().size();
        String summary = "Successfully replaced workflow with " + yamlBlocks.size() + " blocks from YAML. "
                + "Workflow now has " + total + " blocks (" + starterCount + " starter, " + (total - starterCount)
                + " new) and " + graph.getEdges().size() + " connections.";
        log.info("YAML import ({}) built {} blocks and {} edges", policy, total, graph.getEdges().size());
        return new ImportResult(true, List.of(), List.copyOf(warnings), graph, subBlockValues, summary);
    }

    private static String findStartBlockId(WorkflowGraph existing) {
        if (existing == null) return null;
        return existing.getBlocks().values().stream()
                .filter(b -> b.getType() == BlockType.STARTER)
                .map(Block::getId)
                .findFirst()
                .orElse(null);
    }

    /**
     * Folds all starter blocks of the document into one keyed by the open graph's start block id
     * (or the first document starter). Inputs and connections are unioned, later ones winning;
     * connections pointing at a removed starter are retargeted to the survivor.
     */
    Map<String, YamlBlock> mergeStartBlocks(Map<String, YamlBlock> blocks, String existingStartId) {
        List<String> starterIds = blocks.entrySet().stream()
                .filter(e -> BlockType.STARTER.getKey().equals(e.getValue().getType()))
                .map(Map.Entry::getKey)
                .toList();
        if (starterIds.isEmpty()) return blocks;

        String targetId = existingStartId != null ? existingStartId : starterIds.get(0);
        Map<String, Object> mergedInputs = new LinkedHashMap<>();
        Map<String, Object> mergedConnections = new LinkedHashMap<>();
        String mergedName = "Start";
        for (String id : starterIds) {
            YamlBlock starter = blocks.get(id);
            mergedInputs.putAll(starter.getInputs());
            mergedConnections.putAll(starter.getConnections());
            if (starter.getName() != null && !starter.getName().equals("Start")) {
                mergedName = starter.getName();
            }
        }

        Set<String> removed = new HashSet<>(starterIds);
        removed.remove(targetId);

        Map<String, YamlBlock> reconciled = new LinkedHashMap<>();
        blocks.forEach((id, block) -> {
            if (!starterIds.contains(id)) reconciled.put(id, block);
        });
        reconciled.put(targetId, YamlBlock.builder()
                .type(BlockType.STARTER.getKey())
                .name(mergedName)
                .inputs(mergedInputs)
                .connections(mergedConnections)
                .build());

        if (!removed.isEmpty()) {
            reconciled.replaceAll((id, block) -> block.toBuilder()
                    .connections(retarget(block.getConnections(), removed, targetId))
                    .build());
        }
        return reconciled;
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> retarget(Map<String, Object> connections, Set<String> removed, String targetId) {
        return (Map<String, Object>) Values.transform(connections, s -> removed.contains(s) ? targetId : s);
    }

    private void validateBlockTypes(Map<String, YamlBlock> blocks, List<String> errors, List<String> warnings) {
        blocks.forEach((blockId, block) -> {
            BlockDescriptor descriptor = blockRegistry.find(block.getType()).orElse(null);
            if (descriptor == null) {
                errors.add("Unknown block type '" + block.getType() + "' for block '" + blockId + "'");
                return;
            }
            if (descriptor.type().isContainer()) return;
            block.getInputs().keySet().stream()
                    .filter(key -> !descriptor.hasSubBlock(key))
                    .forEach(key -> warnings.add("Block '" + blockId + "' has unknown input '" + key
                            + "' for type '" + block.getType() + "'"));
        });
    }

    /** Parents before children; a parent cycle is cut where processing order first re-enters it. */
    List<String> sortParentsFirst(Map<String, YamlBlock> blocks) {
        List<String> sorted = new ArrayList<>();
        Set<String> processed = new HashSet<>();
        Set<String> visiting = new HashSet<>();
        for (String id : blocks.keySet()) {
            visit(id, blocks, sorted, processed, visiting);
        }
        return sorted;
    }

    private void visit(String id, Map<String, YamlBlock> blocks, List<String> sorted,
                       Set<String> processed, Set<String> visiting) {
        if (processed.contains(id)) return;
        if (visiting.contains(id)) {
            log.warn("Circular parent-child dependency detected for block {}, breaking cycle", id);
            sorted.add(id);
            processed.add(id);
            return;
        }
        visiting.add(id);
        String parentId = blocks.get(id).getParentId();
        if (parentId != null && blocks.containsKey(parentId) && !processed.contains(parentId)) {
            visit(parentId, blocks, sorted, processed, visiting);
        }
        visiting.remove(id);
        if (processed.add(id)) {
            sorted.add(id);
        }
    }

    private static Map<String, String> createIdMapping(List<String> order, Map<String, YamlBlock> blocks,
                                                       ImportPolicy policy, String existingStartId) {
        Map<String, String> idMap = new LinkedHashMap<>();
        for (String yamlId : order) {
            boolean keepStart = policy == ImportPolicy.MERGE
                    && existingStartId != null
                    && BlockType.STARTER.getKey().equals(blocks.get(yamlId).getType());
            idMap.put(yamlId, keepStart ? existingStartId : UUID.randomUUID().toString());
        }
        return idMap;
    }

    private Map<String, Object> inputsOf(String yamlId, YamlBlock yamlBlock) {
        if (BlockType.CONDITION.getKey().equals(yamlBlock.getType())) {
            return conditionInputs.expand(yamlId, yamlBlock.getInputs());
        }
        return yamlBlock.getInputs();
    }

    private Block toBlock(String yamlId, String actualId, YamlBlock yamlBlock, Position position) {
        BlockDescriptor descriptor = blockRegistry.find(yamlBlock.getType())
                .orElseThrow(() -> new IllegalStateException("Unvalidated block type: " + yamlBlock.getType()));
        BlockType type = descriptor.type();

        Block block = Block.builder()
                .id(actualId)
                .type(type)
                .name(yamlBlock.getName())
                .position(position)
                .build();

        if (type.isContainer()) {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("width", CONTAINER_WIDTH);
            data.put("height", CONTAINER_HEIGHT);
            data.put("type", type == BlockType.LOOP ? "loopNode" : "parallelNode");
            data.putAll(Values.deepCopyMap(yamlBlock.getInputs()));
            block.setData(data);
            return block;
        }

        Map<String, SubBlock> subBlocks = blockRegistry.emptySubBlocks(type);
        Map<String, Object> inputs = inputsOf(yamlId, yamlBlock);
        inputs.forEach((key, value) -> {
            SubBlock subBlock = subBlocks.computeIfAbsent(key, k -> new SubBlock(k, "short-input", null));
            if (value != null) {
                subBlock.setValue(Values.deepCopy(value));
            }
        });
        block.setSubBlocks(subBlocks);
        block.setOutputs(Values.deepCopyMap(descriptor.outputs()));
        return block;
    }
}
