package com.blockflow.blockflow_backend.model.graph;

import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.domain.BlockType;
import com.blockflow.blockflow_backend.model.domain.Container;
import com.blockflow.blockflow_backend.model.domain.ContainerKind;
import com.blockflow.blockflow_backend.model.domain.Edge;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A workflow's structure: blocks keyed by id, edges, and the loop/parallel containers
 * derived from block parentage. Mutated only through explicit operations.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class WorkflowGraph {

    @Builder.Default
    private Map<String, Block> blocks = new LinkedHashMap<>();

    @Builder.Default
    private List<Edge> edges = new ArrayList<>();

    @Builder.Default
    private Map<String, Container> loops = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Container> parallels = new LinkedHashMap<>();

    public static WorkflowGraph empty() {
        return WorkflowGraph.builder().build();
    }

    public Optional<Block> findBlock(String blockId) {
        return Optional.ofNullable(blockId != null ? blocks.get(blockId) : null);
    }

    public Block requireBlock(String blockId) {
        return findBlock(blockId).orElseThrow(() -> new BlockNotFoundException(blockId));
    }

    public boolean containsBlock(String blockId) {
        return blockId != null && blocks.containsKey(blockId);
    }

    public List<Edge> incomingEdges(String blockId) {
        return edges.stream().filter(e -> Objects.equals(e.getTarget(), blockId)).toList();
    }

    public List<Edge> outgoingEdges(String blockId) {
        return edges.stream().filter(e -> Objects.equals(e.getSource(), blockId)).toList();
    }

    public void addBlock(Block block) {
        if (block.getId() == null || block.getId().isBlank()) {
            block.setId(UUID.randomUUID().toString());
        }
        blocks.put(block.getId(), block);
        rebuildContainers();
    }

    /** Adds an edge after checking that both endpoints exist and the target is not a trigger. */
    public Edge addEdge(Edge edge) {
        String problem = edgeProblem(edge);
        if (problem != null) {
            throw new InvalidGraphException(problem);
        }
        if (edge.getId() == null || edge.getId().isBlank()) {
            edge.setId(UUID.randomUUID().toString());
        }
        edges.add(edge);
        return edge;
    }

    /** Removes a block with its edges; children of a removed container lose their parent. */
    public void removeBlock(String blockId) {
        if (blocks.remove(blockId) == null) return;
        edges.removeIf(e -> blockId.equals(e.getSource()) || blockId.equals(e.getTarget()));
        blocks.values().stream()
                .filter(b -> blockId.equals(b.getParentId()))
                .forEach(Block::clearParent);
        rebuildContainers();
    }

    /** Blocks that participate in execution: typed and not disabled. */
    @JsonIgnore
    public Map<String, Block> getExecutableBlocks() {
        Map<String, Block> result = new LinkedHashMap<>();
        blocks.forEach((id, block) -> {
            if (block != null && block.getType() != null && block.isEnabled()) {
                result.put(id, block);
            }
        });
        return result;
    }

    /** Recomputes loops and parallels from container blocks and their children's parentId. */
    public void rebuildContainers() {
        Map<String, Container> newLoops = new LinkedHashMap<>();
        Map<String, Container> newParallels = new LinkedHashMap<>();
        for (Block block : blocks.values()) {
            if (!block.isContainer()) continue;
            Container container = toContainer(block);
            if (block.getType() == BlockType.LOOP) {
                newLoops.put(block.getId(), container);
            } else {
                newParallels.put(block.getId(), container);
            }
        }
        this.loops = newLoops;
        this.parallels = newParallels;
    }

    private Container toContainer(Block block) {
        List<String> members = blocks.values().stream()
                .filter(b -> block.getId().equals(b.getParentId()))
                .map(Block::getId)
                .toList();
        Map<String, Object> data = block.getData() != null ? block.getData() : Map.of();
        ContainerKind kind = ContainerKind.of(block.getType());
        String modeKey = kind == ContainerKind.LOOP ? "loopType" : "parallelType";
        Object count = data.containsKey("count") ? data.get("count") : data.get("iterations");
        return Container.builder()
                .id(block.getId())
                .kind(kind)
                .nodes(new ArrayList<>(members))
                .mode(data.get(modeKey) != null ? data.get(modeKey).toString() : null)
                .count(count instanceof Number n ? n.intValue() : null)
                .collection(data.get("collection"))
                .build();
    }

    public Optional<Container> findContainer(String containerId) {
        Container loop = loops.get(containerId);
        if (loop != null) return Optional.of(loop);
        return Optional.ofNullable(parallels.get(containerId));
    }

    /** Structural problems: dangling edge endpoints, edges into triggers, broken parents. */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        for (Edge edge : edges) {
            String problem = edgeProblem(edge);
            if (problem != null) problems.add(problem);
        }
        for (Block block : blocks.values()) {
            if (!block.hasParent()) continue;
            Block parent = blocks.get(block.getParentId());
            if (parent == null) {
                problems.add("Block '" + block.getId() + "' references non-existent parent block '" + block.getParentId() + "'");
            } else if (!parent.isContainer()) {
                problems.add("Block '" + block.getId() + "' has parent '" + parent.getId() + "' which is not a loop or parallel");
            }
        }
        return problems;
    }

    private String edgeProblem(Edge edge) {
        if (!containsBlock(edge.getSource())) {
            return "Edge source '" + edge.getSource() + "' does not exist";
        }
        Block target = blocks.get(edge.getTarget());
        if (target == null) {
            return "Edge target '" + edge.getTarget() + "' does not exist";
        }
        if (target.getType() != null && target.getType().isTrigger()) {
            return "Trigger block '" + target.getName() + "' cannot have incoming connections";
        }
        return null;
    }

    /** Deep copy of blocks, edges and containers. */
    public WorkflowGraph copy() {
        Map<String, Block> copiedBlocks = new LinkedHashMap<>();
        blocks.forEach((id, block) -> copiedBlocks.put(id, block.copy()));
        Map<String, Container> copiedLoops = new LinkedHashMap<>();
        loops.forEach((id, c) -> copiedLoops.put(id, c.copy()));
        Map<String, Container> copiedParallels = new LinkedHashMap<>();
        parallels.forEach((id, c) -> copiedParallels.put(id, c.copy()));
        return WorkflowGraph.builder()
                .blocks(copiedBlocks)
                .edges(new ArrayList<>(edges.stream().map(Edge::copy).toList()))
                .loops(copiedLoops)
                .parallels(copiedParallels)
                .build();
    }
}
