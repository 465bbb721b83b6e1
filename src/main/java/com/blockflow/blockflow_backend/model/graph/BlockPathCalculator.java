package com.blockflow.blockflow_backend.model.graph;

import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.domain.Container;
import com.blockflow.blockflow_backend.model.domain.Edge;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Computes which blocks a given block may reference. A block can see everything upstream of it
 * over edges and, when it sits inside a loop or parallel, every member of each enclosing
 * container (and the container itself) even without a direct edge.
 */
public final class BlockPathCalculator {

    private BlockPathCalculator() {}

    /** All blocks with an edge path into {@code blockId}, excluding the block itself. */
    public static Set<String> ancestors(WorkflowGraph graph, String blockId) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(blockId);
        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (Edge edge : graph.incomingEdges(current)) {
                String source = edge.getSource();
                if (source != null && !source.equals(blockId) && visited.add(source)) {
                    queue.add(source);
                }
            }
        }
        return visited;
    }

    /**
     * Ancestors plus container closure: for each enclosing container, walked outwards, the
     * container id, its members other than {@code blockId}, and the container's own ancestors.
     */
    public static Set<String> accessibleBlockIds(WorkflowGraph graph, String blockId) {
        Set<String> accessible = new LinkedHashSet<>(ancestors(graph, blockId));
        Set<String> seenContainers = new LinkedHashSet<>();
        String parentId = graph.findBlock(blockId).map(Block::getParentId).orElse(null);
        while (parentId != null && seenContainers.add(parentId)) {
            accessible.add(parentId);
            graph.findContainer(parentId)
                    .map(Container::getNodes)
                    .ifPresent(accessible::addAll);
            String containerId = parentId;
            graph.getBlocks().values().stream()
                    .filter(b -> containerId.equals(b.getParentId()))
                    .forEach(b -> accessible.add(b.getId()));
            accessible.addAll(ancestors(graph, parentId));
            parentId = graph.findBlock(parentId).map(Block::getParentId).orElse(null);
        }
        accessible.remove(blockId);
        return accessible;
    }
}
