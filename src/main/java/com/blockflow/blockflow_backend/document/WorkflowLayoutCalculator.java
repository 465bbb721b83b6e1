package com.blockflow.blockflow_backend.document;

import com.blockflow.blockflow_backend.model.domain.Edge;
import com.blockflow.blockflow_backend.model.domain.Position;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Layered left-to-right layout for imported blocks. Roots (no incoming edge) form the first
 * layer, each BFS level the next one; unreachable blocks share a final layer.
 */
public final class WorkflowLayoutCalculator {

    static final double HORIZONTAL_SPACING = 600;
    static final double VERTICAL_SPACING = 200;
    static final double START_X = 150;
    static final double START_Y = 300;

    private WorkflowLayoutCalculator() {}

    public static Map<String, Position> calculate(Collection<String> blockIds, List<Edge> edges) {
        List<String> ids = new ArrayList<>(blockIds);
        Set<String> withIncoming = new HashSet<>();
        Map<String, List<String>> outgoing = new LinkedHashMap<>();
        for (Edge edge : edges) {
            withIncoming.add(edge.getTarget());
            outgoing.computeIfAbsent(edge.getSource(), k -> new ArrayList<>()).add(edge.getTarget());
        }

        Deque<String> queue = new ArrayDeque<>();
        ids.stream().filter(id -> !withIncoming.contains(id)).forEach(queue::add);
        if (queue.isEmpty() && !ids.isEmpty()) {
            queue.add(ids.get(0));
        }

        List<List<String>> layers = new ArrayList<>();
        Set<String> visited = new LinkedHashSet<>();
        while (!queue.isEmpty()) {
            List<String> layer = new ArrayList<>();
            int size = queue.size();
            for (int i = 0; i < size; i++) {
                String id = queue.poll();
                if (!visited.add(id)) continue;
                layer.add(id);
                for (String next : outgoing.getOrDefault(id, List.of())) {
                    if (!visited.contains(next) && ids.contains(next)) queue.add(next);
                }
            }
            if (!layer.isEmpty()) layers.add(layer);
        }
        List<String> remaining = ids.stream().filter(id -> !visited.contains(id)).toList();
        if (!remaining.isEmpty()) layers.add(remaining);

        Map<String, Position> positions = new LinkedHashMap<>();
        for (int layerIndex = 0; layerIndex < layers.size(); layerIndex++) {
            List<String> layer = layers.get(layerIndex);
            double x = START_X + layerIndex * HORIZONTAL_SPACING;
            for (int i = 0; i < layer.size(); i++) {
                double y = START_Y + (i - layer.size() / 2.0) * VERTICAL_SPACING;
                positions.put(layer.get(i), new Position(x, y));
            }
        }
        return positions;
    }
}
