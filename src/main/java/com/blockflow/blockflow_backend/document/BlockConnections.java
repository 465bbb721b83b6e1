package com.blockflow.blockflow_backend.document;

import com.blockflow.blockflow_backend.model.domain.Edge;
import com.blockflow.blockflow_backend.model.domain.SourceHandle;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between edges and the grouped {@code connections} section of a YAML block:
 * <pre>
 * connections:
 *   success: agent-1            # or a list
 *   error: [fallback]
 *   conditions: { if: a, else: b }
 *   loop: { start: body, end: after }
 *   parallel: { start: branch, end: after }
 * </pre>
 * The legacy {@code outgoing: [{target, sourceHandle, targetHandle}]} list is still read,
 * with a warning.
 */
public final class BlockConnections {

    private static final Pattern UUID_PREFIXED =
            Pattern.compile("^[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}-(.+)$");

    private BlockConnections() {}

    // ── Parsing ─────────────────────────────────────────────────────────────────

    public static ParsedConnections parse(String blockId, Map<String, Object> connections) {
        List<Edge> edges = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        if (connections == null || connections.isEmpty()) {
            return new ParsedConnections(edges, errors, warnings);
        }

        addTargets(blockId, connections.get("success"), SourceHandle.SOURCE.getHandle(), "success", edges, errors);
        addTargets(blockId, connections.get("error"), SourceHandle.ERROR.getHandle(), "error", edges, errors);

        Object conditions = connections.get("conditions");
        if (conditions != null) {
            if (conditions instanceof Map<?, ?> byCondition) {
                byCondition.forEach((conditionId, targets) -> addTargets(blockId, targets,
                        SourceHandle.condition(blockId, String.valueOf(conditionId)),
                        "condition target for '" + conditionId + "'", edges, errors));
            } else {
                errors.add("Invalid conditions in block '" + blockId + "': must be an object");
            }
        }

        parseStartEnd(blockId, connections.get("loop"), "loop",
                SourceHandle.LOOP_START, SourceHandle.LOOP_END, edges, errors);
        parseStartEnd(blockId, connections.get("parallel"), "parallel",
                SourceHandle.PARALLEL_START, SourceHandle.PARALLEL_END, edges, errors);

        Object outgoing = connections.get("outgoing");
        if (outgoing instanceof List<?> legacy) {
            warnings.add("Block '" + blockId + "' uses legacy connection format - consider upgrading to the new grouped format");
            for (Object item : legacy) {
                Map<?, ?> connection = item instanceof Map<?, ?> m ? m : Map.of();
                Object target = connection.get("target");
                if (!(target instanceof String t) || t.isBlank()) {
                    errors.add("Missing target in outgoing connection for block '" + blockId + "'");
                    continue;
                }
                edges.add(edge(blockId, t,
                        stringOr(connection.get("sourceHandle"), SourceHandle.SOURCE.getHandle()),
                        stringOr(connection.get("targetHandle"), SourceHandle.TARGET_HANDLE)));
            }
        }
        return new ParsedConnections(edges, errors, warnings);
    }

    private static void parseStartEnd(String blockId, Object section, String label,
                                      SourceHandle start, SourceHandle end,
                                      List<Edge> edges, List<String> errors) {
        if (section == null) return;
        if (!(section instanceof Map<?, ?> map)) {
            errors.add("Invalid " + label + " connections in block '" + blockId + "': must be an object");
            return;
        }
        addTargets(blockId, map.get("start"), start.getHandle(), label + " start target", edges, errors);
        addTargets(blockId, map.get("end"), end.getHandle(), label + " end target", edges, errors);
    }

    private static void addTargets(String blockId, Object targets, String sourceHandle, String label,
                                   List<Edge> edges, List<String> errors) {
        if (targets == null) return;
        List<?> list = targets instanceof List<?> l ? l : List.of(targets);
        for (Object target : list) {
            if (target instanceof String t) {
                edges.add(edge(blockId, t, sourceHandle, SourceHandle.TARGET_HANDLE));
            } else {
                errors.add("Invalid " + label + " in block '" + blockId + "': must be a string");
            }
        }
    }

    private static Edge edge(String source, String target, String sourceHandle, String targetHandle) {
        return Edge.builder()
                .id(UUID.randomUUID().toString())
                .source(source)
                .target(target)
                .sourceHandle(sourceHandle)
                .targetHandle(targetHandle)
                .build();
    }

    private static String stringOr(Object value, String fallback) {
        return value instanceof String s && !s.isBlank() ? s : fallback;
    }

    // ── Generation ──────────────────────────────────────────────────────────────

    /** Groups the outgoing edges of {@code blockId}; a single target is written as a scalar. */
    public static Map<String, Object> generate(String blockId, List<Edge> edges) {
        List<String> success = new ArrayList<>();
        List<String> error = new ArrayList<>();
        Map<String, List<String>> conditions = new LinkedHashMap<>();
        List<String> loopStart = new ArrayList<>();
        List<String> loopEnd = new ArrayList<>();
        List<String> parallelStart = new ArrayList<>();
        List<String> parallelEnd = new ArrayList<>();

        for (Edge edge : edges) {
            if (!Objects.equals(edge.getSource(), blockId)) continue;
            String handle = edge.getSourceHandle() != null ? edge.getSourceHandle() : SourceHandle.SOURCE.getHandle();
            SourceHandle kind = SourceHandle.fromHandle(handle).orElse(null);
            if (kind == null) continue;
            switch (kind) {
                case SOURCE -> success.add(edge.getTarget());
                case ERROR -> error.add(edge.getTarget());
                case CONDITION -> conditions.computeIfAbsent(extractConditionId(handle), k -> new ArrayList<>())
                        .add(edge.getTarget());
                case LOOP_START -> loopStart.add(edge.getTarget());
                case LOOP_END -> loopEnd.add(edge.getTarget());
                case PARALLEL_START -> parallelStart.add(edge.getTarget());
                case PARALLEL_END -> parallelEnd.add(edge.getTarget());
            }
        }

        Map<String, Object> connections = new LinkedHashMap<>();
        if (!success.isEmpty()) connections.put("success", collapse(success));
        if (!error.isEmpty()) connections.put("error", collapse(error));
        if (!conditions.isEmpty()) {
            Map<String, Object> grouped = new LinkedHashMap<>();
            conditions.forEach((id, targets) -> grouped.put(id, collapse(targets)));
            connections.put("conditions", grouped);
        }
        putStartEnd(connections, "loop", loopStart, loopEnd);
        putStartEnd(connections, "parallel", parallelStart, parallelEnd);
        return connections;
    }

    private static void putStartEnd(Map<String, Object> connections, String key, List<String> start, List<String> end) {
        if (start.isEmpty() && end.isEmpty()) return;
        Map<String, Object> section = new LinkedHashMap<>();
        if (!start.isEmpty()) section.put("start", collapse(start));
        if (!end.isEmpty()) section.put("end", collapse(end));
        connections.put(key, section);
    }

    private static Object collapse(List<String> targets) {
        return targets.size() == 1 ? targets.get(0) : List.copyOf(targets);
    }

    /**
     * Semantic condition key of a {@code condition-<blockId>-<key>} handle. A UUID block id is
     * stripped as a whole; otherwise the last dash-separated part is used.
     */
    public static String extractConditionId(String sourceHandle) {
        String prefix = SourceHandle.CONDITION.getHandle();
        if (!sourceHandle.startsWith(prefix)) return sourceHandle;
        Matcher matcher = UUID_PREFIXED.matcher(sourceHandle.substring(prefix.length()));
        if (matcher.matches()) return matcher.group(1);
        String[] parts = sourceHandle.split("-");
        return parts.length >= 2 ? parts[parts.length - 1] : sourceHandle;
    }
}
