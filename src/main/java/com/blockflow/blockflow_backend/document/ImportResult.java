package com.blockflow.blockflow_backend.document;

import com.blockflow.blockflow_backend.model.graph.WorkflowGraph;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a document import. {@code graph} and {@code subBlockValues} are null when the
 * import failed; warnings describe dropped edges and parents of an otherwise successful import.
 */
public record ImportResult(
        boolean success,
        List<String> errors,
        List<String> warnings,
        WorkflowGraph graph,
        Map<String, Map<String, Object>> subBlockValues,
        String summary
) {
    static ImportResult failed(List<String> errors, List<String> warnings) {
        return new ImportResult(false, List.copyOf(errors), List.copyOf(warnings), null, null, null);
    }
}
