package com.blockflow.blockflow_backend.engine;

import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.domain.BlockRegistry;
import com.blockflow.blockflow_backend.model.domain.Edge;
import com.blockflow.blockflow_backend.model.graph.WorkflowGraph;
import com.blockflow.blockflow_backend.snapshot.ExecutionSnapshot;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides whether a run may start at a given block, using the current graph and the last
 * execution snapshot. A block without incoming edges counts as a trigger.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RunFromBlockGate {

    private final BlockRegistry blockRegistry;

    /**
     * @param triggerTarget the target has no incoming edges and runs on an empty snapshot
     * @param effectiveSnapshot snapshot handed to the executor; null when refused
     */
    public record Decision(boolean allowed, boolean triggerTarget, String reason, ExecutionSnapshot effectiveSnapshot) {

        static Decision refuse(String reason) {
            return new Decision(false, false, reason, null);
        }
    }

    public Decision evaluate(WorkflowGraph graph, String blockId, ExecutionSnapshot snapshot) {
        Block target = graph.findBlock(blockId).orElse(null);
        if (target == null) {
            return Decision.refuse("Block not found in workflow: " + blockId);
        }

        List<Edge> incoming = graph.incomingEdges(blockId);
        if (incoming.isEmpty()) {
            if (!isTriggerCapable(target)) {
                return Decision.refuse("Block '" + target.getName() + "' has no incoming connections and is not a trigger");
            }
            // Never leak unrelated prior state into a fresh trigger run
            return new Decision(true, true, null, ExecutionSnapshot.empty());
        }

        if (snapshot == null) {
            return Decision.refuse("Run the workflow once before running from block '" + target.getName() + "'");
        }

        for (Edge edge : incoming) {
            Block source = graph.findBlock(edge.getSource()).orElse(null);
            if (source == null) {
                return Decision.refuse("Upstream block '" + edge.getSource() + "' no longer exists");
            }
            boolean sourceIsTrigger = graph.incomingEdges(source.getId()).isEmpty();
            if (!snapshot.hasExecuted(source.getId()) && !sourceIsTrigger) {
                log.debug("Run from {} refused, upstream {} not executed", blockId, source.getId());
                return Decision.refuse("Upstream dependency not executed: " + source.getName());
            }
        }
        return new Decision(true, false, null, snapshot);
    }

    private boolean isTriggerCapable(Block block) {
        if (blockRegistry.isTriggerBlock(block)) return true;
        return block.getType() != null && blockRegistry.get(block.getType()).triggerCapable();
    }
}
