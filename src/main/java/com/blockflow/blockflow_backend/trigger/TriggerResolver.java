package com.blockflow.blockflow_backend.trigger;

import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.graph.WorkflowGraph;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Picks the block a run starts from, and the input it gets, for a given execution mode.
 * Every failure is a {@link WorkflowValidationException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TriggerResolver {

    private final StartBlockClassifier classifier;
    private final TriggerPayloadBuilder payloadBuilder;

    /**
     * @param callerInput input supplied with the request; when non-null it is used instead of
     *                    any synthesized payload
     */
    public TriggerResolution resolve(WorkflowGraph graph, ExecutionMode mode, Object callerInput) {
        Map<String, Block> blocks = graph.getExecutableBlocks();
        return switch (mode) {
            case CHAT, API -> resolveSingle(blocks, mode, callerInput);
            case MANUAL -> resolveManual(graph, blocks, callerInput);
        };
    }

    private TriggerResolution resolveSingle(Map<String, Block> blocks, ExecutionMode mode, Object callerInput) {
        List<StartBlockCandidate> candidates = classifier.resolveCandidates(blocks, mode);
        if (candidates.isEmpty()) {
            String label = mode.displayName();
            throw new WorkflowValidationException(
                    label + " execution requires " + article(label) + " " + label + " Trigger block");
        }
        StartBlockCandidate primary = candidates.get(0);
        Object payload = callerInput;
        if (payload == null && mode == ExecutionMode.API && payloadBuilder.usesInputFormat(primary.path())) {
            Map<String, Object> testInput = payloadBuilder.inputFormatValues(primary.block());
            payload = testInput.isEmpty() ? null : testInput;
        }
        log.debug("{} run starts at {} ({})", mode, primary.blockId(), primary.path());
        return new TriggerResolution(primary.blockId(), primary.block(), primary.path(), payload);
    }

    private TriggerResolution resolveManual(WorkflowGraph graph, Map<String, Block> blocks, Object callerInput) {
        List<StartBlockCandidate> candidates = classifier.resolveCandidates(blocks, ExecutionMode.MANUAL);
        if (candidates.isEmpty()) {
            log.error("No trigger blocks found for manual run, block types: {}",
                    blocks.values().stream().map(Block::getType).toList());
            throw new WorkflowValidationException("Workflow requires at least one trigger block to execute");
        }

        long apiTriggers = candidates.stream().filter(c -> c.path() == StartBlockPath.SPLIT_API).count();
        if (apiTriggers > 1) {
            log.error("Multiple API triggers found");
            throw new WorkflowValidationException("Multiple API Trigger blocks found. Keep only one.");
        }

        StartBlockCandidate selected = candidates.get(0);
        if (!selected.path().isLegacy() && graph.outgoingEdges(selected.blockId()).isEmpty()) {
            Block trigger = selected.block();
            String triggerName = trigger.getName() != null ? trigger.getName() : trigger.getType().getKey();
            log.error("Trigger has no outgoing connections: {} ({})", triggerName, selected.blockId());
            throw new WorkflowValidationException(triggerName + " must be connected to other blocks to execute",
                    selected.blockId(), trigger.getType().getKey(), triggerName);
        }

        Object payload = callerInput != null ? callerInput : payloadBuilder.build(selected);
        return new TriggerResolution(selected.blockId(), selected.block(), selected.path(), payload);
    }

    private static String article(String word) {
        return "AEIOU".indexOf(Character.toUpperCase(word.charAt(0))) >= 0 ? "an" : "a";
    }
}
