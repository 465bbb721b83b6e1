package com.blockflow.blockflow_backend.trigger;

import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.domain.BlockRegistry;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class StartBlockClassifier {

    static final String START_WORKFLOW_SUBBLOCK = "startWorkflow";

    private final BlockRegistry blockRegistry;

    public Optional<StartBlockPath> classify(Block block) {
        if (block == null || block.getType() == null) return Optional.empty();
        return Optional.ofNullable(switch (block.getType()) {
            case START_TRIGGER -> StartBlockPath.UNIFIED;
            case STARTER -> StartBlockPath.LEGACY_STARTER;
            case INPUT_TRIGGER -> StartBlockPath.SPLIT_INPUT;
            case API_TRIGGER -> StartBlockPath.SPLIT_API;
            case CHAT_TRIGGER -> StartBlockPath.SPLIT_CHAT;
            case MANUAL_TRIGGER -> StartBlockPath.SPLIT_MANUAL;
            case SCHEDULE -> StartBlockPath.SCHEDULE_TRIGGER;
            case WEBHOOK, GENERIC_WEBHOOK -> StartBlockPath.EXTERNAL_TRIGGER;
            default -> blockRegistry.isTriggerBlock(block) ? StartBlockPath.EXTERNAL_TRIGGER : null;
        });
    }

    /**
     * Mode of a legacy starter from its {@code startWorkflow} value: chat, api/run, or
     * manual when unset. Any other value matches no mode.
     */
    public Optional<ExecutionMode> legacyStarterMode(Block block) {
        Object mode = block.subBlockValue(START_WORKFLOW_SUBBLOCK);
        if (mode == null || "manual".equals(mode)) return Optional.of(ExecutionMode.MANUAL);
        if ("chat".equals(mode)) return Optional.of(ExecutionMode.CHAT);
        if ("api".equals(mode) || "run".equals(mode)) return Optional.of(ExecutionMode.API);
        return Optional.empty();
    }

    /**
     * Enabled, typed blocks that can start a run in {@code mode}, best first. Ties keep the
     * graph's block order.
     */
    public List<StartBlockCandidate> resolveCandidates(Map<String, Block> blocks, ExecutionMode mode) {
        List<StartBlockCandidate> candidates = new ArrayList<>();
        blocks.forEach((blockId, block) -> {
            if (block == null || block.getType() == null || !block.isEnabled()) return;
            StartBlockPath path = classify(block).orElse(null);
            if (path == null || !mode.accepts(path)) return;
            if (path.isLegacy() && legacyStarterMode(block).orElse(null) != mode) return;
            candidates.add(new StartBlockCandidate(blockId, block, path));
        });
        candidates.sort(Comparator.comparingInt(c -> mode.rank(c.path())));
        return candidates;
    }
}
