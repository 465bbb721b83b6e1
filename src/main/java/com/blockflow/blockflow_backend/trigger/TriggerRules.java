package com.blockflow.blockflow_backend.trigger;

import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.domain.BlockType;

import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Which trigger blocks may coexist in one workflow. Schedules and webhooks may appear any number
 * of times; the legacy starter excludes the newer single-instance triggers and vice versa.
 */
public final class TriggerRules {

    private static final Set<BlockType> SINGLE_INSTANCE = EnumSet.of(
            BlockType.API_TRIGGER,
            BlockType.INPUT_TRIGGER,
            BlockType.MANUAL_TRIGGER,
            BlockType.CHAT_TRIGGER,
            BlockType.START_TRIGGER);

    private TriggerRules() {}

    public static boolean requiresSingleInstance(BlockType type) {
        return SINGLE_INSTANCE.contains(type);
    }

    /** True when adding a block of {@code type} to {@code blocks} would break a single-instance rule. */
    public static boolean wouldViolateSingleInstance(Collection<Block> blocks, BlockType type) {
        boolean hasLegacyStarter = blocks.stream().anyMatch(b -> b.getType() == BlockType.STARTER);
        if (hasLegacyStarter && requiresSingleInstance(type)) {
            return true;
        }
        if (type == BlockType.STARTER) {
            return blocks.stream().anyMatch(b -> requiresSingleInstance(b.getType()));
        }
        if (type == BlockType.START_TRIGGER) {
            // the unified start replaces every other single-instance trigger
            return blocks.stream().anyMatch(b -> requiresSingleInstance(b.getType()));
        }
        return requiresSingleInstance(type) && blocks.stream().anyMatch(b -> b.getType() == type);
    }
}
