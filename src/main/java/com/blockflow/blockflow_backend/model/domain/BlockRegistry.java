package com.blockflow.blockflow_backend.model.domain;

import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Closed registry of block types. Every {@link BlockType} has exactly one descriptor.
 */
@Component
public class BlockRegistry {

    private static final List<SubBlockConfig> INPUT_FORMAT = List.of(new SubBlockConfig("inputFormat", "input-format"));

    private final Map<BlockType, BlockDescriptor> registry = new EnumMap<>(BlockType.class);

    public BlockRegistry() {
        // Triggers
        register(BlockType.STARTER, "Start",
                List.of(new SubBlockConfig("startWorkflow", "dropdown"),
                        new SubBlockConfig("inputFormat", "input-format")),
                Map.of("input", "any"), null, false);
        register(BlockType.START_TRIGGER, "Start", INPUT_FORMAT,
                Map.of("input", "string", "conversationId", "string", "files", "files"), null, false);
        register(BlockType.INPUT_TRIGGER, "Input Form", INPUT_FORMAT, Map.of("input", "json"), null, false);
        register(BlockType.MANUAL_TRIGGER, "Manual", List.of(), Map.of(), null, false);
        register(BlockType.CHAT_TRIGGER, "Chat", List.of(),
                Map.of("input", "string", "conversationId", "string", "files", "files"), null, false);
        register(BlockType.API_TRIGGER, "API", INPUT_FORMAT, Map.of("input", "json"), null, false);
        register(BlockType.WEBHOOK, "Webhook",
                List.of(new SubBlockConfig("webhookId", "short-input"),
                        new SubBlockConfig("triggerPath", "short-input"),
                        new SubBlockConfig("samplePayload", "code")),
                Map.of("payload", "json", "headers", "json"),
                Map.of("payload", Map.of("event", "test"), "headers", Map.of()), false);
        register(BlockType.GENERIC_WEBHOOK, "Webhook",
                List.of(new SubBlockConfig("webhookId", "short-input"),
                        new SubBlockConfig("triggerPath", "short-input"),
                        new SubBlockConfig("samplePayload", "code")),
                Map.of("payload", "json"), Map.of("payload", Map.of()), false);
        register(BlockType.SCHEDULE, "Schedule",
                List.of(new SubBlockConfig("scheduleType", "dropdown"),
                        new SubBlockConfig("cronExpression", "short-input"),
                        new SubBlockConfig("timezone", "dropdown")),
                Map.of(), null, false);

        // Core blocks
        register(BlockType.AGENT, "Agent",
                List.of(new SubBlockConfig("systemPrompt", "long-input"),
                        new SubBlockConfig("userPrompt", "long-input"),
                        new SubBlockConfig("model", "combobox"),
                        new SubBlockConfig("temperature", "slider"),
                        new SubBlockConfig("responseFormat", "code")),
                Map.of("content", "string", "model", "string", "tokens", "json"), null, false);
        register(BlockType.API, "API",
                List.of(new SubBlockConfig("url", "short-input"),
                        new SubBlockConfig("method", "dropdown"),
                        new SubBlockConfig("headers", "table"),
                        new SubBlockConfig("body", "code")),
                Map.of("data", "json", "status", "number", "headers", "json"), null, false);
        register(BlockType.FUNCTION, "Function",
                List.of(new SubBlockConfig("code", "code"), new SubBlockConfig("language", "dropdown")),
                Map.of("result", "any", "stdout", "string"), null, false);
        register(BlockType.CONDITION, "Condition",
                List.of(new SubBlockConfig("conditions", "condition-input")),
                Map.of("conditionResult", "boolean", "selectedPath", "json", "selectedConditionId", "string"),
                null, false);
        register(BlockType.ROUTER, "Router",
                List.of(new SubBlockConfig("prompt", "long-input"), new SubBlockConfig("model", "combobox")),
                Map.of("content", "string", "selectedPath", "json"), null, false);
        register(BlockType.EVALUATOR, "Evaluator",
                List.of(new SubBlockConfig("metrics", "eval-input"), new SubBlockConfig("content", "long-input")),
                Map.of("content", "string"), null, false);
        register(BlockType.RESPONSE, "Response",
                List.of(new SubBlockConfig("data", "code"), new SubBlockConfig("status", "short-input")),
                Map.of("data", "json", "status", "number"), null, false);
        register(BlockType.SLACK, "Slack",
                List.of(new SubBlockConfig("channel", "short-input"),
                        new SubBlockConfig("text", "long-input"),
                        new SubBlockConfig("webhookId", "short-input"),
                        new SubBlockConfig("triggerPath", "short-input")),
                Map.of("ts", "string", "channel", "string"),
                Map.of("event", Map.of("type", "message", "text", "Hello from Slack")), true);

        // Containers keep their settings in block data rather than subblocks
        register(BlockType.LOOP, "Loop", List.of(), Map.of(), null, false);
        register(BlockType.PARALLEL, "Parallel", List.of(), Map.of(), null, false);
    }

    private void register(BlockType type, String displayName, List<SubBlockConfig> subBlocks,
                          Map<String, Object> outputs, Map<String, Object> samplePayload, boolean triggerCapable) {
        registry.put(type, new BlockDescriptor(type, displayName, subBlocks, outputs, samplePayload, triggerCapable));
    }

    public BlockDescriptor get(BlockType type) {
        BlockDescriptor descriptor = registry.get(type);
        if (descriptor == null) {
            throw new UnsupportedOperationException("No descriptor registered for block type: " + type);
        }
        return descriptor;
    }

    public Optional<BlockDescriptor> find(String typeKey) {
        return BlockType.fromKey(typeKey).map(this::get);
    }

    public boolean isSupported(String typeKey) {
        return BlockType.fromKey(typeKey).isPresent();
    }

    /** Fresh subblock map for a new block of the given type, all values null. */
    public Map<String, SubBlock> emptySubBlocks(BlockType type) {
        Map<String, SubBlock> subBlocks = new LinkedHashMap<>();
        for (SubBlockConfig config : get(type).subBlocks()) {
            subBlocks.put(config.id(), new SubBlock(config.id(), config.type(), null));
        }
        return subBlocks;
    }

    /** New-style trigger category, trigger mode enabled on the block, or the legacy starter. */
    public boolean isTriggerBlock(Block block) {
        if (block == null || block.getType() == null) return false;
        return block.getType().isTrigger() || block.isTriggerMode();
    }
}
