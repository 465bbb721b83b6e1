package com.blockflow.blockflow_backend.console;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/** In-memory terminal of every workflow, newest entry last. */
@Slf4j
@Component
public class TerminalConsoleStore implements ConsoleSink {

    private final Map<String, List<ConsoleEntry>> entriesByWorkflow = new ConcurrentHashMap<>();

    @Override
    public ConsoleEntry add(ConsoleEntry entry) {
        ConsoleEntry stored = entry.toBuilder()
                .id(entry.getId() != null ? entry.getId() : UUID.randomUUID().toString())
                .timestamp(Instant.now())
                .build();
        List<ConsoleEntry> entries = entriesByWorkflow.computeIfAbsent(stored.getWorkflowId(), id -> new ArrayList<>());
        synchronized (entries) {
            entries.add(stored);
        }
        return stored;
    }

    @Override
    public void update(String workflowId, String blockId, String executionId, ConsoleUpdate update) {
        List<ConsoleEntry> entries = entriesByWorkflow.get(workflowId);
        if (entries == null) return;
        synchronized (entries) {
            ConsoleEntry target = findTarget(entries, blockId, executionId);
            if (target == null) {
                log.debug("No console entry for block {} in execution {}", blockId, executionId);
                return;
            }
            apply(target, update);
        }
    }

    // The running entry wins over finished ones so loop iterations update their own line
    private static ConsoleEntry findTarget(List<ConsoleEntry> entries, String blockId, String executionId) {
        ConsoleEntry latest = null;
        for (int i = entries.size() - 1; i >= 0; i--) {
            ConsoleEntry entry = entries.get(i);
            if (!Objects.equals(entry.getBlockId(), blockId)) continue;
            if (executionId != null && !Objects.equals(entry.getExecutionId(), executionId)) continue;
            if (entry.isRunning()) return entry;
            if (latest == null) latest = entry;
        }
        return latest;
    }

    private static void apply(ConsoleEntry entry, ConsoleUpdate update) {
        if (update.input() != null) entry.setInput(update.input());
        if (update.replaceOutput() != null) entry.setOutput(update.replaceOutput());
        if (update.success() != null) entry.setSuccess(update.success());
        if (update.error() != null) entry.setError(update.error());
        if (update.durationMs() != null) entry.setDurationMs(update.durationMs());
        if (update.startedAt() != null) entry.setStartedAt(update.startedAt());
        if (update.endedAt() != null) entry.setEndedAt(update.endedAt());
        if (update.running() != null) entry.setRunning(update.running());
        if (update.iterationCurrent() != null) entry.setIterationCurrent(update.iterationCurrent());
        if (update.iterationTotal() != null) entry.setIterationTotal(update.iterationTotal());
        if (update.iterationType() != null) entry.setIterationType(update.iterationType());
    }

    @Override
    public void cancelRunningEntries(String workflowId) {
        List<ConsoleEntry> entries = entriesByWorkflow.get(workflowId);
        if (entries == null) return;
        Instant now = Instant.now();
        synchronized (entries) {
            for (ConsoleEntry entry : entries) {
                if (!entry.isRunning()) continue;
                entry.setRunning(false);
                entry.setCanceled(true);
                entry.setEndedAt(now);
                if (entry.getStartedAt() != null) {
                    entry.setDurationMs(now.toEpochMilli() - entry.getStartedAt().toEpochMilli());
                }
            }
        }
    }

    @Override
    public List<ConsoleEntry> entries(String workflowId) {
        List<ConsoleEntry> entries = entriesByWorkflow.get(workflowId);
        if (entries == null) return List.of();
        synchronized (entries) {
            return new ArrayList<>(entries);
        }
    }

    @Override
    public void clear(String workflowId) {
        entriesByWorkflow.remove(workflowId);
    }
}
