package com.blockflow.blockflow_backend.engine;

import com.blockflow.blockflow_backend.snapshot.BlockLog;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Builds the trace attached to persisted logs: one span per block log, wrapped in a single
 * workflow-execution span covering the earliest start to the latest end.
 */
public final class TraceSpanBuilder {

    public record Trace(List<TraceSpan> traceSpans, long totalDuration) {}

    private TraceSpanBuilder() {}

    public static Trace build(List<BlockLog> logs) {
        if (logs == null || logs.isEmpty()) {
            return new Trace(List.of(), 0L);
        }
        List<TraceSpan> children = new ArrayList<>();
        Instant earliest = null;
        Instant latest = null;
        for (BlockLog log : logs) {
            Instant start = log.getStartedAt() != null ? log.getStartedAt() : Instant.EPOCH;
            Instant end = log.getEndedAt() != null ? log.getEndedAt() : start.plusMillis(log.getDurationMs());
            children.add(TraceSpan.builder()
                    .id(log.getBlockId() + "-" + start.toEpochMilli())
                    .name(log.getBlockName())
                    .type(log.getBlockType())
                    .blockId(log.getBlockId())
                    .status(log.isSuccess() ? "success" : "error")
                    .duration(log.getDurationMs())
                    .startTime(start)
                    .endTime(end)
                    .input(log.getInput())
                    .output(log.isSuccess() ? log.getOutput() : log.getError())
                    .build());
            if (earliest == null || start.isBefore(earliest)) earliest = start;
            if (latest == null || end.isAfter(latest)) latest = end;
        }
        children.sort(Comparator.comparing(TraceSpan::startTime, Comparator.nullsLast(Comparator.naturalOrder())));

        long totalDuration = latest.toEpochMilli() - earliest.toEpochMilli();
        boolean failed = children.stream().anyMatch(span -> Objects.equals(span.status(), "error"));
        TraceSpan root = TraceSpan.builder()
                .id("workflow-execution")
                .name("Workflow Execution")
                .type("workflow")
                .status(failed ? "error" : "success")
                .duration(totalDuration)
                .startTime(earliest)
                .endTime(latest)
                .children(children)
                .build();
        return new Trace(List.of(root), totalDuration);
    }
}
