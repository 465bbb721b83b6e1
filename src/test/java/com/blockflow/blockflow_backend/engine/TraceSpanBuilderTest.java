package com.blockflow.blockflow_backend.engine;

import com.blockflow.blockflow_backend.snapshot.BlockLog;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TraceSpanBuilderTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void emptyLogsGiveAnEmptyTrace() {
        assertThat(TraceSpanBuilder.build(List.of()).traceSpans()).isEmpty();
        assertThat(TraceSpanBuilder.build(null).totalDuration()).isZero();
    }

    @Test
    void rootSpanCoversEarliestStartToLatestEnd() {
        BlockLog second = BlockLog.builder().blockId("b").blockName("B").success(true)
                .startedAt(T0.plusMillis(300)).durationMs(200).output("out").build();
        BlockLog first = BlockLog.builder().blockId("a").blockName("A").success(true)
                .startedAt(T0).endedAt(T0.plusMillis(250)).durationMs(250).build();

        TraceSpanBuilder.Trace trace = TraceSpanBuilder.build(List.of(second, first));

        assertThat(trace.totalDuration()).isEqualTo(500);
        TraceSpan root = trace.traceSpans().get(0);
        assertThat(root.status()).isEqualTo("success");
        assertThat(root.startTime()).isEqualTo(T0);
        assertThat(root.endTime()).isEqualTo(T0.plusMillis(500));
        assertThat(root.children()).extracting(TraceSpan::blockId).containsExactly("a", "b");
        assertThat(root.children().get(1).output()).isEqualTo("out");
    }

    @Test
    void anyFailedBlockFailsTheRoot() {
        BlockLog failed = BlockLog.builder().blockId("a").success(false).error("boom")
                .startedAt(T0).durationMs(10).build();

        TraceSpan root = TraceSpanBuilder.build(List.of(failed)).traceSpans().get(0);

        assertThat(root.status()).isEqualTo("error");
        assertThat(root.children().get(0).output()).isEqualTo("boom");
    }
}
