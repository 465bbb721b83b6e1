package com.blockflow.blockflow_backend.engine;

import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.domain.BlockRegistry;
import com.blockflow.blockflow_backend.model.domain.BlockType;
import com.blockflow.blockflow_backend.model.domain.Edge;
import com.blockflow.blockflow_backend.model.graph.WorkflowGraph;
import com.blockflow.blockflow_backend.snapshot.ExecutionSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RunFromBlockGateTest {

    private final RunFromBlockGate gate = new RunFromBlockGate(new BlockRegistry());
    private WorkflowGraph graph;

    @BeforeEach
    void setUp() {
        // start -> a -> b -> c
        graph = WorkflowGraph.empty();
        graph.addBlock(Block.builder().id("start").type(BlockType.START_TRIGGER).name("Start").build());
        graph.addBlock(Block.builder().id("a").type(BlockType.AGENT).name("A").build());
        graph.addBlock(Block.builder().id("b").type(BlockType.FUNCTION).name("B").build());
        graph.addBlock(Block.builder().id("c").type(BlockType.AGENT).name("C").build());
        graph.addEdge(Edge.builder().id("e1").source("start").target("a").build());
        graph.addEdge(Edge.builder().id("e2").source("a").target("b").build());
        graph.addEdge(Edge.builder().id("e3").source("b").target("c").build());
    }

    private static ExecutionSnapshot executed(String... blockIds) {
        return ExecutionSnapshot.builder().executedBlocks(new LinkedHashSet<>(List.of(blockIds))).build();
    }

    @Test
    @DisplayName("allowed iff every direct upstream source executed or is a trigger")
    void dependencyGating() {
        assertThat(gate.evaluate(graph, "c", executed("start", "a", "b")).allowed()).isTrue();
        assertThat(gate.evaluate(graph, "c", executed("start", "a")))
                .satisfies(d -> {
                    assertThat(d.allowed()).isFalse();
                    assertThat(d.reason()).isEqualTo("Upstream dependency not executed: B");
                    assertThat(d.effectiveSnapshot()).isNull();
                });
        // start has no incoming edges, so it counts as a trigger even when not executed
        assertThat(gate.evaluate(graph, "a", executed()).allowed()).isTrue();
    }

    @Test
    void refusesWithoutSnapshot() {
        assertThat(gate.evaluate(graph, "b", null).allowed()).isFalse();
    }

    @Test
    void refusesUnknownBlock() {
        assertThat(gate.evaluate(graph, "ghost", executed()).reason()).startsWith("Block not found in workflow");
    }

    @Test
    void refusesWhenAnEdgeSourceNoLongerExists() {
        graph.getBlocks().remove("b");

        RunFromBlockGate.Decision decision = gate.evaluate(graph, "c", executed("start", "a", "b"));

        assertThat(decision.allowed()).isFalse();
        assertThat(decision.reason()).contains("no longer exists");
    }

    @Test
    @DisplayName("a trigger target runs on an empty snapshot even when one is stored")
    void triggerTargetGetsEmptySnapshot() {
        RunFromBlockGate.Decision decision = gate.evaluate(graph, "start", executed("start", "a"));

        assertThat(decision.allowed()).isTrue();
        assertThat(decision.triggerTarget()).isTrue();
        assertThat(decision.effectiveSnapshot().getExecutedBlocks()).isEmpty();
    }

    @Test
    void orphanNonTriggerIsRefused() {
        graph.addBlock(Block.builder().id("lonely").type(BlockType.AGENT).name("Lonely").build());

        assertThat(gate.evaluate(graph, "lonely", null).allowed()).isFalse();
    }

    @Test
    void orphanTriggerCapableBlockIsAllowed() {
        graph.addBlock(Block.builder().id("slack").type(BlockType.SLACK).name("Slack").build());

        assertThat(gate.evaluate(graph, "slack", null).triggerTarget()).isTrue();
    }
}
