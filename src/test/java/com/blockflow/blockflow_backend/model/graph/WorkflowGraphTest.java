package com.blockflow.blockflow_backend.model.graph;

import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.domain.BlockType;
import com.blockflow.blockflow_backend.model.domain.Edge;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WorkflowGraphTest {

    private static Block block(String id, BlockType type) {
        return Block.builder().id(id).type(type).name(id).build();
    }

    @Test
    void rejectsEdgesIntoTriggersAndDanglingEndpoints() {
        WorkflowGraph graph = WorkflowGraph.empty();
        graph.addBlock(block("start", BlockType.START_TRIGGER));
        graph.addBlock(block("agent", BlockType.AGENT));

        assertThatThrownBy(() -> graph.addEdge(Edge.builder().source("agent").target("start").build()))
                .isInstanceOf(InvalidGraphException.class)
                .hasMessageContaining("cannot have incoming connections");
        assertThatThrownBy(() -> graph.addEdge(Edge.builder().source("ghost").target("agent").build()))
                .isInstanceOf(InvalidGraphException.class);

        Edge added = graph.addEdge(Edge.builder().source("start").target("agent").build());
        assertThat(added.getId()).isNotBlank();
        assertThat(added.getSourceHandle()).isEqualTo("source");
    }

    @Test
    void containersAreDerivedFromParentage() {
        WorkflowGraph graph = WorkflowGraph.empty();
        Block loop = block("loop", BlockType.LOOP);
        loop.setData(new LinkedHashMap<>(Map.of("loopType", "forEach", "iterations", 3)));
        graph.addBlock(loop);
        Block child = block("child", BlockType.AGENT);
        child.setParentId("loop");
        graph.addBlock(child);

        assertThat(graph.getLoops()).containsOnlyKeys("loop");
        assertThat(graph.getLoops().get("loop").getNodes()).containsExactly("child");
        assertThat(graph.getLoops().get("loop").getMode()).isEqualTo("forEach");
        assertThat(graph.getLoops().get("loop").getCount()).isEqualTo(3);
    }

    @Test
    void removingAContainerOrphansItsChildrenAndDropsEdges() {
        WorkflowGraph graph = WorkflowGraph.empty();
        graph.addBlock(block("start", BlockType.START_TRIGGER));
        graph.addBlock(block("loop", BlockType.LOOP));
        Block child = block("child", BlockType.AGENT);
        child.setParentId("loop");
        child.setExtent(Block.EXTENT_PARENT);
        graph.addBlock(child);
        graph.addEdge(Edge.builder().source("start").target("loop").build());

        graph.removeBlock("loop");

        assertThat(graph.getEdges()).isEmpty();
        assertThat(graph.getLoops()).isEmpty();
        assertThat(child.hasParent()).isFalse();
        assertThat(child.getExtent()).isNull();
    }

    @Test
    void copyIsDeep() {
        WorkflowGraph graph = WorkflowGraph.empty();
        Block agent = block("agent", BlockType.AGENT);
        agent.setSubBlockValue("prompt", "hello");
        graph.addBlock(agent);

        WorkflowGraph copy = graph.copy();
        copy.getBlocks().get("agent").setSubBlockValue("prompt", "changed");

        assertThat(agent.subBlockValue("prompt")).isEqualTo("hello");
    }

    @Test
    void validateReportsBrokenParents() {
        WorkflowGraph graph = WorkflowGraph.empty();
        Block orphan = block("orphan", BlockType.AGENT);
        orphan.setParentId("missing");
        graph.addBlock(orphan);
        Block misparented = block("mis", BlockType.AGENT);
        misparented.setParentId("orphan");
        graph.addBlock(misparented);

        assertThat(graph.validate()).hasSize(2)
                .anySatisfy(p -> assertThat(p).contains("non-existent parent"))
                .anySatisfy(p -> assertThat(p).contains("not a loop or parallel"));
    }
}
