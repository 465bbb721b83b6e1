package com.blockflow.blockflow_backend.identity;

import com.blockflow.blockflow_backend.config.BlockflowProperties;
import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.domain.BlockType;
import com.blockflow.blockflow_backend.model.domain.Edge;
import com.blockflow.blockflow_backend.model.domain.Position;
import com.blockflow.blockflow_backend.model.graph.WorkflowGraph;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class IdentityTransformServiceTest {

    private IdentityTransformService service;

    @BeforeEach
    void setUp() {
        service = new IdentityTransformService(new BlockflowProperties(), new UniqueNameGenerator());
    }

    private static Block block(String id, BlockType type, String name) {
        return Block.builder().id(id).type(type).name(name).position(new Position(100, 100)).build();
    }

    private static WorkflowGraph graph(Block... blocks) {
        WorkflowGraph graph = WorkflowGraph.empty();
        for (Block b : blocks) graph.addBlock(b);
        return graph;
    }

    private static Edge edge(String source, String target) {
        return Edge.builder().id(source + "-" + target).source(source).target(target).build();
    }

    @Nested
    class RegenerateWorkflowIds {

        @Test
        @DisplayName("every block gets a fresh id and the id map is a bijection")
        void bijection() {
            WorkflowGraph source = graph(
                    block("start", BlockType.START_TRIGGER, "Start"),
                    block("loop", BlockType.LOOP, "Loop 1"),
                    block("agent", BlockType.AGENT, "Agent 1"));
            source.getBlocks().get("agent").setParentId("loop");
            source.rebuildContainers();
            source.addEdge(edge("start", "loop"));

            RegeneratedWorkflow result = service.regenerateWorkflowIds(source);

            Map<String, String> idMap = result.idMap();
            assertThat(idMap.keySet()).containsExactlyInAnyOrder("start", "loop", "agent");
            assertThat(new HashSet<>(idMap.values())).hasSize(3).doesNotContainAnyElementsOf(idMap.keySet());
            assertThat(result.graph().getBlocks().keySet()).containsExactlyInAnyOrderElementsOf(idMap.values());

            Block agent = result.graph().getBlocks().get(idMap.get("agent"));
            assertThat(agent.getParentId()).isEqualTo(idMap.get("loop"));
            assertThat(agent.getName()).isEqualTo("Agent 1");
            assertThat(result.graph().getLoops().get(idMap.get("loop")).getNodes())
                    .containsExactly(idMap.get("agent"));
            assertThat(result.graph().getEdges()).singleElement().satisfies(e -> {
                assertThat(e.getSource()).isEqualTo(idMap.get("start"));
                assertThat(e.getTarget()).isEqualTo(idMap.get("loop"));
                assertThat(e.getId()).isNotEqualTo("start-loop");
            });
        }

        @Test
        void clearsTriggerRuntimeValues() {
            Block webhook = block("hook", BlockType.GENERIC_WEBHOOK, "Webhook");
            webhook.setSubBlockValue("webhookId", "abc");
            webhook.setSubBlockValue("path", "/orders");

            RegeneratedWorkflow result = service.regenerateWorkflowIds(graph(webhook));

            Block copy = result.graph().getBlocks().get(result.idMap().get("hook"));
            assertThat(copy.subBlockValue("webhookId")).isNull();
            assertThat(copy.subBlockValue("path")).isEqualTo("/orders");
            assertThat(webhook.subBlockValue("webhookId")).isEqualTo("abc");
        }
    }

    @Nested
    class Paste {

        @Test
        @DisplayName("pasted blocks get unique names and references follow the rename")
        void renamesAndRewritesReferences() {
            WorkflowGraph target = graph(block("existing", BlockType.AGENT, "Agent 1"));

            Block agent = block("a", BlockType.AGENT, "Agent 1");
            Block fn = block("f", BlockType.FUNCTION, "Function 1");
            fn.setSubBlockValue("code", "return <agent1.content>");
            WorkflowGraph fragment = graph(agent, fn);
            fragment.addEdge(edge("a", "f"));

            RegeneratedBlocks pasted = service.paste(target, fragment, Map.of(), new Position(10, 20));

            Block pastedAgent = target.getBlocks().get(pasted.idMap().get("a"));
            Block pastedFn = target.getBlocks().get(pasted.idMap().get("f"));
            assertThat(pastedAgent.getName()).isEqualTo("Agent 2");
            assertThat(pastedAgent.getPosition()).isEqualTo(new Position(110, 120));
            assertThat(pastedFn.subBlockValue("code")).isEqualTo("return <agent2.content>");
            assertThat(target.getEdges()).singleElement()
                    .satisfies(e -> assertThat(e.getTarget()).isEqualTo(pastedFn.getId()));
            assertThat(target.getBlocks()).hasSize(3);
        }

        @Test
        @DisplayName("child of a copied container keeps its relative position and the new parent")
        void containerClosure() {
            Block loop = block("loop", BlockType.LOOP, "Loop 1");
            Block child = block("child", BlockType.AGENT, "Agent 1");
            child.setParentId("loop");
            child.setPosition(new Position(5, 5));
            WorkflowGraph fragment = graph(loop, child);

            RegeneratedBlocks pasted = service.paste(WorkflowGraph.empty(), fragment, Map.of(), new Position(300, 300));

            Block newChild = pasted.blocks().get(pasted.idMap().get("child"));
            assertThat(newChild.getParentId()).isEqualTo(pasted.idMap().get("loop"));
            assertThat(newChild.getExtent()).isEqualTo(Block.EXTENT_PARENT);
            assertThat(newChild.getPosition()).isEqualTo(new Position(5, 5));
        }

        @Test
        @DisplayName("a locked existing container never receives pasted children")
        void lockedParentIsCleared() {
            Block lockedLoop = block("loop", BlockType.LOOP, "Loop 1");
            lockedLoop.setLocked(true);
            WorkflowGraph target = graph(lockedLoop);
            Block child = block("child", BlockType.AGENT, "Agent 1");
            child.setParentId("loop");

            RegeneratedBlocks pasted = service.paste(target, graph(child), Map.of(), new Position(10, 10));

            Block newChild = pasted.blocks().get(pasted.idMap().get("child"));
            assertThat(newChild.hasParent()).isFalse();
            assertThat(target.getLoops().get("loop").getNodes()).isEmpty();
        }

        @Test
        @DisplayName("a child detached from a locked container takes the full paste offset")
        void lockedParentUsesFullOffset() {
            Block lockedLoop = block("loop", BlockType.LOOP, "Loop 1");
            lockedLoop.setLocked(true);
            WorkflowGraph target = graph(lockedLoop);
            Block child = block("child", BlockType.AGENT, "Agent 1");
            child.setParentId("loop");

            RegeneratedBlocks pasted = service.paste(target, graph(child), Map.of(), new Position(900, 0));

            Block newChild = pasted.blocks().get(pasted.idMap().get("child"));
            assertThat(newChild.hasParent()).isFalse();
            assertThat(newChild.getPosition()).isEqualTo(new Position(1000, 100));
        }

        @Test
        @DisplayName("viewport-sized offsets inside an existing container fall back to the default offset")
        void viewportOffsetInsideContainer() {
            WorkflowGraph target = graph(block("loop", BlockType.LOOP, "Loop 1"));
            Block child = block("child", BlockType.AGENT, "Agent 1");
            child.setParentId("loop");

            RegeneratedBlocks pasted = service.paste(target, graph(child), Map.of(), new Position(900, 0));

            Block newChild = pasted.blocks().get(pasted.idMap().get("child"));
            assertThat(newChild.getParentId()).isEqualTo("loop");
            assertThat(newChild.getPosition()).isEqualTo(new Position(150, 150));
        }

        @Test
        void stagedSubBlockValuesAreKeyedByNewIds() {
            Block agent = block("a", BlockType.AGENT, "Agent 1");
            Map<String, Map<String, Object>> values = new LinkedHashMap<>();
            values.put("a", new LinkedHashMap<>(Map.of("prompt", "hi")));

            RegeneratedBlocks pasted = service.paste(WorkflowGraph.empty(), graph(agent), values, Position.ORIGIN);

            String newId = pasted.idMap().get("a");
            assertThat(pasted.subBlockValues()).containsOnlyKeys(newId);
            assertThat(pasted.blocks().get(newId).subBlockValue("prompt")).isEqualTo("hi");
        }
    }

    @Nested
    class DuplicateBlock {

        @Test
        void placesCopyAtDefaultOffsetAndUnlocksIt() {
            Block agent = block("a", BlockType.AGENT, "Agent 1");
            agent.setLocked(true);
            WorkflowGraph graph = graph(agent);

            Block copy = service.duplicateBlock(graph, "a");

            assertThat(copy.getName()).isEqualTo("Agent 2");
            assertThat(copy.isLocked()).isFalse();
            assertThat(copy.getPosition()).isEqualTo(new Position(150, 150));
            assertThat(graph.getBlocks()).hasSize(2);
        }

        @Test
        @DisplayName("a block in a locked container is duplicated outside of it")
        void lockedContainerPlacesCopyOutside() {
            Block loop = block("loop", BlockType.LOOP, "Loop 1");
            loop.setLocked(true);
            loop.getData().put("width", 600);
            Block child = block("child", BlockType.AGENT, "Agent 1");
            child.setParentId("loop");
            WorkflowGraph graph = graph(loop, child);

            Block copy = service.duplicateBlock(graph, "child");

            assertThat(copy.hasParent()).isFalse();
            assertThat(copy.getPosition()).isEqualTo(new Position(750, 100));
            Set<String> members = Set.copyOf(graph.getLoops().get("loop").getNodes());
            assertThat(members).containsExactly("child");
        }

        @Test
        void dropsTriggerRuntimeValues() {
            Block hook = block("hook", BlockType.GENERIC_WEBHOOK, "Webhook");
            hook.setSubBlockValue("triggerPath", "/x");

            Block copy = service.duplicateBlock(graph(hook), "hook");

            assertThat(copy.getSubBlocks()).doesNotContainKey("triggerPath");
            assertThat(List.copyOf(hook.getSubBlocks().keySet())).containsExactly("triggerPath");
        }
    }
}
