package com.blockflow.blockflow_backend.document;

import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.domain.BlockRegistry;
import com.blockflow.blockflow_backend.model.domain.BlockType;
import com.blockflow.blockflow_backend.model.domain.Edge;
import com.blockflow.blockflow_backend.model.graph.WorkflowGraph;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class WorkflowYamlImporterTest {

    private final WorkflowYamlImporter importer = new WorkflowYamlImporter(
            new WorkflowYamlParser(), new ConditionInputs(new ObjectMapper()), new BlockRegistry());

    private static final String TWO_BLOCKS = """
            version: '1.0'
            blocks:
              start:
                type: starter
                name: Start
                connections:
                  success: agent1
              agent1:
                type: agent
                name: Agent 1
                inputs:
                  systemPrompt: You are terse.
                  model: gpt-4o
            """;

    private static Block byName(WorkflowGraph graph, String name) {
        return graph.getBlocks().values().stream()
                .filter(b -> name.equals(b.getName()))
                .findFirst()
                .orElseThrow();
    }

    @Nested
    class Fresh {

        @Test
        @DisplayName("every block gets a new id and edges are remapped onto them")
        void remapsIds() {
            ImportResult result = importer.importYaml(TWO_BLOCKS, ImportPolicy.FRESH, null);

            assertThat(result.success()).isTrue();
            assertThat(result.graph().getBlocks()).hasSize(2).doesNotContainKeys("start", "agent1");
            Block start = byName(result.graph(), "Start");
            Block agent = byName(result.graph(), "Agent 1");
            assertThat(result.graph().getEdges()).singleElement().satisfies(edge -> {
                assertThat(edge.getSource()).isEqualTo(start.getId());
                assertThat(edge.getTarget()).isEqualTo(agent.getId());
            });
            assertThat(result.subBlockValues().get(agent.getId())).containsEntry("systemPrompt", "You are terse.");
            assertThat(agent.subBlockValue("model")).isEqualTo("gpt-4o");
            assertThat(result.warnings()).isEmpty();
        }

        @Test
        @DisplayName("blocks are laid out left to right by distance from the roots")
        void layersLayout() {
            ImportResult result = importer.importYaml(TWO_BLOCKS, ImportPolicy.FRESH, null);

            double startX = byName(result.graph(), "Start").getPosition().x();
            double agentX = byName(result.graph(), "Agent 1").getPosition().x();
            assertThat(agentX - startX).isEqualTo(WorkflowLayoutCalculator.HORIZONTAL_SPACING);
        }

        @Test
        @DisplayName("dangling references are dropped with a warning")
        void danglingReferencesWarn() {
            String yaml = """
                    version: '1.0'
                    blocks:
                      agent1:
                        type: agent
                        name: Agent 1
                        parentId: loop9
                        connections:
                          success: ghost
                    """;

            ImportResult result = importer.importYaml(yaml, ImportPolicy.FRESH, null);

            assertThat(result.success()).isTrue();
            assertThat(result.graph().getEdges()).isEmpty();
            assertThat(byName(result.graph(), "Agent 1").getParentId()).isNull();
            assertThat(result.warnings()).containsExactlyInAnyOrder(
                    "Block 'agent1' references non-existent parent block 'loop9'",
                    "Block 'agent1' references non-existent target block 'ghost'");
        }

        @Test
        void unknownInputIsOnlyAWarning() {
            String yaml = """
                    version: '1.0'
                    blocks:
                      agent1:
                        type: agent
                        name: Agent 1
                        inputs:
                          vibe: calm
                    """;

            ImportResult result = importer.importYaml(yaml, ImportPolicy.FRESH, null);

            assertThat(result.success()).isTrue();
            assertThat(result.warnings()).containsExactly("Block 'agent1' has unknown input 'vibe' for type 'agent'");
        }

        @Test
        void unknownBlockTypeFails() {
            String yaml = """
                    version: '1.0'
                    blocks:
                      x:
                        type: teleporter
                        name: Beam
                    """;

            ImportResult result = importer.importYaml(yaml, ImportPolicy.FRESH, null);

            assertThat(result.success()).isFalse();
            assertThat(result.graph()).isNull();
            assertThat(result.errors()).containsExactly("Unknown block type 'teleporter' for block 'x'");
        }

        @Test
        void structuralErrorsFail() {
            assertThat(importer.importYaml("blocks: [", ImportPolicy.FRESH, null).errors())
                    .singleElement().asString().startsWith("YAML parsing error");
            assertThat(importer.importYaml("- just\n- a list\n", ImportPolicy.FRESH, null).errors())
                    .containsExactly("Invalid YAML: Root must be an object");
            assertThat(importer.importYaml("version: '1.0'\nblocks:\n  a:\n    name: A\n", ImportPolicy.FRESH, null).errors())
                    .containsExactly("Invalid block 'a': missing or invalid 'type' field");
        }
    }

    @Nested
    class Merge {

        @Test
        @DisplayName("document starters fold into the open graph's start block, keeping its id")
        void keepsExistingStartId() {
            WorkflowGraph existing = WorkflowGraph.empty();
            existing.addBlock(Block.builder().id("keep-me").type(BlockType.STARTER).name("Start").build());
            String yaml = """
                    version: '1.0'
                    blocks:
                      s1:
                        type: starter
                        name: Start
                      s2:
                        type: starter
                        name: Kickoff
                        connections:
                          success: agent1
                      agent1:
                        type: agent
                        name: Agent 1
                    """;

            ImportResult result = importer.importYaml(yaml, ImportPolicy.MERGE, existing);

            assertThat(result.success()).isTrue();
            assertThat(result.graph().getBlocks()).hasSize(2).containsKey("keep-me");
            assertThat(result.graph().getBlocks().get("keep-me").getName()).isEqualTo("Kickoff");
            String agentId = byName(result.graph(), "Agent 1").getId();
            assertThat(result.graph().getEdges()).extracting(Edge::getSource, Edge::getTarget)
                    .containsExactly(tuple("keep-me", agentId));
        }

        @Test
        @DisplayName("without an open start block the first document starter survives")
        void firstStarterSurvives() {
            ImportResult result = importer.importYaml(TWO_BLOCKS, ImportPolicy.MERGE, WorkflowGraph.empty());

            assertThat(result.success()).isTrue();
            assertThat(result.graph().getBlocks().values())
                    .filteredOn(b -> b.getType() == BlockType.STARTER)
                    .hasSize(1);
        }
    }
}
