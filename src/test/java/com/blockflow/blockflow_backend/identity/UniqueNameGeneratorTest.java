package com.blockflow.blockflow_backend.identity;

import com.blockflow.blockflow_backend.model.domain.Block;
import com.blockflow.blockflow_backend.model.domain.BlockType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UniqueNameGeneratorTest {

    private final UniqueNameGenerator generator = new UniqueNameGenerator();

    private static Block named(String name) {
        return Block.builder().id(name).type(BlockType.AGENT).name(name).build();
    }

    @Test
    @DisplayName("first copy of a name gets suffix 1")
    void firstCopy() {
        assertThat(generator.uniqueName("Agent", BlockType.AGENT, List.of())).isEqualTo("Agent 1");
    }

    @Test
    @DisplayName("suffix is one past the highest existing number, gaps are not reused")
    void monotonicSuffix() {
        List<Block> existing = List.of(named("Agent 1"), named("Agent 7"), named("Agent 3"));

        assertThat(generator.uniqueName("Agent 3", BlockType.AGENT, existing)).isEqualTo("Agent 8");
    }

    @Test
    @DisplayName("matching ignores case and whitespace")
    void normalizedMatching() {
        List<Block> existing = List.of(named("my agent 2"));

        assertThat(generator.uniqueName("My Agent", BlockType.AGENT, existing)).isEqualTo("My Agent 3");
    }

    @Test
    @DisplayName("an unsuffixed existing name counts as the baseline")
    void unsuffixedBaseline() {
        assertThat(generator.uniqueName("Function", BlockType.FUNCTION, List.of(named("Function"))))
                .isEqualTo("Function 1");
    }

    @Test
    @DisplayName("Start and Response are pinned names")
    void pinnedNames() {
        assertThat(generator.uniqueName("Start", BlockType.START_TRIGGER, List.of(named("Start"))))
                .isEqualTo(UniqueNameGenerator.START_NAME);
        assertThat(generator.uniqueName("Anything", BlockType.CHAT_TRIGGER, List.of()))
                .isEqualTo("Start");
        assertThat(generator.uniqueName("Response 4", BlockType.RESPONSE, List.of(named("Response"))))
                .isEqualTo(UniqueNameGenerator.RESPONSE_NAME);
    }

    @Test
    void digitsTooLongForAnIntAreTreatedAsBaseline() {
        List<Block> existing = List.of(named("Agent 99999999999999999999"));

        assertThat(generator.uniqueName("Agent", BlockType.AGENT, existing)).isEqualTo("Agent 1");
    }
}
