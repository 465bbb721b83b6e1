package com.blockflow.blockflow_backend.engine.state;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExecutionPhaseTest {

    @ParameterizedTest
    @EnumSource(ExecutionPhase.class)
    void everyPhaseHasATransitionRow(ExecutionPhase phase) {
        assertThat(phase.allowedTransitions()).isNotEmpty();
    }

    @ParameterizedTest
    @EnumSource(value = ExecutionPhase.class, names = {"COMPLETED", "ERRORED", "CANCELLED"})
    void terminalPhasesOnlyReturnToIdle(ExecutionPhase phase) {
        assertThat(phase.isTerminal()).isTrue();
        assertThat(phase.allowedTransitions()).containsExactly(ExecutionPhase.IDLE);
    }

    @Test
    void debugLoop() {
        assertThat(ExecutionPhase.EXECUTING.canTransitionTo(ExecutionPhase.AWAITING_STEP)).isTrue();
        assertThat(ExecutionPhase.AWAITING_STEP.canTransitionTo(ExecutionPhase.STEPPING)).isTrue();
        assertThat(ExecutionPhase.STEPPING.canTransitionTo(ExecutionPhase.AWAITING_STEP)).isTrue();
        assertThat(ExecutionPhase.RESUMING.canTransitionTo(ExecutionPhase.AWAITING_STEP)).isFalse();
        assertThat(ExecutionPhase.AWAITING_STEP.isDebugPhase()).isTrue();
    }

    @Test
    void illegalTransitionThrows() {
        assertThatThrownBy(() -> ExecutionPhase.IDLE.requireTransitionTo(ExecutionPhase.COMPLETED))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("IDLE -> COMPLETED");
        assertThatThrownBy(() -> ExecutionPhase.EXECUTING.requireTransitionTo(ExecutionPhase.EXECUTING))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void activity() {
        assertThat(ExecutionPhase.IDLE.isActive()).isFalse();
        assertThat(ExecutionPhase.COMPLETED.isActive()).isFalse();
        assertThat(ExecutionPhase.AWAITING_STEP.isActive()).isTrue();
    }
}
