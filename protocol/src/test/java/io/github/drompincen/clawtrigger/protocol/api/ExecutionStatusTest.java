package io.github.drompincen.clawtrigger.protocol.api;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutionStatusTest {

    @Test
    void allStatusValuesExist() {
        assertThat(ExecutionStatus.values()).containsExactly(
                ExecutionStatus.PENDING,
                ExecutionStatus.RUNNING,
                ExecutionStatus.RETRYING,
                ExecutionStatus.COMPLETED,
                ExecutionStatus.COMPLETED_SILENT,
                ExecutionStatus.FAILED,
                ExecutionStatus.CANCELLED);
    }

    @Test
    void terminalStatusesAreTheFourEndStates() {
        assertThat(ExecutionStatus.COMPLETED.isTerminal()).isTrue();
        assertThat(ExecutionStatus.COMPLETED_SILENT.isTerminal()).isTrue();
        assertThat(ExecutionStatus.FAILED.isTerminal()).isTrue();
        assertThat(ExecutionStatus.CANCELLED.isTerminal()).isTrue();

        assertThat(ExecutionStatus.PENDING.isTerminal()).isFalse();
        assertThat(ExecutionStatus.RUNNING.isTerminal()).isFalse();
        assertThat(ExecutionStatus.RETRYING.isTerminal()).isFalse();
    }
}
