package com.example.inventoryjobs.domain.enums;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TaskStatus Tests")
class TaskStatusTest {

    @Test
    @DisplayName("Should only let workers claim pending and retry-pending rows")
    void shouldFlagExecutableStatuses() {
        assertThat(TaskStatus.PENDING.isExecutable()).isTrue();
        assertThat(TaskStatus.RETRY_PENDING.isExecutable()).isTrue();
        assertThat(TaskStatus.PROCESSING.isExecutable()).isFalse();
        assertThat(TaskStatus.COMPLETED.isExecutable()).isFalse();
        assertThat(TaskStatus.DEAD_LETTER.isExecutable()).isFalse();
    }

    @Test
    @DisplayName("Should treat completed and dead-letter as terminal")
    void shouldFlagTerminalStatuses() {
        assertThat(TaskStatus.COMPLETED.isTerminal()).isTrue();
        assertThat(TaskStatus.DEAD_LETTER.isTerminal()).isTrue();
        assertThat(TaskStatus.RETRY_PENDING.isTerminal()).isFalse();
    }

    @Test
    @DisplayName("Should resolve status codes")
    void shouldResolveCodes() {
        assertThat(TaskStatus.fromCode("dead-letter")).isEqualTo(TaskStatus.DEAD_LETTER);
        assertThatThrownBy(() -> TaskStatus.fromCode("archived")).isInstanceOf(IllegalArgumentException.class);
    }
}
