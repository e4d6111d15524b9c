package com.example.inventoryjobs.service.queue;

import com.example.inventoryjobs.config.JobsProperties;
import com.example.inventoryjobs.config.MetricsConfig;
import com.example.inventoryjobs.domain.entity.QueuedTask;
import com.example.inventoryjobs.domain.enums.TaskStatus;
import com.example.inventoryjobs.domain.enums.TaskType;
import com.example.inventoryjobs.domain.repository.QueuedTaskRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TaskQueueClient Tests")
class TaskQueueClientTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private QueuedTaskRepository taskRepository;

    @Mock
    private MetricsConfig metricsConfig;

    private TaskQueueClient client;

    @BeforeEach
    void setUp() {
        client = new TaskQueueClient(taskRepository, new JobsProperties(), metricsConfig, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Should apply broker defaults to an empty options object")
    void shouldApplyDefaults() {
        // Given
        when(taskRepository.save(any(QueuedTask.class))).thenAnswer(invocation -> invocation.getArgument(0));

        // When
        var row = client.enqueue(Task.of(TaskType.CLEANUP_OLD_ACTIVITY));

        // Then
        assertThat(row.getStatus()).isEqualTo(TaskStatus.PENDING);
        assertThat(row.getQueue()).isEqualTo("default");
        assertThat(row.getMaxRetry()).isEqualTo(3);
        assertThat(row.getRetryCount()).isZero();
        assertThat(row.getTimeoutSeconds()).isEqualTo(600L);
        assertThat(row.getRetentionSeconds()).isZero();
        assertThat(row.getScheduledTime()).isEqualTo(NOW);
        verify(metricsConfig).recordEnqueued("cleanup:old_activity", "default");
    }

    @Test
    @DisplayName("Should honour explicit options")
    void shouldApplyOptions() {
        // Given
        when(taskRepository.save(any(QueuedTask.class))).thenAnswer(invocation -> invocation.getArgument(0));
        var options = TaskOptions.builder()
                .queue("critical")
                .maxRetry(5)
                .timeout(Duration.ofMinutes(2))
                .retention(Duration.ofHours(1))
                .processIn(Duration.ofMinutes(15))
                .build();

        // When
        var row = client.enqueue(Task.of(TaskType.LOAN_REMINDER, new byte[]{'{', '}'}), options);

        // Then
        assertThat(row.getQueue()).isEqualTo("critical");
        assertThat(row.getMaxRetry()).isEqualTo(5);
        assertThat(row.getTimeoutSeconds()).isEqualTo(120L);
        assertThat(row.getRetentionSeconds()).isEqualTo(3600L);
        assertThat(row.getScheduledTime()).isEqualTo(NOW.plus(Duration.ofMinutes(15)));
    }

    @Test
    @DisplayName("Should prefer an absolute run time over a relative delay")
    void shouldPreferProcessAt() {
        when(taskRepository.save(any(QueuedTask.class))).thenAnswer(invocation -> invocation.getArgument(0));
        var at = NOW.plus(Duration.ofDays(1));

        var row = client.enqueue(Task.of(TaskType.LOAN_REMINDER),
                TaskOptions.builder().processAt(at).processIn(Duration.ofMinutes(1)).build());

        assertThat(row.getScheduledTime()).isEqualTo(at);
    }

    @Test
    @DisplayName("Should reject an unknown queue and invalid limits")
    void shouldRejectInvalidOptions() {
        assertThatThrownBy(() -> client.enqueue(Task.of(TaskType.LOAN_REMINDER), TaskOptions.onQueue("bulk")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("bulk");
        assertThatThrownBy(() -> client.enqueue(Task.of(TaskType.LOAN_REMINDER), TaskOptions.builder().maxRetry(-1).build()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> client.enqueue(Task.of(TaskType.LOAN_REMINDER), TaskOptions.builder().timeout(Duration.ZERO).build()))
                .isInstanceOf(IllegalArgumentException.class);
        verify(taskRepository, never()).save(any());
    }
}
