package com.example.inventoryjobs.service;

import com.example.inventoryjobs.domain.entity.QueuedTask;
import com.example.inventoryjobs.domain.enums.TaskStatus;
import com.example.inventoryjobs.domain.enums.TaskType;
import com.example.inventoryjobs.domain.repository.QueuedTaskRepository;
import com.example.inventoryjobs.exception.InvalidTaskStateException;
import com.example.inventoryjobs.exception.TaskNotFoundException;
import com.example.inventoryjobs.service.queue.PayloadCodec;
import com.example.inventoryjobs.service.thumbnail.ThumbnailPayload;
import com.example.inventoryjobs.store.PhotoStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("TaskInspectionService Tests")
class TaskInspectionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private QueuedTaskRepository taskRepository;

    @Mock
    private PhotoStore photoStore;

    private PayloadCodec payloadCodec;
    private TaskInspectionService service;

    @BeforeEach
    void setUp() {
        payloadCodec = new PayloadCodec(new ObjectMapper().findAndRegisterModules(),
                Validation.buildDefaultValidatorFactory().getValidator());
        service = new TaskInspectionService(taskRepository, photoStore, payloadCodec, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private QueuedTask deadLetter(TaskType type, byte[] payload) {
        return QueuedTask.builder()
                .id(UUID.randomUUID())
                .taskType(type.getCode())
                .payload(payload)
                .queue("default")
                .status(TaskStatus.DEAD_LETTER)
                .retryCount(3)
                .maxRetry(3)
                .lastError("smtp timeout")
                .scheduledTime(NOW.minusSeconds(3600))
                .build();
    }

    @Nested
    @DisplayName("Requeue")
    class RequeueTests {

        @Test
        @DisplayName("Should reset a dead letter to pending with a fresh retry budget")
        void shouldRequeueDeadLetter() {
            // Given
            var task = deadLetter(TaskType.LOAN_REMINDER, "{}".getBytes(StandardCharsets.UTF_8));
            when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));
            when(taskRepository.save(task)).thenReturn(task);

            // When
            var requeued = service.requeue(task.getId());

            // Then
            assertThat(requeued.getStatus()).isEqualTo(TaskStatus.PENDING);
            assertThat(requeued.getRetryCount()).isZero();
            assertThat(requeued.getScheduledTime()).isEqualTo(NOW);
            assertThat(requeued.getLastError()).isNull();
            verifyNoInteractions(photoStore);
        }

        @Test
        @DisplayName("Should move the photo back to pending when requeuing a thumbnail task")
        void shouldResetPhotoForThumbnailTask() {
            // Given
            var photoId = UUID.randomUUID();
            var payload = ThumbnailPayload.builder()
                    .photoId(photoId)
                    .workspaceId(UUID.randomUUID())
                    .itemId(UUID.randomUUID())
                    .storagePath("ws/item/original.png")
                    .build();
            var task = deadLetter(TaskType.GENERATE_THUMBNAILS,
                    payloadCodec.encode(TaskType.GENERATE_THUMBNAILS, payload).getPayload());
            when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));
            when(photoStore.resetToPending(photoId)).thenReturn(true);
            when(taskRepository.save(task)).thenReturn(task);

            // When
            service.requeue(task.getId());

            // Then
            verify(photoStore).resetToPending(photoId);
            assertThat(task.getStatus()).isEqualTo(TaskStatus.PENDING);
        }

        @Test
        @DisplayName("Should still requeue a thumbnail task whose payload cannot be decoded")
        void shouldRequeueWithUndecodablePayload() {
            var task = deadLetter(TaskType.GENERATE_THUMBNAILS, "garbage".getBytes(StandardCharsets.UTF_8));
            when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));
            when(taskRepository.save(task)).thenReturn(task);

            service.requeue(task.getId());

            verifyNoInteractions(photoStore);
            assertThat(task.getStatus()).isEqualTo(TaskStatus.PENDING);
        }

        @Test
        @DisplayName("Should refuse to requeue a task that is not dead-lettered")
        void shouldRejectNonDeadLetter() {
            // Given
            var task = deadLetter(TaskType.LOAN_REMINDER, new byte[0]);
            task.setStatus(TaskStatus.PROCESSING);
            when(taskRepository.findById(task.getId())).thenReturn(Optional.of(task));

            // When & Then
            assertThatThrownBy(() -> service.requeue(task.getId()))
                    .isInstanceOf(InvalidTaskStateException.class);
            verify(taskRepository, never()).save(any());
        }

        @Test
        @DisplayName("Should report a missing task")
        void shouldThrowWhenMissing() {
            var id = UUID.randomUUID();
            when(taskRepository.findById(id)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.requeue(id))
                    .isInstanceOf(TaskNotFoundException.class);
        }
    }

    @Test
    @DisplayName("Should aggregate statistics across queues")
    void shouldAggregateStatistics() {
        // Given
        when(taskRepository.getStatsByQueueAndStatus()).thenReturn(List.of(
                new Object[]{"default", TaskStatus.PENDING, 4L},
                new Object[]{"critical", TaskStatus.PENDING, 2L},
                new Object[]{"default", TaskStatus.DEAD_LETTER, 1L}
        ));

        // When
        var stats = service.getQueueStatistics();

        // Then
        assertThat(stats.getPendingCount()).isEqualTo(6L);
        assertThat(stats.getDeadLetterCount()).isEqualTo(1L);
        assertThat(stats.getProcessingCount()).isZero();
        assertThat(stats.getQueueStatusDistribution().get("default"))
                .containsEntry("PENDING", 4L)
                .containsEntry("DEAD_LETTER", 1L);
        assertThat(stats.getGeneratedAt()).isEqualTo(NOW);
    }
}
