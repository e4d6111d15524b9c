package com.example.inventoryjobs.service;

import com.example.inventoryjobs.domain.entity.QueuedTask;
import com.example.inventoryjobs.domain.enums.TaskStatus;
import com.example.inventoryjobs.domain.enums.TaskType;
import com.example.inventoryjobs.domain.repository.QueuedTaskRepository;
import com.example.inventoryjobs.dto.QueueStatistics;
import com.example.inventoryjobs.exception.InvalidPayloadException;
import com.example.inventoryjobs.exception.InvalidTaskStateException;
import com.example.inventoryjobs.exception.TaskNotFoundException;
import com.example.inventoryjobs.service.queue.PayloadCodec;
import com.example.inventoryjobs.service.thumbnail.ThumbnailPayload;
import com.example.inventoryjobs.store.PhotoStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Operator view of the broker.
 * <p>
 * Provides:
 * - Dead letter listing
 * - Per-queue statistics
 * - Re-enqueue of dead-lettered tasks with a fresh retry budget
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskInspectionService {

    private final QueuedTaskRepository taskRepository;
    private final PhotoStore photoStore;
    private final PayloadCodec payloadCodec;
    private final Clock clock;

    @Transactional(readOnly = true)
    public Page<QueuedTask> listDeadLetters(Pageable pageable) {
        return taskRepository.findByStatusOrderByUpdatedAtDesc(TaskStatus.DEAD_LETTER, pageable);
    }

    @Transactional(readOnly = true)
    public QueuedTask getTask(UUID taskId) {
        return taskRepository.findById(taskId)
                .orElseThrow(() -> new TaskNotFoundException(taskId));
    }

    @Transactional(readOnly = true)
    public QueueStatistics getQueueStatistics() {
        var distribution = new HashMap<String, Map<String, Long>>();
        var totals = new HashMap<TaskStatus, Long>();
        for (var row : taskRepository.getStatsByQueueAndStatus()) {
            var queue = (String) row[0];
            var status = (TaskStatus) row[1];
            var count = (Long) row[2];
            distribution.computeIfAbsent(queue, k -> new HashMap<>()).put(status.name(), count);
            totals.merge(status, count, Long::sum);
        }

        return QueueStatistics.builder()
                .queueStatusDistribution(distribution)
                .pendingCount(totals.getOrDefault(TaskStatus.PENDING, 0L))
                .processingCount(totals.getOrDefault(TaskStatus.PROCESSING, 0L))
                .retryPendingCount(totals.getOrDefault(TaskStatus.RETRY_PENDING, 0L))
                .completedCount(totals.getOrDefault(TaskStatus.COMPLETED, 0L))
                .deadLetterCount(totals.getOrDefault(TaskStatus.DEAD_LETTER, 0L))
                .generatedAt(clock.instant())
                .build();
    }

    /**
     * Put a dead-lettered task back on its queue with a fresh retry budget.
     * A thumbnail task first moves its photo from failed back to pending.
     */
    @Transactional
    public QueuedTask requeue(UUID taskId) {
        var task = getTask(taskId);
        if (task.getStatus() != TaskStatus.DEAD_LETTER) {
            throw new InvalidTaskStateException(taskId.toString(), task.getStatus().name(), TaskStatus.PENDING.name());
        }

        if (task.resolveType().filter(type -> type == TaskType.GENERATE_THUMBNAILS).isPresent()) {
            resetPhoto(task);
        }

        task.setStatus(TaskStatus.PENDING);
        task.setRetryCount(0);
        task.setScheduledTime(clock.instant());
        task.setCompletedAt(null);
        task.setLastError(null);
        task.setLastErrorStackTrace(null);
        task.setLockedBy(null);
        task.setLockedUntil(null);

        log.info("Re-enqueued dead-lettered task {} (type: {}) on queue {}", taskId, task.getTaskType(), task.getQueue());
        return taskRepository.save(task);
    }

    private void resetPhoto(QueuedTask task) {
        try {
            var payload = payloadCodec.decode(task, ThumbnailPayload.class);
            if (!photoStore.resetToPending(payload.getPhotoId())) {
                log.info("Photo {} was not in failed state, leaving its status unchanged", payload.getPhotoId());
            }
        } catch (InvalidPayloadException e) {
            log.warn("Task {} has an undecodable thumbnail payload, photo status not reset: {}", task.getId(), e.getMessage());
        }
    }
}
