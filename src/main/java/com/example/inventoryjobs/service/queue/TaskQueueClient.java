package com.example.inventoryjobs.service.queue;

import com.example.inventoryjobs.config.JobsProperties;
import com.example.inventoryjobs.config.MetricsConfig;
import com.example.inventoryjobs.domain.entity.QueuedTask;
import com.example.inventoryjobs.domain.enums.TaskQueue;
import com.example.inventoryjobs.domain.enums.TaskStatus;
import com.example.inventoryjobs.domain.repository.QueuedTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;

/**
 * Producer side of the task broker.
 * <p>
 * Writes one PENDING row per call. Delivery is at-least-once: handlers must tolerate
 * running the same task more than once.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskQueueClient {

    private final QueuedTaskRepository taskRepository;
    private final JobsProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    @Transactional
    public QueuedTask enqueue(Task task, TaskOptions options) {
        var queue = options.getQueue() != null ? options.getQueue() : TaskQueue.DEFAULT.getCode();
        if (!properties.getQueues().containsKey(queue)) {
            throw new IllegalArgumentException("Unknown queue: " + queue);
        }

        var maxRetry = options.getMaxRetry() != null ? options.getMaxRetry() : properties.getDefaultMaxRetry();
        if (maxRetry < 0) {
            throw new IllegalArgumentException("maxRetry must not be negative: " + maxRetry);
        }

        var timeout = options.getTimeout() != null ? options.getTimeout() : task.getType().getDefaultTimeout();
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }

        var retention = options.getRetention() != null ? options.getRetention() : Duration.ZERO;
        if (retention.isNegative()) {
            throw new IllegalArgumentException("retention must not be negative: " + retention);
        }

        var now = clock.instant();
        var scheduledTime = now;
        if (options.getProcessAt() != null) {
            scheduledTime = options.getProcessAt();
        } else if (options.getProcessIn() != null) {
            scheduledTime = now.plus(options.getProcessIn());
        }

        var row = QueuedTask.builder()
                .taskType(task.getType().getCode())
                .payload(task.getPayload())
                .queue(queue)
                .status(TaskStatus.PENDING)
                .retryCount(0)
                .maxRetry(maxRetry)
                .timeoutSeconds(Math.max(1L, timeout.toSeconds()))
                .retentionSeconds(retention.toSeconds())
                .scheduledTime(scheduledTime)
                .build();

        var saved = taskRepository.save(row);
        metricsConfig.recordEnqueued(saved.getTaskType(), queue);
        log.info("Enqueued task {} (type: {}, queue: {}, maxRetry: {}, runAt: {})",
                saved.getId(), saved.getTaskType(), queue, maxRetry, scheduledTime);
        return saved;
    }

    public QueuedTask enqueue(Task task) {
        return enqueue(task, TaskOptions.defaults());
    }
}
