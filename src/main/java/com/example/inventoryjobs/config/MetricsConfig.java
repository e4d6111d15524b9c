package com.example.inventoryjobs.config;

import com.example.inventoryjobs.domain.enums.TaskStatus;
import com.example.inventoryjobs.domain.repository.QueuedTaskRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Metrics configuration for monitoring the task broker and workers.
 * <p>
 * Exposes Prometheus metrics for:
 * - Task counts by status
 * - Queue depths
 * - Execution times
 * - Failures, retries and dead letters
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final QueuedTaskRepository taskRepository;
    private final JobsProperties properties;

    private final ConcurrentHashMap<String, AtomicLong> taskCounters = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        for (var status : TaskStatus.values()) {
            var key = "status_" + status.name().toLowerCase();
            taskCounters.put(key, new AtomicLong(0));

            Gauge.builder("task_scheduler_tasks", taskCounters.get(key), AtomicLong::get)
                    .tag("status", status.name().toLowerCase())
                    .description("Number of tasks by status")
                    .register(meterRegistry);
        }

        for (var queue : properties.getQueues().keySet()) {
            var key = "queue_" + queue;
            taskCounters.put(key, new AtomicLong(0));

            Gauge.builder("task_scheduler_queue_depth", taskCounters.get(key), AtomicLong::get)
                    .tag("queue", queue)
                    .description("Number of tasks waiting to run by queue")
                    .register(meterRegistry);
        }
    }

    /**
     * Periodically update gauge metrics from database
     */
    @Scheduled(fixedDelayString = "${jobs.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        for (var status : TaskStatus.values()) {
            var count = taskRepository.countByStatus(status);
            taskCounters.get("status_" + status.name().toLowerCase()).set(count);
        }

        for (var queue : properties.getQueues().keySet()) {
            var depth = taskRepository.countByQueueAndStatus(queue, TaskStatus.PENDING)
                    + taskRepository.countByQueueAndStatus(queue, TaskStatus.RETRY_PENDING);
            taskCounters.get("queue_" + queue).set(depth);
        }
    }

    public Timer.Sample startTaskExecutionTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordTaskExecution(Timer.Sample sample, String taskType, boolean success) {
        sample.stop(Timer.builder("task_scheduler_execution_time")
                .tag("type", taskType)
                .tag("success", String.valueOf(success))
                .description("Task execution time")
                .register(meterRegistry));
    }

    public void recordTaskFailure(String taskType, String errorType) {
        meterRegistry.counter("task_scheduler_failures",
                "type", taskType,
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    public void recordRetry(String taskType, int attemptNumber) {
        meterRegistry.counter("task_scheduler_retries",
                "type", taskType,
                "attempt", String.valueOf(attemptNumber)
        ).increment();
    }

    public void recordDeadLetter(String taskType) {
        meterRegistry.counter("task_scheduler_dead_letters", "type", taskType).increment();
    }

    public void recordEnqueued(String taskType, String queue) {
        meterRegistry.counter("task_scheduler_enqueued", "type", taskType, "queue", queue).increment();
    }
}
