package com.example.inventoryjobs.service.executor;

import com.example.inventoryjobs.config.JobsProperties;
import com.example.inventoryjobs.config.MetricsConfig;
import com.example.inventoryjobs.domain.entity.QueuedTask;
import com.example.inventoryjobs.domain.enums.TaskStatus;
import com.example.inventoryjobs.domain.repository.QueuedTaskRepository;
import com.example.inventoryjobs.service.alert.SlackAlertService;
import com.example.inventoryjobs.service.handler.TaskContext;
import com.example.inventoryjobs.service.handler.TaskExecutionResult;
import com.example.inventoryjobs.service.handler.TaskHandlerRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.net.InetAddress;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ScheduledExecutorService;

/**
 * Service responsible for claiming and executing individual tasks.
 * <p>
 * Handles:
 * - Claiming due rows with a lease
 * - Typed dispatch to the registered handler
 * - Deadline enforcement through a watchdog interrupt
 * - Retry scheduling with linear backoff
 * - Dead-lettering, metrics and alerts
 * <p>
 * Outcome writes carry the row version. If the lease was recovered in the meantime the
 * write is dropped, since another attempt now owns the task.
 */
@Slf4j
@Service
public class TaskExecutorService {

    private final QueuedTaskRepository taskRepository;
    private final TaskHandlerRegistry handlerRegistry;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final JobsProperties properties;
    private final ScheduledExecutorService watchdogScheduler;
    private final Clock clock;

    @Value("${HOSTNAME:unknown}")
    private String hostname;

    private String instanceId;

    public TaskExecutorService(QueuedTaskRepository taskRepository, TaskHandlerRegistry handlerRegistry,
                               SlackAlertService slackAlertService, MetricsConfig metricsConfig, JobsProperties properties,
                               @Qualifier("taskWatchdogScheduler") ScheduledExecutorService watchdogScheduler, Clock clock) {
        this.taskRepository = taskRepository;
        this.handlerRegistry = handlerRegistry;
        this.slackAlertService = slackAlertService;
        this.metricsConfig = metricsConfig;
        this.properties = properties;
        this.watchdogScheduler = watchdogScheduler;
        this.clock = clock;
    }

    @PostConstruct
    public void initInstanceId() {
        try {
            var host = InetAddress.getLocalHost().getHostName();
            instanceId = host + "-" + ProcessHandle.current().pid();
        } catch (Exception e) {
            instanceId = hostname + "-" + UUID.randomUUID().toString().substring(0, 8);
        }
    }

    public String getInstanceId() {
        return instanceId;
    }

    /**
     * Claim up to {@code limit} due tasks of one queue.
     * Rows locked by another worker are skipped, never waited on.
     */
    @Transactional
    public List<QueuedTask> claimDueTasks(String queue, int limit) {
        if (limit <= 0) {
            return List.of();
        }

        var now = clock.instant();
        var tasks = taskRepository.findDueTasksForUpdate(queue, now, limit);
        if (tasks.isEmpty()) {
            return tasks;
        }

        var grace = properties.getWorker().getLeaseGrace();
        for (var task : tasks) {
            task.setStatus(TaskStatus.PROCESSING);
            task.setLockedBy(instanceId);
            task.setLockedUntil(now.plus(task.getTimeout()).plus(grace));
            task.setStartedAt(now);
        }
        log.debug("Claimed {} tasks from queue {}", tasks.size(), queue);
        return taskRepository.saveAll(tasks);
    }

    /**
     * Hand a claimed task back without counting an attempt, e.g. when the pool is shutting down
     */
    public void releaseClaim(QueuedTask task) {
        task.setStatus(task.getRetryCount() > 0 ? TaskStatus.RETRY_PENDING : TaskStatus.PENDING);
        task.setLockedBy(null);
        task.setLockedUntil(null);
        saveOutcome(task);
    }

    /**
     * Execute a claimed task on the calling thread.
     *
     * @return true if the handler reported success within the deadline
     */
    public boolean executeTask(QueuedTask task) {
        var resolved = task.resolveType();
        if (resolved.isEmpty()) {
            log.error("Task {} has unknown type '{}', dead-lettering", task.getId(), task.getTaskType());
            applyFailure(task, TaskExecutionResult.permanentFailure(
                    "Unknown task type: " + task.getTaskType(), TaskExecutionResult.ERROR_UNKNOWN_TYPE));
            return false;
        }

        var type = resolved.get();
        var handler = handlerRegistry.getHandlerOrThrow(type);
        var startTime = clock.instant();
        var context = TaskContext.builder()
                .taskId(task.getId())
                .type(type)
                .queue(task.getQueue())
                .attempt(task.getAttempt())
                .maxRetry(task.getMaxRetry())
                .deadline(startTime.plus(task.getTimeout()))
                .clock(clock)
                .build();

        log.info("Starting execution of task {} (type: {}, queue: {}, attempt: {}/{})",
                task.getId(), type.getCode(), task.getQueue(), task.getAttempt(), task.getMaxRetry() + 1);

        var timerSample = metricsConfig.startTaskExecutionTimer();
        var watchdog = DeadlineWatchdog.arm(watchdogScheduler, Thread.currentThread(), task.getTimeout());
        TaskExecutionResult result;
        try {
            result = handler.execute(context, task);
            if (result == null) {
                result = TaskExecutionResult.failure("Handler returned no result", "NO_RESULT");
            }
        } catch (Exception e) {
            result = TaskExecutionResult.failure(e);
        } catch (Error e) {
            // a crashing handler fails its attempt; the worker thread keeps serving
            log.error("Task {} crashed: {}", task.getId(), e.toString(), e);
            result = TaskExecutionResult.failure(e);
        } finally {
            watchdog.disarm();
        }

        if (watchdog.hasFired()) {
            result = TaskExecutionResult.timeout("Task exceeded its timeout of " + task.getTimeout())
                    .withAuxiliaryFailures(result.getAuxiliaryFailures());
        }

        var endTime = clock.instant();
        task.setExecutionDurationMs(Duration.between(startTime, endTime).toMillis());

        if (result.hasAuxiliaryFailures()) {
            log.warn("Task {} had {} best-effort failures: {}", task.getId(), result.getAuxiliaryFailures().size(), result.getAuxiliaryFailures());
        }

        if (result.isSuccess()) {
            metricsConfig.recordTaskExecution(timerSample, task.getTaskType(), true);
            handleSuccess(task, result, endTime);
            return true;
        }

        metricsConfig.recordTaskExecution(timerSample, task.getTaskType(), false);
        metricsConfig.recordTaskFailure(task.getTaskType(), result.getErrorType());
        applyFailure(task, result);
        return false;
    }

    /**
     * Apply the retry policy to a failed attempt: retry with linear backoff while the
     * budget lasts, dead-letter otherwise.
     */
    public void applyFailure(QueuedTask task, TaskExecutionResult result) {
        var now = clock.instant();
        task.setLastError(result.getErrorMessage());
        task.setLastErrorStackTrace(result.getStackTrace());
        task.setLockedBy(null);
        task.setLockedUntil(null);

        if (!result.isRetryable() || !task.canRetry()) {
            deadLetter(task, result, now);
            return;
        }

        var newRetryCount = task.getRetryCount() + 1;
        var nextRetryTime = now.plus(properties.getRetryDelayStep().multipliedBy(newRetryCount));
        log.warn("Task {} failed ({}: {}), scheduling retry {}/{} at {}", task.getId(), result.getErrorType(),
                result.getErrorMessage(), newRetryCount, task.getMaxRetry(), nextRetryTime);

        task.setStatus(TaskStatus.RETRY_PENDING);
        task.setRetryCount(newRetryCount);
        task.setScheduledTime(nextRetryTime);
        if (saveOutcome(task)) {
            metricsConfig.recordRetry(task.getTaskType(), newRetryCount);
        }
    }

    private void handleSuccess(QueuedTask task, TaskExecutionResult result, Instant endTime) {
        log.info("Task {} completed successfully in {}ms {}", task.getId(), task.getExecutionDurationMs(),
                result.getResponseData().isEmpty() ? "" : result.getResponseData());

        if (task.getRetentionSeconds() <= 0) {
            try {
                taskRepository.delete(task);
            } catch (OptimisticLockingFailureException e) {
                log.warn("Task {} was reclaimed before its completion was recorded: {}", task.getId(), e.getMessage());
            }
            return;
        }

        task.setStatus(TaskStatus.COMPLETED);
        task.setCompletedAt(endTime);
        task.setRetainUntil(endTime.plus(task.getRetention()));
        task.setLastError(null);
        task.setLastErrorStackTrace(null);
        task.setLockedBy(null);
        task.setLockedUntil(null);
        saveOutcome(task);
    }

    private void deadLetter(QueuedTask task, TaskExecutionResult result, Instant now) {
        log.error("Task {} (type: {}) dead-lettered after {} attempts: {}", task.getId(), task.getTaskType(),
                task.getRetryCount() + 1, result.getErrorMessage());

        task.setStatus(TaskStatus.DEAD_LETTER);
        task.setCompletedAt(now);
        if (saveOutcome(task)) {
            metricsConfig.recordDeadLetter(task.getTaskType());
            notifyHandler(task, result);
            slackAlertService.sendDeadLetterAlert(task);
        }
    }

    private void notifyHandler(QueuedTask task, TaskExecutionResult result) {
        var handler = task.resolveType().flatMap(handlerRegistry::getHandler);
        if (handler.isEmpty()) {
            return;
        }
        try {
            handler.get().onDeadLetter(task, result);
        } catch (Exception e) {
            log.warn("Dead-letter hook for task {} failed: {}", task.getId(), e.getMessage(), e);
        }
    }

    private boolean saveOutcome(QueuedTask task) {
        try {
            taskRepository.save(task);
            return true;
        } catch (OptimisticLockingFailureException e) {
            log.warn("Task {} was reclaimed before its outcome was recorded: {}", task.getId(), e.getMessage());
            return false;
        }
    }
}
