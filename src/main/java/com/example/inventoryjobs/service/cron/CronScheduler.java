package com.example.inventoryjobs.service.cron;

import com.example.inventoryjobs.config.JobsProperties;
import com.example.inventoryjobs.service.queue.Task;
import com.example.inventoryjobs.service.queue.TaskOptions;
import com.example.inventoryjobs.service.queue.TaskQueueClient;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockConfiguration;
import net.javacrumbs.shedlock.core.LockingTaskExecutor;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Fires registered tasks on cron schedules.
 * <p>
 * Every instance runs the triggers; a ShedLock lock named {@code cron:<type>} makes sure
 * one fire enqueues exactly one task across the cluster. Missed fires (process down) are
 * skipped, not backfilled.
 */
@Slf4j
@Component
public class CronScheduler implements SmartLifecycle {

    static final Duration LOCK_AT_MOST_FOR = Duration.ofMinutes(5);
    static final Duration LOCK_AT_LEAST_FOR = Duration.ofSeconds(30);

    private final TaskQueueClient taskQueueClient;
    private final LockingTaskExecutor lockingTaskExecutor;
    private final Clock clock;
    private final ZoneId zone;
    private final List<Registration> registrations = new CopyOnWriteArrayList<>();

    private ThreadPoolTaskScheduler scheduler;
    private volatile boolean running;

    public CronScheduler(TaskQueueClient taskQueueClient, LockingTaskExecutor lockingTaskExecutor,
                         JobsProperties properties, Clock clock) {
        this.taskQueueClient = taskQueueClient;
        this.lockingTaskExecutor = lockingTaskExecutor;
        this.clock = clock;
        this.zone = ZoneId.of(properties.getScheduler().getZone());
    }

    /**
     * Register a recurring task.
     *
     * @param cronExpr 5-field (minute resolution) or 6-field (with seconds) cron expression
     * @param task     task enqueued on every fire
     * @param queue    target queue
     * @throws IllegalArgumentException if the expression is not valid
     */
    public synchronized void register(String cronExpr, Task task, String queue) {
        var registration = new Registration(normalize(cronExpr), task, queue);
        registrations.add(registration);
        log.info("Registered cron schedule '{}' for task type {} on queue {}", cronExpr, task.getType().getCode(), queue);
        if (running) {
            schedule(registration);
        }
    }

    public List<Registration> getRegistrations() {
        return List.copyOf(registrations);
    }

    /**
     * Convert a cron expression to the 6-field form Spring evaluates
     */
    static String normalize(String cronExpr) {
        if (cronExpr == null || cronExpr.isBlank()) {
            throw new IllegalArgumentException("Cron expression must not be blank");
        }
        var trimmed = cronExpr.trim();
        var fields = trimmed.split("\\s+").length;
        String expression;
        if (fields == 5) {
            expression = "0 " + trimmed;
        } else if (fields == 6) {
            expression = trimmed;
        } else {
            throw new IllegalArgumentException("Cron expression must have 5 or 6 fields: " + cronExpr);
        }
        if (!CronExpression.isValidExpression(expression)) {
            throw new IllegalArgumentException("Invalid cron expression: " + cronExpr);
        }
        return expression;
    }

    void fire(Registration registration) {
        var lockName = "cron:" + registration.getTask().getType().getCode();
        var lockConfig = new LockConfiguration(clock.instant(), lockName, LOCK_AT_MOST_FOR, LOCK_AT_LEAST_FOR);
        try {
            lockingTaskExecutor.executeWithLock((Runnable) () -> enqueue(registration), lockConfig);
        } catch (Exception e) {
            log.error("Cron fire for {} failed: {}", lockName, e.getMessage(), e);
        }
    }

    private void enqueue(Registration registration) {
        var queued = taskQueueClient.enqueue(registration.getTask(), TaskOptions.onQueue(registration.getQueue()));
        log.info("Cron fired task {} (type: {})", queued.getId(), registration.getTask().getType().getCode());
    }

    private void schedule(Registration registration) {
        scheduler.schedule(() -> fire(registration), new CronTrigger(registration.getExpression(), zone));
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("cron-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        registrations.forEach(this::schedule);
        running = true;
        log.info("Cron scheduler started with {} schedules in zone {}", registrations.size(), zone);
    }

    @Override
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdown();
        log.info("Cron scheduler stopped");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Value
    public static class Registration {
        String expression;
        Task task;
        String queue;
    }
}
