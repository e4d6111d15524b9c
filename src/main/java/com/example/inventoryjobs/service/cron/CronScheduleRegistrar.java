package com.example.inventoryjobs.service.cron;

import com.example.inventoryjobs.config.JobsProperties;
import com.example.inventoryjobs.domain.enums.TaskQueue;
import com.example.inventoryjobs.domain.enums.TaskType;
import com.example.inventoryjobs.service.queue.Task;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Registers the recurring maintenance and reminder schedules.
 * Disabled with {@code jobs.scheduler.enabled=false} for worker-only processes.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "jobs.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class CronScheduleRegistrar {

    private final CronScheduler cronScheduler;
    private final JobsProperties properties;

    @PostConstruct
    public void registerSchedules() {
        var schedules = properties.getScheduler().getSchedules();
        var queue = TaskQueue.DEFAULT.getCode();

        cronScheduler.register(schedules.getLoanReminders(), Task.of(TaskType.LOAN_REMINDER_SCHEDULE), queue);
        cronScheduler.register(schedules.getRepairReminders(), Task.of(TaskType.REPAIR_REMINDER_SCHEDULE), queue);
        cronScheduler.register(schedules.getDeletedRecordsCleanup(), Task.of(TaskType.CLEANUP_DELETED_RECORDS), queue);
        cronScheduler.register(schedules.getActivityCleanup(), Task.of(TaskType.CLEANUP_OLD_ACTIVITY), queue);
    }
}
