package com.example.inventoryjobs.service.reminder;

import com.example.inventoryjobs.config.JobsProperties;
import com.example.inventoryjobs.domain.entity.QueuedTask;
import com.example.inventoryjobs.domain.enums.TaskType;
import com.example.inventoryjobs.domain.model.DueRepair;
import com.example.inventoryjobs.service.handler.TaskContext;
import com.example.inventoryjobs.service.handler.TaskExecutionResult;
import com.example.inventoryjobs.service.handler.TaskHandler;
import com.example.inventoryjobs.service.queue.PayloadCodec;
import com.example.inventoryjobs.service.queue.TaskQueueClient;
import com.example.inventoryjobs.store.ReminderStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * Handler for {@code repair:reminder:schedule} tasks.
 * <p>
 * Enqueues one {@code repair:reminder} task per repair log whose reminder date falls within
 * the lookahead window and whose reminder has not been sent yet.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RepairReminderScheduler implements TaskHandler {

    private final ReminderStore reminderStore;
    private final TaskQueueClient taskQueueClient;
    private final PayloadCodec payloadCodec;
    private final JobsProperties properties;
    private final Clock clock;

    @Override
    public TaskType getTaskType() {
        return TaskType.REPAIR_REMINDER_SCHEDULE;
    }

    @Override
    public TaskExecutionResult execute(TaskContext context, QueuedTask task) {
        var cutoff = LocalDate.ofInstant(clock.instant(), ZoneOffset.UTC).plusDays(properties.getReminders().getLookaheadDays());

        List<DueRepair> repairs;
        try {
            repairs = reminderStore.findRepairsNeedingReminder(cutoff);
        } catch (DataAccessException e) {
            log.error("Failed to query repair reminders due by {}: {}", cutoff, e.getMessage());
            return TaskExecutionResult.failure(e);
        }

        var enqueued = 0;
        var failed = 0;
        for (var repair : repairs) {
            context.throwIfCancelled();
            try {
                var payload = toPayload(repair);
                taskQueueClient.enqueue(payloadCodec.encode(TaskType.REPAIR_REMINDER, payload),
                        LoanReminderScheduler.REMINDER_OPTIONS);
                enqueued++;
            } catch (Exception e) {
                log.warn("Failed to enqueue reminder for repair {}: {}", repair.getRepairLogId(), e.getMessage());
                failed++;
            }
        }

        log.info("Scheduled {} repair reminders ({} failed) for reminders due by {}", enqueued, failed, cutoff);
        return TaskExecutionResult.success(Map.of("enqueued", enqueued, "failed", failed));
    }

    static RepairReminderPayload toPayload(DueRepair repair) {
        return RepairReminderPayload.builder()
                .repairLogId(repair.getRepairLogId())
                .workspaceId(repair.getWorkspaceId())
                .inventoryId(repair.getInventoryId())
                .itemName(repair.getItemName())
                .description(repair.getDescription())
                .reminderDate(repair.getReminderDate())
                .build();
    }
}
