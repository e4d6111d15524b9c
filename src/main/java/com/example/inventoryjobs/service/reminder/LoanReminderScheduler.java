package com.example.inventoryjobs.service.reminder;

import com.example.inventoryjobs.config.JobsProperties;
import com.example.inventoryjobs.domain.entity.QueuedTask;
import com.example.inventoryjobs.domain.enums.TaskQueue;
import com.example.inventoryjobs.domain.enums.TaskType;
import com.example.inventoryjobs.domain.model.DueLoan;
import com.example.inventoryjobs.service.handler.TaskContext;
import com.example.inventoryjobs.service.handler.TaskExecutionResult;
import com.example.inventoryjobs.service.handler.TaskHandler;
import com.example.inventoryjobs.service.queue.PayloadCodec;
import com.example.inventoryjobs.service.queue.TaskOptions;
import com.example.inventoryjobs.service.queue.TaskQueueClient;
import com.example.inventoryjobs.store.ReminderStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * Handler for {@code loan:reminder:schedule} tasks.
 * <p>
 * Finds unreturned loans due within the lookahead window, overdue ones included, and
 * enqueues one {@code loan:reminder} task per loan. Loans stay in the window until
 * returned, so an overdue loan is reminded again on every run.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoanReminderScheduler implements TaskHandler {

    static final TaskOptions REMINDER_OPTIONS = TaskOptions.builder()
            .queue(TaskQueue.DEFAULT.getCode())
            .maxRetry(3)
            .timeout(Duration.ofSeconds(30))
            .build();

    private final ReminderStore reminderStore;
    private final TaskQueueClient taskQueueClient;
    private final PayloadCodec payloadCodec;
    private final JobsProperties properties;
    private final Clock clock;

    @Override
    public TaskType getTaskType() {
        return TaskType.LOAN_REMINDER_SCHEDULE;
    }

    @Override
    public TaskExecutionResult execute(TaskContext context, QueuedTask task) {
        var now = clock.instant();
        var cutoff = LocalDate.ofInstant(now, ZoneOffset.UTC).plusDays(properties.getReminders().getLookaheadDays());

        List<DueLoan> loans;
        try {
            loans = reminderStore.findLoansNeedingReminder(cutoff);
        } catch (DataAccessException e) {
            log.error("Failed to query loans due by {}: {}", cutoff, e.getMessage());
            return TaskExecutionResult.failure(e);
        }

        var enqueued = 0;
        var skipped = 0;
        var failed = 0;
        for (var loan : loans) {
            context.throwIfCancelled();

            if (!loan.hasBorrowerEmail()) {
                log.info("Skipping reminder for loan {}: borrower has no email", loan.getLoanId());
                skipped++;
                continue;
            }

            try {
                var payload = toPayload(loan, now);
                taskQueueClient.enqueue(payloadCodec.encode(TaskType.LOAN_REMINDER, payload), REMINDER_OPTIONS);
                enqueued++;
            } catch (Exception e) {
                log.warn("Failed to enqueue reminder for loan {}: {}", loan.getLoanId(), e.getMessage());
                failed++;
            }
        }

        log.info("Scheduled {} loan reminders ({} skipped, {} failed) for loans due by {}", enqueued, skipped, failed, cutoff);
        return TaskExecutionResult.success(Map.of(
                "enqueued", enqueued,
                "skipped", skipped,
                "failed", failed
        ));
    }

    static LoanReminderPayload toPayload(DueLoan loan, Instant now) {
        return LoanReminderPayload.builder()
                .loanId(loan.getLoanId())
                .workspaceId(loan.getWorkspaceId())
                .borrowerName(loan.getBorrowerName())
                .borrowerEmail(loan.getBorrowerEmail())
                .itemName(loan.getItemName())
                .dueDate(loan.getDueDate())
                .overdue(loan.getDueDate().isBefore(now))
                .build();
    }
}
