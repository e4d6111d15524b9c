package com.example.inventoryjobs.service.reminder;

import com.example.inventoryjobs.client.EmailSender;
import com.example.inventoryjobs.client.PushMessage;
import com.example.inventoryjobs.client.PushSender;
import com.example.inventoryjobs.domain.entity.QueuedTask;
import com.example.inventoryjobs.domain.enums.TaskType;
import com.example.inventoryjobs.exception.ExternalServiceException;
import com.example.inventoryjobs.exception.InvalidPayloadException;
import com.example.inventoryjobs.service.handler.TaskContext;
import com.example.inventoryjobs.service.handler.TaskExecutionResult;
import com.example.inventoryjobs.service.handler.TaskHandler;
import com.example.inventoryjobs.service.queue.PayloadCodec;
import com.example.inventoryjobs.store.WorkspaceMemberStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Handler for {@code loan:reminder} tasks.
 * <p>
 * The borrower email is the primary effect: if it cannot be sent the task fails and is
 * retried. Push notifications to workspace owners and admins are best effort.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LoanReminderProcessor implements TaskHandler {

    static final List<String> RECIPIENT_ROLES = List.of(WorkspaceMemberStore.ROLE_OWNER, WorkspaceMemberStore.ROLE_ADMIN);

    private static final DateTimeFormatter DUE_DATE_FORMAT =
            DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.ENGLISH).withZone(ZoneOffset.UTC);

    private final PayloadCodec payloadCodec;
    private final WorkspaceMemberStore workspaceMemberStore;
    private final Optional<EmailSender> emailSender;
    private final Optional<PushSender> pushSender;

    @Override
    public TaskType getTaskType() {
        return TaskType.LOAN_REMINDER;
    }

    @Override
    public TaskExecutionResult execute(TaskContext context, QueuedTask task) {
        LoanReminderPayload payload;
        try {
            payload = payloadCodec.decode(task, LoanReminderPayload.class);
        } catch (InvalidPayloadException e) {
            log.error("Task {}: {}", task.getId(), e.getMessage());
            return TaskExecutionResult.failure(e, TaskExecutionResult.ERROR_INVALID_PAYLOAD);
        }

        log.info("Processing loan reminder for loan {}, borrower: {}, item: {}",
                payload.getLoanId(), payload.getBorrowerName(), payload.getItemName());

        if (emailSender.isPresent()) {
            context.throwIfCancelled();
            try {
                emailSender.get().sendLoanReminder(payload.getBorrowerEmail(), payload.getBorrowerName(),
                        payload.getItemName(), payload.getDueDate(), payload.isOverdue());
            } catch (ExternalServiceException e) {
                log.error("Failed to send loan reminder email for loan {}: {}", payload.getLoanId(), e.getMessage());
                // a rejected address is retried too; only the retry budget ends it
                return TaskExecutionResult.failure("failed to send loan reminder email: " + e.getMessage(), "EMAIL_FAILED");
            } catch (RuntimeException e) {
                log.error("Failed to send loan reminder email for loan {}: {}", payload.getLoanId(), e.getMessage());
                var result = TaskExecutionResult.failure(e, "EMAIL_FAILED");
                result.setErrorMessage("failed to send loan reminder email: " + result.getErrorMessage());
                return result;
            }
        }

        var result = TaskExecutionResult.success(Map.of("loanId", payload.getLoanId().toString()));

        var push = pushSender.filter(PushSender::isEnabled);
        if (push.isPresent()) {
            try {
                sendPushNotifications(push.get(), payload);
            } catch (Exception e) {
                log.warn("Failed to send push notification for loan {}: {}", payload.getLoanId(), e.getMessage());
                result.withAuxiliaryFailure("push", e.getMessage());
            }
        }

        log.info("Loan reminder sent for loan {}", payload.getLoanId());
        return result;
    }

    private void sendPushNotifications(PushSender sender, LoanReminderPayload payload) {
        var userIds = workspaceMemberStore.findUserIdsByRoles(payload.getWorkspaceId(), RECIPIENT_ROLES);
        if (userIds.isEmpty()) {
            return;
        }
        sender.sendToUsers(userIds, buildPushMessage(payload));
    }

    static PushMessage buildPushMessage(LoanReminderPayload payload) {
        var dueDate = DUE_DATE_FORMAT.format(payload.getDueDate());
        var overdue = payload.isOverdue();
        return PushMessage.builder()
                .title(overdue ? "Loan Overdue" : "Loan Due Soon")
                .body(String.format("%s borrowed by %s %s %s", payload.getItemName(), payload.getBorrowerName(),
                        overdue ? "was due on" : "is due on", dueDate))
                .tag(overdue ? "loan-overdue" : "loan-due")
                .url("/dashboard/loans/" + payload.getLoanId())
                .data("type", "loan_reminder")
                .data("loan_id", payload.getLoanId().toString())
                .data("workspace_id", payload.getWorkspaceId().toString())
                .data("is_overdue", String.valueOf(overdue))
                .build();
    }
}
