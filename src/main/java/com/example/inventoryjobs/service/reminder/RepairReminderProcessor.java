package com.example.inventoryjobs.service.reminder;

import com.example.inventoryjobs.client.PushMessage;
import com.example.inventoryjobs.client.PushSender;
import com.example.inventoryjobs.domain.entity.QueuedTask;
import com.example.inventoryjobs.domain.enums.TaskType;
import com.example.inventoryjobs.domain.model.NewNotification;
import com.example.inventoryjobs.exception.InvalidPayloadException;
import com.example.inventoryjobs.service.handler.TaskContext;
import com.example.inventoryjobs.service.handler.TaskExecutionResult;
import com.example.inventoryjobs.service.handler.TaskHandler;
import com.example.inventoryjobs.service.queue.PayloadCodec;
import com.example.inventoryjobs.store.NotificationStore;
import com.example.inventoryjobs.store.ReminderStore;
import com.example.inventoryjobs.store.WorkspaceMemberStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Handler for {@code repair:reminder} tasks.
 * <p>
 * In-app notifications and push go to workspace owners and admins, best effort. Marking the
 * reminder as sent is the primary effect; until it succeeds the reminder stays due and the
 * task is retried.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RepairReminderProcessor implements TaskHandler {

    static final String TITLE = "Maintenance Reminder";

    private final PayloadCodec payloadCodec;
    private final WorkspaceMemberStore workspaceMemberStore;
    private final NotificationStore notificationStore;
    private final ReminderStore reminderStore;
    private final Optional<PushSender> pushSender;

    @Override
    public TaskType getTaskType() {
        return TaskType.REPAIR_REMINDER;
    }

    @Override
    public TaskExecutionResult execute(TaskContext context, QueuedTask task) {
        RepairReminderPayload payload;
        try {
            payload = payloadCodec.decode(task, RepairReminderPayload.class);
        } catch (InvalidPayloadException e) {
            log.error("Task {}: {}", task.getId(), e.getMessage());
            return TaskExecutionResult.failure(e, TaskExecutionResult.ERROR_INVALID_PAYLOAD);
        }

        log.info("Processing repair reminder for repair {}, item: {}", payload.getRepairLogId(), payload.getItemName());

        var result = TaskExecutionResult.success(Map.of("repairLogId", payload.getRepairLogId().toString()));

        List<UUID> recipients;
        try {
            recipients = workspaceMemberStore.findUserIdsByRoles(payload.getWorkspaceId(), LoanReminderProcessor.RECIPIENT_ROLES);
        } catch (DataAccessException e) {
            log.warn("Failed to load recipients for repair {}: {}", payload.getRepairLogId(), e.getMessage());
            result.withAuxiliaryFailure("recipients", e.getMessage());
            recipients = List.of();
        }

        var created = createInAppNotifications(payload, recipients, result);

        var push = pushSender.filter(PushSender::isEnabled);
        if (push.isPresent() && !recipients.isEmpty()) {
            try {
                push.get().sendToUsers(recipients, buildPushMessage(payload));
            } catch (Exception e) {
                log.warn("Failed to send push notification for repair {}: {}", payload.getRepairLogId(), e.getMessage());
                result.withAuxiliaryFailure("push", e.getMessage());
            }
        }

        context.throwIfCancelled();
        try {
            if (!reminderStore.markRepairReminderSent(payload.getRepairLogId())) {
                log.info("Repair log {} no longer exists, nothing to mark", payload.getRepairLogId());
            }
        } catch (DataAccessException e) {
            log.error("Failed to mark repair reminder {} as sent: {}", payload.getRepairLogId(), e.getMessage());
            var failure = TaskExecutionResult.failure(e, "MARK_SENT_FAILED");
            failure.setErrorMessage("failed to mark repair reminder as sent: " + e.getMessage());
            return failure.withAuxiliaryFailures(result.getAuxiliaryFailures());
        }

        log.info("Repair reminder sent for repair {} ({} in-app notifications)", payload.getRepairLogId(), created);
        return result.withResponseData("notifications", created);
    }

    private int createInAppNotifications(RepairReminderPayload payload, List<UUID> recipients, TaskExecutionResult result) {
        var message = buildInAppMessage(payload);
        var created = 0;
        for (var userId : recipients) {
            var notification = NewNotification.builder()
                    .userId(userId)
                    .workspaceId(payload.getWorkspaceId())
                    .notificationType(NewNotification.TYPE_REPAIR_REMINDER)
                    .title(TITLE)
                    .message(message)
                    .metadata("repair_log_id", payload.getRepairLogId().toString())
                    .metadata("inventory_id", payload.getInventoryId().toString())
                    .metadata("item_name", payload.getItemName())
                    .build();
            try {
                notificationStore.create(notification);
                created++;
            } catch (Exception e) {
                log.warn("Failed to create notification for user {}: {}", userId, e.getMessage());
                result.withAuxiliaryFailure("notification:" + userId, e.getMessage());
            }
        }
        return created;
    }

    static String buildInAppMessage(RepairReminderPayload payload) {
        return String.format("Scheduled maintenance for %s: %s", payload.getItemName(), truncate(payload.getDescription(), 100));
    }

    static PushMessage buildPushMessage(RepairReminderPayload payload) {
        var description = payload.getDescription();
        var body = description == null || description.isEmpty()
                ? "Scheduled maintenance for " + payload.getItemName()
                : payload.getItemName() + ": " + truncate(description, 50);

        return PushMessage.builder()
                .title(TITLE)
                .body(body)
                .tag("repair-reminder")
                .url("/dashboard/inventory/" + payload.getInventoryId())
                .data("type", "repair_reminder")
                .data("repair_log_id", payload.getRepairLogId().toString())
                .data("workspace_id", payload.getWorkspaceId().toString())
                .data("inventory_id", payload.getInventoryId().toString())
                .build();
    }

    private static String truncate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        return value.length() > maxLength ? value.substring(0, maxLength) + "..." : value;
    }
}
