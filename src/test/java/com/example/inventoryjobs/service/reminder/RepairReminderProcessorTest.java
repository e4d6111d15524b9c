package com.example.inventoryjobs.service.reminder;

import com.example.inventoryjobs.client.PushMessage;
import com.example.inventoryjobs.client.PushSender;
import com.example.inventoryjobs.domain.entity.QueuedTask;
import com.example.inventoryjobs.domain.enums.TaskType;
import com.example.inventoryjobs.domain.model.NewNotification;
import com.example.inventoryjobs.service.handler.TaskContext;
import com.example.inventoryjobs.service.queue.PayloadCodec;
import com.example.inventoryjobs.store.NotificationStore;
import com.example.inventoryjobs.store.ReminderStore;
import com.example.inventoryjobs.store.WorkspaceMemberStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.Validation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataRetrievalFailureException;
import org.springframework.dao.QueryTimeoutException;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RepairReminderProcessor Tests")
class RepairReminderProcessorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T09:00:00Z");

    @Mock
    private WorkspaceMemberStore workspaceMemberStore;

    @Mock
    private NotificationStore notificationStore;

    @Mock
    private ReminderStore reminderStore;

    @Mock
    private PushSender pushSender;

    private PayloadCodec payloadCodec;
    private RepairReminderProcessor processor;
    private RepairReminderPayload payload;
    private TaskContext context;
    private QueuedTask task;

    @BeforeEach
    void setUp() {
        payloadCodec = new PayloadCodec(new ObjectMapper().findAndRegisterModules(),
                Validation.buildDefaultValidatorFactory().getValidator());
        processor = new RepairReminderProcessor(payloadCodec, workspaceMemberStore, notificationStore, reminderStore,
                Optional.of(pushSender));

        payload = RepairReminderPayload.builder()
                .repairLogId(UUID.randomUUID())
                .workspaceId(UUID.randomUUID())
                .inventoryId(UUID.randomUUID())
                .itemName("Table Saw")
                .description("Replace blade")
                .reminderDate(NOW)
                .build();
        task = QueuedTask.builder()
                .id(UUID.randomUUID())
                .taskType(TaskType.REPAIR_REMINDER.getCode())
                .payload(payloadCodec.encode(TaskType.REPAIR_REMINDER, payload).getPayload())
                .build();
        context = TaskContext.builder()
                .taskId(task.getId())
                .type(TaskType.REPAIR_REMINDER)
                .attempt(1)
                .maxRetry(3)
                .deadline(NOW.plusSeconds(30))
                .clock(Clock.fixed(NOW, ZoneOffset.UTC))
                .build();
    }

    @Test
    @DisplayName("Should notify every owner and admin, push, and mark the reminder sent")
    void shouldNotifyAndMarkSent() {
        // Given
        var owner = UUID.randomUUID();
        var admin = UUID.randomUUID();
        when(workspaceMemberStore.findUserIdsByRoles(payload.getWorkspaceId(), LoanReminderProcessor.RECIPIENT_ROLES))
                .thenReturn(List.of(owner, admin));
        when(notificationStore.create(any())).thenReturn(UUID.randomUUID());
        when(pushSender.isEnabled()).thenReturn(true);
        when(reminderStore.markRepairReminderSent(payload.getRepairLogId())).thenReturn(true);
        var notificationCaptor = ArgumentCaptor.forClass(NewNotification.class);

        // When
        var result = processor.execute(context, task);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getResponseData()).containsEntry("notifications", 2);
        verify(notificationStore, times(2)).create(notificationCaptor.capture());
        var first = notificationCaptor.getAllValues().get(0);
        assertThat(first.getUserId()).isEqualTo(owner);
        assertThat(first.getNotificationType()).isEqualTo(NewNotification.TYPE_REPAIR_REMINDER);
        assertThat(first.getTitle()).isEqualTo("Maintenance Reminder");
        assertThat(first.getMessage()).isEqualTo("Scheduled maintenance for Table Saw: Replace blade");
        assertThat(first.getMetadata())
                .containsEntry("repair_log_id", payload.getRepairLogId().toString())
                .containsEntry("inventory_id", payload.getInventoryId().toString())
                .containsEntry("item_name", "Table Saw");
        verify(pushSender).sendToUsers(any(), any(PushMessage.class));
        verify(reminderStore).markRepairReminderSent(payload.getRepairLogId());
    }

    @Test
    @DisplayName("Should still mark the reminder sent when a notification insert fails")
    void shouldTreatNotificationFailureAsAuxiliary() {
        // Given
        var user = UUID.randomUUID();
        when(workspaceMemberStore.findUserIdsByRoles(any(), anyList())).thenReturn(List.of(user));
        when(notificationStore.create(any())).thenThrow(new DataRetrievalFailureException("insert failed"));
        when(reminderStore.markRepairReminderSent(any())).thenReturn(true);

        // When
        var result = processor.execute(context, task);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getResponseData()).containsEntry("notifications", 0);
        assertThat(result.getAuxiliaryFailures()).containsExactly("notification:" + user + ": insert failed");
        verify(reminderStore).markRepairReminderSent(payload.getRepairLogId());
    }

    @Test
    @DisplayName("Should still mark the reminder sent when recipients cannot be loaded")
    void shouldContinueWithoutRecipients() {
        // Given
        when(workspaceMemberStore.findUserIdsByRoles(any(), anyList()))
                .thenThrow(new QueryTimeoutException("members query timed out"));
        when(reminderStore.markRepairReminderSent(any())).thenReturn(true);

        // When
        var result = processor.execute(context, task);

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getAuxiliaryFailures()).hasSize(1);
        verify(notificationStore, never()).create(any());
        verify(pushSender, never()).sendToUsers(anyList(), any());
    }

    @Test
    @DisplayName("Should fail and retry when the reminder cannot be marked as sent")
    void shouldFailWhenMarkSentFails() {
        // Given
        when(workspaceMemberStore.findUserIdsByRoles(any(), anyList())).thenReturn(List.of());
        when(reminderStore.markRepairReminderSent(any())).thenThrow(new QueryTimeoutException("lock timeout"));

        // When
        var result = processor.execute(context, task);

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.isRetryable()).isTrue();
        assertThat(result.getErrorType()).isEqualTo("MARK_SENT_FAILED");
        assertThat(result.getErrorMessage()).isEqualTo("failed to mark repair reminder as sent: lock timeout");
    }

    @Test
    @DisplayName("Should succeed when the repair log was already deleted")
    void shouldSucceedWhenRepairLogGone() {
        when(workspaceMemberStore.findUserIdsByRoles(any(), anyList())).thenReturn(List.of());
        when(reminderStore.markRepairReminderSent(any())).thenReturn(false);

        var result = processor.execute(context, task);

        assertThat(result.isSuccess()).isTrue();
    }

    @Test
    @DisplayName("Should truncate long descriptions in the in-app message")
    void shouldTruncateInAppMessage() {
        payload.setDescription("x".repeat(150));

        var message = RepairReminderProcessor.buildInAppMessage(payload);

        assertThat(message).isEqualTo("Scheduled maintenance for Table Saw: " + "x".repeat(100) + "...");
    }

    @Test
    @DisplayName("Should build the push body from item and description")
    void shouldBuildPushBody() {
        payload.setDescription("y".repeat(60));
        assertThat(RepairReminderProcessor.buildPushMessage(payload).getBody())
                .isEqualTo("Table Saw: " + "y".repeat(50) + "...");

        payload.setDescription("");
        var message = RepairReminderProcessor.buildPushMessage(payload);
        assertThat(message.getBody()).isEqualTo("Scheduled maintenance for Table Saw");
        assertThat(message.getUrl()).isEqualTo("/dashboard/inventory/" + payload.getInventoryId());
        assertThat(message.getTag()).isEqualTo("repair-reminder");
    }
}
