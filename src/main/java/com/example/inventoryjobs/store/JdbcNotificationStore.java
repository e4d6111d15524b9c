package com.example.inventoryjobs.store;

import com.example.inventoryjobs.domain.model.NewNotification;
import com.example.inventoryjobs.tx.TxManager;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcNotificationStore implements NotificationStore {

    private final TxManager txManager;
    private final JdbcTemplate jdbcTemplate;
    private final ObjectMapper objectMapper;

    @Override
    public UUID create(NewNotification notification) {
        var id = UUID.randomUUID();
        txManager.getTransactionOrDefault(jdbcTemplate).update("""
                        INSERT INTO auth.notifications (id, user_id, workspace_id, notification_type, title, message, metadata)
                        VALUES (?, ?, ?, CAST(? AS auth.notification_type_enum), ?, ?, CAST(? AS jsonb))
                        """,
                id,
                notification.getUserId(),
                notification.getWorkspaceId(),
                notification.getNotificationType(),
                notification.getTitle(),
                notification.getMessage(),
                toJson(notification));
        return id;
    }

    private String toJson(NewNotification notification) {
        if (notification.getMetadata() == null || notification.getMetadata().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(notification.getMetadata());
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Notification metadata is not serializable", e);
        }
    }
}
