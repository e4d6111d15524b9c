package com.example.inventoryjobs.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

/**
 * In-app notification to insert for one user.
 */
@Value
@Builder
public class NewNotification {

    public static final String TYPE_REPAIR_REMINDER = "REPAIR_REMINDER";

    UUID userId;
    UUID workspaceId;
    String notificationType;
    String title;
    String message;

    @Singular("metadata")
    Map<String, Object> metadata;
}
