package com.example.inventoryjobs.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A repair log entry with a pending maintenance reminder.
 */
@Value
@Builder
public class DueRepair {
    UUID repairLogId;
    UUID workspaceId;
    UUID inventoryId;
    String itemName;
    String description;
    Instant reminderDate;
}
