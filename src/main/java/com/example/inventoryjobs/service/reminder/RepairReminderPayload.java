package com.example.inventoryjobs.service.reminder;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Payload of a {@code repair:reminder} task
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RepairReminderPayload {

    @NotNull
    private UUID repairLogId;

    @NotNull
    private UUID workspaceId;

    @NotNull
    private UUID inventoryId;

    private String itemName;

    private String description;

    private Instant reminderDate;
}
