package com.example.inventoryjobs.service.reminder;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Payload of a {@code loan:reminder} task
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class LoanReminderPayload {

    @NotNull
    private UUID loanId;

    @NotNull
    private UUID workspaceId;

    private String borrowerName;

    @NotBlank
    private String borrowerEmail;

    private String itemName;

    @NotNull
    private Instant dueDate;

    @JsonProperty("is_overdue")
    private boolean overdue;
}
