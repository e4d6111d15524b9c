package com.example.inventoryjobs.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * An unreturned loan whose due date falls inside the reminder window.
 */
@Value
@Builder
public class DueLoan {
    UUID loanId;
    UUID workspaceId;
    String itemName;
    String borrowerName;

    /**
     * Null when the borrower has no email on file
     */
    String borrowerEmail;

    Instant dueDate;

    public boolean hasBorrowerEmail() {
        return borrowerEmail != null && !borrowerEmail.isBlank();
    }
}
