package com.example.inventoryjobs.client;

import java.time.Instant;

/**
 * Delivers loan reminder emails to borrowers.
 */
public interface EmailSender {

    /**
     * @throws com.example.inventoryjobs.exception.ExternalServiceException if the message was not accepted
     */
    void sendLoanReminder(String to, String borrowerName, String itemName, Instant dueDate, boolean isOverdue);
}
