package com.example.inventoryjobs.store;

import com.example.inventoryjobs.domain.model.DueLoan;
import com.example.inventoryjobs.domain.model.DueRepair;

import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Queries behind loan and repair reminders.
 */
public interface ReminderStore {

    /**
     * Unreturned loans due on or before {@code cutoff}, overdue ones included
     */
    List<DueLoan> findLoansNeedingReminder(LocalDate cutoff);

    /**
     * Repairs with an unsent reminder dated on or before {@code cutoff}
     */
    List<DueRepair> findRepairsNeedingReminder(LocalDate cutoff);

    /**
     * @return false when the repair log no longer exists
     */
    boolean markRepairReminderSent(UUID repairLogId);
}
