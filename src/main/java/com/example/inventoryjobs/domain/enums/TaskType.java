package com.example.inventoryjobs.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.time.Duration;
import java.util.Optional;

/**
 * Closed set of task types understood by this build.
 * The code is the wire identifier stored in the broker and must never change.
 */
@Getter
@RequiredArgsConstructor
public enum TaskType {

    LOAN_REMINDER("loan:reminder", "Loan Reminder", Duration.ofSeconds(30)),

    LOAN_REMINDER_SCHEDULE("loan:reminder:schedule", "Loan Reminder Fan-out", Duration.ofSeconds(30)),

    REPAIR_REMINDER("repair:reminder", "Repair Reminder", Duration.ofSeconds(30)),

    REPAIR_REMINDER_SCHEDULE("repair:reminder:schedule", "Repair Reminder Fan-out", Duration.ofSeconds(30)),

    CLEANUP_DELETED_RECORDS("cleanup:deleted_records", "Deleted Records Cleanup", Duration.ofMinutes(10)),

    CLEANUP_OLD_ACTIVITY("cleanup:old_activity", "Activity Log Cleanup", Duration.ofMinutes(10)),

    GENERATE_THUMBNAILS("photo:generate_thumbnails", "Thumbnail Generation", Duration.ofMinutes(5));

    private final String code;
    private final String displayName;

    /**
     * Timeout applied when the enqueuer does not set one
     */
    private final Duration defaultTimeout;

    /**
     * Find TaskType by its wire code
     */
    public static TaskType fromCode(String code) {
        return findByCode(code)
                .orElseThrow(() -> new IllegalArgumentException("Unknown task type code: " + code));
    }

    /**
     * Lookup that tolerates rows written by a newer build
     */
    public static Optional<TaskType> findByCode(String code) {
        for (var type : values()) {
            if (type.getCode().equals(code)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
