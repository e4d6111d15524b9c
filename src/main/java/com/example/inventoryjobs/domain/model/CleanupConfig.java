package com.example.inventoryjobs.domain.model;

import lombok.Value;

/**
 * Retention periods used by the cleanup processor.
 */
@Value
public class CleanupConfig {

    public static final int DEFAULT_DELETED_RECORDS_RETENTION_DAYS = 90;
    public static final int DEFAULT_ACTIVITY_LOGS_RETENTION_DAYS = 365;

    int deletedRecordsRetentionDays;
    int activityLogsRetentionDays;

    public static CleanupConfig defaults() {
        return new CleanupConfig(DEFAULT_DELETED_RECORDS_RETENTION_DAYS, DEFAULT_ACTIVITY_LOGS_RETENTION_DAYS);
    }
}
