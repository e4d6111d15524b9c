package com.example.inventoryjobs.config;

import com.example.inventoryjobs.domain.enums.TaskQueue;
import com.example.inventoryjobs.domain.model.CleanupConfig;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Configuration properties for the job execution core.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "jobs")
public class JobsProperties {

    /**
     * Queue name to relative weight. Higher weight means proportionally more worker attention.
     */
    @NotEmpty
    private Map<String, @Min(1) Integer> queues = defaultQueues();

    /**
     * Default maximum retry attempts after the first failed attempt
     */
    @Min(0)
    private int defaultMaxRetry = 3;

    /**
     * Linear backoff step: the n-th retry runs n * step after the failure
     */
    @NotNull
    private Duration retryDelayStep = Duration.ofMinutes(1);

    @Valid
    private Worker worker = new Worker();

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Valid
    private Reminders reminders = new Reminders();

    @Valid
    private Cleanup cleanup = new Cleanup();

    @Valid
    private Thumbnails thumbnails = new Thumbnails();

    public CleanupConfig getCleanupConfig() {
        return new CleanupConfig(cleanup.getDeletedRecordsRetentionDays(), cleanup.getActivityLogsRetentionDays());
    }

    private static Map<String, Integer> defaultQueues() {
        var queues = new LinkedHashMap<String, Integer>();
        for (var queue : TaskQueue.values()) {
            queues.put(queue.getCode(), queue.getDefaultWeight());
        }
        return queues;
    }

    @Data
    public static class Worker {

        /**
         * Whether this process pulls and executes tasks
         */
        private boolean enabled = true;

        /**
         * Number of tasks processed in parallel
         */
        @Min(1)
        private int concurrency = 10;

        /**
         * Polling interval in milliseconds
         */
        @Min(100)
        private long pollIntervalMs = 1000;

        /**
         * Extra lease time on top of the task timeout before a claimed task counts as abandoned
         */
        @NotNull
        private Duration leaseGrace = Duration.ofSeconds(30);

        /**
         * How long shutdown waits for in-flight tasks
         */
        @NotNull
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        @Min(1000)
        private long staleTaskCheckIntervalMs = 60000;

        @Min(1000)
        private long retentionCleanupIntervalMs = 3600000;
    }

    @Data
    public static class Scheduler {

        /**
         * Whether this process fires cron schedules
         */
        private boolean enabled = true;

        /**
         * Time zone cron expressions are evaluated in
         */
        @NotBlank
        private String zone = "UTC";

        @Valid
        private Schedules schedules = new Schedules();
    }

    @Data
    public static class Schedules {

        @NotBlank
        private String loanReminders = "0 9 * * *";

        @NotBlank
        private String repairReminders = "0 9 * * *";

        @NotBlank
        private String deletedRecordsCleanup = "0 3 * * 0";

        @NotBlank
        private String activityCleanup = "0 4 * * 0";
    }

    @Data
    public static class Reminders {

        /**
         * Items due within this many days (and all overdue items) get a reminder
         */
        @Min(0)
        private int lookaheadDays = 3;
    }

    @Data
    public static class Cleanup {

        @Min(0)
        private int deletedRecordsRetentionDays = CleanupConfig.DEFAULT_DELETED_RECORDS_RETENTION_DAYS;

        @Min(0)
        private int activityLogsRetentionDays = CleanupConfig.DEFAULT_ACTIVITY_LOGS_RETENTION_DAYS;
    }

    @Data
    public static class Thumbnails {

        /**
         * Local scratch directory for originals and generated sizes
         */
        @NotBlank
        private String workDir = System.getProperty("java.io.tmpdir") + "/inventory-thumbnails";
    }
}
