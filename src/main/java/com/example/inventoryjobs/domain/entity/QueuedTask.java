package com.example.inventoryjobs.domain.entity;

import com.example.inventoryjobs.domain.enums.TaskStatus;
import com.example.inventoryjobs.domain.enums.TaskType;
import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * A task row in the durable broker table.
 * <p>
 * Holds:
 * - The wire type id and the opaque payload (immutable once enqueued)
 * - Queue name, retry budget, timeout and retention
 * - Lease fields used for claiming and stale recovery
 * - Execution bookkeeping for operators
 */
@Entity
@Table(name = "queued_tasks", indexes = {
        @Index(name = "idx_queued_task_queue_status_time", columnList = "queue, status, scheduled_time"),
        @Index(name = "idx_queued_task_status_locked_until", columnList = "status, locked_until"),
        @Index(name = "idx_queued_task_retain_until", columnList = "retain_until")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class QueuedTask {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Wire type id, e.g. {@code loan:reminder}. Kept as a string so rows written
     * by another build can still be loaded and dead-lettered.
     */
    @Column(name = "task_type", nullable = false, updatable = false, length = 64)
    private String taskType;

    /**
     * Serialized task arguments, usually JSON
     */
    @Column(name = "payload", updatable = false, columnDefinition = "bytea")
    private byte[] payload;

    @Column(name = "queue", nullable = false, length = 32)
    private String queue;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    private TaskStatus status;

    /**
     * Failed attempts so far
     */
    @Column(name = "retry_count", nullable = false)
    @Builder.Default
    private Integer retryCount = 0;

    /**
     * Retries allowed after the first attempt
     */
    @Column(name = "max_retry", nullable = false)
    private Integer maxRetry;

    @Column(name = "timeout_seconds", nullable = false)
    private Long timeoutSeconds;

    /**
     * How long a completed row is kept. Zero deletes it on success.
     */
    @Column(name = "retention_seconds", nullable = false)
    @Builder.Default
    private Long retentionSeconds = 0L;

    /**
     * Earliest time the task may run
     */
    @Column(name = "scheduled_time", nullable = false)
    private Instant scheduledTime;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    /**
     * Stack trace of last error (truncated)
     */
    @Column(name = "last_error_stack_trace", columnDefinition = "TEXT")
    private String lastErrorStackTrace;

    // === Lease Fields ===

    /**
     * Worker instance that claimed the row
     */
    @Column(name = "locked_by", length = 100)
    private String lockedBy;

    /**
     * Lease expiry. A PROCESSING row past this instant is considered abandoned.
     */
    @Column(name = "locked_until")
    private Instant lockedUntil;

    @Version
    @Column(name = "version")
    private Long version;

    // === Audit Fields ===

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "execution_duration_ms")
    private Long executionDurationMs;

    @Column(name = "retain_until")
    private Instant retainUntil;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        this.createdAt = now;
        this.updatedAt = now;
        if (this.status == null) {
            this.status = TaskStatus.PENDING;
        }
        if (this.retryCount == null) {
            this.retryCount = 0;
        }
        if (this.retentionSeconds == null) {
            this.retentionSeconds = 0L;
        }
        if (this.scheduledTime == null) {
            this.scheduledTime = now;
        }
    }

    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // === Helper Methods ===

    /**
     * Resolve the wire id, empty when this build does not know the type
     */
    public Optional<TaskType> resolveType() {
        return TaskType.findByCode(taskType);
    }

    public Duration getTimeout() {
        return Duration.ofSeconds(timeoutSeconds);
    }

    public Duration getRetention() {
        return Duration.ofSeconds(retentionSeconds);
    }

    public boolean canRetry() {
        return retryCount < maxRetry;
    }

    /**
     * 1-based number of the attempt currently running
     */
    public int getAttempt() {
        return retryCount + 1;
    }

    public boolean isLeaseExpired(Instant now) {
        return lockedUntil != null && lockedUntil.isBefore(now);
    }
}
