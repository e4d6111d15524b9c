package com.example.inventoryjobs.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle of a row in the task broker.
 * <p>
 * PENDING → PROCESSING → (deleted | COMPLETED | RETRY_PENDING | DEAD_LETTER).
 * RETRY_PENDING rows are claimed again once their scheduled time passes.
 */
@Getter
@RequiredArgsConstructor
public enum TaskStatus {

    /**
     * Enqueued and waiting for its scheduled time.
     */
    PENDING("pending", "Pending", true),

    /**
     * Claimed by a worker and currently running.
     */
    PROCESSING("processing", "Processing", false),

    /**
     * Failed at least once and waiting for its backoff to elapse.
     */
    RETRY_PENDING("retry-pending", "Retry Pending", true),

    /**
     * Finished successfully and kept until its retention expires.
     */
    COMPLETED("completed", "Completed", false),

    /**
     * Retries exhausted or the task type is unknown. Requires an operator.
     */
    DEAD_LETTER("dead-letter", "Dead Letter", false);

    private final String code;
    private final String displayName;

    /**
     * Whether a worker may claim a row in this status
     */
    private final boolean executable;

    public static TaskStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown task status code: " + code);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == DEAD_LETTER;
    }
}
