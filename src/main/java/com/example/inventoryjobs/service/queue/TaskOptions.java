package com.example.inventoryjobs.service.queue;

import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;

/**
 * Enqueue options. Any option left null falls back to the broker default:
 * queue {@code default}, the configured max retry, the task type's timeout,
 * no retention and immediate processing.
 */
@Getter
@Builder(toBuilder = true)
public class TaskOptions {

    private final String queue;
    private final Integer maxRetry;
    private final Duration timeout;

    /**
     * How long the completed row is kept for inspection
     */
    private final Duration retention;

    /**
     * Absolute earliest run time. Takes precedence over {@link #processIn}.
     */
    private final Instant processAt;

    private final Duration processIn;

    public static TaskOptions defaults() {
        return TaskOptions.builder().build();
    }

    public static TaskOptions onQueue(String queue) {
        return TaskOptions.builder().queue(queue).build();
    }
}
