package com.example.inventoryjobs.service.handler;

import com.example.inventoryjobs.domain.enums.TaskType;
import com.example.inventoryjobs.exception.TaskCancelledException;
import lombok.Builder;
import lombok.Getter;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Per-attempt execution context handed to a {@link TaskHandler}.
 * <p>
 * Cancellation is signalled two ways: the deadline passing, and the worker thread being
 * interrupted by the executor's watchdog. Blocking JDBC and IO calls observe the interrupt;
 * long loops should call {@link #throwIfCancelled()}.
 */
@Getter
@Builder
public class TaskContext {

    private final UUID taskId;
    private final TaskType type;
    private final String queue;

    /**
     * 1-based attempt number
     */
    private final int attempt;

    private final int maxRetry;
    private final Instant deadline;

    @Builder.Default
    private final Clock clock = Clock.systemUTC();

    /**
     * True when a failure of this attempt will dead-letter the task
     */
    public boolean isFinalAttempt() {
        return attempt > maxRetry;
    }

    public boolean isCancelled() {
        return Thread.currentThread().isInterrupted() || clock.instant().isAfter(deadline);
    }

    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new TaskCancelledException(taskId);
        }
    }
}
