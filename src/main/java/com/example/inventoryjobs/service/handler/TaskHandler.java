package com.example.inventoryjobs.service.handler;

import com.example.inventoryjobs.domain.entity.QueuedTask;
import com.example.inventoryjobs.domain.enums.TaskType;

/**
 * Interface for task handlers.
 * <p>
 * Each task type has exactly one handler bean; startup fails otherwise.
 * <p>
 * Handlers should:
 * - Be stateless and safe to run more than once for the same task
 * - Observe cancellation through {@link TaskContext}
 * - Return a failure result (or throw) when the primary effect did not happen
 * - Open their own {@code TxManager} scope where several writes must be atomic
 */
public interface TaskHandler {

    /**
     * Get the task type this handler supports
     */
    TaskType getTaskType();

    /**
     * Execute the task
     *
     * @param context attempt metadata and deadline
     * @param task    the claimed broker row
     * @return Result of the execution
     */
    TaskExecutionResult execute(TaskContext context, QueuedTask task);

    /**
     * Called once after the task was dead-lettered, including when its lease expired and the
     * last attempt never reached {@link #execute}. Durable "gave up" state belongs here.
     * Failures are logged by the caller and do not change the task outcome.
     *
     * @param task   the dead-lettered row
     * @param result the failure that exhausted the task
     */
    default void onDeadLetter(QueuedTask task, TaskExecutionResult result) {
    }

    default boolean supports(TaskType taskType) {
        return getTaskType() == taskType;
    }
}
