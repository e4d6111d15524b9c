package com.example.inventoryjobs.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Thrown by a handler that observed its deadline passing
 */
@Getter
public class TaskCancelledException extends RuntimeException {

    private final UUID taskId;

    public TaskCancelledException(UUID taskId) {
        super("Task " + taskId + " cancelled: deadline exceeded");
        this.taskId = taskId;
    }
}
