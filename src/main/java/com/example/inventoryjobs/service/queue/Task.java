package com.example.inventoryjobs.service.queue;

import com.example.inventoryjobs.domain.enums.TaskType;
import lombok.Value;

/**
 * A unit of deferred work: a type and its serialized arguments.
 */
@Value
public class Task {

    TaskType type;
    byte[] payload;

    public static Task of(TaskType type) {
        return new Task(type, new byte[0]);
    }

    public static Task of(TaskType type, byte[] payload) {
        return new Task(type, payload != null ? payload : new byte[0]);
    }
}
