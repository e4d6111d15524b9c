package com.example.inventoryjobs.service.handler;

import com.example.inventoryjobs.domain.enums.TaskType;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Registry for task handlers.
 * <p>
 * Discovers all TaskHandler beans and maps each {@link TaskType} to exactly one of them.
 * A missing or duplicate handler is a configuration error and fails startup.
 */
@Slf4j
@Component
public class TaskHandlerRegistry {

    private final Map<TaskType, TaskHandler> handlers = new EnumMap<>(TaskType.class);
    private final List<TaskHandler> handlerBeans;

    public TaskHandlerRegistry(List<TaskHandler> handlerBeans) {
        this.handlerBeans = handlerBeans;
    }

    @PostConstruct
    public void initialize() {
        for (var handler : handlerBeans) {
            var type = handler.getTaskType();
            var existing = handlers.putIfAbsent(type, handler);
            if (existing != null) {
                throw new IllegalStateException(String.format("Duplicate handler for task type %s: %s and %s",
                        type.getCode(), existing.getClass().getSimpleName(), handler.getClass().getSimpleName()));
            }
            log.info("Registered handler for task type {}: {}", type.getCode(), handler.getClass().getSimpleName());
        }

        var missing = EnumSet.allOf(TaskType.class);
        missing.removeAll(handlers.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No handler registered for task types: " + missing);
        }
    }

    public Optional<TaskHandler> getHandler(TaskType taskType) {
        return Optional.ofNullable(handlers.get(taskType));
    }

    /**
     * Get handler for a task type, throwing if not found
     *
     * @throws IllegalArgumentException if no handler is registered
     */
    public TaskHandler getHandlerOrThrow(TaskType taskType) {
        return getHandler(taskType).orElseThrow(() -> new IllegalArgumentException("No handler registered for task type: " + taskType));
    }

    public boolean hasHandler(TaskType taskType) {
        return handlers.containsKey(taskType);
    }

    public Set<TaskType> getRegisteredTypes() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    public int getHandlerCount() {
        return handlers.size();
    }
}
