package com.example.inventoryjobs.infra.events;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process broadcaster. Subscribers are typically SSE or websocket sessions of the API layer.
 */
@Slf4j
@Component
public class InMemoryEventBroadcaster implements EventBroadcaster {

    private final Map<UUID, List<Consumer<Event>>> subscribers = new ConcurrentHashMap<>();

    /**
     * @return handle that removes the subscription when run
     */
    public Runnable subscribe(UUID workspaceId, Consumer<Event> subscriber) {
        subscribers.computeIfAbsent(workspaceId, id -> new CopyOnWriteArrayList<>()).add(subscriber);
        return () -> subscribers.computeIfPresent(workspaceId, (id, list) -> {
            list.remove(subscriber);
            return list.isEmpty() ? null : list;
        });
    }

    @Override
    public void publish(UUID workspaceId, Event event) {
        var targets = subscribers.getOrDefault(workspaceId, List.of());
        log.debug("Publishing {} for {} to {} subscribers", event.getType(), event.getEntityId(), targets.size());
        for (var subscriber : targets) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException e) {
                log.warn("Subscriber failed to receive {} in workspace {}: {}", event.getType(), workspaceId, e.getMessage());
            }
        }
    }

    public int subscriberCount(UUID workspaceId) {
        return subscribers.getOrDefault(workspaceId, List.of()).size();
    }
}
