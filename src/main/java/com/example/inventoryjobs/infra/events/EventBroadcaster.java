package com.example.inventoryjobs.infra.events;

import java.util.UUID;

/**
 * Fan-out of realtime events to the connected clients of a workspace.
 * Publishing is fire-and-forget: implementations must not throw on delivery problems.
 */
public interface EventBroadcaster {

    void publish(UUID workspaceId, Event event);
}
