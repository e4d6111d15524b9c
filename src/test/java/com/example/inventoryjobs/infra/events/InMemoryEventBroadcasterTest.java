package com.example.inventoryjobs.infra.events;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemoryEventBroadcaster Tests")
class InMemoryEventBroadcasterTest {

    private final InMemoryEventBroadcaster broadcaster = new InMemoryEventBroadcaster();

    private static Event readyEvent() {
        return Event.builder()
                .type(Event.THUMBNAIL_READY)
                .entityId(UUID.randomUUID().toString())
                .entityType("item_photo")
                .build();
    }

    @Test
    @DisplayName("Should deliver only to subscribers of the same workspace")
    void shouldScopeByWorkspace() {
        // Given
        var workspace = UUID.randomUUID();
        var received = new ArrayList<Event>();
        var other = new ArrayList<Event>();
        broadcaster.subscribe(workspace, received::add);
        broadcaster.subscribe(UUID.randomUUID(), other::add);

        // When
        broadcaster.publish(workspace, readyEvent());

        // Then
        assertThat(received).hasSize(1);
        assertThat(other).isEmpty();
    }

    @Test
    @DisplayName("Should keep delivering when one subscriber throws")
    void shouldIsolateFailingSubscriber() {
        var workspace = UUID.randomUUID();
        var received = new ArrayList<Event>();
        broadcaster.subscribe(workspace, event -> {
            throw new IllegalStateException("connection closed");
        });
        broadcaster.subscribe(workspace, received::add);

        broadcaster.publish(workspace, readyEvent());

        assertThat(received).hasSize(1);
    }

    @Test
    @DisplayName("Should stop delivering after unsubscribe")
    void shouldUnsubscribe() {
        var workspace = UUID.randomUUID();
        var received = new ArrayList<Event>();
        var unsubscribe = broadcaster.subscribe(workspace, received::add);

        unsubscribe.run();
        broadcaster.publish(workspace, readyEvent());

        assertThat(received).isEmpty();
        assertThat(broadcaster.subscriberCount(workspace)).isZero();
    }
}
