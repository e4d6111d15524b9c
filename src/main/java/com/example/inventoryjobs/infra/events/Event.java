package com.example.inventoryjobs.infra.events;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A realtime event pushed to clients of one workspace.
 */
@Value
@Builder
public class Event {

    public static final String THUMBNAIL_READY = "photo.thumbnail_ready";
    public static final String THUMBNAIL_FAILED = "photo.thumbnail_failed";

    /**
     * Dotted event name, e.g. {@code photo.thumbnail_ready}
     */
    String type;

    String entityId;
    String entityType;

    @Singular("data")
    Map<String, Object> data;
}
