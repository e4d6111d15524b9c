package com.example.inventoryjobs.client;

import java.util.List;
import java.util.UUID;

/**
 * Web push delivery. Optional: when no bean exists, push is skipped.
 */
public interface PushSender {

    boolean isEnabled();

    void sendToUsers(List<UUID> userIds, PushMessage message);
}
