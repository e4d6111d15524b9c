package com.example.inventoryjobs.store;

import com.example.inventoryjobs.domain.model.NewNotification;

import java.util.UUID;

/**
 * Persistence of in-app notifications.
 */
public interface NotificationStore {

    /**
     * @return id of the inserted notification
     */
    UUID create(NewNotification notification);
}
