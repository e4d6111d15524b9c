package com.example.inventoryjobs.client;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.Map;

/**
 * A web push notification as shown by the browser.
 */
@Value
@Builder
public class PushMessage {

    public static final String DEFAULT_ICON = "/icon-192.png";
    public static final String DEFAULT_BADGE = "/favicon-32x32.png";

    String title;
    String body;

    @Builder.Default
    String icon = DEFAULT_ICON;

    @Builder.Default
    String badge = DEFAULT_BADGE;

    /**
     * Notifications sharing a tag replace each other on the device
     */
    String tag;

    /**
     * Page opened when the notification is clicked
     */
    String url;

    @Singular("data")
    Map<String, String> data;
}
