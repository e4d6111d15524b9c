package com.example.inventoryjobs.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Thumbnail state of an item photo: pending → processing → (ready | failed).
 */
@Getter
@RequiredArgsConstructor
public enum ThumbnailStatus {

    PENDING("pending"),

    PROCESSING("processing"),

    READY("ready"),

    FAILED("failed");

    /**
     * Value stored in {@code item_photos.thumbnail_status}
     */
    private final String code;

    public static ThumbnailStatus fromCode(String code) {
        for (var status : values()) {
            if (status.getCode().equals(code)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown thumbnail status: " + code);
    }

    public boolean isTerminal() {
        return this == READY || this == FAILED;
    }
}
