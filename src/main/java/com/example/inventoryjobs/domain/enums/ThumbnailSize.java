package com.example.inventoryjobs.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Generated thumbnail sizes, as the bounding box edge in pixels.
 */
@Getter
@RequiredArgsConstructor
public enum ThumbnailSize {

    SMALL("small", 150),

    MEDIUM("medium", 400),

    LARGE("large", 800);

    private final String code;
    private final int maxEdge;
}
