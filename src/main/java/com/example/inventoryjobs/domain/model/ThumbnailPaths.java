package com.example.inventoryjobs.domain.model;

import com.example.inventoryjobs.domain.enums.ThumbnailSize;
import lombok.Value;

import java.util.Map;

/**
 * Stored thumbnail paths. A size that was not generated is null.
 */
@Value
public class ThumbnailPaths {
    String small;
    String medium;
    String large;

    public static ThumbnailPaths of(Map<ThumbnailSize, String> paths) {
        return new ThumbnailPaths(
                paths.get(ThumbnailSize.SMALL),
                paths.get(ThumbnailSize.MEDIUM),
                paths.get(ThumbnailSize.LARGE));
    }
}
