package com.example.inventoryjobs.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Canonical queues and their default weights.
 * Weights can be overridden through {@code jobs.queues}.
 */
@Getter
@RequiredArgsConstructor
public enum TaskQueue {

    CRITICAL("critical", 6),

    DEFAULT("default", 3),

    LOW("low", 1);

    private final String code;
    private final int defaultWeight;
}
