package com.example.inventoryjobs.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * Broker statistics for operators
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueueStatistics {

    /**
     * queue -> status -> count
     */
    private Map<String, Map<String, Long>> queueStatusDistribution;
    private long pendingCount;
    private long processingCount;
    private long retryPendingCount;
    private long completedCount;
    private long deadLetterCount;
    private Instant generatedAt;
}
