package com.example.inventoryjobs.store;

import java.time.Instant;

/**
 * Bulk deletes behind the retention cleanup.
 */
public interface RetentionStore {

    /**
     * @return number of tombstones removed
     */
    int deleteDeletedRecordsBefore(Instant cutoff);

    /**
     * @return number of activity entries removed
     */
    int deleteActivityBefore(Instant cutoff);
}
