package com.example.inventoryjobs.service.cleanup;

import com.example.inventoryjobs.config.JobsProperties;
import com.example.inventoryjobs.domain.model.CleanupConfig;
import com.example.inventoryjobs.store.RetentionStore;
import com.example.inventoryjobs.tx.TxManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;

/**
 * Purges rows past their retention period.
 * <p>
 * Each purge is one bulk delete with cutoff {@code now - retentionDays}; rows exactly at the
 * cutoff are kept.
 */
@Slf4j
@Service
public class CleanupProcessor {

    private final RetentionStore retentionStore;
    private final TxManager txManager;
    private final CleanupConfig config;
    private final Clock clock;

    @Autowired
    public CleanupProcessor(RetentionStore retentionStore, TxManager txManager, JobsProperties properties, Clock clock) {
        this(retentionStore, txManager, properties.getCleanupConfig(), clock);
    }

    public CleanupProcessor(RetentionStore retentionStore, TxManager txManager, CleanupConfig config, Clock clock) {
        this.retentionStore = retentionStore;
        this.txManager = txManager;
        this.config = config;
        this.clock = clock;
    }

    public CleanupConfig getConfig() {
        return config;
    }

    /**
     * @return number of deleted-record tombstones removed
     */
    public int purgeDeletedRecords() throws Exception {
        var cutoff = clock.instant().minus(Duration.ofDays(config.getDeletedRecordsRetentionDays()));
        var deleted = txManager.withTransaction(tx -> retentionStore.deleteDeletedRecordsBefore(cutoff));
        log.info("Purged {} deleted records older than {} days", deleted, config.getDeletedRecordsRetentionDays());
        return deleted;
    }

    /**
     * @return number of activity log entries removed
     */
    public int purgeOldActivity() throws Exception {
        var cutoff = clock.instant().minus(Duration.ofDays(config.getActivityLogsRetentionDays()));
        var deleted = txManager.withTransaction(tx -> retentionStore.deleteActivityBefore(cutoff));
        log.info("Purged {} activity log entries older than {} days", deleted, config.getActivityLogsRetentionDays());
        return deleted;
    }
}
