package com.example.inventoryjobs.store;

import com.example.inventoryjobs.tx.TxManager;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;

@Repository
@RequiredArgsConstructor
public class JdbcRetentionStore implements RetentionStore {

    private final TxManager txManager;
    private final JdbcTemplate jdbcTemplate;

    @Override
    public int deleteDeletedRecordsBefore(Instant cutoff) {
        return txManager.getTransactionOrDefault(jdbcTemplate)
                .update("DELETE FROM warehouse.deleted_records WHERE deleted_at < ?", Timestamp.from(cutoff));
    }

    @Override
    public int deleteActivityBefore(Instant cutoff) {
        return txManager.getTransactionOrDefault(jdbcTemplate)
                .update("DELETE FROM warehouse.activity_log WHERE created_at < ?", Timestamp.from(cutoff));
    }
}
