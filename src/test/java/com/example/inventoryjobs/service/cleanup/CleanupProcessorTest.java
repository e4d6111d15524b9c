package com.example.inventoryjobs.service.cleanup;

import com.example.inventoryjobs.domain.model.CleanupConfig;
import com.example.inventoryjobs.store.JdbcRetentionStore;
import com.example.inventoryjobs.tx.TxManager;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("CleanupProcessor Tests")
class CleanupProcessorTest {

    private static final Instant NOW = Instant.parse("2026-03-01T03:00:00Z");

    private JdbcTemplate jdbcTemplate;
    private CleanupProcessor cleanupProcessor;

    @BeforeEach
    void setUp() {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:cleanup;DB_CLOSE_DELAY=-1");
        dataSource.setUser("sa");
        jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.execute("CREATE SCHEMA IF NOT EXISTS warehouse");
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS warehouse.deleted_records (id UUID PRIMARY KEY, deleted_at TIMESTAMP NOT NULL)");
        jdbcTemplate.execute("CREATE TABLE IF NOT EXISTS warehouse.activity_log (id UUID PRIMARY KEY, created_at TIMESTAMP NOT NULL)");
        jdbcTemplate.update("DELETE FROM warehouse.deleted_records");
        jdbcTemplate.update("DELETE FROM warehouse.activity_log");

        var txManager = new TxManager(dataSource);
        cleanupProcessor = new CleanupProcessor(
                new JdbcRetentionStore(txManager, jdbcTemplate),
                txManager,
                CleanupConfig.defaults(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private UUID insert(String table, String column, Duration age) {
        var id = UUID.randomUUID();
        jdbcTemplate.update("INSERT INTO warehouse." + table + " (id, " + column + ") VALUES (?, ?)",
                id, Timestamp.from(NOW.minus(age)));
        return id;
    }

    @Test
    @DisplayName("Should purge deleted records past the 90 day retention and keep recent ones")
    void shouldPurgeOnlyExpiredDeletedRecords() throws Exception {
        insert("deleted_records", "deleted_at", Duration.ofDays(100));
        var recent = insert("deleted_records", "deleted_at", Duration.ofDays(10));

        var deleted = cleanupProcessor.purgeDeletedRecords();

        assertThat(deleted).isEqualTo(1);
        assertThat(jdbcTemplate.queryForList("SELECT id FROM warehouse.deleted_records", UUID.class))
                .containsExactly(recent);
    }

    @Test
    @DisplayName("Should purge activity past the 365 day retention")
    void shouldPurgeOnlyExpiredActivity() throws Exception {
        insert("activity_log", "created_at", Duration.ofDays(400));
        insert("activity_log", "created_at", Duration.ofDays(200));

        var deleted = cleanupProcessor.purgeOldActivity();

        assertThat(deleted).isEqualTo(1);
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM warehouse.activity_log", Integer.class)).isEqualTo(1);
    }

    @Test
    @DisplayName("Should keep everything when nothing is old enough")
    void shouldDeleteNothingWhenAllRecent() throws Exception {
        insert("deleted_records", "deleted_at", Duration.ofDays(89));

        assertThat(cleanupProcessor.purgeDeletedRecords()).isZero();
    }

    @Test
    @DisplayName("Should expose the default retention periods")
    void shouldUseDefaultRetention() {
        assertThat(cleanupProcessor.getConfig().getDeletedRecordsRetentionDays()).isEqualTo(90);
        assertThat(cleanupProcessor.getConfig().getActivityLogsRetentionDays()).isEqualTo(365);
    }
}
