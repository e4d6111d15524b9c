package com.example.inventoryjobs.tx;

import lombok.Getter;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;

import java.sql.Connection;
import java.util.UUID;

/**
 * An open transaction bound to the current thread.
 * <p>
 * Only the outermost {@link TxManager#withTransaction} creates one; nested calls on the
 * same thread receive the same instance. Never hand it to another thread.
 */
@Getter
public class AmbientTransaction {

    private final UUID id;
    private final Connection connection;

    /**
     * JdbcTemplate pinned to {@link #connection}. Statements issued through it never close
     * the connection and never touch auto-commit.
     */
    private final JdbcOperations jdbc;

    AmbientTransaction(Connection connection) {
        this.id = UUID.randomUUID();
        this.connection = connection;
        this.jdbc = new JdbcTemplate(new SingleConnectionDataSource(connection, true));
    }

    @Override
    public String toString() {
        return "AmbientTransaction[" + id + "]";
    }
}
