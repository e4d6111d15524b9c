package com.example.inventoryjobs.store;

import com.example.inventoryjobs.domain.model.DueLoan;
import com.example.inventoryjobs.domain.model.DueRepair;
import com.example.inventoryjobs.tx.TxManager;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Date;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcReminderStore implements ReminderStore {

    private static final String LOANS_NEEDING_REMINDER = """
            SELECT l.id, l.workspace_id, l.due_date, b.name AS borrower_name, b.email AS borrower_email, i.name AS item_name
            FROM warehouse.loans l
            JOIN warehouse.borrowers b ON b.id = l.borrower_id
            JOIN warehouse.inventory inv ON inv.id = l.inventory_id
            JOIN warehouse.items i ON i.id = inv.item_id
            WHERE l.returned_at IS NULL
              AND l.due_date IS NOT NULL
              AND l.due_date <= ?
            ORDER BY l.due_date ASC
            """;

    private static final String REPAIRS_NEEDING_REMINDER = """
            SELECT r.id, r.workspace_id, r.inventory_id, r.description, r.reminder_date, i.name AS item_name
            FROM warehouse.repair_logs r
            JOIN warehouse.inventory inv ON inv.id = r.inventory_id
            JOIN warehouse.items i ON i.id = inv.item_id
            WHERE r.reminder_date IS NOT NULL
              AND r.reminder_date <= ?
              AND r.reminder_sent = false
            ORDER BY r.reminder_date ASC
            """;

    private final TxManager txManager;
    private final JdbcTemplate jdbcTemplate;

    @Override
    public List<DueLoan> findLoansNeedingReminder(LocalDate cutoff) {
        return jdbc().query(LOANS_NEEDING_REMINDER, (rs, rowNum) -> DueLoan.builder()
                .loanId(rs.getObject("id", UUID.class))
                .workspaceId(rs.getObject("workspace_id", UUID.class))
                .dueDate(startOfDay(rs, "due_date"))
                .borrowerName(rs.getString("borrower_name"))
                .borrowerEmail(rs.getString("borrower_email"))
                .itemName(rs.getString("item_name"))
                .build(), Date.valueOf(cutoff));
    }

    @Override
    public List<DueRepair> findRepairsNeedingReminder(LocalDate cutoff) {
        return jdbc().query(REPAIRS_NEEDING_REMINDER, (rs, rowNum) -> DueRepair.builder()
                .repairLogId(rs.getObject("id", UUID.class))
                .workspaceId(rs.getObject("workspace_id", UUID.class))
                .inventoryId(rs.getObject("inventory_id", UUID.class))
                .description(rs.getString("description"))
                .reminderDate(startOfDay(rs, "reminder_date"))
                .itemName(rs.getString("item_name"))
                .build(), Date.valueOf(cutoff));
    }

    @Override
    public boolean markRepairReminderSent(UUID repairLogId) {
        return jdbc().update("""
                UPDATE warehouse.repair_logs
                SET reminder_sent = true, updated_at = now()
                WHERE id = ?
                """, repairLogId) > 0;
    }

    private JdbcOperations jdbc() {
        return txManager.getTransactionOrDefault(jdbcTemplate);
    }

    private static Instant startOfDay(ResultSet rs, String column) throws SQLException {
        var date = rs.getObject(column, LocalDate.class);
        return date != null ? date.atStartOfDay(ZoneOffset.UTC).toInstant() : null;
    }
}
