package com.example.inventoryjobs.store;

import com.example.inventoryjobs.domain.enums.ThumbnailStatus;
import com.example.inventoryjobs.domain.model.ThumbnailPaths;
import com.example.inventoryjobs.tx.TxManager;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcOperations;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
@RequiredArgsConstructor
public class JdbcPhotoStore implements PhotoStore {

    private static final int MAX_ERROR_LENGTH = 1000;

    private final TxManager txManager;
    private final JdbcTemplate jdbcTemplate;

    @Override
    public Optional<ThumbnailStatus> findThumbnailStatus(UUID photoId) {
        return jdbc().query("SELECT thumbnail_status FROM warehouse.item_photos WHERE id = ?",
                        (rs, rowNum) -> ThumbnailStatus.fromCode(rs.getString("thumbnail_status")), photoId)
                .stream()
                .findFirst();
    }

    @Override
    public boolean markProcessing(UUID photoId) {
        return jdbc().update("""
                UPDATE warehouse.item_photos
                SET thumbnail_status = 'processing', updated_at = CURRENT_TIMESTAMP
                WHERE id = ? AND thumbnail_status IN ('pending', 'processing')
                """, photoId) > 0;
    }

    @Override
    public boolean markReady(UUID photoId, ThumbnailPaths paths) {
        return jdbc().update("""
                        UPDATE warehouse.item_photos
                        SET thumbnail_status = 'ready',
                            thumbnail_small_path = ?,
                            thumbnail_medium_path = ?,
                            thumbnail_large_path = ?,
                            thumbnail_error = NULL,
                            updated_at = CURRENT_TIMESTAMP
                        WHERE id = ? AND thumbnail_status = 'processing'
                        """,
                paths.getSmall(), paths.getMedium(), paths.getLarge(), photoId) > 0;
    }

    @Override
    public boolean markFailed(UUID photoId, String error) {
        return jdbc().update("""
                UPDATE warehouse.item_photos
                SET thumbnail_status = 'failed', thumbnail_error = ?, updated_at = CURRENT_TIMESTAMP
                WHERE id = ? AND thumbnail_status IN ('pending', 'processing')
                """, truncate(error), photoId) > 0;
    }

    @Override
    public boolean recordAttemptError(UUID photoId, String error) {
        return jdbc().update("""
                UPDATE warehouse.item_photos
                SET thumbnail_error = ?, updated_at = CURRENT_TIMESTAMP
                WHERE id = ? AND thumbnail_status = 'processing'
                """, truncate(error), photoId) > 0;
    }

    @Override
    public boolean resetToPending(UUID photoId) {
        return jdbc().update("""
                UPDATE warehouse.item_photos
                SET thumbnail_status = 'pending', thumbnail_error = NULL, updated_at = CURRENT_TIMESTAMP
                WHERE id = ? AND thumbnail_status = 'failed'
                """, photoId) > 0;
    }

    private JdbcOperations jdbc() {
        return txManager.getTransactionOrDefault(jdbcTemplate);
    }

    private static String truncate(String error) {
        if (error == null || error.length() <= MAX_ERROR_LENGTH) {
            return error;
        }
        return error.substring(0, MAX_ERROR_LENGTH - 3) + "...";
    }
}
