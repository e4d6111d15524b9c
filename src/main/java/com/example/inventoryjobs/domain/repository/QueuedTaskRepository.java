package com.example.inventoryjobs.domain.repository;

import com.example.inventoryjobs.domain.entity.QueuedTask;
import com.example.inventoryjobs.domain.enums.TaskStatus;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for the task broker table.
 * <p>
 * Claiming relies on PostgreSQL's FOR UPDATE SKIP LOCKED so that concurrent
 * workers on any number of instances never receive the same row.
 */
@Repository
public interface QueuedTaskRepository extends JpaRepository<QueuedTask, UUID> {

    /**
     * Lock due tasks of one queue for claiming.
     * Must run inside a transaction; the caller marks the rows PROCESSING before commit.
     */
    @Query(value = """
            SELECT t.* FROM queued_tasks t
            WHERE t.queue = :queue
              AND t.status IN ('PENDING', 'RETRY_PENDING')
              AND t.scheduled_time <= :now
            ORDER BY t.scheduled_time ASC
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<QueuedTask> findDueTasksForUpdate(@Param("queue") String queue, @Param("now") Instant now, @Param("limit") int limit);

    /**
     * PROCESSING rows whose lease expired, i.e. the worker crashed or hung past its grace
     */
    @Query(value = """
            SELECT t.* FROM queued_tasks t
            WHERE t.status = 'PROCESSING'
              AND t.locked_until < :now
            ORDER BY t.locked_until ASC
            LIMIT :limit
            FOR UPDATE SKIP LOCKED
            """, nativeQuery = true)
    List<QueuedTask> findExpiredLeasesForUpdate(@Param("now") Instant now, @Param("limit") int limit);

    /**
     * Delete completed rows whose retention has elapsed
     */
    @Modifying
    @Query("""
            DELETE FROM QueuedTask t
            WHERE t.status = com.example.inventoryjobs.domain.enums.TaskStatus.COMPLETED
              AND t.retainUntil < :now
            """)
    int deleteExpiredRetention(@Param("now") Instant now);

    long countByStatus(TaskStatus status);

    long countByQueueAndStatus(String queue, TaskStatus status);

    Page<QueuedTask> findByStatusOrderByUpdatedAtDesc(TaskStatus status, Pageable pageable);

    /**
     * Task counts grouped by queue and status
     */
    @Query("""
            SELECT t.queue as queue, t.status as status, COUNT(t) as count
            FROM QueuedTask t
            GROUP BY t.queue, t.status
            """)
    List<Object[]> getStatsByQueueAndStatus();
}
