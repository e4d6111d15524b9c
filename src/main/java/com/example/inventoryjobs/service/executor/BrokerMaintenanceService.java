package com.example.inventoryjobs.service.executor;

import com.example.inventoryjobs.domain.repository.QueuedTaskRepository;
import com.example.inventoryjobs.service.handler.TaskExecutionResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;

/**
 * Periodic housekeeping of the broker table, each job running on one instance at a time.
 * <p>
 * - Lease recovery: a PROCESSING row past its lease belongs to a crashed or stuck worker.
 *   It counts as a failed attempt, which makes delivery at-least-once.
 * - Retention janitor: removes COMPLETED rows whose retention has elapsed.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BrokerMaintenanceService {

    static final int RECOVERY_BATCH_SIZE = 100;

    private final QueuedTaskRepository taskRepository;
    private final TaskExecutorService taskExecutorService;
    private final Clock clock;

    @Transactional
    @Scheduled(fixedDelayString = "${jobs.worker.stale-task-check-interval-ms:60000}")
    @SchedulerLock(name = "staleTaskRecovery", lockAtLeastFor = "10s", lockAtMostFor = "5m")
    public int recoverExpiredLeases() {
        var expired = taskRepository.findExpiredLeasesForUpdate(clock.instant(), RECOVERY_BATCH_SIZE);
        if (expired.isEmpty()) {
            log.debug("No expired leases found");
            return 0;
        }

        log.warn("Found {} tasks with expired leases, applying retry policy", expired.size());
        for (var task : expired) {
            log.warn("Task {} (type: {}) lease held by {} expired at {}", task.getId(), task.getTaskType(),
                    task.getLockedBy(), task.getLockedUntil());
            taskExecutorService.applyFailure(task, TaskExecutionResult.failure(
                    "Lease expired: worker crashed or stalled", "LEASE_EXPIRED"));
        }
        return expired.size();
    }

    @Transactional
    @Scheduled(fixedDelayString = "${jobs.worker.retention-cleanup-interval-ms:3600000}")
    @SchedulerLock(name = "taskRetentionCleanup", lockAtLeastFor = "30s", lockAtMostFor = "10m")
    public int purgeExpiredRetention() {
        var deleted = taskRepository.deleteExpiredRetention(clock.instant());
        if (deleted > 0) {
            log.info("Deleted {} completed tasks past their retention", deleted);
        }
        return deleted;
    }
}
