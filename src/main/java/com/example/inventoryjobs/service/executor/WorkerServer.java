package com.example.inventoryjobs.service.executor;

import com.example.inventoryjobs.config.JobsProperties;
import com.example.inventoryjobs.domain.entity.QueuedTask;
import com.example.inventoryjobs.service.queue.QueueSelector;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Consumer side of the task broker.
 * <p>
 * Every instance polls; PostgreSQL's SKIP LOCKED spreads rows across instances.
 * <p>
 * Flow:
 * 1. Poll job runs on a fixed delay
 * 2. Queues are ordered by weighted random sampling for this cycle
 * 3. Each queue is claimed up to the free worker capacity, in that order
 * 4. Each claimed task runs on its own worker thread
 */
@Slf4j
@Service
public class WorkerServer {

    private final TaskExecutorService taskExecutorService;
    private final JobsProperties properties;
    private final ExecutorService workerExecutor;
    private final QueueSelector queueSelector;
    private final Semaphore permits;
    private final int concurrency;

    private final AtomicBoolean isPolling = new AtomicBoolean(false);
    private volatile boolean shuttingDown;

    @Autowired
    public WorkerServer(TaskExecutorService taskExecutorService, JobsProperties properties,
                        @Qualifier("taskWorkerExecutor") ExecutorService workerExecutor) {
        this(taskExecutorService, properties, workerExecutor, new QueueSelector(properties.getQueues(), new Random()));
    }

    WorkerServer(TaskExecutorService taskExecutorService, JobsProperties properties, ExecutorService workerExecutor,
                 QueueSelector queueSelector) {
        this.taskExecutorService = taskExecutorService;
        this.properties = properties;
        this.workerExecutor = workerExecutor;
        this.queueSelector = queueSelector;
        this.concurrency = properties.getWorker().getConcurrency();
        this.permits = new Semaphore(concurrency);
    }

    @Scheduled(fixedDelayString = "${jobs.worker.poll-interval-ms:1000}", initialDelayString = "${jobs.worker.poll-interval-ms:1000}")
    public void pollAndDispatch() {
        if (!properties.getWorker().isEnabled() || shuttingDown) {
            return;
        }
        if (!isPolling.compareAndSet(false, true)) {
            log.debug("Previous polling cycle still running, skipping");
            return;
        }

        try {
            var dispatched = pollOnce();
            if (dispatched > 0) {
                log.debug("Dispatched {} tasks, {} in flight", dispatched, getInFlightCount());
            }
        } catch (Exception e) {
            log.error("Error in task polling cycle: {}", e.getMessage(), e);
        } finally {
            isPolling.set(false);
        }
    }

    /**
     * One claim pass over all queues.
     *
     * @return number of tasks handed to workers
     */
    int pollOnce() {
        var dispatched = 0;
        for (var queue : queueSelector.nextOrder()) {
            if (shuttingDown) {
                break;
            }
            var capacity = permits.availablePermits();
            if (capacity == 0) {
                break;
            }
            for (var task : taskExecutorService.claimDueTasks(queue, capacity)) {
                dispatch(task);
                dispatched++;
            }
        }
        return dispatched;
    }

    private void dispatch(QueuedTask task) {
        permits.acquireUninterruptibly();
        try {
            workerExecutor.execute(() -> {
                try {
                    taskExecutorService.executeTask(task);
                } catch (Exception e) {
                    log.error("Error processing task {}: {}", task.getId(), e.getMessage(), e);
                } finally {
                    permits.release();
                }
            });
        } catch (RejectedExecutionException e) {
            permits.release();
            log.warn("Worker pool rejected task {}, releasing its claim", task.getId());
            taskExecutorService.releaseClaim(task);
        }
    }

    public int getInFlightCount() {
        return concurrency - permits.availablePermits();
    }

    /**
     * Stop claiming and wait for in-flight tasks. Tasks still running after the
     * shutdown timeout are interrupted and fail their attempt.
     */
    @PreDestroy
    public void shutdown() {
        shuttingDown = true;
        var timeout = properties.getWorker().getShutdownTimeout();
        log.info("Stopping worker, waiting up to {} for {} in-flight tasks", timeout, getInFlightCount());

        workerExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("In-flight tasks did not finish within {}, interrupting them", timeout);
                workerExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
