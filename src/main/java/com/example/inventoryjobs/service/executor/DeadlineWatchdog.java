package com.example.inventoryjobs.service.executor;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Interrupts a worker thread when its task passes the deadline.
 * <p>
 * Must be disarmed by the worker thread itself once the handler returns. After
 * {@link #disarm()} the worker is never interrupted by this watchdog, and an
 * interrupt it already delivered is cleared.
 */
final class DeadlineWatchdog {

    private final Thread worker;
    private ScheduledFuture<?> future;
    private boolean armed = true;
    private boolean fired;

    private DeadlineWatchdog(Thread worker) {
        this.worker = worker;
    }

    static DeadlineWatchdog arm(ScheduledExecutorService scheduler, Thread worker, Duration timeout) {
        var watchdog = new DeadlineWatchdog(worker);
        var future = scheduler.schedule(watchdog::fire, timeout.toMillis(), TimeUnit.MILLISECONDS);
        watchdog.attach(future);
        return watchdog;
    }

    private synchronized void attach(ScheduledFuture<?> future) {
        this.future = future;
    }

    private synchronized void fire() {
        if (armed) {
            fired = true;
            worker.interrupt();
        }
    }

    synchronized void disarm() {
        armed = false;
        if (future != null) {
            future.cancel(false);
        }
        if (fired) {
            Thread.interrupted();
        }
    }

    synchronized boolean hasFired() {
        return fired;
    }
}
