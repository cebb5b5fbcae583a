package io.github.hotbrkm.outreach.dispatcher.schedule;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * A named task that never runs concurrently with itself. A trigger that arrives while the previous run is still
 * in progress is dropped.
 */
@Slf4j
public class RecurringTask {

    @Getter
    private final String name;
    @Getter
    private final Duration interval;
    private final Runnable action;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicLong completedRuns = new AtomicLong();
    private final AtomicLong droppedRuns = new AtomicLong();
    private volatile ScheduledFuture<?> future;

    RecurringTask(String name, Duration interval, Runnable action) {
        this.name = name;
        this.interval = interval;
        this.action = action;
    }

    /**
     * Runs the action on the calling thread unless a run is already in progress.
     *
     * @return false when the run was dropped
     */
    public boolean runNow() {
        if (!running.compareAndSet(false, true)) {
            droppedRuns.incrementAndGet();
            log.debug("task={}, event=run_dropped, reason=already_running", name);
            return false;
        }
        try {
            action.run();
            completedRuns.incrementAndGet();
        } catch (RuntimeException e) {
            log.error("task={}, event=run_failed", name, e);
        } finally {
            running.set(false);
        }
        return true;
    }

    public boolean isRunning() {
        return running.get();
    }

    public long completedRuns() {
        return completedRuns.get();
    }

    public long droppedRuns() {
        return droppedRuns.get();
    }

    void attach(ScheduledFuture<?> scheduledFuture) {
        this.future = scheduledFuture;
    }

    void cancel() {
        ScheduledFuture<?> current = future;
        if (current != null) {
            current.cancel(false);
        }
    }
}
