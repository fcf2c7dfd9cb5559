package com.arbiter.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Mutable counters behind {@link SchedulerStats}.
 */
class SchedulerCounters {

    final AtomicLong scheduled = new AtomicLong();
    final AtomicLong completed = new AtomicLong();
    final AtomicLong failed = new AtomicLong();
    final AtomicLong preempted = new AtomicLong();
    final AtomicLong cancelled = new AtomicLong();
    final AtomicLong rejected = new AtomicLong();
    final AtomicLong denied = new AtomicLong();
    final AtomicLong promoted = new AtomicLong();

    private final AtomicLong totalWaitMs = new AtomicLong();
    private final AtomicLong totalExecutionMs = new AtomicLong();
    private final AtomicLong finishedExecutions = new AtomicLong();
    private volatile Instant lastScheduleTime;

    void recordAdmission(Duration waited) {
        scheduled.incrementAndGet();
        totalWaitMs.addAndGet(Math.max(0, waited.toMillis()));
    }

    void recordFinished(boolean success, Duration ran) {
        (success ? completed : failed).incrementAndGet();
        finishedExecutions.incrementAndGet();
        totalExecutionMs.addAndGet(Math.max(0, ran.toMillis()));
    }

    void markTick(Instant when) {
        this.lastScheduleTime = when;
    }

    SchedulerStats snapshot() {
        long admitted = scheduled.get();
        long finished = finishedExecutions.get();
        return new SchedulerStats(
                admitted,
                completed.get(),
                failed.get(),
                preempted.get(),
                cancelled.get(),
                rejected.get(),
                denied.get(),
                promoted.get(),
                admitted == 0 ? 0.0 : (double) totalWaitMs.get() / admitted,
                finished == 0 ? 0.0 : (double) totalExecutionMs.get() / finished,
                lastScheduleTime
        );
    }
}
