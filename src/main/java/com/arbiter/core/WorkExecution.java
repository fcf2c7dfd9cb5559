package com.arbiter.core;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * An admitted {@link WorkItem} together with the resources granted to it.
 * <p>
 * The external executor reports progress and moves the execution to COMPLETED or
 * FAILED; the scheduler may move it to PREEMPTED or CANCELLED. Only the first
 * transition out of RUNNING takes effect.
 */
public class WorkExecution {

    private final WorkItem item;
    private final ResourceAllocation allocated;
    private final Instant startedAt;
    private final Clock clock;
    private final AtomicReference<ExecutionStatus> status = new AtomicReference<>(ExecutionStatus.RUNNING);

    private volatile Instant completedAt;
    private volatile Instant preemptedAt;
    private volatile double progress;
    private volatile String error;

    public WorkExecution(WorkItem item, ResourceAllocation allocated, Clock clock) {
        this.item = Objects.requireNonNull(item, "Work item cannot be null");
        this.allocated = Objects.requireNonNull(allocated, "Allocation cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.startedAt = clock.instant();
    }

    public String getTaskId() {
        return item.id();
    }

    public WorkItem getItem() {
        return item;
    }

    public Tier getTier() {
        return item.priority();
    }

    public ResourceAllocation getAllocated() {
        return allocated;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }

    public Instant getPreemptedAt() {
        return preemptedAt;
    }

    public ExecutionStatus getStatus() {
        return status.get();
    }

    public double getProgress() {
        return progress;
    }

    public String getError() {
        return error;
    }

    /**
     * Report progress in percent (clamped to 0..100). Ignored once the execution has left RUNNING.
     */
    public void updateProgress(double percent) {
        if (status.get() == ExecutionStatus.RUNNING) {
            this.progress = Math.max(0.0, Math.min(100.0, percent));
        }
    }

    /**
     * Executor callback: the work finished successfully.
     *
     * @return false if the execution had already left RUNNING
     */
    public boolean complete() {
        if (status.compareAndSet(ExecutionStatus.RUNNING, ExecutionStatus.COMPLETED)) {
            this.progress = 100.0;
            this.completedAt = clock.instant();
            return true;
        }
        return false;
    }

    /**
     * Executor callback: the work failed.
     *
     * @return false if the execution had already left RUNNING
     */
    public boolean fail(String error) {
        if (status.compareAndSet(ExecutionStatus.RUNNING, ExecutionStatus.FAILED)) {
            this.error = error;
            this.completedAt = clock.instant();
            return true;
        }
        return false;
    }

    /**
     * Mark as evicted in favour of a more urgent item.
     */
    public boolean markPreempted() {
        if (status.compareAndSet(ExecutionStatus.RUNNING, ExecutionStatus.PREEMPTED)) {
            this.preemptedAt = clock.instant();
            return true;
        }
        return false;
    }

    /**
     * Mark as cancelled on behalf of a caller. Does not stop real work.
     */
    public boolean cancel() {
        if (status.compareAndSet(ExecutionStatus.RUNNING, ExecutionStatus.CANCELLED)) {
            this.completedAt = clock.instant();
            return true;
        }
        return false;
    }

    /**
     * Time spent running, up to completion if known, otherwise up to {@code now}.
     */
    public Duration getElapsed(Instant now) {
        Instant end = completedAt != null ? completedAt : now;
        return Duration.between(startedAt, end);
    }

    @Override
    public String toString() {
        return "WorkExecution{" +
                "taskId='" + item.id() + '\'' +
                ", tier=" + item.priority() +
                ", status=" + status.get() +
                ", progress=" + progress +
                '}';
    }
}
