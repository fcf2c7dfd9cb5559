package com.arbiter.core;

/**
 * Lifecycle of a single {@link WorkExecution}.
 * Every status except RUNNING is final for the execution instance; PREEMPTED
 * sends the underlying work item back to the queue.
 */
public enum ExecutionStatus {
    RUNNING,
    COMPLETED,
    FAILED,
    PREEMPTED,
    CANCELLED;

    /**
     * Whether the execution has finished for good (completed, failed or cancelled).
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
