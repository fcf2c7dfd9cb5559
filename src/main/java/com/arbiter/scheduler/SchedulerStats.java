package com.arbiter.scheduler;

import java.time.Instant;

/**
 * Counters accumulated by the scheduler since it was created.
 *
 * @param totalScheduled     executions admitted
 * @param totalCompleted     executions completed
 * @param totalFailed        executions failed
 * @param totalPreempted     preemption events
 * @param totalCancelled     executions cancelled through removeTask
 * @param totalRejected      items dropped as unsatisfiable or as duplicates of a running id
 * @param totalDenied        admission attempts refused for lack of resources
 * @param totalPromoted      starvation promotions
 * @param averageWaitMs      mean time from submission to admission
 * @param averageExecutionMs mean running time of completed and failed executions
 * @param lastScheduleTime   end of the last successful tick, null before the first
 */
public record SchedulerStats(
        long totalScheduled,
        long totalCompleted,
        long totalFailed,
        long totalPreempted,
        long totalCancelled,
        long totalRejected,
        long totalDenied,
        long totalPromoted,
        double averageWaitMs,
        double averageExecutionMs,
        Instant lastScheduleTime
) {
}
