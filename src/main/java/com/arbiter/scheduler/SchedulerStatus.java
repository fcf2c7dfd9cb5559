package com.arbiter.scheduler;

import com.arbiter.config.SchedulerConfig;
import com.arbiter.queue.QueueStatus;

/**
 * Read-only snapshot for observability layers. The running count is best effort:
 * it is not taken atomically with the queue status.
 *
 * @param running            whether the scheduling loop is active
 * @param policy             active scheduling policy
 * @param config             active configuration
 * @param stats              accumulated counters
 * @param queueStatus        queue snapshot
 * @param runningCount       executions currently holding resources
 * @param starvationCount    denied items waiting for promotion
 * @param recentPreemptions  preemptions in the trailing minute
 */
public record SchedulerStatus(
        boolean running,
        SchedulingPolicy policy,
        SchedulerConfig config,
        SchedulerStats stats,
        QueueStatus queueStatus,
        int runningCount,
        int starvationCount,
        int recentPreemptions
) {
}
