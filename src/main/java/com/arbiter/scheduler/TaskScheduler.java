package com.arbiter.scheduler;

import com.arbiter.config.AllocationStrategy;
import com.arbiter.config.SchedulerConfig;
import com.arbiter.config.SystemResources;
import com.arbiter.config.TierQuota;
import com.arbiter.core.Tier;
import com.arbiter.core.WorkExecution;
import com.arbiter.core.WorkItem;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resource-bounded scheduler abstraction for producers and observers.
 * Decides when queued work may run; it never performs the work itself.
 */
public interface TaskScheduler {

    /**
     * Queue a work item. Never throws for admission reasons; outcomes are
     * visible through {@link #getStatus()}.
     */
    void addTask(WorkItem item);

    /**
     * Remove a queued item, or cancel a running one and free its resources.
     * Cancellation is administrative only: the executor must abort real work itself.
     *
     * @return false if the id is neither queued nor running
     */
    boolean removeTask(String taskId);

    /**
     * Snapshot of policy, configuration, counters and queue state.
     */
    SchedulerStatus getStatus();

    /**
     * Replace the quotas of the given tiers.
     */
    void updateAllocationStrategy(Map<Tier, TierQuota> updates);

    /**
     * Replace the quotas of every tier.
     */
    void updateAllocationStrategy(AllocationStrategy strategy);

    /**
     * Replace the global resource caps.
     */
    void updateSystemResources(SystemResources resources);

    /**
     * Start the scheduling loop.
     */
    void start();

    /**
     * Stop the scheduling loop and wait briefly for it to exit.
     */
    void stop();

    /**
     * Whether the scheduling loop is active.
     */
    boolean isRunning();

    /**
     * Run a single scheduling tick on the calling thread.
     */
    void runOnce();

    SchedulingPolicy getPolicy();

    void setPolicy(SchedulingPolicy policy);

    SchedulerConfig getConfig();

    void updateConfig(SchedulerConfig config);

    /**
     * Executions currently holding resources, oldest first.
     */
    List<WorkExecution> getRunningExecutions();

    Optional<WorkExecution> getExecution(String taskId);
}
