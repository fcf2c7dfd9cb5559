package com.arbiter.config;

import java.util.Objects;

/**
 * Root configuration for an arbiter instance.
 *
 * @param name               instance name, used in log lines
 * @param scheduler          scheduling loop configuration
 * @param systemResources    global resource caps
 * @param allocationStrategy per-tier quota table
 */
public record ArbiterConfig(
        String name,
        SchedulerConfig scheduler,
        SystemResources systemResources,
        AllocationStrategy allocationStrategy
) {
    public ArbiterConfig {
        name = name != null ? name : "arbiter";
        Objects.requireNonNull(scheduler, "Scheduler config cannot be null");
        Objects.requireNonNull(systemResources, "System resources cannot be null");
        Objects.requireNonNull(allocationStrategy, "Allocation strategy cannot be null");
    }

    /**
     * Configuration using every default.
     */
    public static ArbiterConfig defaults() {
        return new ArbiterConfig(
                "arbiter",
                SchedulerConfig.defaults(),
                SystemResources.defaults(),
                AllocationStrategy.defaults()
        );
    }
}
