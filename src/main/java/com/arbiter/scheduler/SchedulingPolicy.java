package com.arbiter.scheduler;

/**
 * How the scheduling loop picks and admits work on each tick.
 */
public enum SchedulingPolicy {
    /**
     * Tiers drained CRITICAL/HIGH first, then NORMAL, then LOW/BACKGROUND.
     * CRITICAL and HIGH candidates that do not fit may evict a less urgent running item.
     */
    PRIORITY_PREEMPTIVE,

    /**
     * One dequeue per tick, direct admission, no preemption.
     */
    ROUND_ROBIN,

    /**
     * One dequeue per tick, direct admission, no preemption.
     */
    FAIR_SHARE,

    /**
     * PRIORITY_PREEMPTIVE while aggregate concurrency utilisation is above 80%,
     * FAIR_SHARE otherwise.
     */
    ADAPTIVE;

    public static SchedulingPolicy fromName(String name) {
        if (name == null || name.isBlank()) {
            return PRIORITY_PREEMPTIVE;
        }
        return valueOf(name.trim().toUpperCase().replace("-", "_"));
    }
}
