package com.arbiter.config;

import com.arbiter.scheduler.SchedulingPolicy;

import java.util.Objects;

/**
 * Tunables of the scheduling loop. Replaced as a whole at runtime.
 *
 * @param tickIntervalMs           pause between ticks
 * @param starvationThresholdMs    wait after the first denial before an item is promoted to HIGH
 * @param preemptionEnabled        whether CRITICAL/HIGH items may evict running work
 * @param maxPreemptionsPerMinute  preemption events allowed in any rolling 60 second window
 * @param policy                   active scheduling policy
 * @param maxConsecutiveFailures   faulty ticks in a row tolerated before the loop halts
 * @param failureBackoffMs         pause after a faulty tick
 * @param unsatisfiableTasks       handling of items that can never fit their tier
 */
public record SchedulerConfig(
        long tickIntervalMs,
        long starvationThresholdMs,
        boolean preemptionEnabled,
        int maxPreemptionsPerMinute,
        SchedulingPolicy policy,
        int maxConsecutiveFailures,
        long failureBackoffMs,
        UnsatisfiableTaskPolicy unsatisfiableTasks
) {
    public SchedulerConfig {
        Objects.requireNonNull(policy, "Scheduling policy cannot be null");
        Objects.requireNonNull(unsatisfiableTasks, "Unsatisfiable task policy cannot be null");
        if (tickIntervalMs <= 0) {
            throw new IllegalArgumentException("Tick interval must be positive");
        }
        if (starvationThresholdMs < 0) {
            throw new IllegalArgumentException("Starvation threshold must be non-negative");
        }
        if (maxPreemptionsPerMinute < 0) {
            throw new IllegalArgumentException("Max preemptions per minute must be non-negative");
        }
        if (maxConsecutiveFailures <= 0) {
            throw new IllegalArgumentException("Max consecutive failures must be positive");
        }
        if (failureBackoffMs < 0) {
            throw new IllegalArgumentException("Failure backoff must be non-negative");
        }
    }

    /**
     * Default scheduler configuration.
     */
    public static SchedulerConfig defaults() {
        return new SchedulerConfig(
                1000,                               // tickIntervalMs
                300_000,                            // starvationThresholdMs
                true,                               // preemptionEnabled
                5,                                  // maxPreemptionsPerMinute
                SchedulingPolicy.PRIORITY_PREEMPTIVE,
                10,                                 // maxConsecutiveFailures
                5000,                               // failureBackoffMs
                UnsatisfiableTaskPolicy.RETRY
        );
    }

    public SchedulerConfig withPolicy(SchedulingPolicy newPolicy) {
        return new SchedulerConfig(tickIntervalMs, starvationThresholdMs, preemptionEnabled,
                maxPreemptionsPerMinute, newPolicy, maxConsecutiveFailures, failureBackoffMs, unsatisfiableTasks);
    }

    public SchedulerConfig withPreemption(boolean enabled, int maxPerMinute) {
        return new SchedulerConfig(tickIntervalMs, starvationThresholdMs, enabled,
                maxPerMinute, policy, maxConsecutiveFailures, failureBackoffMs, unsatisfiableTasks);
    }

    public SchedulerConfig withStarvationThresholdMs(long thresholdMs) {
        return new SchedulerConfig(tickIntervalMs, thresholdMs, preemptionEnabled,
                maxPreemptionsPerMinute, policy, maxConsecutiveFailures, failureBackoffMs, unsatisfiableTasks);
    }

    public SchedulerConfig withTiming(long newTickIntervalMs, long newFailureBackoffMs) {
        return new SchedulerConfig(newTickIntervalMs, starvationThresholdMs, preemptionEnabled,
                maxPreemptionsPerMinute, policy, maxConsecutiveFailures, newFailureBackoffMs, unsatisfiableTasks);
    }

    public SchedulerConfig withMaxConsecutiveFailures(int maxFailures) {
        return new SchedulerConfig(tickIntervalMs, starvationThresholdMs, preemptionEnabled,
                maxPreemptionsPerMinute, policy, maxFailures, failureBackoffMs, unsatisfiableTasks);
    }

    public SchedulerConfig withUnsatisfiableTasks(UnsatisfiableTaskPolicy handling) {
        return new SchedulerConfig(tickIntervalMs, starvationThresholdMs, preemptionEnabled,
                maxPreemptionsPerMinute, policy, maxConsecutiveFailures, failureBackoffMs, handling);
    }
}
