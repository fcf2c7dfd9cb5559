package com.arbiter.core;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * A unit of work waiting for admission.
 * <p>
 * Items order by tier first (CRITICAL before BACKGROUND) and by submission time
 * within a tier. Instances are immutable; a tier change produces a copy.
 *
 * @param id                   unique identity
 * @param priority             priority tier
 * @param createdAt            submission timestamp
 * @param estimatedDuration    producer's estimate of execution time
 * @param resourceRequirements per-quantity overrides of the computed requirement
 * @param retryCount           attempts already made
 * @param maxRetries           attempts allowed
 */
public record WorkItem(
        String id,
        Tier priority,
        Instant createdAt,
        Duration estimatedDuration,
        Map<ResourceType, Integer> resourceRequirements,
        int retryCount,
        int maxRetries
) implements Comparable<WorkItem> {

    public static final int DEFAULT_MAX_RETRIES = 3;

    public WorkItem {
        Objects.requireNonNull(id, "Task id cannot be null");
        Objects.requireNonNull(priority, "Priority cannot be null");
        Objects.requireNonNull(createdAt, "Creation time cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Task id cannot be blank");
        }
        estimatedDuration = estimatedDuration != null ? estimatedDuration : Duration.ZERO;
        resourceRequirements = resourceRequirements == null || resourceRequirements.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(resourceRequirements));
        for (Map.Entry<ResourceType, Integer> e : resourceRequirements.entrySet()) {
            if (e.getValue() == null || e.getValue() < 0) {
                throw new IllegalArgumentException("Requirement for " + e.getKey() + " must be non-negative");
            }
        }
        if (retryCount < 0 || maxRetries < 0) {
            throw new IllegalArgumentException("Retry counters must be non-negative");
        }
    }

    public static WorkItem of(String id, Tier priority, Instant createdAt) {
        return new WorkItem(id, priority, createdAt, Duration.ZERO, Map.of(), 0, DEFAULT_MAX_RETRIES);
    }

    public static Builder builder(String id, Tier priority) {
        return new Builder(id, priority);
    }

    /**
     * Copy of this item moved to another tier.
     */
    public WorkItem withPriority(Tier newPriority) {
        return new WorkItem(id, newPriority, createdAt, estimatedDuration, resourceRequirements,
                retryCount, maxRetries);
    }

    @Override
    public int compareTo(WorkItem other) {
        int byTier = Integer.compare(priority.level(), other.priority.level());
        if (byTier != 0) {
            return byTier;
        }
        return createdAt.compareTo(other.createdAt);
    }

    public static final class Builder {
        private final String id;
        private final Tier priority;
        private Instant createdAt;
        private Duration estimatedDuration = Duration.ZERO;
        private final Map<ResourceType, Integer> requirements = new EnumMap<>(ResourceType.class);
        private int retryCount;
        private int maxRetries = DEFAULT_MAX_RETRIES;

        private Builder(String id, Tier priority) {
            this.id = id;
            this.priority = priority;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder estimatedDuration(Duration estimatedDuration) {
            this.estimatedDuration = estimatedDuration;
            return this;
        }

        public Builder require(ResourceType type, int amount) {
            requirements.put(type, amount);
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public WorkItem build() {
            return new WorkItem(id, priority, createdAt != null ? createdAt : Instant.now(),
                    estimatedDuration, requirements, retryCount, maxRetries);
        }
    }
}
