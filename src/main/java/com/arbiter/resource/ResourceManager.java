package com.arbiter.resource;

import com.arbiter.config.AllocationStrategy;
import com.arbiter.config.SystemResources;
import com.arbiter.config.TierQuota;
import com.arbiter.core.ResourceAllocation;
import com.arbiter.core.Tier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Tracks resource consumption per tier and gates admission against each tier's quota.
 * <p>
 * A tier's quota is {@code floor(cap * percent / 100)} for every quantity, evaluated
 * against the global caps independently of the other tiers.
 */
public class ResourceManager {

    private static final Logger log = LoggerFactory.getLogger(ResourceManager.class);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<Tier, ResourceAllocation> currentUsage = new EnumMap<>(Tier.class);
    private final Map<Tier, List<String>> activeTasks = new EnumMap<>(Tier.class);
    private final Map<String, Grant> grants = new HashMap<>();

    private SystemResources systemResources;
    private AllocationStrategy allocationStrategy;

    public ResourceManager() {
        this(SystemResources.defaults(), AllocationStrategy.defaults());
    }

    public ResourceManager(SystemResources systemResources, AllocationStrategy allocationStrategy) {
        this.systemResources = Objects.requireNonNull(systemResources, "System resources cannot be null");
        this.allocationStrategy = Objects.requireNonNull(allocationStrategy, "Allocation strategy cannot be null");
        for (Tier tier : Tier.values()) {
            currentUsage.put(tier, ResourceAllocation.ZERO);
            activeTasks.put(tier, new ArrayList<>());
        }
        log.info("ResourceManager initialized with caps {}", systemResources);
    }

    /**
     * Quota of a tier under the current caps and strategy.
     */
    public ResourceAllocation maxAllocation(Tier tier) {
        lock.lock();
        try {
            TierQuota quota = allocationStrategy.quota(tier);
            return quota.applyTo(systemResources);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether {@code required} fits in the tier's remaining quota. Never mutates state.
     */
    public boolean canAllocate(Tier tier, ResourceAllocation required) {
        lock.lock();
        try {
            return currentUsage.get(tier).fitsWithin(required, maxAllocation(tier));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Whether {@code required} would fit the tier's quota if nothing else were running.
     */
    public boolean canEverFit(Tier tier, ResourceAllocation required) {
        return required.fitsWithin(maxAllocation(tier));
    }

    /**
     * Reserve resources for a task.
     *
     * @return false if the tier's quota cannot hold {@code required}, or the task already holds a grant
     */
    public boolean allocate(String taskId, Tier tier, ResourceAllocation required) {
        Objects.requireNonNull(taskId, "Task id cannot be null");
        lock.lock();
        try {
            if (grants.containsKey(taskId)) {
                log.warn("Task {} already holds resources, refusing second allocation", taskId);
                return false;
            }
            if (!canAllocate(tier, required)) {
                log.debug("Tier {} cannot hold {} for task {} (usage={}, max={})",
                        tier, required, taskId, currentUsage.get(tier), maxAllocation(tier));
                return false;
            }
            currentUsage.put(tier, currentUsage.get(tier).plus(required));
            activeTasks.get(tier).add(taskId);
            grants.put(taskId, new Grant(tier, required));
            log.debug("Allocated {} to task {} in tier {}", required, taskId, tier);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Release the resources recorded for a task.
     */
    public void release(String taskId, Tier tier) {
        release(taskId, tier, null);
    }

    /**
     * Release resources held by a task. Usage is clamped at zero per quantity.
     * Does nothing if the task holds no recorded allocation.
     *
     * @param allocated amount to return, or null to return the recorded grant
     */
    public void release(String taskId, Tier tier, ResourceAllocation allocated) {
        lock.lock();
        try {
            Grant grant = grants.remove(taskId);
            if (grant == null) {
                log.debug("Task {} has no recorded allocation, nothing to release", taskId);
                return;
            }
            ResourceAllocation amount = allocated != null ? allocated : grant.allocation();
            currentUsage.put(tier, currentUsage.get(tier).minusClamped(amount));
            activeTasks.get(tier).remove(taskId);
            if (grant.tier() != tier) {
                // Recorded under another tier; keep that tier's task list consistent too
                activeTasks.get(grant.tier()).remove(taskId);
                log.warn("Task {} released from {} but was allocated in {}", taskId, tier, grant.tier());
            }
            log.debug("Released {} from task {} in tier {}", amount, taskId, tier);
        } finally {
            lock.unlock();
        }
    }

    public ResourceAllocation getCurrentUsage(Tier tier) {
        lock.lock();
        try {
            return currentUsage.get(tier);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Headroom left under a tier's quota, floored at zero.
     */
    public ResourceAllocation getAvailable(Tier tier) {
        lock.lock();
        try {
            return maxAllocation(tier).minusClamped(currentUsage.get(tier));
        } finally {
            lock.unlock();
        }
    }

    public Optional<ResourceAllocation> getTaskAllocation(String taskId) {
        lock.lock();
        try {
            Grant grant = grants.get(taskId);
            return grant != null ? Optional.of(grant.allocation()) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public List<String> getActiveTasks(Tier tier) {
        lock.lock();
        try {
            return List.copyOf(activeTasks.get(tier));
        } finally {
            lock.unlock();
        }
    }

    public Map<Tier, TierResourceStatus> getResourceStatus() {
        lock.lock();
        try {
            Map<Tier, TierResourceStatus> status = new EnumMap<>(Tier.class);
            for (Tier tier : Tier.values()) {
                ResourceAllocation max = maxAllocation(tier);
                ResourceAllocation usage = currentUsage.get(tier);
                status.put(tier, new TierResourceStatus(
                        tier,
                        max,
                        usage,
                        usage.percentOf(max),
                        activeTasks.get(tier).size(),
                        max.minusClamped(usage)));
            }
            return Collections.unmodifiableMap(status);
        } finally {
            lock.unlock();
        }
    }

    public ResourceUsageSummary getTotalUsage() {
        lock.lock();
        try {
            ResourceAllocation total = ResourceAllocation.ZERO;
            for (ResourceAllocation usage : currentUsage.values()) {
                total = total.plus(usage);
            }
            return new ResourceUsageSummary(total, systemResources, total.percentOf(systemResources.asAllocation()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replace the quotas of the tiers present in {@code updates}; other tiers are unchanged.
     * Running grants are kept even if they now exceed the new quota.
     */
    public void updateAllocationStrategy(Map<Tier, TierQuota> updates) {
        lock.lock();
        try {
            this.allocationStrategy = allocationStrategy.merge(updates);
            log.info("Allocation strategy updated for tiers {}", updates.keySet());
        } finally {
            lock.unlock();
        }
    }

    public void updateAllocationStrategy(AllocationStrategy strategy) {
        updateAllocationStrategy(strategy.asMap());
    }

    public void updateSystemResources(SystemResources resources) {
        Objects.requireNonNull(resources, "System resources cannot be null");
        lock.lock();
        try {
            this.systemResources = resources;
            log.info("System resources updated: {}", resources);
        } finally {
            lock.unlock();
        }
    }

    public SystemResources getSystemResources() {
        lock.lock();
        try {
            return systemResources;
        } finally {
            lock.unlock();
        }
    }

    public AllocationStrategy getAllocationStrategy() {
        lock.lock();
        try {
            return allocationStrategy;
        } finally {
            lock.unlock();
        }
    }

    private record Grant(Tier tier, ResourceAllocation allocation) {}
}
