package com.arbiter.resource;

import com.arbiter.core.ResourceAllocation;
import com.arbiter.core.ResourceType;
import com.arbiter.core.Tier;

import java.util.Map;

/**
 * Resource picture of one tier.
 *
 * @param tier          the tier
 * @param maxAllocation quota derived from system caps and the allocation strategy
 * @param currentUsage  resources held by the tier's running tasks
 * @param usagePercent  usage relative to the quota, per quantity
 * @param activeTasks   number of tasks holding resources in this tier
 * @param available     headroom left under the quota (never negative)
 */
public record TierResourceStatus(
        Tier tier,
        ResourceAllocation maxAllocation,
        ResourceAllocation currentUsage,
        Map<ResourceType, Double> usagePercent,
        int activeTasks,
        ResourceAllocation available
) {
}
