package com.arbiter.resource;

import com.arbiter.config.SystemResources;
import com.arbiter.core.ResourceAllocation;
import com.arbiter.core.ResourceType;

import java.util.Map;

/**
 * Usage summed over all tiers, relative to the global caps.
 *
 * @param totalUsage      usage summed over all tiers
 * @param systemResources global caps
 * @param usagePercent    total usage relative to the caps, per quantity
 */
public record ResourceUsageSummary(
        ResourceAllocation totalUsage,
        SystemResources systemResources,
        Map<ResourceType, Double> usagePercent
) {
    public double percent(ResourceType type) {
        return usagePercent.get(type);
    }
}
