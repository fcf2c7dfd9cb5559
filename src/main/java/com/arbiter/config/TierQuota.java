package com.arbiter.config;

import com.arbiter.core.ResourceAllocation;
import com.arbiter.core.ResourceType;

/**
 * Percentage of each global cap one tier may hold.
 *
 * @param connectionsPercent share of connection slots
 * @param bandwidthPercent   share of bandwidth
 * @param concurrencyPercent share of concurrency slots
 * @param diskIoPercent      share of disk I/O
 * @param memoryPercent      share of memory
 */
public record TierQuota(
        int connectionsPercent,
        int bandwidthPercent,
        int concurrencyPercent,
        int diskIoPercent,
        int memoryPercent
) {
    public TierQuota {
        checkPercent("connections", connectionsPercent);
        checkPercent("bandwidth", bandwidthPercent);
        checkPercent("concurrency", concurrencyPercent);
        checkPercent("disk-io", diskIoPercent);
        checkPercent("memory", memoryPercent);
    }

    /**
     * Same percentage for every quantity.
     */
    public static TierQuota uniform(int percent) {
        return new TierQuota(percent, percent, percent, percent, percent);
    }

    public int percent(ResourceType type) {
        return switch (type) {
            case CONNECTIONS -> connectionsPercent;
            case BANDWIDTH -> bandwidthPercent;
            case CONCURRENCY -> concurrencyPercent;
            case DISK_IO -> diskIoPercent;
            case MEMORY -> memoryPercent;
        };
    }

    /**
     * Apply the percentages to a capacity, rounding each quantity down.
     */
    public ResourceAllocation applyTo(SystemResources resources) {
        ResourceAllocation caps = resources.asAllocation();
        ResourceAllocation result = ResourceAllocation.ZERO;
        for (ResourceType type : ResourceType.values()) {
            long scaled = (long) caps.get(type) * percent(type) / 100;
            result = result.with(type, (int) scaled);
        }
        return result;
    }

    private static void checkPercent(String name, int value) {
        if (value < 0 || value > 100) {
            throw new IllegalArgumentException(name + " percent must be within 0..100, got " + value);
        }
    }
}
