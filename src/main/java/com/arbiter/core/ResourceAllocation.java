package com.arbiter.core;

import java.util.EnumMap;
import java.util.Map;

/**
 * Five non-negative resource quantities. The same shape describes a capacity,
 * a tier quota, a usage snapshot or the amount granted to one running item.
 *
 * @param connections  connection slots
 * @param bandwidthKbps bandwidth in KB/s
 * @param concurrency  concurrency slots
 * @param diskIoMbps   disk I/O in MB/s
 * @param memoryMb     memory in MB
 */
public record ResourceAllocation(
        int connections,
        int bandwidthKbps,
        int concurrency,
        int diskIoMbps,
        int memoryMb
) {
    public static final ResourceAllocation ZERO = new ResourceAllocation(0, 0, 0, 0, 0);

    public ResourceAllocation {
        if (connections < 0 || bandwidthKbps < 0 || concurrency < 0 || diskIoMbps < 0 || memoryMb < 0) {
            throw new IllegalArgumentException("Resource quantities must be non-negative: "
                    + connections + "/" + bandwidthKbps + "/" + concurrency + "/" + diskIoMbps + "/" + memoryMb);
        }
    }

    public int get(ResourceType type) {
        return switch (type) {
            case CONNECTIONS -> connections;
            case BANDWIDTH -> bandwidthKbps;
            case CONCURRENCY -> concurrency;
            case DISK_IO -> diskIoMbps;
            case MEMORY -> memoryMb;
        };
    }

    /**
     * Copy with one quantity replaced.
     */
    public ResourceAllocation with(ResourceType type, int value) {
        return switch (type) {
            case CONNECTIONS -> new ResourceAllocation(value, bandwidthKbps, concurrency, diskIoMbps, memoryMb);
            case BANDWIDTH -> new ResourceAllocation(connections, value, concurrency, diskIoMbps, memoryMb);
            case CONCURRENCY -> new ResourceAllocation(connections, bandwidthKbps, value, diskIoMbps, memoryMb);
            case DISK_IO -> new ResourceAllocation(connections, bandwidthKbps, concurrency, value, memoryMb);
            case MEMORY -> new ResourceAllocation(connections, bandwidthKbps, concurrency, diskIoMbps, value);
        };
    }

    /**
     * Elementwise sum, saturating at {@link Integer#MAX_VALUE} per quantity.
     */
    public ResourceAllocation plus(ResourceAllocation other) {
        return new ResourceAllocation(
                saturatedAdd(connections, other.connections),
                saturatedAdd(bandwidthKbps, other.bandwidthKbps),
                saturatedAdd(concurrency, other.concurrency),
                saturatedAdd(diskIoMbps, other.diskIoMbps),
                saturatedAdd(memoryMb, other.memoryMb));
    }

    /**
     * Elementwise subtraction, clamped at zero per quantity.
     */
    public ResourceAllocation minusClamped(ResourceAllocation other) {
        return new ResourceAllocation(
                Math.max(0, connections - other.connections),
                Math.max(0, bandwidthKbps - other.bandwidthKbps),
                Math.max(0, concurrency - other.concurrency),
                Math.max(0, diskIoMbps - other.diskIoMbps),
                Math.max(0, memoryMb - other.memoryMb));
    }

    /**
     * True iff every quantity is less than or equal to the matching quantity of {@code limit}.
     */
    public boolean fitsWithin(ResourceAllocation limit) {
        for (ResourceType type : ResourceType.values()) {
            if (get(type) > limit.get(type)) {
                return false;
            }
        }
        return true;
    }

    /**
     * True iff {@code this + extra} fits within {@code limit} for every quantity.
     * Sums are compared as longs, so large requirements never wrap around.
     */
    public boolean fitsWithin(ResourceAllocation extra, ResourceAllocation limit) {
        for (ResourceType type : ResourceType.values()) {
            if ((long) get(type) + extra.get(type) > limit.get(type)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Utilisation of each quantity relative to {@code capacity}, in percent.
     * A zero capacity is treated as one to avoid division by zero.
     */
    public Map<ResourceType, Double> percentOf(ResourceAllocation capacity) {
        Map<ResourceType, Double> percentages = new EnumMap<>(ResourceType.class);
        for (ResourceType type : ResourceType.values()) {
            percentages.put(type, get(type) * 100.0 / Math.max(capacity.get(type), 1));
        }
        return percentages;
    }

    public Map<ResourceType, Integer> asMap() {
        Map<ResourceType, Integer> map = new EnumMap<>(ResourceType.class);
        for (ResourceType type : ResourceType.values()) {
            map.put(type, get(type));
        }
        return map;
    }

    private static int saturatedAdd(int a, int b) {
        return (int) Math.min((long) a + b, Integer.MAX_VALUE);
    }
}
