package com.arbiter.config;

import com.arbiter.core.ResourceAllocation;

/**
 * Global hard caps for the five resource quantities.
 *
 * @param maxConnections   maximum connection slots
 * @param maxBandwidthKbps maximum bandwidth (KB/s)
 * @param maxConcurrency   maximum concurrently running tasks
 * @param maxDiskIoMbps    maximum disk I/O (MB/s)
 * @param maxMemoryMb      maximum memory (MB)
 */
public record SystemResources(
        int maxConnections,
        int maxBandwidthKbps,
        int maxConcurrency,
        int maxDiskIoMbps,
        int maxMemoryMb
) {
    public SystemResources {
        if (maxConnections < 0 || maxBandwidthKbps < 0 || maxConcurrency < 0
                || maxDiskIoMbps < 0 || maxMemoryMb < 0) {
            throw new IllegalArgumentException("System resource caps must be non-negative");
        }
    }

    /**
     * Default capacity: 20 connections, 10 MB/s, 10 tasks, 100 MB/s disk, 1 GB memory.
     */
    public static SystemResources defaults() {
        return new SystemResources(
                20,      // maxConnections
                10240,   // maxBandwidthKbps
                10,      // maxConcurrency
                100,     // maxDiskIoMbps
                1024     // maxMemoryMb
        );
    }

    public ResourceAllocation asAllocation() {
        return new ResourceAllocation(maxConnections, maxBandwidthKbps, maxConcurrency, maxDiskIoMbps, maxMemoryMb);
    }
}
