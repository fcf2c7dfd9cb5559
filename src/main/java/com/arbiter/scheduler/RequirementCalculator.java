package com.arbiter.scheduler;

import com.arbiter.core.ResourceAllocation;
import com.arbiter.core.ResourceType;
import com.arbiter.core.WorkItem;

import java.util.Map;

/**
 * Computes the resources a work item asks for at admission.
 * <p>
 * Base: 1 connection, 1024 KB/s, 1 slot, 10 MB/s disk, 64 MB. CRITICAL doubles
 * connections, bandwidth and memory; BACKGROUND drops to 256 KB/s and 32 MB.
 * Explicit overrides on the item win over both.
 */
public class RequirementCalculator {

    static final ResourceAllocation BASE = new ResourceAllocation(1, 1024, 1, 10, 64);
    static final ResourceAllocation CRITICAL = new ResourceAllocation(2, 2048, 1, 10, 128);
    static final ResourceAllocation BACKGROUND = new ResourceAllocation(1, 256, 1, 10, 32);

    public ResourceAllocation calculate(WorkItem item) {
        ResourceAllocation required = switch (item.priority()) {
            case CRITICAL -> CRITICAL;
            case BACKGROUND -> BACKGROUND;
            default -> BASE;
        };
        for (Map.Entry<ResourceType, Integer> override : item.resourceRequirements().entrySet()) {
            required = required.with(override.getKey(), override.getValue());
        }
        return required;
    }
}
