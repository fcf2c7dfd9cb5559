package com.arbiter.queue;

import com.arbiter.core.Tier;

import java.util.List;
import java.util.Map;

/**
 * Point-in-time view of the queue.
 *
 * @param lengths         live items per tier
 * @param totalTasks      live items across all tiers
 * @param distribution    share of the total per tier, in percent
 * @param waitingTaskIds  ids per tier, in dequeue order
 * @param deletedPending  removed entries not yet purged from the heaps
 */
public record QueueStatus(
        Map<Tier, Integer> lengths,
        int totalTasks,
        Map<Tier, Double> distribution,
        Map<Tier, List<String>> waitingTaskIds,
        int deletedPending
) {
    /**
     * Tier an id is currently queued in, or null if it is not queued.
     */
    public Tier tierOf(String taskId) {
        for (Map.Entry<Tier, List<String>> entry : waitingTaskIds.entrySet()) {
            if (entry.getValue().contains(taskId)) {
                return entry.getKey();
            }
        }
        return null;
    }
}
