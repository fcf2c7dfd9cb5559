package com.arbiter.scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Remembers when each denied item was first refused admission.
 * <p>
 * An item is promoted at most once: after {@link #drainStarved} hands it out it is
 * not tracked again until it is admitted or forgotten.
 */
public class StarvationTracker {

    private final Map<String, Instant> firstDenied = new LinkedHashMap<>();
    private final Set<String> promoted = new HashSet<>();

    /**
     * Record a denial. Only the first denial time is kept.
     *
     * @return true if tracking started with this call
     */
    public synchronized boolean recordDenial(String taskId, Instant when) {
        if (promoted.contains(taskId) || firstDenied.containsKey(taskId)) {
            return false;
        }
        firstDenied.put(taskId, when);
        return true;
    }

    /**
     * Remove and return every tracked id that has waited longer than {@code threshold}.
     */
    public synchronized List<String> drainStarved(Instant now, Duration threshold) {
        List<String> starved = new ArrayList<>();
        var iterator = firstDenied.entrySet().iterator();
        while (iterator.hasNext()) {
            Map.Entry<String, Instant> entry = iterator.next();
            if (Duration.between(entry.getValue(), now).compareTo(threshold) > 0) {
                starved.add(entry.getKey());
                promoted.add(entry.getKey());
                iterator.remove();
            }
        }
        return starved;
    }

    /**
     * Stop tracking an item: it was admitted or removed.
     */
    public synchronized void forget(String taskId) {
        firstDenied.remove(taskId);
        promoted.remove(taskId);
    }

    public synchronized boolean isTracked(String taskId) {
        return firstDenied.containsKey(taskId);
    }

    public synchronized boolean wasPromoted(String taskId) {
        return promoted.contains(taskId);
    }

    public synchronized Instant firstDeniedAt(String taskId) {
        return firstDenied.get(taskId);
    }

    /**
     * Items currently waiting for promotion.
     */
    public synchronized int size() {
        return firstDenied.size();
    }

    public synchronized void clear() {
        firstDenied.clear();
        promoted.clear();
    }
}
