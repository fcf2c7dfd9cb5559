package com.arbiter.scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rolling log of preemption events used for rate limiting.
 *
 * <p>Entries are appended in time order, so expiry only ever drains the head.
 */
public class PreemptionHistory {

    public static final Duration DEFAULT_WINDOW = Duration.ofSeconds(60);

    private final Deque<Instant> events = new ArrayDeque<>();
    private final Duration window;
    private final Clock clock;

    public PreemptionHistory(Clock clock) {
        this(clock, DEFAULT_WINDOW);
    }

    public PreemptionHistory(Clock clock, Duration window) {
        if (window.isZero() || window.isNegative()) {
            throw new IllegalArgumentException("Window size must be positive");
        }
        this.clock = clock;
        this.window = window;
    }

    /**
     * Whether another preemption fits under {@code maxPerWindow}.
     */
    public synchronized boolean canPreempt(int maxPerWindow) {
        evictExpired();
        return events.size() < maxPerWindow;
    }

    public synchronized void record() {
        evictExpired();
        events.addLast(clock.instant());
    }

    /**
     * Events inside the current window.
     */
    public synchronized int count() {
        evictExpired();
        return events.size();
    }

    /**
     * Drop events older than the window.
     *
     * @return number of events dropped
     */
    public synchronized int prune() {
        return evictExpired();
    }

    public synchronized void clear() {
        events.clear();
    }

    public Duration getWindow() {
        return window;
    }

    private int evictExpired() {
        Instant windowStart = clock.instant().minus(window);
        int evicted = 0;
        Instant head;
        while ((head = events.peekFirst()) != null && !head.isAfter(windowStart)) {
            events.pollFirst();
            evicted++;
        }
        return evicted;
    }
}
