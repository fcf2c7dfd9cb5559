package com.arbiter.queue;

import com.arbiter.core.Tier;
import com.arbiter.core.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Multi-level priority queue of pending work.
 * <p>
 * One min-heap per tier, ordered by submission time, plus an id index for O(1)
 * membership checks. Removal is lazy: the heap entry is flagged dead and
 * skipped when it reaches the head, or purged by {@link #cleanupDeleted()}.
 * <p>
 * All operations are serialized by a single coarse lock.
 */
public class PriorityTaskQueue {

    private static final Logger log = LoggerFactory.getLogger(PriorityTaskQueue.class);

    private static final Comparator<Entry> ENTRY_ORDER = Comparator
            .comparing((Entry e) -> e.orderStamp)
            .thenComparingLong(e -> e.sequence);

    private final Map<Tier, PriorityQueue<Entry>> heaps = new EnumMap<>(Tier.class);
    private final Map<Tier, Integer> liveCounts = new EnumMap<>(Tier.class);
    private final Map<Tier, Instant> latestStamps = new EnumMap<>(Tier.class);
    private final Map<String, Entry> index = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();
    private final Clock clock;
    private long nextSequence;
    private int deadEntries;

    public PriorityTaskQueue() {
        this(Clock.systemUTC());
    }

    public PriorityTaskQueue(Clock clock) {
        this.clock = clock;
        for (Tier tier : Tier.values()) {
            heaps.put(tier, new PriorityQueue<>(ENTRY_ORDER));
            liveCounts.put(tier, 0);
        }
    }

    /**
     * Insert an item at the position given by its submission time.
     * An item already queued under the same id is replaced.
     */
    public void put(WorkItem item) {
        lock.lock();
        try {
            insert(item, item.createdAt());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Insert an item behind everything currently queued in its tier, regardless
     * of its submission time. Used for preempted and promoted items.
     */
    public void requeue(WorkItem item) {
        lock.lock();
        try {
            Instant now = clock.instant();
            Instant latest = latestStamps.get(item.priority());
            Instant stamp = latest != null && latest.isAfter(now) ? latest : now;
            if (item.createdAt().isAfter(stamp)) {
                stamp = item.createdAt();
            }
            insert(item, stamp);
        } finally {
            lock.unlock();
        }
    }

    private void insert(WorkItem item, Instant orderStamp) {
        Entry previous = index.get(item.id());
        if (previous != null) {
            log.debug("Task {} already queued in {}, replacing it", item.id(), previous.item.priority());
            markDead(previous);
        }

        Entry entry = new Entry(item, orderStamp, nextSequence++);
        heaps.get(item.priority()).offer(entry);
        index.put(item.id(), entry);
        liveCounts.merge(item.priority(), 1, Integer::sum);

        Instant latest = latestStamps.get(item.priority());
        if (latest == null || orderStamp.isAfter(latest)) {
            latestStamps.put(item.priority(), orderStamp);
        }
        log.trace("Task {} queued in {} (size={})", item.id(), item.priority(), index.size());
    }

    /**
     * Remove and return the most urgent live item from any tier.
     */
    public Optional<WorkItem> get() {
        return get(Tier.values());
    }

    /**
     * Remove and return the head of the first non-empty tier among {@code tiers},
     * checked in the order given. Dead entries met on the way are discarded.
     */
    public Optional<WorkItem> get(Tier... tiers) {
        lock.lock();
        try {
            for (Tier tier : tiers) {
                PriorityQueue<Entry> heap = heaps.get(tier);
                Entry entry;
                while ((entry = heap.poll()) != null) {
                    if (!entry.live) {
                        deadEntries--;
                        continue;
                    }
                    index.remove(entry.item.id());
                    liveCounts.merge(tier, -1, Integer::sum);
                    return Optional.of(entry.item);
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Logically delete a queued item in O(1).
     *
     * @return false if no item with that id is queued
     */
    public boolean remove(String taskId) {
        lock.lock();
        try {
            Entry entry = index.get(taskId);
            if (entry == null) {
                return false;
            }
            markDead(entry);
            log.debug("Task {} removed from {} queue", taskId, entry.item.priority());
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Move a queued item to another tier. The item joins the back of the new tier.
     *
     * @return false if no item with that id is queued
     */
    public boolean updatePriority(String taskId, Tier newTier) {
        lock.lock();
        try {
            Entry entry = index.get(taskId);
            if (entry == null) {
                return false;
            }
            markDead(entry);
            requeue(entry.item.withPriority(newTier));
            log.debug("Task {} moved from {} to {}", taskId, entry.item.priority(), newTier);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void markDead(Entry entry) {
        entry.live = false;
        index.remove(entry.item.id());
        liveCounts.merge(entry.item.priority(), -1, Integer::sum);
        deadEntries++;
    }

    /**
     * Look at the most urgent live item without removing it.
     */
    public Optional<WorkItem> peek() {
        lock.lock();
        try {
            for (Tier tier : Tier.values()) {
                Optional<WorkItem> head = peek(tier);
                if (head.isPresent()) {
                    return head;
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public Optional<WorkItem> peek(Tier tier) {
        lock.lock();
        try {
            PriorityQueue<Entry> heap = heaps.get(tier);
            // Dead heads would be skipped by get() anyway
            while (heap.peek() != null && !heap.peek().live) {
                heap.poll();
                deadEntries--;
            }
            Entry head = heap.peek();
            return head != null ? Optional.of(head.item) : Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    public boolean contains(String taskId) {
        lock.lock();
        try {
            return index.containsKey(taskId);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Number of live items across all tiers.
     */
    public int size() {
        lock.lock();
        try {
            return index.size();
        } finally {
            lock.unlock();
        }
    }

    public int size(Tier tier) {
        lock.lock();
        try {
            return liveCounts.get(tier);
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public boolean isEmpty(Tier tier) {
        return size(tier) == 0;
    }

    /**
     * Live items of one tier in dequeue order.
     */
    public List<WorkItem> getWaitingTasks(Tier tier) {
        lock.lock();
        try {
            return liveInOrder(heaps.get(tier));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Live items of every tier in dequeue order.
     */
    public List<WorkItem> getWaitingTasks() {
        lock.lock();
        try {
            List<WorkItem> all = new ArrayList<>();
            for (Tier tier : Tier.values()) {
                all.addAll(liveInOrder(heaps.get(tier)));
            }
            return all;
        } finally {
            lock.unlock();
        }
    }

    private static List<WorkItem> liveInOrder(PriorityQueue<Entry> heap) {
        return heap.stream()
                .filter(e -> e.live)
                .sorted(ENTRY_ORDER)
                .map(e -> e.item)
                .toList();
    }

    /**
     * Drop every queued item of one tier.
     */
    public void clear(Tier tier) {
        lock.lock();
        try {
            PriorityQueue<Entry> heap = heaps.get(tier);
            for (Entry entry : heap) {
                if (entry.live) {
                    index.remove(entry.item.id());
                } else {
                    deadEntries--;
                }
            }
            heap.clear();
            liveCounts.put(tier, 0);
            log.info("Cleared {} queue", tier);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Drop every queued item.
     */
    public void clear() {
        lock.lock();
        try {
            for (Tier tier : Tier.values()) {
                heaps.get(tier).clear();
                liveCounts.put(tier, 0);
            }
            index.clear();
            deadEntries = 0;
            log.info("Cleared all queues");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rebuild every heap without its dead entries. O(n log n).
     *
     * @return number of entries purged
     */
    public int cleanupDeleted() {
        lock.lock();
        try {
            int purged = 0;
            for (Tier tier : Tier.values()) {
                PriorityQueue<Entry> heap = heaps.get(tier);
                List<Entry> live = heap.stream().filter(e -> e.live).toList();
                purged += heap.size() - live.size();
                heap.clear();
                heap.addAll(live);
            }
            deadEntries = 0;
            if (purged > 0) {
                log.debug("Purged {} deleted queue entries", purged);
            }
            return purged;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Dead entries still held by the heaps.
     */
    public int getDeletedPending() {
        lock.lock();
        try {
            return deadEntries;
        } finally {
            lock.unlock();
        }
    }

    public QueueStatus getQueueStatus() {
        lock.lock();
        try {
            Map<Tier, Integer> lengths = new EnumMap<>(liveCounts);
            int total = index.size();
            Map<Tier, Double> distribution = new EnumMap<>(Tier.class);
            for (Tier tier : Tier.values()) {
                distribution.put(tier, lengths.get(tier) * 100.0 / Math.max(total, 1));
            }
            Map<Tier, List<String>> waiting = new EnumMap<>(Tier.class);
            for (Tier tier : Tier.values()) {
                waiting.put(tier, liveInOrder(heaps.get(tier)).stream().map(WorkItem::id).toList());
            }
            return new QueueStatus(
                    Collections.unmodifiableMap(lengths),
                    total,
                    Collections.unmodifiableMap(distribution),
                    Collections.unmodifiableMap(waiting),
                    deadEntries);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        lock.lock();
        try {
            return "PriorityTaskQueue{size=" + index.size() + ", lengths=" + liveCounts + '}';
        } finally {
            lock.unlock();
        }
    }

    /**
     * Heap slot. {@code live} is cleared on removal instead of restructuring the heap.
     */
    private static final class Entry {
        private final WorkItem item;
        private final Instant orderStamp;
        private final long sequence;
        private boolean live = true;

        private Entry(WorkItem item, Instant orderStamp, long sequence) {
            this.item = item;
            this.orderStamp = orderStamp;
            this.sequence = sequence;
        }
    }
}
