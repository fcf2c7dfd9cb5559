package com.arbiter.scheduler;

import com.arbiter.TestClock;
import com.arbiter.config.AllocationStrategy;
import com.arbiter.config.SchedulerConfig;
import com.arbiter.config.SystemResources;
import com.arbiter.config.TierQuota;
import com.arbiter.config.UnsatisfiableTaskPolicy;
import com.arbiter.core.ExecutionStatus;
import com.arbiter.core.ResourceAllocation;
import com.arbiter.core.ResourceType;
import com.arbiter.core.Tier;
import com.arbiter.core.WorkExecution;
import com.arbiter.core.WorkItem;
import com.arbiter.queue.PriorityTaskQueue;
import com.arbiter.resource.ResourceManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultTaskScheduler, driven tick by tick through runOnce().
 */
class DefaultTaskSchedulerTest {

    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    /**
     * Caps large enough that every tier, LOW and BACKGROUND included, has usable quota.
     */
    private static final SystemResources LARGE = new SystemResources(100, 1_000_000, 100, 1000, 10_000);

    private TestClock clock;
    private PriorityTaskQueue queue;
    private ResourceManager resourceManager;
    private List<WorkExecution> started;
    private DefaultTaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new TestClock(T0);
        queue = new PriorityTaskQueue(clock);
        resourceManager = new ResourceManager(LARGE, AllocationStrategy.defaults());
        started = new ArrayList<>();
        scheduler = newScheduler(started::add);
    }

    private DefaultTaskScheduler newScheduler(ExecutionHook hook) {
        return new DefaultTaskScheduler("test", SchedulerConfig.defaults(), queue, resourceManager,
                hook, new LoggingFaultListener(), clock);
    }

    private static WorkItem item(String id, Tier tier, long secondsAfterStart) {
        return WorkItem.of(id, tier, T0.plusSeconds(secondsAfterStart));
    }

    private static WorkItem itemWithConcurrency(String id, Tier tier, int concurrency) {
        return WorkItem.builder(id, tier)
                .createdAt(T0)
                .require(ResourceType.CONCURRENCY, concurrency)
                .build();
    }

    /**
     * Submit and admit items one tick at a time, one second apart.
     */
    private void admit(WorkItem... items) {
        for (WorkItem item : items) {
            scheduler.addTask(item);
            scheduler.runOnce();
            assertTrue(scheduler.getExecution(item.id()).isPresent(), "Expected " + item.id() + " to be admitted");
            clock.advance(Duration.ofSeconds(1));
        }
    }

    private List<String> startedIds() {
        return started.stream().map(WorkExecution::getTaskId).toList();
    }

    // ---------------------------------------------------------------------
    // Ordering and admission
    // ---------------------------------------------------------------------

    @Test
    @DisplayName("Should start items of one tier in submission order when resources are plentiful")
    void shouldStartInSubmissionOrder() {
        clock.advance(Duration.ofSeconds(5));
        scheduler.addTask(item("n2", Tier.NORMAL, 2));
        scheduler.addTask(item("n0", Tier.NORMAL, 0));
        scheduler.addTask(item("n1", Tier.NORMAL, 1));

        scheduler.runOnce();
        scheduler.runOnce();
        scheduler.runOnce();

        assertEquals(List.of("n0", "n1", "n2"), startedIds());
        SchedulerStats stats = scheduler.getStatus().stats();
        assertEquals(3, stats.totalScheduled());
        assertEquals(4000.0, stats.averageWaitMs(), 0.001);
        assertTrue(queue.isEmpty());
    }

    @Test
    @DisplayName("Should drain urgent tiers before lower ones")
    void shouldDrainUrgentTiersFirst() {
        scheduler.addTask(item("low", Tier.LOW, 0));
        scheduler.addTask(item("normal", Tier.NORMAL, 1));
        scheduler.addTask(item("critical", Tier.CRITICAL, 2));
        scheduler.addTask(item("high", Tier.HIGH, 3));

        for (int i = 0; i < 4; i++) {
            scheduler.runOnce();
        }

        assertEquals(List.of("critical", "high", "normal", "low"), startedIds());
    }

    @Test
    @DisplayName("Should requeue a denied item in its original position and count the denial")
    void shouldRequeueDeniedItem() {
        resourceManager.updateSystemResources(SystemResources.defaults());
        admit(item("n0", Tier.NORMAL, 0));
        scheduler.addTask(item("n1", Tier.NORMAL, 1));
        scheduler.addTask(item("n2", Tier.NORMAL, 2));

        scheduler.runOnce();

        SchedulerStatus status = scheduler.getStatus();
        assertEquals(1, status.runningCount());
        assertEquals(List.of("n1", "n2"), status.queueStatus().waitingTaskIds().get(Tier.NORMAL));
        assertEquals(1, status.stats().totalDenied());
        assertEquals(1, status.starvationCount());
    }

    @Test
    @DisplayName("Should admit more work after the allocation strategy is widened")
    void shouldAdmitAfterStrategyUpdate() {
        resourceManager.updateSystemResources(SystemResources.defaults());
        scheduler.addTask(item("n1", Tier.NORMAL, 0));
        scheduler.addTask(item("n2", Tier.NORMAL, 1));
        scheduler.runOnce();
        scheduler.runOnce();
        assertEquals(1, scheduler.getRunningExecutions().size());

        scheduler.updateAllocationStrategy(Map.of(Tier.NORMAL, TierQuota.uniform(50)));
        scheduler.runOnce();

        assertEquals(2, scheduler.getRunningExecutions().size());
        assertEquals(5, resourceManager.maxAllocation(Tier.NORMAL).concurrency());
    }

    // ---------------------------------------------------------------------
    // Starvation
    // ---------------------------------------------------------------------

    @Test
    @DisplayName("Should promote a starved item to HIGH exactly once")
    void shouldPromoteStarvedItemOnce() {
        scheduler.updateConfig(SchedulerConfig.defaults()
                .withPreemption(false, 5)
                .withStarvationThresholdMs(1000));
        admit(itemWithConcurrency("critical-full", Tier.CRITICAL, 50),
                itemWithConcurrency("high-full", Tier.HIGH, 30));

        scheduler.addTask(item("starving", Tier.CRITICAL, 0));
        scheduler.runOnce();

        SchedulerStatus status = scheduler.getStatus();
        assertEquals(Tier.CRITICAL, status.queueStatus().tierOf("starving"));
        assertEquals(1, status.starvationCount());

        clock.advance(Duration.ofMillis(500));
        scheduler.runOnce();
        assertEquals(Tier.CRITICAL, scheduler.getStatus().queueStatus().tierOf("starving"));

        clock.advance(Duration.ofMillis(1000));
        scheduler.runOnce();

        status = scheduler.getStatus();
        assertEquals(Tier.HIGH, status.queueStatus().tierOf("starving"));
        assertEquals(1, status.stats().totalPromoted());
        assertEquals(0, status.starvationCount());

        clock.advance(Duration.ofSeconds(5));
        scheduler.runOnce();
        scheduler.runOnce();

        status = scheduler.getStatus();
        assertEquals(Tier.HIGH, status.queueStatus().tierOf("starving"));
        assertEquals(1, status.stats().totalPromoted());
    }

    @Test
    @DisplayName("Should stop tracking starvation once the item is admitted")
    void shouldStopTrackingWhenAdmitted() {
        resourceManager.updateSystemResources(SystemResources.defaults());
        admit(item("n0", Tier.NORMAL, 0));
        scheduler.addTask(item("n1", Tier.NORMAL, 1));
        scheduler.runOnce();
        assertEquals(1, scheduler.getStatus().starvationCount());

        scheduler.getExecution("n0").orElseThrow().complete();
        scheduler.runOnce();
        scheduler.runOnce();

        assertTrue(scheduler.getExecution("n1").isPresent());
        assertEquals(0, scheduler.getStatus().starvationCount());
    }

    // ---------------------------------------------------------------------
    // Preemption
    // ---------------------------------------------------------------------

    @Test
    @DisplayName("Should not preempt when the urgent item fits its own quota")
    void shouldNotPreemptWhenQuotaFits() {
        admit(itemWithConcurrency("low", Tier.LOW, 4), item("bg", Tier.BACKGROUND, 0));

        scheduler.addTask(item("critical", Tier.CRITICAL, 10));
        scheduler.runOnce();

        assertTrue(scheduler.getExecution("critical").isPresent());
        assertTrue(scheduler.getExecution("low").isPresent());
        assertTrue(scheduler.getExecution("bg").isPresent());
        assertEquals(0, scheduler.getStatus().stats().totalPreempted());
        assertEquals(3, scheduler.getStatus().runningCount());
    }

    @Test
    @DisplayName("Should preempt the BACKGROUND execution rather than the LOW one")
    void shouldPreemptLowestTier() {
        admit(itemWithConcurrency("critical-full", Tier.CRITICAL, 50),
                itemWithConcurrency("low", Tier.LOW, 4),
                item("bg", Tier.BACKGROUND, 0));
        WorkExecution background = scheduler.getExecution("bg").orElseThrow();

        scheduler.addTask(item("critical", Tier.CRITICAL, 10));
        scheduler.runOnce();

        SchedulerStatus status = scheduler.getStatus();
        assertEquals(ExecutionStatus.PREEMPTED, background.getStatus());
        assertEquals(clock.instant(), background.getPreemptedAt());
        assertTrue(scheduler.getExecution("low").isPresent());
        assertEquals(Tier.BACKGROUND, status.queueStatus().tierOf("bg"));
        assertEquals(Tier.CRITICAL, status.queueStatus().tierOf("critical"));
        assertEquals(1, status.stats().totalPreempted());
        assertEquals(1, status.recentPreemptions());
        assertEquals(ResourceAllocation.ZERO, resourceManager.getCurrentUsage(Tier.BACKGROUND));
    }

    @Test
    @DisplayName("Should not preempt when preemption is disabled")
    void shouldNotPreemptWhenDisabled() {
        scheduler.updateConfig(SchedulerConfig.defaults().withPreemption(false, 5));
        admit(itemWithConcurrency("critical-full", Tier.CRITICAL, 50), item("bg", Tier.BACKGROUND, 0));

        scheduler.addTask(item("critical", Tier.CRITICAL, 10));
        scheduler.runOnce();

        assertTrue(scheduler.getExecution("bg").isPresent());
        assertEquals(0, scheduler.getStatus().stats().totalPreempted());
        assertEquals(1, scheduler.getStatus().stats().totalDenied());
    }

    @Test
    @DisplayName("Should not preempt under the round-robin policy")
    void shouldNotPreemptUnderRoundRobin() {
        scheduler.setPolicy(SchedulingPolicy.ROUND_ROBIN);
        admit(itemWithConcurrency("critical-full", Tier.CRITICAL, 50), item("bg", Tier.BACKGROUND, 0));

        scheduler.addTask(item("critical", Tier.CRITICAL, 10));
        scheduler.runOnce();

        assertEquals(SchedulingPolicy.ROUND_ROBIN, scheduler.getPolicy());
        assertTrue(scheduler.getExecution("bg").isPresent());
        assertEquals(0, scheduler.getStatus().stats().totalPreempted());
    }

    @Test
    @DisplayName("Should leave an urgent item queued when nothing less urgent is running")
    void shouldNotPreemptPeers() {
        admit(itemWithConcurrency("critical", Tier.CRITICAL, 1),
                itemWithConcurrency("high-full", Tier.HIGH, 30));

        scheduler.addTask(item("high", Tier.HIGH, 10));
        scheduler.runOnce();

        assertEquals(0, scheduler.getStatus().stats().totalPreempted());
        assertEquals(Tier.HIGH, scheduler.getStatus().queueStatus().tierOf("high"));
        assertEquals(2, scheduler.getStatus().runningCount());
    }

    @Test
    @DisplayName("Should pick the lowest tier below the incoming one, most recent first")
    void shouldSelectVictim() {
        admit(item("critical", Tier.CRITICAL, 0),
                item("normal", Tier.NORMAL, 0),
                item("low-1", Tier.LOW, 0),
                item("low-2", Tier.LOW, 1));

        assertEquals("low-2", scheduler.selectVictim(Tier.HIGH).orElseThrow().getTaskId());
        assertEquals("low-2", scheduler.selectVictim(Tier.NORMAL).orElseThrow().getTaskId());
        assertTrue(scheduler.selectVictim(Tier.LOW).isEmpty());
    }

    @Test
    @DisplayName("Should cap preemptions per minute and resume after the window passes")
    void shouldRateLimitPreemptions() {
        scheduler.updateConfig(SchedulerConfig.defaults().withPreemption(true, 2));
        admit(itemWithConcurrency("critical-full", Tier.CRITICAL, 50),
                item("l1", Tier.LOW, 1),
                item("l2", Tier.LOW, 2),
                item("l3", Tier.LOW, 3),
                item("l4", Tier.LOW, 4));
        scheduler.addTask(item("critical", Tier.CRITICAL, 10));

        scheduler.runOnce();
        // One victim per event, even though it frees nothing in the CRITICAL tier
        assertEquals(4, scheduler.getStatus().runningCount());
        assertEquals(Tier.CRITICAL, scheduler.getStatus().queueStatus().tierOf("critical"));

        scheduler.runOnce();
        scheduler.runOnce();

        SchedulerStatus status = scheduler.getStatus();
        assertEquals(2, status.stats().totalPreempted());
        assertEquals(2, status.recentPreemptions());
        assertEquals(Tier.LOW, status.queueStatus().tierOf("l4"));
        assertEquals(Tier.LOW, status.queueStatus().tierOf("l3"));
        assertTrue(scheduler.getExecution("l1").isPresent());
        assertTrue(scheduler.getExecution("l2").isPresent());

        clock.advance(Duration.ofSeconds(61));
        scheduler.runOnce();

        status = scheduler.getStatus();
        assertEquals(3, status.stats().totalPreempted());
        assertEquals(1, status.recentPreemptions());
        assertTrue(scheduler.getExecution("l2").isEmpty());
    }

    // ---------------------------------------------------------------------
    // Adaptive policy
    // ---------------------------------------------------------------------

    private void useSmallSystemWithWideLowTier() {
        resourceManager.updateSystemResources(SystemResources.defaults());
        resourceManager.updateAllocationStrategy(Map.of(Tier.LOW, TierQuota.uniform(40)));
        scheduler.setPolicy(SchedulingPolicy.ADAPTIVE);
    }

    @Test
    @DisplayName("Should behave as fair share while concurrency utilisation is moderate")
    void shouldUseFairShareUnderModerateLoad() {
        useSmallSystemWithWideLowTier();
        admit(itemWithConcurrency("critical-full", Tier.CRITICAL, 5), item("l1", Tier.LOW, 1));

        scheduler.addTask(item("critical", Tier.CRITICAL, 10));
        scheduler.runOnce();

        assertEquals(0, scheduler.getStatus().stats().totalPreempted());
        assertEquals(1, scheduler.getStatus().stats().totalDenied());
        assertTrue(scheduler.getExecution("l1").isPresent());
    }

    @Test
    @DisplayName("Should preempt once concurrency utilisation exceeds the adaptive threshold")
    void shouldPreemptUnderHeavyLoad() {
        useSmallSystemWithWideLowTier();
        admit(itemWithConcurrency("critical-full", Tier.CRITICAL, 5),
                item("l1", Tier.LOW, 1),
                item("l2", Tier.LOW, 2),
                item("l3", Tier.LOW, 3),
                item("l4", Tier.LOW, 4));
        assertTrue(resourceManager.getTotalUsage().percent(ResourceType.CONCURRENCY)
                > DefaultTaskScheduler.ADAPTIVE_CONCURRENCY_THRESHOLD);

        scheduler.addTask(item("critical", Tier.CRITICAL, 10));
        scheduler.runOnce();

        assertEquals(1, scheduler.getStatus().stats().totalPreempted());
        assertTrue(scheduler.getExecution("l4").isEmpty());
        assertTrue(scheduler.getExecution("l3").isPresent());
    }

    // ---------------------------------------------------------------------
    // Removal and completion
    // ---------------------------------------------------------------------

    @Test
    @DisplayName("Should report false and change nothing when removing an unknown id")
    void shouldNotRemoveUnknownId() {
        admit(item("running", Tier.NORMAL, 0));
        scheduler.addTask(item("queued", Tier.NORMAL, 1));

        assertFalse(scheduler.removeTask("nonexistent"));

        SchedulerStatus status = scheduler.getStatus();
        assertEquals(1, status.queueStatus().totalTasks());
        assertEquals(1, status.runningCount());
        assertFalse(scheduler.removeTask(null));
    }

    @Test
    @DisplayName("Should remove a queued item")
    void shouldRemoveQueuedItem() {
        scheduler.addTask(item("queued", Tier.NORMAL, 0));

        assertTrue(scheduler.removeTask("queued"));

        assertFalse(queue.contains("queued"));
        scheduler.runOnce();
        assertTrue(started.isEmpty());
    }

    @Test
    @DisplayName("Should cancel a running item and release its resources")
    void shouldCancelRunningItem() {
        admit(item("running", Tier.HIGH, 0));
        WorkExecution execution = scheduler.getExecution("running").orElseThrow();

        assertTrue(scheduler.removeTask("running"));

        assertEquals(ExecutionStatus.CANCELLED, execution.getStatus());
        assertTrue(scheduler.getExecution("running").isEmpty());
        assertEquals(ResourceAllocation.ZERO, resourceManager.getCurrentUsage(Tier.HIGH));
        assertEquals(1, scheduler.getStatus().stats().totalCancelled());
        assertFalse(scheduler.removeTask("running"));
    }

    @Test
    @DisplayName("Should reclaim completed executions on the next tick")
    void shouldReclaimCompletedExecutions() {
        admit(item("transfer", Tier.NORMAL, 0));
        WorkExecution execution = scheduler.getExecution("transfer").orElseThrow();
        clock.advance(Duration.ofSeconds(1));
        assertTrue(execution.complete());

        assertTrue(scheduler.getExecution("transfer").isPresent());
        scheduler.runOnce();

        SchedulerStats stats = scheduler.getStatus().stats();
        assertTrue(scheduler.getExecution("transfer").isEmpty());
        assertEquals(ResourceAllocation.ZERO, resourceManager.getCurrentUsage(Tier.NORMAL));
        assertEquals(1, stats.totalCompleted());
        assertEquals(2000.0, stats.averageExecutionMs(), 0.001);
        assertEquals(clock.instant(), stats.lastScheduleTime());
    }

    @Test
    @DisplayName("Should mark the execution failed when the execution hook throws")
    void shouldFailExecutionWhenHookThrows() {
        scheduler = newScheduler(execution -> {
            throw new IllegalStateException("executor unavailable");
        });
        scheduler.addTask(item("transfer", Tier.NORMAL, 0));

        scheduler.runOnce();

        SchedulerStats stats = scheduler.getStatus().stats();
        assertEquals(1, stats.totalScheduled());
        assertEquals(1, stats.totalFailed());
        assertEquals(0, scheduler.getStatus().runningCount());
        assertEquals(ResourceAllocation.ZERO, resourceManager.getCurrentUsage(Tier.NORMAL));
    }

    @Test
    @DisplayName("Should list running executions oldest first")
    void shouldListRunningExecutionsOldestFirst() {
        admit(item("a", Tier.LOW, 0), item("b", Tier.CRITICAL, 1), item("c", Tier.NORMAL, 2));

        assertEquals(List.of("a", "b", "c"),
                scheduler.getRunningExecutions().stream().map(WorkExecution::getTaskId).toList());
    }

    // ---------------------------------------------------------------------
    // Submission checks and corrupt state
    // ---------------------------------------------------------------------

    @Test
    @DisplayName("Should reject items that can never fit when configured to")
    void shouldRejectUnsatisfiableItems() {
        scheduler.updateConfig(SchedulerConfig.defaults().withUnsatisfiableTasks(UnsatisfiableTaskPolicy.REJECT));

        scheduler.addTask(itemWithConcurrency("huge", Tier.NORMAL, 1000));
        scheduler.addTask(item("fine", Tier.NORMAL, 0));

        assertFalse(queue.contains("huge"));
        assertTrue(queue.contains("fine"));
        assertEquals(1, scheduler.getStatus().stats().totalRejected());
    }

    @Test
    @DisplayName("Should keep unsatisfiable items queued by default")
    void shouldRetryUnsatisfiableItemsByDefault() {
        scheduler.addTask(itemWithConcurrency("huge", Tier.NORMAL, 1000));
        scheduler.runOnce();

        assertTrue(queue.contains("huge"));
        assertEquals(0, scheduler.getStatus().stats().totalRejected());
        assertEquals(1, scheduler.getStatus().stats().totalDenied());
    }

    @Test
    @DisplayName("Should ignore resubmission of a running id")
    void shouldIgnoreResubmissionOfRunningId() {
        admit(item("transfer", Tier.NORMAL, 0));

        scheduler.addTask(item("transfer", Tier.NORMAL, 5));

        assertFalse(queue.contains("transfer"));
        assertEquals(1, scheduler.getStatus().stats().totalRejected());
    }

    @Test
    @DisplayName("Should drop a running id that comes out of the queue without faulting the tick")
    void shouldDropDequeuedDuplicateOfRunningItem() {
        admit(item("transfer", Tier.NORMAL, 0));
        queue.put(item("transfer", Tier.NORMAL, 5));
        scheduler.addTask(item("next", Tier.NORMAL, 6));

        assertDoesNotThrow(() -> scheduler.runOnce());
        assertFalse(queue.contains("transfer"));
        assertEquals(1, scheduler.getStatus().stats().totalRejected());
        assertEquals(ExecutionStatus.RUNNING, scheduler.getExecution("transfer").orElseThrow().getStatus());

        scheduler.runOnce();
        assertEquals(List.of("transfer", "next"), startedIds());
    }

    @Test
    @DisplayName("Should drop a duplicate urgent id before considering preemption")
    void shouldNotPreemptForDuplicateOfRunningItem() {
        admit(item("victim", Tier.LOW, 0), item("urgent", Tier.HIGH, 1));
        queue.put(WorkItem.builder("urgent", Tier.HIGH)
                .createdAt(T0)
                .require(ResourceType.CONCURRENCY, 1000)
                .build());

        scheduler.runOnce();

        assertEquals(ExecutionStatus.RUNNING, scheduler.getExecution("victim").orElseThrow().getStatus());
        assertEquals(0, scheduler.getStatus().stats().totalPreempted());
        assertEquals(1, scheduler.getStatus().stats().totalRejected());
    }

    @Test
    @DisplayName("Should deny and requeue an item whose requirement overflows the current usage")
    void shouldDenyHugeRequirementWithoutFault() {
        admit(item("n1", Tier.NORMAL, 0));
        WorkItem huge = WorkItem.builder("huge", Tier.NORMAL)
                .createdAt(T0.plusSeconds(1))
                .require(ResourceType.MEMORY, Integer.MAX_VALUE)
                .build();
        scheduler.addTask(huge);

        assertDoesNotThrow(() -> scheduler.runOnce());

        assertTrue(queue.contains("huge"));
        assertTrue(scheduler.getExecution("huge").isEmpty());
        assertEquals(1, scheduler.getStatus().stats().totalDenied());
        assertEquals(1, scheduler.getStatus().starvationCount());
    }

    @Test
    @DisplayName("Should expose policy, configuration and counters in the status")
    void shouldExposeStatus() {
        admit(item("a", Tier.NORMAL, 0));
        scheduler.addTask(item("b", Tier.LOW, 1));

        SchedulerStatus status = scheduler.getStatus();

        assertFalse(status.running());
        assertEquals(SchedulingPolicy.PRIORITY_PREEMPTIVE, status.policy());
        assertEquals(SchedulerConfig.defaults(), status.config());
        assertEquals(1, status.runningCount());
        assertEquals(1, status.queueStatus().totalTasks());
        assertEquals(1, status.stats().totalScheduled());
        assertNotNull(status.stats().lastScheduleTime());
    }
}
