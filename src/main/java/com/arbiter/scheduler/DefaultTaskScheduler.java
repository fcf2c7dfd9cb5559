package com.arbiter.scheduler;

import com.arbiter.config.AllocationStrategy;
import com.arbiter.config.ArbiterConfig;
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
import com.arbiter.exception.SchedulerStateException;
import com.arbiter.queue.PriorityTaskQueue;
import com.arbiter.resource.ResourceManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Single-loop scheduler tying the priority queue to the resource manager.
 * <p>
 * Each tick: promote starved items, try to admit one candidate according to the
 * active policy (possibly evicting one less urgent execution), reclaim finished
 * executions and prune the preemption log.
 * <p>
 * The queue and the resource manager guard themselves; the scheduler keeps the
 * cross-component invariants by always touching them in the same order within a
 * tick. Ticks never overlap: the loop and {@link #runOnce()} share one monitor.
 */
public class DefaultTaskScheduler implements TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(DefaultTaskScheduler.class);

    static final double ADAPTIVE_CONCURRENCY_THRESHOLD = 80.0;
    private static final long STOP_TIMEOUT_MS = 5000;

    private final String name;
    private final PriorityTaskQueue queue;
    private final ResourceManager resourceManager;
    private final ExecutionHook executionHook;
    private final SchedulerFaultListener faultListener;
    private final Clock clock;
    private final RequirementCalculator requirementCalculator = new RequirementCalculator();

    private final Map<String, WorkExecution> runningTasks = new ConcurrentHashMap<>();
    private final StarvationTracker starvationTracker = new StarvationTracker();
    private final PreemptionHistory preemptionHistory;
    private final SchedulerCounters counters = new SchedulerCounters();

    private final Object tickMonitor = new Object();
    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile SchedulerConfig config;
    private volatile Thread loopThread;
    private volatile Throwable haltCause;

    public DefaultTaskScheduler(SchedulerConfig config, PriorityTaskQueue queue, ResourceManager resourceManager) {
        this("arbiter", config, queue, resourceManager, ExecutionHook.NO_OP,
                new LoggingFaultListener(), Clock.systemUTC());
    }

    public DefaultTaskScheduler(String name,
                                SchedulerConfig config,
                                PriorityTaskQueue queue,
                                ResourceManager resourceManager,
                                ExecutionHook executionHook,
                                SchedulerFaultListener faultListener,
                                Clock clock) {
        this.name = name;
        this.config = Objects.requireNonNull(config, "Scheduler config cannot be null");
        this.queue = Objects.requireNonNull(queue, "Queue cannot be null");
        this.resourceManager = Objects.requireNonNull(resourceManager, "Resource manager cannot be null");
        this.executionHook = Objects.requireNonNull(executionHook, "Execution hook cannot be null");
        this.faultListener = Objects.requireNonNull(faultListener, "Fault listener cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        this.preemptionHistory = new PreemptionHistory(clock);

        log.info("DefaultTaskScheduler '{}' initialized (policy={}, tick={}ms, preemption={})",
                name, config.policy(), config.tickIntervalMs(), config.preemptionEnabled());
    }

    /**
     * Build a scheduler with its own queue and resource manager from a root configuration.
     */
    public static DefaultTaskScheduler fromConfig(ArbiterConfig config, ExecutionHook hook) {
        Clock clock = Clock.systemUTC();
        return new DefaultTaskScheduler(
                config.name(),
                config.scheduler(),
                new PriorityTaskQueue(clock),
                new ResourceManager(config.systemResources(), config.allocationStrategy()),
                hook,
                new LoggingFaultListener(),
                clock);
    }

    // ---------------------------------------------------------------------
    // Producer / observer API
    // ---------------------------------------------------------------------

    @Override
    public void addTask(WorkItem item) {
        if (item == null) {
            throw new NullPointerException("Work item cannot be null");
        }
        if (runningTasks.containsKey(item.id())) {
            counters.rejected.incrementAndGet();
            log.warn("Task {} is already running, ignoring resubmission", item.id());
            return;
        }
        if (config.unsatisfiableTasks() == UnsatisfiableTaskPolicy.REJECT) {
            ResourceAllocation required = requirementCalculator.calculate(item);
            if (!resourceManager.canEverFit(item.priority(), required)) {
                counters.rejected.incrementAndGet();
                log.warn("Task {} rejected: requirement {} exceeds the {} quota {}",
                        item.id(), required, item.priority(), resourceManager.maxAllocation(item.priority()));
                return;
            }
        }
        queue.put(item);
        log.debug("Task {} submitted with priority {} (queue size: {})",
                item.id(), item.priority(), queue.size());
    }

    @Override
    public boolean removeTask(String taskId) {
        if (taskId == null) {
            return false;
        }
        if (queue.remove(taskId)) {
            starvationTracker.forget(taskId);
            log.info("Task {} removed from queue", taskId);
            return true;
        }

        WorkExecution execution = runningTasks.get(taskId);
        if (execution != null && runningTasks.remove(taskId, execution)) {
            boolean cancelled = execution.cancel();
            resourceManager.release(taskId, execution.getTier(), execution.getAllocated());
            starvationTracker.forget(taskId);
            if (cancelled) {
                counters.cancelled.incrementAndGet();
                log.info("Running task {} cancelled, resources released", taskId);
            } else {
                // Finished before we got to it; account for it as the sweep would
                recordFinished(execution);
            }
            return true;
        }

        log.debug("Task {} is unknown, nothing to remove", taskId);
        return false;
    }

    @Override
    public SchedulerStatus getStatus() {
        SchedulerConfig current = config;
        return new SchedulerStatus(
                isRunning(),
                current.policy(),
                current,
                counters.snapshot(),
                queue.getQueueStatus(),
                runningTasks.size(),
                starvationTracker.size(),
                preemptionHistory.count());
    }

    @Override
    public void updateAllocationStrategy(Map<Tier, TierQuota> updates) {
        resourceManager.updateAllocationStrategy(updates);
    }

    @Override
    public void updateAllocationStrategy(AllocationStrategy strategy) {
        resourceManager.updateAllocationStrategy(strategy);
    }

    @Override
    public void updateSystemResources(SystemResources resources) {
        resourceManager.updateSystemResources(resources);
    }

    @Override
    public SchedulingPolicy getPolicy() {
        return config.policy();
    }

    @Override
    public void setPolicy(SchedulingPolicy policy) {
        Objects.requireNonNull(policy, "Scheduling policy cannot be null");
        this.config = config.withPolicy(policy);
        log.info("Scheduler '{}' policy set to {}", name, policy);
    }

    @Override
    public SchedulerConfig getConfig() {
        return config;
    }

    @Override
    public void updateConfig(SchedulerConfig newConfig) {
        this.config = Objects.requireNonNull(newConfig, "Scheduler config cannot be null");
        log.info("Scheduler '{}' configuration updated: {}", name, newConfig);
    }

    @Override
    public List<WorkExecution> getRunningExecutions() {
        return runningTasks.values().stream()
                .sorted(Comparator.comparing(WorkExecution::getStartedAt))
                .toList();
    }

    @Override
    public Optional<WorkExecution> getExecution(String taskId) {
        return Optional.ofNullable(runningTasks.get(taskId));
    }

    /**
     * Cause of the last halt, if the loop stopped on its own.
     */
    public Optional<Throwable> getHaltCause() {
        return Optional.ofNullable(haltCause);
    }

    // ---------------------------------------------------------------------
    // Loop lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void start() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        haltCause = null;
        Thread thread = new Thread(this::loop, "arbiter-scheduler-" + name);
        thread.setDaemon(true);
        loopThread = thread;
        thread.start();
        log.info("Scheduler '{}' started", name);
    }

    @Override
    public void stop() {
        if (!running.getAndSet(false)) {
            return;
        }
        Thread thread = loopThread;
        if (thread != null && thread != Thread.currentThread()) {
            thread.interrupt();
            try {
                thread.join(STOP_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        log.info("Scheduler '{}' stopped, {} tasks queued, {} running", name, queue.size(), runningTasks.size());
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    private void loop() {
        int consecutiveFailures = 0;
        while (running.get()) {
            long pauseMs;
            try {
                runOnce();
                consecutiveFailures = 0;
                pauseMs = config.tickIntervalMs();
            } catch (SchedulerStateException e) {
                halt(e);
                return;
            } catch (RuntimeException e) {
                consecutiveFailures++;
                faultListener.onTickFault(e, consecutiveFailures);
                if (consecutiveFailures >= config.maxConsecutiveFailures()) {
                    halt(new SchedulerStateException(
                            "Scheduler tick failed " + consecutiveFailures + " times in a row", e));
                    return;
                }
                pauseMs = config.failureBackoffMs();
            }

            try {
                TimeUnit.MILLISECONDS.sleep(pauseMs);
            } catch (InterruptedException e) {
                if (running.get()) {
                    Thread.currentThread().interrupt();
                    log.warn("Scheduler '{}' interrupted, stopping loop", name);
                    running.set(false);
                }
                return;
            }
        }
    }

    private void halt(Throwable cause) {
        haltCause = cause;
        running.set(false);
        log.error("Scheduler '{}' halting: {}", name, cause.getMessage());
        faultListener.onSchedulerHalted(cause);
    }

    // ---------------------------------------------------------------------
    // Tick
    // ---------------------------------------------------------------------

    @Override
    public void runOnce() {
        synchronized (tickMonitor) {
            SchedulerConfig current = config;

            handleStarvation(current);

            switch (current.policy()) {
                case PRIORITY_PREEMPTIVE -> priorityPreemptiveSchedule(current);
                case ROUND_ROBIN, FAIR_SHARE -> fairShareSchedule();
                case ADAPTIVE -> adaptiveSchedule(current);
            }

            sweepFinished();
            preemptionHistory.prune();
            counters.markTick(clock.instant());
        }
    }

    private void handleStarvation(SchedulerConfig current) {
        Duration threshold = Duration.ofMillis(current.starvationThresholdMs());
        for (String taskId : starvationTracker.drainStarved(clock.instant(), threshold)) {
            if (queue.updatePriority(taskId, Tier.HIGH)) {
                counters.promoted.incrementAndGet();
                log.warn("Task {} starved for over {}ms, promoted to {}", taskId, threshold.toMillis(), Tier.HIGH);
            } else {
                starvationTracker.forget(taskId);
            }
        }
    }

    private void priorityPreemptiveSchedule(SchedulerConfig current) {
        Optional<WorkItem> next = queue.get(Tier.CRITICAL, Tier.HIGH)
                .or(() -> queue.get(Tier.NORMAL))
                .or(() -> queue.get(Tier.LOW, Tier.BACKGROUND));
        if (next.isEmpty()) {
            return;
        }

        WorkItem item = next.get();
        if (isDuplicateOfRunning(item)) {
            return;
        }
        ResourceAllocation required = requirementCalculator.calculate(item);
        boolean urgent = item.priority().level() <= Tier.HIGH.level();

        if (urgent && current.preemptionEnabled() && !resourceManager.canAllocate(item.priority(), required)) {
            if (preemptionHistory.canPreempt(current.maxPreemptionsPerMinute())) {
                tryPreemption(item, required);
                return;
            }
            log.debug("Preemption limit of {}/min reached, task {} waits for its own quota",
                    current.maxPreemptionsPerMinute(), item.id());
        }
        tryStart(item, required);
    }

    private void fairShareSchedule() {
        queue.get()
                .filter(item -> !isDuplicateOfRunning(item))
                .ifPresent(item -> tryStart(item, requirementCalculator.calculate(item)));
    }

    /**
     * An id resubmitted while the loop was admitting it can come out of the queue
     * while already running. The duplicate is dropped and counted as rejected.
     */
    private boolean isDuplicateOfRunning(WorkItem item) {
        if (!runningTasks.containsKey(item.id())) {
            return false;
        }
        counters.rejected.incrementAndGet();
        starvationTracker.forget(item.id());
        log.warn("Task {} was dequeued while already running, dropping the duplicate", item.id());
        return true;
    }

    private void adaptiveSchedule(SchedulerConfig current) {
        double concurrencyUsage = resourceManager.getTotalUsage().percent(ResourceType.CONCURRENCY);
        if (concurrencyUsage > ADAPTIVE_CONCURRENCY_THRESHOLD) {
            priorityPreemptiveSchedule(current);
        } else {
            fairShareSchedule();
        }
    }

    /**
     * Evict the least urgent running execution below the incoming tier, then try the
     * incoming item. One victim per event, even if the freed resources do not suffice.
     */
    private void tryPreemption(WorkItem incoming, ResourceAllocation required) {
        Optional<WorkExecution> victim = selectVictim(incoming.priority());
        if (victim.isEmpty()) {
            log.debug("No running task below {} to preempt for task {}", incoming.priority(), incoming.id());
            tryStart(incoming, required);
            return;
        }

        if (preempt(victim.get())) {
            counters.preempted.incrementAndGet();
            preemptionHistory.record();
            log.warn("Task {} ({}) preempted for task {} ({})", victim.get().getTaskId(),
                    victim.get().getTier(), incoming.id(), incoming.priority());
        }
        tryStart(incoming, required);
    }

    /**
     * Lowest tier strictly below {@code incoming}; among equals, the most recently started.
     */
    Optional<WorkExecution> selectVictim(Tier incoming) {
        return runningTasks.values().stream()
                .filter(e -> e.getStatus() == ExecutionStatus.RUNNING)
                .filter(e -> incoming.isHigherThan(e.getTier()))
                .max(Comparator.comparingInt((WorkExecution e) -> e.getTier().level())
                        .thenComparing(WorkExecution::getStartedAt));
    }

    private boolean preempt(WorkExecution execution) {
        String taskId = execution.getTaskId();
        if (!runningTasks.remove(taskId, execution)) {
            return false;
        }
        resourceManager.release(taskId, execution.getTier(), execution.getAllocated());
        if (!execution.markPreempted()) {
            // Finished between selection and eviction
            recordFinished(execution);
            return false;
        }
        queue.requeue(execution.getItem());
        return true;
    }

    private void tryStart(WorkItem item, ResourceAllocation required) {
        if (!resourceManager.allocate(item.id(), item.priority(), required)) {
            queue.put(item);
            counters.denied.incrementAndGet();
            if (starvationTracker.recordDenial(item.id(), clock.instant())) {
                log.debug("Task {} denied resources in {}, starvation tracking started", item.id(), item.priority());
            }
            return;
        }

        WorkExecution execution = new WorkExecution(item, required, clock);
        runningTasks.put(item.id(), execution);
        starvationTracker.forget(item.id());
        counters.recordAdmission(Duration.between(item.createdAt(), execution.getStartedAt()));
        log.debug("Task {} admitted in {} with {}", item.id(), item.priority(), required);

        try {
            executionHook.onStart(execution);
        } catch (RuntimeException e) {
            log.warn("Execution hook failed for task {}: {}", item.id(), e.getMessage(), e);
            execution.fail("Execution hook failed: " + e.getMessage());
        }
    }

    private void sweepFinished() {
        for (WorkExecution execution : runningTasks.values()) {
            if (!execution.getStatus().isTerminal()) {
                continue;
            }
            if (runningTasks.remove(execution.getTaskId(), execution)) {
                resourceManager.release(execution.getTaskId(), execution.getTier(), execution.getAllocated());
                recordFinished(execution);
                log.debug("Task {} finished with status {}", execution.getTaskId(), execution.getStatus());
            }
        }
    }

    private void recordFinished(WorkExecution execution) {
        switch (execution.getStatus()) {
            case COMPLETED -> counters.recordFinished(true, execution.getElapsed(clock.instant()));
            case FAILED -> counters.recordFinished(false, execution.getElapsed(clock.instant()));
            case CANCELLED -> counters.cancelled.incrementAndGet();
            default -> log.warn("Task {} left the running set in status {}",
                    execution.getTaskId(), execution.getStatus());
        }
    }

    @Override
    public String toString() {
        return "DefaultTaskScheduler{" +
                "name='" + name + '\'' +
                ", policy=" + config.policy() +
                ", queued=" + queue.size() +
                ", running=" + runningTasks.size() +
                '}';
    }
}
