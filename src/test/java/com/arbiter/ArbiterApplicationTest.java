package com.arbiter;

import com.arbiter.config.ArbiterConfig;
import com.arbiter.config.ConfigLoader;
import com.arbiter.core.Tier;
import com.arbiter.core.WorkItem;
import com.arbiter.scheduler.DefaultTaskScheduler;
import com.arbiter.scheduler.SchedulerStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests running the bundled configuration with an asynchronous executor.
 */
class ArbiterApplicationTest {

    private ScheduledExecutorService workers;
    private DefaultTaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        workers = Executors.newScheduledThreadPool(4);
        ArbiterConfig config = ConfigLoader.load("classpath:arbiter.yaml");
        scheduler = DefaultTaskScheduler.fromConfig(config, execution ->
                workers.schedule(() -> execution.complete(), 20, TimeUnit.MILLISECONDS));
        scheduler.updateConfig(config.scheduler().withTiming(10, 10));
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        scheduler.stop();
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
    }

    private void awaitCompleted(long expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000;
        while (scheduler.getStatus().stats().totalCompleted() < expected) {
            if (System.currentTimeMillis() > deadline) {
                fail("Only " + scheduler.getStatus().stats().totalCompleted() + " of " + expected + " completed");
            }
            Thread.sleep(10);
        }
    }

    @Test
    @DisplayName("Should complete urgent and normal work within the default quotas")
    void shouldCompleteWorkWithinQuotas() throws InterruptedException {
        scheduler.start();
        for (int i = 0; i < 12; i++) {
            Tier tier = Tier.fromLevel(1 + i % 3);
            scheduler.addTask(WorkItem.of("transfer-" + i, tier, Instant.now()));
        }

        awaitCompleted(12);

        SchedulerStatus status = scheduler.getStatus();
        assertEquals(12, status.stats().totalScheduled());
        assertEquals(0, status.stats().totalFailed());
        assertEquals(0, status.queueStatus().totalTasks());
        assertTrue(status.running());
    }

    @Test
    @DisplayName("Should leave LOW and BACKGROUND work queued while their default concurrency quota is zero")
    void shouldStarveTiersWithZeroQuota() throws InterruptedException {
        scheduler.start();
        scheduler.addTask(WorkItem.of("low", Tier.LOW, Instant.now()));
        scheduler.addTask(WorkItem.of("background", Tier.BACKGROUND, Instant.now()));
        scheduler.addTask(WorkItem.of("normal", Tier.NORMAL, Instant.now()));

        awaitCompleted(1);
        Thread.sleep(100);

        SchedulerStatus status = scheduler.getStatus();
        assertEquals(1, status.stats().totalScheduled());
        assertEquals(Tier.LOW, status.queueStatus().tierOf("low"));
        assertEquals(Tier.BACKGROUND, status.queueStatus().tierOf("background"));
        assertTrue(status.stats().totalDenied() > 0);
    }
}
