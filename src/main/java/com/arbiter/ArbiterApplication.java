package com.arbiter;

import com.arbiter.core.Tier;
import com.arbiter.core.WorkExecution;
import com.arbiter.core.WorkItem;
import com.arbiter.core.WorkItemFactory;
import com.arbiter.display.TierLabels;
import com.arbiter.scheduler.ExecutionHook;
import com.arbiter.scheduler.SchedulerStatus;
import com.arbiter.scheduler.TaskScheduler;
import com.arbiter.spring.EnableArbiter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Example Spring Boot application demonstrating the arbiter with a simulated executor.
 */
@SpringBootApplication
@EnableArbiter
public class ArbiterApplication {

    private static final Logger log = LoggerFactory.getLogger(ArbiterApplication.class);

    private final ScheduledExecutorService workers = Executors.newScheduledThreadPool(4);

    public static void main(String[] args) {
        SpringApplication.run(ArbiterApplication.class, args);
    }

    /**
     * Simulated transfer executor: finishes each admitted task after a short random delay,
     * unless the scheduler preempted or cancelled it in the meantime.
     */
    @Bean
    public ExecutionHook simulatedExecutor() {
        return execution -> {
            long delayMs = 500 + ThreadLocalRandom.current().nextLong(1500);
            workers.schedule(() -> finish(execution), delayMs, TimeUnit.MILLISECONDS);
        };
    }

    private void finish(WorkExecution execution) {
        if (execution.complete()) {
            log.info("Task {} [{}] completed", execution.getTaskId(), TierLabels.displayName(execution.getTier()));
        } else {
            log.info("Task {} [{}] ended as {}", execution.getTaskId(),
                    TierLabels.displayName(execution.getTier()), execution.getStatus());
        }
    }

    @Bean
    public CommandLineRunner demo(TaskScheduler scheduler) {
        return args -> {
            log.info("=== Arbiter Demo Started ===");

            WorkItemFactory factory = new WorkItemFactory();
            Tier[] tiers = Tier.values();
            for (int i = 0; i < 20; i++) {
                Tier tier = tiers[i % tiers.length];
                // LOW and BACKGROUND have no concurrency quota under the default caps
                int slots = tier.level() >= Tier.LOW.level() ? 0 : 1;
                String payload = """
                    {
                        "id": "transfer-%d",
                        "priority": "%s",
                        "estimated_duration_ms": 1000,
                        "resources": {"concurrency": %d}
                    }
                    """.formatted(i, tier.name().toLowerCase(), slots);
                WorkItem item = factory.fromJson(payload);
                scheduler.addTask(item);
            }

            for (int round = 0; round < 10; round++) {
                TimeUnit.SECONDS.sleep(1);
                SchedulerStatus status = scheduler.getStatus();
                log.info("Queued: {}, running: {}, starving: {}, stats: {}",
                        status.queueStatus().lengths(), status.runningCount(),
                        status.starvationCount(), status.stats());
            }

            log.info("=== Demo Finished ===");
            scheduler.stop();
            workers.shutdown();
            workers.awaitTermination(5, TimeUnit.SECONDS);
            System.exit(0);
        };
    }
}
