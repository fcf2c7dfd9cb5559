package com.arbiter.adapter.spring;

import com.arbiter.config.ArbiterConfig;
import com.arbiter.config.ConfigLoader;
import com.arbiter.queue.PriorityTaskQueue;
import com.arbiter.resource.ResourceManager;
import com.arbiter.scheduler.DefaultTaskScheduler;
import com.arbiter.scheduler.ExecutionHook;
import com.arbiter.scheduler.LoggingFaultListener;
import com.arbiter.scheduler.SchedulerFaultListener;
import com.arbiter.scheduler.TaskScheduler;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring Boot auto-configuration for the arbiter.
 * Every component is a separate bean so applications can replace any of them.
 */
@Configuration
@ConditionalOnProperty(prefix = "arbiter", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(ArbiterProperties.class)
public class ArbiterAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ArbiterAutoConfiguration.class);

    private TaskScheduler taskScheduler;

    @Bean
    @ConditionalOnMissingBean
    public ArbiterConfig arbiterConfig(ArbiterProperties properties) {
        log.info("Loading arbiter configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock arbiterClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public PriorityTaskQueue priorityTaskQueue(Clock arbiterClock) {
        return new PriorityTaskQueue(arbiterClock);
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourceManager resourceManager(ArbiterConfig config) {
        return new ResourceManager(config.systemResources(), config.allocationStrategy());
    }

    @Bean
    @ConditionalOnMissingBean
    public ExecutionHook executionHook() {
        log.warn("No ExecutionHook bean defined; admitted tasks will not be executed");
        return ExecutionHook.NO_OP;
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulerFaultListener schedulerFaultListener() {
        return new LoggingFaultListener();
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskScheduler taskScheduler(ArbiterConfig config,
                                       ArbiterProperties properties,
                                       PriorityTaskQueue queue,
                                       ResourceManager resourceManager,
                                       ExecutionHook executionHook,
                                       SchedulerFaultListener faultListener,
                                       Clock arbiterClock) {
        log.info("Creating TaskScheduler: {}", config.name());
        this.taskScheduler = new DefaultTaskScheduler(config.name(), config.scheduler(), queue,
                resourceManager, executionHook, faultListener, arbiterClock);
        if (properties.isAutoStart()) {
            taskScheduler.start();
        }
        return this.taskScheduler;
    }

    @PreDestroy
    public void shutdown() {
        if (taskScheduler != null && taskScheduler.isRunning()) {
            log.info("Stopping TaskScheduler");
            taskScheduler.stop();
        }
    }
}
