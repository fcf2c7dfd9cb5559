package com.arbiter.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default fault listener: writes faults to the log.
 */
public class LoggingFaultListener implements SchedulerFaultListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingFaultListener.class);

    @Override
    public void onTickFault(Throwable cause, int consecutiveFailures) {
        log.warn("Scheduler tick failed ({} in a row): {}", consecutiveFailures, cause.getMessage(), cause);
    }

    @Override
    public void onSchedulerHalted(Throwable cause) {
        log.error("Scheduler halted: {}", cause.getMessage(), cause);
    }
}
