package com.arbiter.scheduler;

/**
 * Receives faults raised inside the scheduling loop.
 */
public interface SchedulerFaultListener {

    /**
     * A tick failed; the loop backs off and continues.
     *
     * @param cause               the failure
     * @param consecutiveFailures failed ticks in a row, including this one
     */
    void onTickFault(Throwable cause, int consecutiveFailures);

    /**
     * The loop stopped because its state is corrupt or too many ticks failed in a row.
     * The scheduler will not restart on its own.
     */
    void onSchedulerHalted(Throwable cause);
}
