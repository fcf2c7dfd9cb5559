package com.arbiter.scheduler;

import com.arbiter.core.WorkExecution;

/**
 * Called once for every admitted execution. Fire-and-forget: the scheduler does
 * not wait for the work. The implementation must eventually call
 * {@link WorkExecution#complete()} or {@link WorkExecution#fail(String)}, and should
 * watch for PREEMPTED or CANCELLED to abort real work.
 */
@FunctionalInterface
public interface ExecutionHook {

    /**
     * Hook that does nothing; admitted executions stay RUNNING until someone completes them.
     */
    ExecutionHook NO_OP = execution -> { };

    void onStart(WorkExecution execution);
}
