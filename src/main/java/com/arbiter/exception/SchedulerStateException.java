package com.arbiter.exception;

/**
 * Signals that the scheduler's bookkeeping is inconsistent (for example an item
 * about to be admitted is already running). Unlike an ordinary tick fault this
 * stops the scheduling loop and is escalated to the embedding application.
 */
public class SchedulerStateException extends ArbiterException {

    public SchedulerStateException(String message) {
        super(message);
    }

    public SchedulerStateException(String message, Throwable cause) {
        super(message, cause);
    }
}
