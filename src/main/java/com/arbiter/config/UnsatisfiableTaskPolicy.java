package com.arbiter.config;

/**
 * What {@code addTask} does with an item whose requirement can never fit its tier's quota.
 */
public enum UnsatisfiableTaskPolicy {
    /**
     * Queue it anyway; it cycles between denial and starvation promotion.
     */
    RETRY,

    /**
     * Drop it at submission, log a warning and count it as rejected.
     */
    REJECT
}
