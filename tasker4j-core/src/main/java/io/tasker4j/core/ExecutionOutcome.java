package io.tasker4j.core;

/**
 * Result of one execution attempt, as seen by the executor.
 */
public enum ExecutionOutcome {
    SUCCEEDED,
    /**
     * Recurring job threw; recurring jobs are never retried.
     */
    FAILED,
    RETRY_SCHEDULED,
    ABANDONED,
    /**
     * The job could not be constructed or the payload could not be decoded.
     */
    REJECTED
}
