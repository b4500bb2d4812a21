package io.tasker4j;

/**
 * A job fired repeatedly on a schedule. Recurring jobs take no parameters and are never retried.
 */
public interface RecurringJob {

    void run() throws Exception;
}
