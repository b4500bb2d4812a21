package io.tasker4j;

import io.tasker4j.core.JobPublisher;
import io.tasker4j.core.RecurringJobDescriptor;

import java.util.List;

/**
 * Main entry point of the background task server.
 *
 * <p>A started server drives:
 * <ul>
 *   <li>recurring jobs (fixed interval or cron expression)</li>
 *   <li>the immediate queue, drained in bounded batches</li>
 *   <li>the delayed queue, swept for due entries</li>
 * </ul>
 * Application code enqueues one-shot jobs through {@link #publisher()}.
 */
public interface TaskServer {
    void start();

    void stop();

    boolean isRunning();

    JobPublisher publisher();

    /**
     * Snapshot of the recurring job descriptors currently scheduled.
     */
    List<RecurringJobDescriptor> recurringJobs();
}
