package io.tasker4j.internal;

import io.tasker4j.spi.JobRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs jobs inside the scheduler's own process.
 *
 * <p>With a task-worker pool configured every job is offloaded to it; otherwise the job is queued on the
 * event loop as a new task and runs between ticks.
 */
public class EventLoopJobRunner implements JobRunner {
    private static final Logger log = LoggerFactory.getLogger(EventLoopJobRunner.class);

    private final JobExecutor executor;
    private final Executor eventLoop;
    private final Executor taskWorkers;

    /**
     * @param taskWorkers dedicated pool, or null to run jobs on the event loop
     */
    public EventLoopJobRunner(JobExecutor executor, Executor eventLoop, Executor taskWorkers) {
        this.executor = Objects.requireNonNull(executor, "executor must not be null");
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop must not be null");
        this.taskWorkers = taskWorkers;
    }

    @Override
    public void runRecurring(String jobClass) {
        submit("recurring " + jobClass, () -> executor.runRecurring(jobClass));
    }

    @Override
    public void runOneShot(String payload) {
        submit("one-shot", () -> executor.runOneShot(payload));
    }

    public boolean usesTaskWorkers() {
        return taskWorkers != null;
    }

    private void submit(String what, Runnable work) {
        Executor target = taskWorkers != null ? taskWorkers : eventLoop;
        try {
            target.execute(work);
        } catch (RejectedExecutionException e) {
            log.error("tasker job hand-off rejected job={} msg={}", what, e.getMessage());
        }
    }
}
