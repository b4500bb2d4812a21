package io.tasker4j.config;

import io.tasker4j.TaskServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;

import java.util.Objects;

/**
 * Starts the task server once every other bean is up and stops it first on shutdown.
 * Running state is read from the server itself, so a server stopped directly is reported as stopped.
 */
public class TaskServerLifecycle implements SmartLifecycle {
    private static final Logger log = LoggerFactory.getLogger(TaskServerLifecycle.class);

    private final TaskServer taskServer;

    public TaskServerLifecycle(TaskServer taskServer) {
        this.taskServer = Objects.requireNonNull(taskServer, "taskServer must not be null");
    }

    @Override
    public void start() {
        taskServer.start();
    }

    @Override
    public void stop() {
        taskServer.stop();
    }

    /**
     * Blocks while in-process jobs drain, then releases the container's shutdown latch even if stopping failed.
     */
    @Override
    public void stop(Runnable callback) {
        try {
            stop();
        } catch (RuntimeException e) {
            log.error("tasker shutdown failed msg={}", e.getMessage(), e);
        } finally {
            callback.run();
        }
    }

    @Override
    public boolean isRunning() {
        return taskServer.isRunning();
    }

    @Override
    public int getPhase() {
        return Integer.MAX_VALUE;
    }
}
