package io.tasker4j.core;

public enum RuntimeMode {
    /**
     * Single-threaded event loop; jobs run as tasks on the loop or on a dedicated task-worker pool.
     */
    EVENT_LOOP,
    /**
     * One OS process per job invocation, spawned from a bootstrap command.
     */
    PROCESS
}
