package io.tasker4j.spi;

/**
 * Execution strategy for dispatched jobs.
 *
 * <p>Both methods hand the work off and return without waiting for the job to finish. Implementations
 * must not throw: a failed hand-off is logged and the item skipped.
 */
public interface JobRunner extends AutoCloseable {

    void runRecurring(String jobClass);

    /**
     * @param payload encoded one-shot job message
     */
    void runOneShot(String payload);

    @Override
    default void close() {
    }
}
