package io.tasker4j.spi;

import java.time.Duration;

/**
 * Registers periodic ticks on whatever drives time in the runtime (event loop or OS timers).
 */
public interface TickScheduler {

    /**
     * Runs {@code tick} every {@code period}, first after one period.
     *
     * @return handle that cancels the tick
     */
    Registration every(Duration period, Runnable tick);

    interface Registration {
        void cancel();
    }
}
