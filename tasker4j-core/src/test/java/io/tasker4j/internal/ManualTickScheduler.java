package io.tasker4j.internal;

import io.tasker4j.spi.TickScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Ticks fire only when the test says so.
 */
class ManualTickScheduler implements TickScheduler {

    static final class Tick {
        final Duration period;
        final Runnable body;
        boolean cancelled;

        Tick(Duration period, Runnable body) {
            this.period = period;
            this.body = body;
        }
    }

    final List<Tick> ticks = new ArrayList<>();

    @Override
    public Registration every(Duration period, Runnable tick) {
        Tick t = new Tick(period, tick);
        ticks.add(t);
        return () -> t.cancelled = true;
    }

    List<Tick> withPeriod(Duration period) {
        List<Tick> out = new ArrayList<>();
        for (Tick t : ticks) {
            if (t.period.equals(period)) {
                out.add(t);
            }
        }
        return out;
    }

    /**
     * Simulates {@code elapsed} of wall time: each live tick fires once per full period.
     */
    void elapse(Duration elapsed) {
        for (Tick t : ticks) {
            if (t.cancelled) {
                continue;
            }
            long times = elapsed.toMillis() / t.period.toMillis();
            for (long i = 0; i < times; i++) {
                t.body.run();
            }
        }
    }
}
