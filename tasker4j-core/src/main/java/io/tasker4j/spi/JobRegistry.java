package io.tasker4j.spi;

import io.tasker4j.core.RecurringJobDescriptor;

import java.util.List;

/**
 * Holds the recurring job descriptors discovered at startup.
 *
 * <p>Only the dispatch loop writes through {@link #advance}; the whole set is replaced on restart.
 */
public interface JobRegistry {

    void replaceAll(List<RecurringJobDescriptor> descriptors);

    List<RecurringJobDescriptor> list();

    /**
     * Replaces the lookahead cache of the descriptor at {@code index}. Out-of-range indexes are ignored.
     */
    void advance(int index, List<Long> newUpcoming);
}
