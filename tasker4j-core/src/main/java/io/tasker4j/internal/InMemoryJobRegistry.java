package io.tasker4j.internal;

import io.tasker4j.core.RecurringJobDescriptor;
import io.tasker4j.spi.JobRegistry;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Plain in-process registry, owned by the single scheduling thread.
 */
public class InMemoryJobRegistry implements JobRegistry {

    private volatile List<RecurringJobDescriptor> descriptors = List.of();

    @Override
    public void replaceAll(List<RecurringJobDescriptor> descriptors) {
        Objects.requireNonNull(descriptors, "descriptors must not be null");
        this.descriptors = List.copyOf(descriptors);
    }

    @Override
    public List<RecurringJobDescriptor> list() {
        return descriptors;
    }

    @Override
    public synchronized void advance(int index, List<Long> newUpcoming) {
        List<RecurringJobDescriptor> current = descriptors;
        if (index < 0 || index >= current.size()) {
            return;
        }
        List<RecurringJobDescriptor> next = new ArrayList<>(current);
        next.set(index, current.get(index).withUpcoming(newUpcoming));
        descriptors = List.copyOf(next);
    }
}
