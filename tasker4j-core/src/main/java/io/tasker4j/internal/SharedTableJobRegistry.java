package io.tasker4j.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tasker4j.core.RecurringJobDescriptor;
import io.tasker4j.spi.JobRegistry;
import io.tasker4j.spi.SharedTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Registry stored as one JSON blob in a {@link SharedTable}, so that every worker of the group sees the
 * same lookahead caches.
 *
 * <p>{@link #advance} is read-modify-write without a lock. Two workers advancing concurrently may lose an
 * update, which at worst causes one missed or duplicate firing.
 */
public class SharedTableJobRegistry implements JobRegistry {
    private static final Logger log = LoggerFactory.getLogger(SharedTableJobRegistry.class);

    private static final TypeReference<List<RecurringJobDescriptor>> LIST_TYPE = new TypeReference<>() {
    };

    private final SharedTable table;
    private final String key;
    private final ObjectMapper objectMapper;

    public SharedTableJobRegistry(SharedTable table, String key, ObjectMapper objectMapper) {
        this.table = Objects.requireNonNull(table, "table must not be null");
        this.key = Objects.requireNonNull(key, "key must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public void replaceAll(List<RecurringJobDescriptor> descriptors) {
        Objects.requireNonNull(descriptors, "descriptors must not be null");
        write(descriptors);
    }

    @Override
    public List<RecurringJobDescriptor> list() {
        Optional<String> blob = table.get(key);
        if (blob.isEmpty() || blob.get().isBlank()) {
            return List.of();
        }
        try {
            List<RecurringJobDescriptor> items = objectMapper.readValue(blob.get(), LIST_TYPE);
            return items == null ? List.of() : List.copyOf(items);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            log.warn("tasker recurring registry blob unreadable key={} msg={}", key, e.getMessage());
            return List.of();
        }
    }

    @Override
    public void advance(int index, List<Long> newUpcoming) {
        List<RecurringJobDescriptor> items = list();
        if (index < 0 || index >= items.size()) {
            return;
        }
        List<RecurringJobDescriptor> next = new ArrayList<>(items);
        next.set(index, items.get(index).withUpcoming(newUpcoming));
        write(next);
    }

    private void write(List<RecurringJobDescriptor> descriptors) {
        try {
            table.put(key, objectMapper.writeValueAsString(descriptors));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot encode recurring job registry", e);
        }
    }
}
