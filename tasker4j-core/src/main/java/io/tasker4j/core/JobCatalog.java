package io.tasker4j.core;

import io.tasker4j.OneShotJob;
import io.tasker4j.OneShotJobFactory;
import io.tasker4j.RecurringJob;

import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Maps job class identifiers to the factories that construct them.
 *
 * <p>Populated at startup. Lookups of unknown identifiers fail with {@link IllegalStateException}.
 */
public class JobCatalog {

    private final Map<String, Supplier<? extends RecurringJob>> recurring = new ConcurrentHashMap<>();
    private final Map<String, Function<Map<String, Object>, ? extends OneShotJob>> oneShot = new ConcurrentHashMap<>();

    public JobCatalog registerRecurring(String jobClass, Supplier<? extends RecurringJob> factory) {
        requireId(jobClass);
        Objects.requireNonNull(factory, "factory must not be null");
        if (recurring.putIfAbsent(jobClass, factory) != null) {
            throw new IllegalStateException("Duplicate recurring job class: " + jobClass);
        }
        return this;
    }

    public JobCatalog registerOneShot(String jobClass, Function<Map<String, Object>, ? extends OneShotJob> factory) {
        requireId(jobClass);
        Objects.requireNonNull(factory, "factory must not be null");
        if (oneShot.putIfAbsent(jobClass, factory) != null) {
            throw new IllegalStateException("Duplicate one-shot job class: " + jobClass);
        }
        return this;
    }

    public JobCatalog registerOneShot(OneShotJobFactory factory) {
        Objects.requireNonNull(factory, "factory must not be null");
        return registerOneShot(factory.jobClass(), factory::create);
    }

    public RecurringJob newRecurring(String jobClass) {
        Supplier<? extends RecurringJob> factory = recurring.get(jobClass);
        if (factory == null) {
            throw new IllegalStateException("No recurring job registered for jobClass: " + jobClass);
        }
        RecurringJob job = factory.get();
        if (job == null) {
            throw new IllegalStateException("Recurring job factory returned null for jobClass: " + jobClass);
        }
        return job;
    }

    public OneShotJob newOneShot(String jobClass, Map<String, Object> params) {
        Function<Map<String, Object>, ? extends OneShotJob> factory = oneShot.get(jobClass);
        if (factory == null) {
            throw new IllegalStateException("No one-shot job registered for jobClass: " + jobClass);
        }
        OneShotJob job = factory.apply(params == null ? Map.of() : params);
        if (job == null) {
            throw new IllegalStateException("One-shot job factory returned null for jobClass: " + jobClass);
        }
        return job;
    }

    public Set<String> recurringJobClasses() {
        return Set.copyOf(recurring.keySet());
    }

    public Set<String> oneShotJobClasses() {
        return Set.copyOf(oneShot.keySet());
    }

    private static void requireId(String jobClass) {
        Objects.requireNonNull(jobClass, "jobClass must not be null");
        if (jobClass.isBlank()) {
            throw new IllegalArgumentException("jobClass must not be blank");
        }
    }
}
