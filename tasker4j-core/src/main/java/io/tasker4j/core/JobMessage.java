package io.tasker4j.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A one-shot job invocation as it travels through the queues.
 *
 * @param runAt epoch seconds; {@code null} for immediate messages
 */
public record JobMessage(
        String jobClass,
        Map<String, Object> params,
        Long runAt,
        int retryAttempts,
        int retryIntervalSeconds,
        int failTimes
) {

    public JobMessage {
        Objects.requireNonNull(jobClass, "jobClass must not be null");
        if (jobClass.isBlank()) {
            throw new IllegalArgumentException("jobClass must not be blank");
        }
        params = params == null || params.isEmpty()
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public static JobMessage immediate(String jobClass, Map<String, Object> params) {
        return immediate(jobClass, params, RetryPolicy.none());
    }

    public static JobMessage immediate(String jobClass, Map<String, Object> params, RetryPolicy retryPolicy) {
        RetryPolicy p = retryPolicy == null ? RetryPolicy.none() : retryPolicy;
        return new JobMessage(jobClass, params, null, p.retryAttempts(), p.retryIntervalSeconds(), p.failTimes());
    }

    public static JobMessage delayed(String jobClass, Map<String, Object> params, long runAt, RetryPolicy retryPolicy) {
        RetryPolicy p = retryPolicy == null ? RetryPolicy.none() : retryPolicy;
        return new JobMessage(jobClass, params, runAt, p.retryAttempts(), p.retryIntervalSeconds(), p.failTimes());
    }

    public boolean isDelayed() {
        return runAt != null;
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(
                Math.max(0, failTimes),
                Math.max(0, retryAttempts),
                Math.max(0, retryIntervalSeconds)
        );
    }
}
