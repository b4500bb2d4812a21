package io.tasker4j.core;

import java.util.Optional;

/**
 * Retry bookkeeping attached to a one-shot job message.
 *
 * @param failTimes            number of attempts that already failed
 * @param retryAttempts        maximum number of retries (0 = never retry)
 * @param retryIntervalSeconds fixed delay before each retry
 */
public record RetryPolicy(int failTimes, int retryAttempts, int retryIntervalSeconds) {

    private static final RetryPolicy NONE = new RetryPolicy(0, 0, 0);

    public RetryPolicy {
        if (failTimes < 0) {
            throw new IllegalArgumentException("failTimes must not be negative");
        }
        if (retryAttempts < 0) {
            throw new IllegalArgumentException("retryAttempts must not be negative");
        }
        if (retryIntervalSeconds < 0) {
            throw new IllegalArgumentException("retryIntervalSeconds must not be negative");
        }
    }

    public static RetryPolicy create(int failTimes, int retryAttempts, int retryIntervalSeconds) {
        return new RetryPolicy(failTimes, retryAttempts, retryIntervalSeconds);
    }

    /**
     * A fresh policy for publishers: no failures yet.
     */
    public static RetryPolicy of(int retryAttempts, int retryIntervalSeconds) {
        return new RetryPolicy(0, retryAttempts, retryIntervalSeconds);
    }

    public static RetryPolicy none() {
        return NONE;
    }

    public boolean allowsRetry() {
        return retryAttempts >= 1 && retryIntervalSeconds >= 1;
    }

    /**
     * Decides whether a failed attempt of {@code message} may be retried.
     *
     * @return the policy to attach to the republished message, or empty when the job is abandoned
     */
    public static Optional<RetryPolicy> afterFailure(JobMessage message) {
        RetryPolicy current = message.retryPolicy();
        if (!current.allowsRetry()) {
            return Optional.empty();
        }

        int failTimes = current.failTimes() < 1 ? 1 : current.failTimes() + 1;
        if (failTimes > current.retryAttempts()) {
            return Optional.empty();
        }
        return Optional.of(new RetryPolicy(failTimes, current.retryAttempts(), current.retryIntervalSeconds()));
    }
}
