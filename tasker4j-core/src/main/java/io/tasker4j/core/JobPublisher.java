package io.tasker4j.core;

import io.tasker4j.spi.QueueGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;

/**
 * Enqueues one-shot jobs.
 *
 * <p>Every call writes straight through to the queue store and returns once the store has accepted the
 * write. Store failures propagate to the caller.
 *
 * <p>Typical usage:
 * <pre>{@code
 * publisher.publishNow("send-email", Map.of("to", "a@b.com"));
 * publisher.publishDelayed("send-email", Map.of("to", "a@b.com"), 60, RetryPolicy.of(2, 5));
 * }</pre>
 */
public class JobPublisher {
    private static final Logger log = LoggerFactory.getLogger(JobPublisher.class);

    private final QueueGateway queueGateway;
    private final JobMessageCodec codec;
    private final WorkerContext context;
    private final Clock clock;

    public JobPublisher(QueueGateway queueGateway, JobMessageCodec codec, WorkerContext context, Clock clock) {
        this.queueGateway = Objects.requireNonNull(queueGateway, "queueGateway must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Enqueue for execution on the next immediate-queue drain. Never retried.
     */
    public void publishNow(String jobClass, Map<String, Object> params) {
        publishNow(jobClass, params, null);
    }

    /**
     * Enqueue for execution on the next immediate-queue drain; failures are retried through the delayed queue.
     */
    public void publishNow(String jobClass, Map<String, Object> params, RetryPolicy retryPolicy) {
        JobMessage message = JobMessage.immediate(requireJobClass(jobClass), params, retryPolicy);
        queueGateway.push(context.immediateQueueKey(), codec.encode(message));
        log.debug("tasker published immediate job jobClass={}", jobClass);
    }

    public void publishDelayed(String jobClass, Map<String, Object> params, long delaySeconds) {
        publishDelayed(jobClass, params, delaySeconds, null);
    }

    /**
     * Enqueue for execution {@code delaySeconds} from now.
     *
     * @param retryPolicy copied onto the message as-is; null means no retry
     */
    public void publishDelayed(String jobClass, Map<String, Object> params, long delaySeconds, RetryPolicy retryPolicy) {
        if (delaySeconds < 0) {
            throw new IllegalArgumentException("delaySeconds must not be negative");
        }
        long runAt = clock.instant().getEpochSecond() + delaySeconds;
        pushDelayed(requireJobClass(jobClass), params, runAt, retryPolicy);
    }

    public void publishDelayed(String jobClass, Map<String, Object> params, Duration delay, RetryPolicy retryPolicy) {
        Objects.requireNonNull(delay, "delay must not be null");
        publishDelayed(jobClass, params, delay.toSeconds(), retryPolicy);
    }

    /**
     * Enqueue for execution at an absolute time.
     */
    public void publishAt(String jobClass, Map<String, Object> params, Instant runAt, RetryPolicy retryPolicy) {
        Objects.requireNonNull(runAt, "runAt must not be null");
        pushDelayed(requireJobClass(jobClass), params, runAt.getEpochSecond(), retryPolicy);
    }

    private void pushDelayed(String jobClass, Map<String, Object> params, long runAt, RetryPolicy retryPolicy) {
        JobMessage message = JobMessage.delayed(jobClass, params, runAt, retryPolicy);
        queueGateway.pushDelayed(context.delayedQueueKey(), codec.encode(message), runAt);
        log.debug("tasker published delayed job jobClass={} runAt={} failTimes={}", jobClass, runAt, message.failTimes());
    }

    private static String requireJobClass(String jobClass) {
        Objects.requireNonNull(jobClass, "jobClass must not be null");
        if (jobClass.isBlank()) {
            throw new IllegalArgumentException("jobClass must not be blank");
        }
        return jobClass;
    }
}
