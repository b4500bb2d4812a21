package io.tasker4j.internal;

import io.tasker4j.OneShotJob;
import io.tasker4j.RecurringJob;
import io.tasker4j.core.ExecutionOutcome;
import io.tasker4j.core.JobCatalog;
import io.tasker4j.core.JobMessage;
import io.tasker4j.core.JobMessageCodec;
import io.tasker4j.core.JobPublisher;
import io.tasker4j.core.RetryPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Runs a single job invocation and turns one-shot failures into retry decisions.
 *
 * <p>Never throws: construction problems, job exceptions and a failed republish are all logged.
 */
public class JobExecutor {
    private static final Logger log = LoggerFactory.getLogger(JobExecutor.class);

    private final JobCatalog catalog;
    private final JobMessageCodec codec;
    private final JobPublisher publisher;

    public JobExecutor(JobCatalog catalog, JobMessageCodec codec, JobPublisher publisher) {
        this.catalog = Objects.requireNonNull(catalog, "catalog must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.publisher = Objects.requireNonNull(publisher, "publisher must not be null");
    }

    public ExecutionOutcome runRecurring(String jobClass) {
        RecurringJob job;
        try {
            job = catalog.newRecurring(jobClass);
        } catch (Exception e) {
            log.error("tasker recurring job not constructible jobClass={} msg={}", jobClass, e.getMessage());
            return ExecutionOutcome.REJECTED;
        }

        log.info("tasker run recurring job jobClass={}", jobClass);
        try {
            job.run();
            return ExecutionOutcome.SUCCEEDED;
        } catch (Exception e) {
            log.error("tasker recurring job failed jobClass={} msg={}", jobClass, e.getMessage(), e);
            return ExecutionOutcome.FAILED;
        }
    }

    public ExecutionOutcome runOneShot(String payload) {
        JobMessage message;
        try {
            message = codec.decode(payload);
        } catch (IllegalArgumentException e) {
            log.error("tasker dropped undecodable job payload msg={}", e.getMessage());
            return ExecutionOutcome.REJECTED;
        }
        return runOneShot(message);
    }

    public ExecutionOutcome runOneShot(JobMessage message) {
        Objects.requireNonNull(message, "message must not be null");
        String jobClass = message.jobClass();

        OneShotJob job;
        try {
            job = catalog.newOneShot(jobClass, message.params());
        } catch (Exception e) {
            log.error("tasker one-shot job not constructible jobClass={} msg={}", jobClass, e.getMessage());
            return ExecutionOutcome.REJECTED;
        }

        if (message.params().isEmpty()) {
            log.info("tasker run {} job jobClass={}", message.isDelayed() ? "delayed" : "immediate", jobClass);
        } else {
            log.info("tasker run {} job jobClass={} job={}", message.isDelayed() ? "delayed" : "immediate", jobClass, job.toJson());
        }

        boolean success;
        try {
            success = job.process();
        } catch (Exception e) {
            log.error("tasker job failed jobClass={} failTimes={} msg={}", jobClass, message.failTimes(), e.getMessage(), e);
            success = false;
        }

        if (success) {
            return ExecutionOutcome.SUCCEEDED;
        }
        return retryOrAbandon(message);
    }

    private ExecutionOutcome retryOrAbandon(JobMessage message) {
        Optional<RetryPolicy> next = RetryPolicy.afterFailure(message);
        if (next.isEmpty()) {
            log.warn("tasker job abandoned jobClass={} failTimes={} retryAttempts={}",
                    message.jobClass(), message.failTimes(), message.retryAttempts());
            return ExecutionOutcome.ABANDONED;
        }

        RetryPolicy policy = next.get();
        try {
            publisher.publishDelayed(message.jobClass(), message.params(), policy.retryIntervalSeconds(), policy);
        } catch (Exception e) {
            log.error("tasker retry publish failed jobClass={} failTimes={} msg={}",
                    message.jobClass(), policy.failTimes(), e.getMessage(), e);
            return ExecutionOutcome.ABANDONED;
        }

        log.info("tasker job retry scheduled jobClass={} failTimes={} retryAttempts={} inSeconds={}",
                message.jobClass(), policy.failTimes(), policy.retryAttempts(), policy.retryIntervalSeconds());
        return ExecutionOutcome.RETRY_SCHEDULED;
    }
}
