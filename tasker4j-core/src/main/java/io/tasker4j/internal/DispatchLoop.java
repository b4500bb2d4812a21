package io.tasker4j.internal;

import io.tasker4j.core.DispatchSettings;
import io.tasker4j.core.JobMessage;
import io.tasker4j.core.JobMessageCodec;
import io.tasker4j.core.RecurringJobDescriptor;
import io.tasker4j.core.ScheduleCalculator;
import io.tasker4j.core.WorkerContext;
import io.tasker4j.spi.JobRegistry;
import io.tasker4j.spi.JobRunner;
import io.tasker4j.spi.QueueGateway;
import io.tasker4j.spi.TickScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Periodic driver of the task server.
 *
 * <p>Ticks registered by {@link #start(TickScheduler)}:
 * <ul>
 *   <li>one timer per interval job, firing every {@code intervalSeconds}</li>
 *   <li>cron tick: consumes at most one due entry per cron job and advances its lookahead cache</li>
 *   <li>immediate drain: pops a bounded batch from the immediate queue</li>
 *   <li>delayed sweep: removes due entries from the delayed queue, executing only the fresh ones</li>
 * </ul>
 *
 * <p>No tick method throws. A store failure reads as "nothing to do this tick".
 */
public class DispatchLoop {
    private static final Logger log = LoggerFactory.getLogger(DispatchLoop.class);

    private final JobRegistry registry;
    private final QueueGateway queueGateway;
    private final JobMessageCodec codec;
    private final ScheduleCalculator calculator;
    private final JobRunner runner;
    private final WorkerContext context;
    private final Clock clock;
    private final DispatchSettings settings;

    private final List<TickScheduler.Registration> registrations = new ArrayList<>();

    public DispatchLoop(JobRegistry registry,
                        QueueGateway queueGateway,
                        JobMessageCodec codec,
                        ScheduleCalculator calculator,
                        JobRunner runner,
                        WorkerContext context,
                        Clock clock,
                        DispatchSettings settings) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.queueGateway = Objects.requireNonNull(queueGateway, "queueGateway must not be null");
        this.codec = Objects.requireNonNull(codec, "codec must not be null");
        this.calculator = Objects.requireNonNull(calculator, "calculator must not be null");
        this.runner = Objects.requireNonNull(runner, "runner must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
    }

    public synchronized void start(TickScheduler ticks) {
        Objects.requireNonNull(ticks, "ticks must not be null");
        if (!registrations.isEmpty()) {
            return;
        }

        int intervalJobs = 0;
        for (RecurringJobDescriptor d : safeList()) {
            if (!d.usesInterval()) {
                continue;
            }
            String jobClass = d.jobClass();
            registrations.add(ticks.every(Duration.ofSeconds(d.intervalSeconds()), () -> dispatchRecurring(jobClass)));
            intervalJobs++;
        }

        registrations.add(ticks.every(settings.cronTick(), this::tickCron));
        registrations.add(ticks.every(settings.queueTick(), this::drainImmediate));
        registrations.add(ticks.every(settings.queueTick(), this::sweepDelayed));

        log.info("tasker dispatch loop started workerId={} intervalJobs={} cronTick={} queueTick={} batchCap={}",
                context.workerId(), intervalJobs, settings.cronTick(), settings.queueTick(), settings.immediateBatchCap());
    }

    public synchronized void stop() {
        for (TickScheduler.Registration r : registrations) {
            try {
                r.cancel();
            } catch (RuntimeException e) {
                log.warn("tasker tick cancel failed msg={}", e.getMessage());
            }
        }
        registrations.clear();
    }

    /**
     * Cron tick. For each cron job: refill an exhausted cache from now, then, if the earliest entry is due,
     * consume it, persist the rest and fire once. Further overdue entries are left for later ticks.
     */
    public void tickCron() {
        long now = clock.instant().getEpochSecond();
        List<RecurringJobDescriptor> descriptors = safeList();

        for (int i = 0; i < descriptors.size(); i++) {
            RecurringJobDescriptor d = descriptors.get(i);
            if (!d.usesCron()) {
                continue;
            }
            try {
                fireIfDue(i, d, now);
            } catch (RuntimeException e) {
                log.error("tasker cron tick failed jobClass={} msg={}", d.jobClass(), e.getMessage(), e);
            }
        }
    }

    private void fireIfDue(int index, RecurringJobDescriptor d, long now) {
        List<Long> upcoming = d.upcoming();
        if (d.needsRefill()) {
            upcoming = calculator.nextWindow(d.cronExpression(), now);
            registry.advance(index, upcoming);
            log.debug("tasker cron window refilled jobClass={} size={}", d.jobClass(), upcoming.size());
        }

        if (upcoming.isEmpty() || now < upcoming.get(0)) {
            return;
        }

        registry.advance(index, new ArrayList<>(upcoming.subList(1, upcoming.size())));
        dispatchRecurring(d.jobClass());
    }

    /**
     * Immediate drain. Pops at most {@code immediateBatchCap} payloads, then hands each to the runner.
     *
     * @return number of payloads handed off
     */
    public int drainImmediate() {
        String key = context.immediateQueueKey();
        int cap = settings.immediateBatchCap();
        List<String> payloads = new ArrayList<>(cap);

        while (payloads.size() < cap) {
            Optional<String> payload;
            try {
                payload = queueGateway.popOrEmpty(key);
            } catch (RuntimeException e) {
                log.warn("tasker immediate queue pop failed key={} msg={}", key, e.getMessage());
                break;
            }
            if (payload.isEmpty() || payload.get().isEmpty()) {
                break;
            }
            payloads.add(payload.get());
        }

        for (String payload : payloads) {
            handOffOneShot(payload);
        }
        return payloads.size();
    }

    /**
     * Delayed sweep over {@code [now - lookBack, now + lookAhead]}.
     * Undecodable entries are removed; entries not yet due are left alone; due entries are removed and
     * executed only when at most {@code staleThreshold} late. Removal happens in one call before any hand-off;
     * if it fails nothing is executed this tick.
     *
     * @return number of payloads handed off
     */
    public int sweepDelayed() {
        String key = context.delayedQueueKey();
        long now = clock.instant().getEpochSecond();

        List<String> entries;
        try {
            entries = queueGateway.rangeByScore(
                    key,
                    now - settings.delayedLookBack().toSeconds(),
                    now + settings.delayedLookAhead().toSeconds()
            );
        } catch (RuntimeException e) {
            log.warn("tasker delayed queue range failed key={} msg={}", key, e.getMessage());
            return 0;
        }
        if (entries == null || entries.isEmpty()) {
            return 0;
        }

        long staleAfter = settings.staleThreshold().toSeconds();
        List<String> toRemove = new ArrayList<>();
        List<String> toRun = new ArrayList<>();

        for (String payload : entries) {
            JobMessage message;
            try {
                message = codec.decode(payload);
            } catch (IllegalArgumentException e) {
                log.warn("tasker delayed entry undecodable, removing msg={}", e.getMessage());
                toRemove.add(payload);
                continue;
            }

            long runAt = message.runAt() == null ? 0L : message.runAt();
            if (runAt > now) {
                continue;
            }

            toRemove.add(payload);
            if (now - runAt <= staleAfter) {
                toRun.add(payload);
            } else {
                log.warn("tasker delayed job stale, dropped jobClass={} runAt={} now={}", message.jobClass(), runAt, now);
            }
        }

        if (toRemove.isEmpty()) {
            return 0;
        }

        try {
            queueGateway.remove(key, toRemove);
        } catch (RuntimeException e) {
            log.warn("tasker delayed queue remove failed key={} count={} msg={}", key, toRemove.size(), e.getMessage());
            return 0;
        }

        for (String payload : toRun) {
            handOffOneShot(payload);
        }
        return toRun.size();
    }

    public void dispatchRecurring(String jobClass) {
        try {
            runner.runRecurring(jobClass);
        } catch (RuntimeException e) {
            log.error("tasker recurring hand-off failed jobClass={} msg={}", jobClass, e.getMessage(), e);
        }
    }

    private void handOffOneShot(String payload) {
        try {
            runner.runOneShot(payload);
        } catch (RuntimeException e) {
            log.error("tasker one-shot hand-off failed msg={}", e.getMessage(), e);
        }
    }

    private List<RecurringJobDescriptor> safeList() {
        try {
            return registry.list();
        } catch (RuntimeException e) {
            log.warn("tasker recurring registry unreadable msg={}", e.getMessage());
            return List.of();
        }
    }
}
