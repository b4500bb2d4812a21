package io.tasker4j.internal;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tasker4j.TaskServer;
import io.tasker4j.core.DispatchSettings;
import io.tasker4j.core.JobCatalog;
import io.tasker4j.core.JobMessageCodec;
import io.tasker4j.core.JobPublisher;
import io.tasker4j.core.JobSchedule;
import io.tasker4j.core.RecurringJobDescriptor;
import io.tasker4j.core.RuntimeMode;
import io.tasker4j.core.ScheduleCalculator;
import io.tasker4j.core.WorkerContext;
import io.tasker4j.spi.JobRegistry;
import io.tasker4j.spi.JobRunner;
import io.tasker4j.spi.QueueGateway;
import io.tasker4j.spi.SharedTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Task server wired from a queue store and a job catalog.
 *
 * <p>Typical usage:
 * <pre>{@code
 * TaskServer server = DefaultTaskServer.builder()
 *         .catalog(catalog)
 *         .schedule("report", "@every 1m")
 *         .queueGateway(gateway)
 *         .build();
 *
 * server.start();
 * server.publisher().publishNow("send-email", Map.of("to", "a@b.com"));
 * server.stop();
 * }</pre>
 *
 * <p>In {@link RuntimeMode#EVENT_LOOP} every tick runs on the single {@code tasker.event-loop} thread and
 * jobs run either there or on the {@code tasker.task-worker} pool. In {@link RuntimeMode#PROCESS} ticks run
 * on {@code tasker.scheduler} and each job is a child process.
 */
public class DefaultTaskServer implements TaskServer {
    private static final Logger log = LoggerFactory.getLogger(DefaultTaskServer.class);

    private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(30);

    private final JobCatalog catalog;
    private final List<JobSchedule> schedules;
    private final QueueGateway queueGateway;
    private final RuntimeMode runtimeMode;
    private final int taskWorkerNum;
    private final DispatchSettings settings;
    private final WorkerContext context;
    private final ScheduleCalculator calculator;
    private final BootstrapCommand recurringCommand;
    private final BootstrapCommand oneShotCommand;
    private final Duration processTimeout;
    private final File workingDir;
    private final Clock clock;

    private final JobMessageCodec codec;
    private final JobPublisher publisher;
    private final JobRegistry registry;

    private final AtomicBoolean started = new AtomicBoolean(false);

    private ScheduledExecutorService tickExecutor;
    private ExecutorService taskWorkers;
    private ScheduledExecutorService watchdog;
    private JobRunner runner;
    private DispatchLoop dispatchLoop;

    protected DefaultTaskServer(Builder b) {
        this.catalog = Objects.requireNonNull(b.catalog, "catalog must not be null");
        this.queueGateway = Objects.requireNonNull(b.queueGateway, "queueGateway must not be null");
        this.runtimeMode = Objects.requireNonNull(b.runtimeMode, "runtimeMode must not be null");
        this.settings = Objects.requireNonNull(b.settings, "settings must not be null");
        this.clock = Objects.requireNonNull(b.clock, "clock must not be null");
        this.processTimeout = Objects.requireNonNull(b.processTimeout, "processTimeout must not be null");
        if (b.taskWorkerNum < 0) {
            throw new IllegalArgumentException("taskWorkerNum must not be negative");
        }
        this.taskWorkerNum = b.taskWorkerNum;
        this.schedules = List.copyOf(b.schedules);
        this.context = b.context != null ? b.context : WorkerContext.of(WorkerContext.generateWorkerId());
        this.calculator = new ScheduleCalculator(b.zone != null ? b.zone : ZoneId.systemDefault());
        this.recurringCommand = b.recurringCommand != null ? b.recurringCommand : BootstrapCommand.defaultRecurring();
        this.oneShotCommand = b.oneShotCommand != null ? b.oneShotCommand : BootstrapCommand.defaultOneShot();
        this.workingDir = b.workingDir != null ? b.workingDir : new File(System.getProperty("user.dir"));

        ObjectMapper objectMapper = b.objectMapper != null ? b.objectMapper : new ObjectMapper();
        this.codec = new JobMessageCodec(objectMapper);
        this.publisher = new JobPublisher(queueGateway, codec, context, clock);

        if (runtimeMode == RuntimeMode.EVENT_LOOP) {
            SharedTable table = b.sharedTable != null ? b.sharedTable : new InMemorySharedTable();
            this.registry = new SharedTableJobRegistry(table, context.registryKey(), objectMapper);
        } else {
            this.registry = new InMemoryJobRegistry();
            recurringCommand.validate(BootstrapCommand.TASK_CLASS);
            oneShotCommand.validate(BootstrapCommand.PAYLOAD);
            if (!workingDir.isDirectory()) {
                throw new IllegalArgumentException("workingDir does not exist or is not a directory: " + workingDir);
            }
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Discover recurring jobs and start ticking. Idempotent.
     */
    @Override
    public void start() {
        if (!started.compareAndSet(false, true)) {
            return;
        }

        log.info("tasker starting runtimeMode={} workerId={} taskWorkerNum={} keyPrefix={} zone={}",
                runtimeMode, context.workerId(), taskWorkerNum, context.keyPrefix(), calculator.zone());

        List<RecurringJobDescriptor> descriptors = new RecurringJobDiscovery(calculator, clock).discover(schedules);
        registry.replaceAll(descriptors);

        if (runtimeMode == RuntimeMode.EVENT_LOOP) {
            tickExecutor = Executors.newSingleThreadScheduledExecutor(daemon("tasker.event-loop"));
            if (taskWorkerNum > 0) {
                taskWorkers = Executors.newFixedThreadPool(taskWorkerNum, daemon("tasker.task-worker"));
            }
            JobExecutor executor = new JobExecutor(catalog, codec, publisher);
            runner = new EventLoopJobRunner(executor, tickExecutor, taskWorkers);
        } else {
            tickExecutor = Executors.newSingleThreadScheduledExecutor(daemon("tasker.scheduler"));
            watchdog = Executors.newSingleThreadScheduledExecutor(daemon("tasker.watchdog"));
            runner = new ProcessJobRunner(recurringCommand, oneShotCommand, workingDir, processTimeout, watchdog, context);
        }

        dispatchLoop = new DispatchLoop(registry, queueGateway, codec, calculator, runner, context, clock, settings);
        dispatchLoop.start(new ExecutorTickScheduler(tickExecutor));

        log.info("tasker started recurringJobs={}", descriptors.size());
    }

    /**
     * Stop ticking and wait for running in-process jobs. Spawned job processes are left to their watchdog.
     * Idempotent.
     */
    @Override
    public void stop() {
        if (!started.compareAndSet(true, false)) {
            return;
        }

        log.info("tasker stopping...");

        if (dispatchLoop != null) {
            dispatchLoop.stop();
            dispatchLoop = null;
        }

        tickExecutor = shutdown(tickExecutor);
        taskWorkers = shutdown(taskWorkers);

        if (runner != null) {
            runner.close();
            runner = null;
        }

        if (watchdog != null) {
            // pending kills still fire after shutdown()
            watchdog.shutdown();
            watchdog = null;
        }
        log.info("tasker stopped successfully.");
    }

    @Override
    public boolean isRunning() {
        return started.get();
    }

    @Override
    public JobPublisher publisher() {
        return publisher;
    }

    @Override
    public List<RecurringJobDescriptor> recurringJobs() {
        return registry.list();
    }

    public WorkerContext workerContext() {
        return context;
    }

    public RuntimeMode runtimeMode() {
        return runtimeMode;
    }

    private static <E extends ExecutorService> E shutdown(E executor) {
        if (executor == null) {
            return null;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(SHUTDOWN_GRACE.toSeconds(), TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        return null;
    }

    private static ThreadFactory daemon(String name) {
        return r -> {
            Thread t = new Thread(r);
            t.setName(name);
            t.setDaemon(true);
            return t;
        };
    }

    public static class Builder {
        private JobCatalog catalog;
        private final List<JobSchedule> schedules = new ArrayList<>();
        private QueueGateway queueGateway;
        private SharedTable sharedTable;
        private RuntimeMode runtimeMode = RuntimeMode.EVENT_LOOP;
        private int taskWorkerNum;
        private DispatchSettings settings = DispatchSettings.defaults();
        private WorkerContext context;
        private ZoneId zone;
        private BootstrapCommand recurringCommand;
        private BootstrapCommand oneShotCommand;
        private Duration processTimeout = ProcessJobRunner.DEFAULT_TIMEOUT;
        private File workingDir;
        private Clock clock = Clock.systemUTC();
        private ObjectMapper objectMapper;

        protected Builder() {
        }

        public Builder catalog(JobCatalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder schedule(String jobClass, String expression) {
            this.schedules.add(new JobSchedule(jobClass, expression));
            return this;
        }

        public Builder schedules(List<JobSchedule> schedules) {
            this.schedules.addAll(Objects.requireNonNull(schedules, "schedules must not be null"));
            return this;
        }

        public Builder queueGateway(QueueGateway queueGateway) {
            this.queueGateway = queueGateway;
            return this;
        }

        /**
         * Table holding the recurring registry in event-loop mode. Defaults to an in-memory table.
         */
        public Builder sharedTable(SharedTable sharedTable) {
            this.sharedTable = sharedTable;
            return this;
        }

        public Builder runtimeMode(RuntimeMode runtimeMode) {
            this.runtimeMode = runtimeMode;
            return this;
        }

        /**
         * Size of the dedicated task-worker pool in event-loop mode; 0 runs jobs on the loop itself.
         */
        public Builder taskWorkerNum(int taskWorkerNum) {
            this.taskWorkerNum = taskWorkerNum;
            return this;
        }

        public Builder settings(DispatchSettings settings) {
            this.settings = settings;
            return this;
        }

        public Builder workerContext(WorkerContext context) {
            this.context = context;
            return this;
        }

        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        public Builder recurringCommand(String template) {
            this.recurringCommand = template == null ? null : BootstrapCommand.parse(template);
            return this;
        }

        public Builder oneShotCommand(String template) {
            this.oneShotCommand = template == null ? null : BootstrapCommand.parse(template);
            return this;
        }

        public Builder processTimeout(Duration processTimeout) {
            this.processTimeout = processTimeout;
            return this;
        }

        public Builder workingDir(File workingDir) {
            this.workingDir = workingDir;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder objectMapper(ObjectMapper objectMapper) {
            this.objectMapper = objectMapper;
            return this;
        }

        public DefaultTaskServer build() {
            return new DefaultTaskServer(this);
        }
    }
}
