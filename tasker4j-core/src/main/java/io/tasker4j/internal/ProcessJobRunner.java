package io.tasker4j.internal;

import io.tasker4j.core.WorkerContext;
import io.tasker4j.spi.JobRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Spawns one OS process per job invocation and does not wait for it.
 *
 * <p>Each child gets a watchdog that force-kills it once {@code timeout} elapses. Child stdout/stderr are
 * inherited so job logs land in the scheduler's output.
 */
public class ProcessJobRunner implements JobRunner {
    private static final Logger log = LoggerFactory.getLogger(ProcessJobRunner.class);

    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(600);

    private final BootstrapCommand recurringCommand;
    private final BootstrapCommand oneShotCommand;
    private final File workingDir;
    private final Duration timeout;
    private final ScheduledExecutorService watchdog;
    private final WorkerContext context;

    public ProcessJobRunner(BootstrapCommand recurringCommand,
                            BootstrapCommand oneShotCommand,
                            File workingDir,
                            Duration timeout,
                            ScheduledExecutorService watchdog,
                            WorkerContext context) {
        this.recurringCommand = Objects.requireNonNull(recurringCommand, "recurringCommand must not be null")
                .validate(BootstrapCommand.TASK_CLASS);
        this.oneShotCommand = Objects.requireNonNull(oneShotCommand, "oneShotCommand must not be null")
                .validate(BootstrapCommand.PAYLOAD);
        this.workingDir = Objects.requireNonNull(workingDir, "workingDir must not be null");
        if (!workingDir.isDirectory()) {
            throw new IllegalArgumentException("workingDir does not exist or is not a directory: " + workingDir);
        }
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        if (timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be a positive duration");
        }
        this.watchdog = Objects.requireNonNull(watchdog, "watchdog must not be null");
        this.context = Objects.requireNonNull(context, "context must not be null");
    }

    @Override
    public void runRecurring(String jobClass) {
        try {
            spawnRecurring(jobClass);
        } catch (IOException | RuntimeException e) {
            log.error("tasker job process spawn failed jobClass={} msg={}", jobClass, e.getMessage(), e);
        }
    }

    @Override
    public void runOneShot(String payload) {
        try {
            spawnOneShot(payload);
        } catch (IOException | RuntimeException e) {
            log.error("tasker job process spawn failed payload={} msg={}", payload, e.getMessage(), e);
        }
    }

    Process spawnRecurring(String jobClass) throws IOException {
        Map<String, String> values = baseValues();
        values.put(BootstrapCommand.TASK_CLASS, jobClass);
        return spawn(recurringCommand.render(values), jobClass);
    }

    Process spawnOneShot(String payload) throws IOException {
        Map<String, String> values = baseValues();
        values.put(BootstrapCommand.PAYLOAD, payload);
        return spawn(oneShotCommand.render(values), "one-shot");
    }

    private Process spawn(List<String> command, String label) throws IOException {
        Process process = new ProcessBuilder(command)
                .directory(workingDir)
                .inheritIO()
                .start();
        log.debug("tasker job process started job={} pid={}", label, process.pid());

        ScheduledFuture<?> kill = watchdog.schedule(() -> {
            if (process.isAlive()) {
                log.warn("tasker job process timed out, killing job={} pid={} timeout={}", label, process.pid(), timeout);
                process.destroyForcibly();
            }
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);

        process.onExit().thenAccept(p -> {
            kill.cancel(false);
            if (p.exitValue() != 0) {
                log.warn("tasker job process exited job={} pid={} exitCode={}", label, p.pid(), p.exitValue());
            }
        });
        return process;
    }

    private Map<String, String> baseValues() {
        Map<String, String> values = new HashMap<>();
        values.put(BootstrapCommand.JAVA_BIN, Paths.get(System.getProperty("java.home"), "bin", "java").toString());
        values.put(BootstrapCommand.CLASSPATH, System.getProperty("java.class.path", ""));
        values.put(BootstrapCommand.ROOT_PATH, workingDir.getAbsolutePath());
        values.put(BootstrapCommand.ENV, context.env());
        return values;
    }

    public Duration timeout() {
        return timeout;
    }
}
