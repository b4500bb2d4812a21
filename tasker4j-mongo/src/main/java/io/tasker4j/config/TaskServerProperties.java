package io.tasker4j.config;

import io.tasker4j.core.DispatchSettings;
import io.tasker4j.core.RuntimeMode;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Runtime configuration of the task server.
 */
@ConfigurationProperties(prefix = "tasker")
public class TaskServerProperties {

    public enum SharedTableBackend {
        MEMORY,
        MONGO
    }

    private boolean enabled = true;
    private RuntimeMode runtimeMode = RuntimeMode.EVENT_LOOP;
    private int taskWorkerNum = 0; // 0 = run jobs on the event loop
    private String keyPrefix = "";
    private String workerId;
    private String env = "";
    private String timezone; // null = system default
    private int immediateBatchCap = DispatchSettings.DEFAULT_IMMEDIATE_BATCH_CAP;
    private Duration cronTick = Duration.ofSeconds(1);
    private Duration queueTick = Duration.ofSeconds(2);
    private Duration delayedLookBack = Duration.ofSeconds(3600);
    private Duration delayedLookAhead = Duration.ofSeconds(30);
    private Duration staleThreshold = Duration.ofSeconds(5);
    private SharedTableBackend sharedTable = SharedTableBackend.MONGO;
    private boolean ensureIndexesOnStartup = false;
    private final Process process = new Process();

    /**
     * Settings of {@link RuntimeMode#PROCESS}.
     */
    public static class Process {
        private String recurringCommand; // null = built-in JobBootstrap command
        private String oneShotCommand;
        private Duration timeout = Duration.ofSeconds(600);
        private String workingDir; // null = current directory

        public String getRecurringCommand() {
            return recurringCommand;
        }

        public void setRecurringCommand(String recurringCommand) {
            this.recurringCommand = recurringCommand;
        }

        public String getOneShotCommand() {
            return oneShotCommand;
        }

        public void setOneShotCommand(String oneShotCommand) {
            this.oneShotCommand = oneShotCommand;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public String getWorkingDir() {
            return workingDir;
        }

        public void setWorkingDir(String workingDir) {
            this.workingDir = workingDir;
        }
    }

    public DispatchSettings toDispatchSettings() {
        return new DispatchSettings(immediateBatchCap, cronTick, queueTick, delayedLookBack, delayedLookAhead, staleThreshold);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public RuntimeMode getRuntimeMode() {
        return runtimeMode;
    }

    public void setRuntimeMode(RuntimeMode runtimeMode) {
        this.runtimeMode = runtimeMode;
    }

    public int getTaskWorkerNum() {
        return taskWorkerNum;
    }

    public void setTaskWorkerNum(int taskWorkerNum) {
        this.taskWorkerNum = taskWorkerNum;
    }

    public String getKeyPrefix() {
        return keyPrefix;
    }

    public void setKeyPrefix(String keyPrefix) {
        this.keyPrefix = keyPrefix;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public String getEnv() {
        return env;
    }

    public void setEnv(String env) {
        this.env = env;
    }

    public String getTimezone() {
        return timezone;
    }

    public void setTimezone(String timezone) {
        this.timezone = timezone;
    }

    public int getImmediateBatchCap() {
        return immediateBatchCap;
    }

    public void setImmediateBatchCap(int immediateBatchCap) {
        this.immediateBatchCap = immediateBatchCap;
    }

    public Duration getCronTick() {
        return cronTick;
    }

    public void setCronTick(Duration cronTick) {
        this.cronTick = cronTick;
    }

    public Duration getQueueTick() {
        return queueTick;
    }

    public void setQueueTick(Duration queueTick) {
        this.queueTick = queueTick;
    }

    public Duration getDelayedLookBack() {
        return delayedLookBack;
    }

    public void setDelayedLookBack(Duration delayedLookBack) {
        this.delayedLookBack = delayedLookBack;
    }

    public Duration getDelayedLookAhead() {
        return delayedLookAhead;
    }

    public void setDelayedLookAhead(Duration delayedLookAhead) {
        this.delayedLookAhead = delayedLookAhead;
    }

    public Duration getStaleThreshold() {
        return staleThreshold;
    }

    public void setStaleThreshold(Duration staleThreshold) {
        this.staleThreshold = staleThreshold;
    }

    public SharedTableBackend getSharedTable() {
        return sharedTable;
    }

    public void setSharedTable(SharedTableBackend sharedTable) {
        this.sharedTable = sharedTable;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public Process getProcess() {
        return process;
    }
}
