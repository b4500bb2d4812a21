package io.tasker4j.core;

import org.slf4j.LoggerFactory;

import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.Objects;
import java.util.UUID;

/**
 * Identity of the worker process and the store key namespace it uses.
 *
 * @param keyPrefix prefix of every store key (may be empty)
 * @param workerId  identifier of this scheduler instance, used in logs
 * @param env       deployment environment, passed to bootstrap commands
 */
public record WorkerContext(String keyPrefix, String workerId, String env) {

    public WorkerContext {
        keyPrefix = keyPrefix == null ? "" : keyPrefix.trim();
        Objects.requireNonNull(workerId, "workerId must not be null");
        if (workerId.isBlank()) {
            throw new IllegalArgumentException("workerId must not be blank");
        }
        env = env == null ? "" : env.trim();
    }

    public static WorkerContext of(String workerId) {
        return new WorkerContext("", workerId, "");
    }

    /**
     * Host, pid and a random suffix, truncated to 128 characters.
     */
    public static String generateWorkerId() {
        String host = "tasker4j";
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            LoggerFactory.getLogger(WorkerContext.class).debug("tasker host name unavailable msg={}", e.getMessage());
        }

        String pid = String.valueOf(ManagementFactory.getRuntimeMXBean().getPid());
        String generated = host + "-" + pid + "-" + UUID.randomUUID();
        if (generated.length() > 128) {
            return generated.substring(0, 128);
        }
        return generated;
    }

    public String immediateQueueKey() {
        return keyPrefix + "tasks:immediate";
    }

    public String delayedQueueKey() {
        return keyPrefix + "tasks:delayed";
    }

    public String registryKey() {
        return keyPrefix + "tasks:recurring";
    }
}
