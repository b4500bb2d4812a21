package io.tasker4j.internal;

import io.tasker4j.AbstractOneShotJob;
import io.tasker4j.core.JobCatalog;
import io.tasker4j.core.WorkerContext;
import io.tasker4j.spi.BootstrapProvider;
import io.tasker4j.spi.QueueGateway;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Registered through META-INF/services for {@link JobBootstrapTest}.
 */
public class TestBootstrapProvider implements BootstrapProvider {

    static final AtomicInteger PINGS = new AtomicInteger();
    static final InMemoryQueueGateway QUEUES = new InMemoryQueueGateway();
    static final WorkerContext CONTEXT = new WorkerContext("boot:", "bootstrap-worker", "test");

    @Override
    public JobCatalog jobCatalog(String env) {
        return new JobCatalog()
                .registerRecurring("Ping", () -> PINGS::incrementAndGet)
                .registerOneShot("AlwaysFails", params -> new AbstractOneShotJob(params) {
                    @Override
                    public boolean process() {
                        return false;
                    }
                });
    }

    @Override
    public QueueGateway queueGateway(String env) {
        return QUEUES;
    }

    @Override
    public WorkerContext workerContext(String env) {
        if ("broken".equals(env)) {
            throw new IllegalStateException("no config for env " + env);
        }
        return CONTEXT;
    }
}
