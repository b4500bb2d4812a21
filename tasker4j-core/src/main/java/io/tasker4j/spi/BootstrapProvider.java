package io.tasker4j.spi;

import io.tasker4j.core.JobCatalog;
import io.tasker4j.core.WorkerContext;

/**
 * Supplies the collaborators a freshly spawned job process needs.
 *
 * <p>Looked up with {@link java.util.ServiceLoader} by the process bootstrap; register implementations in
 * {@code META-INF/services/io.tasker4j.spi.BootstrapProvider}.
 */
public interface BootstrapProvider {

    JobCatalog jobCatalog(String env);

    /**
     * Queue access used to republish retries from inside the job process.
     */
    QueueGateway queueGateway(String env);

    WorkerContext workerContext(String env);
}
