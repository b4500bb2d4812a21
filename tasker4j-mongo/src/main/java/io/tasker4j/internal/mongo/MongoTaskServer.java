package io.tasker4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tasker4j.config.TaskServerProperties;
import io.tasker4j.core.JobCatalog;
import io.tasker4j.core.JobSchedule;
import io.tasker4j.core.WorkerContext;
import io.tasker4j.internal.DefaultTaskServer;
import io.tasker4j.internal.InMemorySharedTable;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.io.File;
import java.time.ZoneId;
import java.util.List;
import java.util.Objects;

/**
 * Task server whose queues, and in event-loop mode the recurring registry, live in MongoDB.
 *
 * <p>Typical usage:
 * <pre>{@code
 * TaskServer server = new MongoTaskServer(props, mongoTemplate, catalog, schedules, objectMapper);
 * server.start();
 *
 * server.publisher().publishDelayed("send-email", Map.of("to", "a@b.com"), 60, RetryPolicy.of(2, 5));
 * server.stop();
 * }</pre>
 */
public class MongoTaskServer extends DefaultTaskServer {

    public MongoTaskServer(TaskServerProperties props,
                           MongoTemplate mongoTemplate,
                           JobCatalog catalog,
                           List<JobSchedule> schedules,
                           ObjectMapper objectMapper) {
        super(configure(props, mongoTemplate, catalog, schedules, objectMapper));
    }

    private static Builder configure(TaskServerProperties props,
                                     MongoTemplate mongoTemplate,
                                     JobCatalog catalog,
                                     List<JobSchedule> schedules,
                                     ObjectMapper objectMapper) {
        Objects.requireNonNull(props, "props must not be null");
        Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");

        String workerId = props.getWorkerId();
        if (workerId == null || workerId.isBlank()) {
            workerId = WorkerContext.generateWorkerId();
        }

        TaskServerProperties.Process process = props.getProcess();
        Builder b = DefaultTaskServer.builder()
                .catalog(catalog)
                .schedules(schedules == null ? List.of() : schedules)
                .queueGateway(new MongoQueueGateway(mongoTemplate))
                .sharedTable(props.getSharedTable() == TaskServerProperties.SharedTableBackend.MONGO
                        ? new MongoSharedTable(mongoTemplate)
                        : new InMemorySharedTable())
                .runtimeMode(props.getRuntimeMode())
                .taskWorkerNum(props.getTaskWorkerNum())
                .settings(props.toDispatchSettings())
                .workerContext(new WorkerContext(props.getKeyPrefix(), workerId, props.getEnv()))
                .recurringCommand(process.getRecurringCommand())
                .oneShotCommand(process.getOneShotCommand())
                .processTimeout(process.getTimeout());

        if (props.getTimezone() != null && !props.getTimezone().isBlank()) {
            b.zone(ZoneId.of(props.getTimezone()));
        }
        if (process.getWorkingDir() != null && !process.getWorkingDir().isBlank()) {
            b.workingDir(new File(process.getWorkingDir()));
        }
        if (objectMapper != null) {
            b.objectMapper(objectMapper);
        }
        return b;
    }
}
