package io.tasker4j.config;

import io.tasker4j.internal.mongo.DelayedTaskDocument;
import io.tasker4j.internal.mongo.QueuedTaskDocument;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

import java.util.Objects;

/**
 * MongoDB index definitions for the task queues.
 *
 * <p>Indexes are <b>not</b> created automatically unless {@code tasker.ensure-indexes-on-startup=true}.
 * In production they are usually managed by migrations or ops scripts.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_queue_fifo</b> on {@code task_queue}: { queue: 1, enqueuedAt: 1, _id: 1 }
 *       <br/>Used by the FIFO pop.</li>
 *   <li><b>ux_queue_payload</b> (unique) on {@code task_delayed_queue}: { queue: 1, payload: 1 }
 *       <br/>Gives the delayed queue its set semantics.</li>
 *   <li><b>idx_queue_score</b> on {@code task_delayed_queue}: { queue: 1, score: 1 }
 *       <br/>Used by the delayed sweep range query.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.task_queue.createIndex({ queue: 1, enqueuedAt: 1, _id: 1 }, { name: "idx_queue_fifo" });
 * db.task_delayed_queue.createIndex({ queue: 1, payload: 1 }, { name: "ux_queue_payload", unique: true });
 * db.task_delayed_queue.createIndex({ queue: 1, score: 1 }, { name: "idx_queue_score" });
 * </pre>
 */
public class TaskServerMongoIndexConfig {

    public static final String IDX_QUEUE_FIFO = "idx_queue_fifo";
    public static final String UX_QUEUE_PAYLOAD = "ux_queue_payload";
    public static final String IDX_QUEUE_SCORE = "idx_queue_score";

    private final MongoTemplate mongoTemplate;

    public TaskServerMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    public void ensureIndexes() {
        mongoTemplate.indexOps(QueuedTaskDocument.class).ensureIndex(queueFifoIndex());
        mongoTemplate.indexOps(DelayedTaskDocument.class).ensureIndex(queuePayloadUniqueIndex());
        mongoTemplate.indexOps(DelayedTaskDocument.class).ensureIndex(queueScoreIndex());
    }

    public static Index queueFifoIndex() {
        return new Index()
                .on("queue", Sort.Direction.ASC)
                .on("enqueuedAt", Sort.Direction.ASC)
                .on("_id", Sort.Direction.ASC)
                .named(IDX_QUEUE_FIFO);
    }

    public static Index queuePayloadUniqueIndex() {
        return new Index()
                .on("queue", Sort.Direction.ASC)
                .on("payload", Sort.Direction.ASC)
                .unique()
                .named(UX_QUEUE_PAYLOAD);
    }

    public static Index queueScoreIndex() {
        return new Index()
                .on("queue", Sort.Direction.ASC)
                .on("score", Sort.Direction.ASC)
                .named(IDX_QUEUE_SCORE);
    }
}
