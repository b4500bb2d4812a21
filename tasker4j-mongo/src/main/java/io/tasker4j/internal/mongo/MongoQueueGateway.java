package io.tasker4j.internal.mongo;

import io.tasker4j.spi.QueueGateway;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * MongoDB-backed queues.
 *
 * <ul>
 *   <li>Immediate queue: one document per entry in {@code task_queue}; pop is a single {@code findAndRemove},
 *       so each entry is handed to exactly one worker.</li>
 *   <li>Delayed queue: sorted-set semantics in {@code task_delayed_queue}; pushing an existing payload only
 *       moves its score.</li>
 * </ul>
 */
public class MongoQueueGateway implements QueueGateway {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    public MongoQueueGateway(MongoTemplate mongoTemplate) {
        this(mongoTemplate, Clock.systemUTC());
    }

    public MongoQueueGateway(MongoTemplate mongoTemplate, Clock clock) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public void push(String key, String payload) {
        requireKey(key);
        Objects.requireNonNull(payload, "payload must not be null");
        mongoTemplate.insert(new QueuedTaskDocument(key, payload, clock.instant()));
    }

    @Override
    public Optional<String> popOrEmpty(String key) {
        requireKey(key);
        Query q = new Query(Criteria.where("queue").is(key))
                .with(Sort.by(Sort.Order.asc("enqueuedAt"), Sort.Order.asc("_id")));
        QueuedTaskDocument doc = mongoTemplate.findAndRemove(q, QueuedTaskDocument.class);
        return doc == null ? Optional.empty() : Optional.ofNullable(doc.getPayload());
    }

    @Override
    public void pushDelayed(String key, String payload, long score) {
        requireKey(key);
        Objects.requireNonNull(payload, "payload must not be null");
        Query q = new Query(Criteria.where("queue").is(key).and("payload").is(payload));
        Update u = new Update()
                .set("score", score)
                .set("updatedAt", clock.instant());
        mongoTemplate.upsert(q, u, DelayedTaskDocument.class);
    }

    @Override
    public List<String> rangeByScore(String key, long min, long max) {
        requireKey(key);
        if (min > max) {
            return List.of();
        }
        Query q = new Query(Criteria.where("queue").is(key).and("score").gte(min).lte(max))
                .with(Sort.by(Sort.Order.asc("score"), Sort.Order.asc("payload")));
        q.fields().include("payload").include("score");

        List<DelayedTaskDocument> docs = mongoTemplate.find(q, DelayedTaskDocument.class);
        List<String> out = new ArrayList<>(docs.size());
        for (DelayedTaskDocument d : docs) {
            if (d != null && d.getPayload() != null) {
                out.add(d.getPayload());
            }
        }
        return out;
    }

    @Override
    public long remove(String key, Collection<String> payloads) {
        requireKey(key);
        if (payloads == null || payloads.isEmpty()) {
            return 0;
        }
        Query q = new Query(Criteria.where("queue").is(key).and("payload").in(payloads));
        return mongoTemplate.remove(q, DelayedTaskDocument.class).getDeletedCount();
    }

    private static void requireKey(String key) {
        Objects.requireNonNull(key, "key must not be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
    }
}
