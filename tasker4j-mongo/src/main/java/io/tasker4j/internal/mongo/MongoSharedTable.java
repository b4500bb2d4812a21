package io.tasker4j.internal.mongo;

import io.tasker4j.spi.SharedTable;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link SharedTable} stored as one {@code task_shared_table} document per key, visible to every scheduler
 * instance connected to the same database.
 */
public class MongoSharedTable implements SharedTable {

    private final MongoTemplate mongoTemplate;

    public MongoSharedTable(MongoTemplate mongoTemplate) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
    }

    @Override
    public Optional<String> get(String key) {
        Objects.requireNonNull(key, "key must not be null");
        SharedEntryDocument doc = mongoTemplate.findById(key, SharedEntryDocument.class);
        return doc == null ? Optional.empty() : Optional.ofNullable(doc.getValue());
    }

    @Override
    public void put(String key, String value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        Query q = new Query(Criteria.where("_id").is(key));
        Update u = new Update()
                .set("value", value)
                .set("updatedAt", Instant.now());
        mongoTemplate.upsert(q, u, SharedEntryDocument.class);
    }
}
