package io.tasker4j.internal.mongo;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Entry of an immediate queue. Popped in {@code (enqueuedAt, _id)} order.
 */
@Document(collection = "task_queue")
public class QueuedTaskDocument {

    @Id
    private String id;

    private String queue;
    private String payload;
    private Instant enqueuedAt;

    public QueuedTaskDocument() {
    }

    public QueuedTaskDocument(String queue, String payload, Instant enqueuedAt) {
        this.queue = queue;
        this.payload = payload;
        this.enqueuedAt = enqueuedAt;
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getQueue() {
        return queue;
    }

    public void setQueue(String queue) {
        this.queue = queue;
    }

    public String getPayload() {
        return payload;
    }

    public void setPayload(String payload) {
        this.payload = payload;
    }

    public Instant getEnqueuedAt() {
        return enqueuedAt;
    }

    public void setEnqueuedAt(Instant enqueuedAt) {
        this.enqueuedAt = enqueuedAt;
    }
}
