package io.tasker4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClients;
import io.tasker4j.AbstractOneShotJob;
import io.tasker4j.config.TaskServerProperties;
import io.tasker4j.core.JobCatalog;
import io.tasker4j.core.JobMessage;
import io.tasker4j.core.JobMessageCodec;
import io.tasker4j.core.JobSchedule;
import io.tasker4j.core.RecurringJobDescriptor;
import io.tasker4j.core.RetryPolicy;
import io.tasker4j.internal.SharedTableJobRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoQueueGatewayIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private MongoTemplate mongoTemplate;
    private MongoQueueGateway gateway;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "tasker4j_test");
        dropAll();
        gateway = new MongoQueueGateway(mongoTemplate);
    }

    @AfterEach
    void tearDown() {
        dropAll();
    }

    @Test
    void immediateQueueShouldPopEachEntryOnceInFifoOrder() {
        gateway.push("tasks:immediate", "a");
        gateway.push("tasks:immediate", "b");
        gateway.push("other:tasks:immediate", "x");

        assertEquals("a", gateway.popOrEmpty("tasks:immediate").orElseThrow());
        assertEquals("b", gateway.popOrEmpty("tasks:immediate").orElseThrow());
        assertTrue(gateway.popOrEmpty("tasks:immediate").isEmpty());
        assertEquals(1, mongoTemplate.count(new Query(), QueuedTaskDocument.class));
    }

    @Test
    void delayedQueueShouldBehaveLikeASortedSet() {
        gateway.pushDelayed("tasks:delayed", "late", 300);
        gateway.pushDelayed("tasks:delayed", "early", 100);
        gateway.pushDelayed("tasks:delayed", "early", 200);

        assertEquals(2, mongoTemplate.count(new Query(), DelayedTaskDocument.class));
        assertEquals(List.of("early", "late"), gateway.rangeByScore("tasks:delayed", 0, 1000));
        assertEquals(List.of(), gateway.rangeByScore("tasks:delayed", 0, 150));

        assertEquals(1, gateway.remove("tasks:delayed", List.of("early", "missing")));
        assertEquals(List.of("late"), gateway.rangeByScore("tasks:delayed", 0, 1000));
    }

    @Test
    void sharedTableShouldBackTheRecurringRegistry() {
        MongoSharedTable table = new MongoSharedTable(mongoTemplate);
        SharedTableJobRegistry a = new SharedTableJobRegistry(table, "tasks:recurring", new ObjectMapper());
        SharedTableJobRegistry b = new SharedTableJobRegistry(table, "tasks:recurring", new ObjectMapper());

        a.replaceAll(List.of(RecurringJobDescriptor.cron("report", "*/5 * * * *", List.of(10L, 20L))));
        b.advance(0, List.of(20L));

        assertEquals(List.of(20L), a.list().get(0).upcoming());
    }

    @Test
    void failingJobShouldBeRetriedThroughTheDelayedCollection() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        JobCatalog catalog = new JobCatalog().registerOneShot("SendEmail", params -> new AbstractOneShotJob(params) {
            @Override
            public boolean process() {
                return attempts.incrementAndGet() >= 2;
            }
        });

        MongoTaskServer server = new MongoTaskServer(fastProps(), mongoTemplate, catalog,
                List.<JobSchedule>of(), new ObjectMapper());
        server.publisher().publishNow("SendEmail", Map.of("to", "a@b.com"), RetryPolicy.of(2, 1));
        server.start();

        boolean reached = waitUntil(10, TimeUnit.SECONDS, () -> attempts.get() >= 2);
        server.stop();

        assertTrue(reached);
        assertEquals(0, mongoTemplate.count(new Query(), QueuedTaskDocument.class));
        assertEquals(0, mongoTemplate.count(
                new Query(Criteria.where("score").lte(Instant.now().getEpochSecond())), DelayedTaskDocument.class));
    }

    @Test
    void staleDelayedEntryShouldBeDroppedWithoutRunning() throws Exception {
        AtomicInteger runs = new AtomicInteger();
        JobCatalog catalog = new JobCatalog().registerOneShot("Report", params -> new AbstractOneShotJob(params) {
            @Override
            public boolean process() {
                runs.incrementAndGet();
                return true;
            }
        });
        long runAt = Instant.now().getEpochSecond() - 10;
        gateway.pushDelayed("tasks:delayed", new JobMessageCodec().encode(JobMessage.delayed("Report", Map.of(), runAt, null)), runAt);

        MongoTaskServer server = new MongoTaskServer(fastProps(), mongoTemplate, catalog, List.of(), new ObjectMapper());
        server.start();
        boolean drained = waitUntil(5, TimeUnit.SECONDS,
                () -> mongoTemplate.count(new Query(), DelayedTaskDocument.class) == 0);
        server.stop();

        assertTrue(drained);
        assertEquals(0, runs.get());
    }

    private static TaskServerProperties fastProps() {
        TaskServerProperties props = new TaskServerProperties();
        props.setWorkerId("test-worker");
        props.setCronTick(Duration.ofMillis(200));
        props.setQueueTick(Duration.ofMillis(200));
        return props;
    }

    private void dropAll() {
        mongoTemplate.dropCollection(QueuedTaskDocument.class);
        mongoTemplate.dropCollection(DelayedTaskDocument.class);
        mongoTemplate.dropCollection(SharedEntryDocument.class);
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(100);
        }
        return false;
    }
}
