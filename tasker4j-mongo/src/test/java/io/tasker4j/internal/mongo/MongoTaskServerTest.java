package io.tasker4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tasker4j.config.TaskServerProperties;
import io.tasker4j.core.DispatchSettings;
import io.tasker4j.core.JobCatalog;
import io.tasker4j.core.RuntimeMode;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

class MongoTaskServerTest {

    private final MongoTemplate mongoTemplate = mock(MongoTemplate.class);

    @Test
    void shouldBuildWorkerContextFromProperties() {
        TaskServerProperties props = new TaskServerProperties();
        props.setKeyPrefix("shop:");
        props.setWorkerId("worker-7");
        props.setEnv("staging");

        MongoTaskServer server = new MongoTaskServer(props, mongoTemplate, new JobCatalog(), List.of(), new ObjectMapper());

        assertThat(server.workerContext().immediateQueueKey()).isEqualTo("shop:tasks:immediate");
        assertThat(server.workerContext().workerId()).isEqualTo("worker-7");
        assertThat(server.workerContext().env()).isEqualTo("staging");
        assertThat(server.runtimeMode()).isEqualTo(RuntimeMode.EVENT_LOOP);
        assertThat(server.isRunning()).isFalse();
    }

    @Test
    void missingWorkerIdShouldBeGenerated() {
        MongoTaskServer server = new MongoTaskServer(new TaskServerProperties(), mongoTemplate, new JobCatalog(), null, null);

        assertThat(server.workerContext().workerId()).isNotBlank();
    }

    @Test
    void invalidProcessSettingsShouldFailFast() {
        TaskServerProperties props = new TaskServerProperties();
        props.setRuntimeMode(RuntimeMode.PROCESS);
        props.getProcess().setRecurringCommand("java -jar app.jar recurring");

        assertThatThrownBy(() -> new MongoTaskServer(props, mongoTemplate, new JobCatalog(), List.of(), new ObjectMapper()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("{taskClass}");
    }

    @Test
    void defaultsShouldMatchTheDispatchDefaults() {
        TaskServerProperties props = new TaskServerProperties();

        assertThat(props.toDispatchSettings()).isEqualTo(DispatchSettings.defaults());
        assertThat(props.getProcess().getTimeout().toSeconds()).isEqualTo(600);
    }
}
