package io.tasker4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tasker4j.AbstractOneShotJob;
import io.tasker4j.OneShotJob;
import io.tasker4j.OneShotJobFactory;
import io.tasker4j.Recurring;
import io.tasker4j.RecurringJob;
import io.tasker4j.TaskServer;
import io.tasker4j.core.JobPublisher;
import io.tasker4j.core.JobSchedule;
import io.tasker4j.core.RecurringJobDescriptor;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.data.mongodb.core.MongoTemplate;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class TaskServerAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TaskServerConfig.class))
            .withBean(MongoTemplate.class, () -> mock(MongoTemplate.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withBean(DemoReportJob.class, DemoReportJob::new)
            .withBean(UnscheduledJob.class, UnscheduledJob::new)
            .withBean(DemoEmailFactory.class, DemoEmailFactory::new)
            .withPropertyValues(
                    "tasker.enabled=true",
                    "tasker.worker-id=test-worker",
                    "tasker.key-prefix=demo:",
                    "tasker.shared-table=memory",
                    "tasker.queue-tick=500ms"
            );

    @Test
    void shouldAutoConfigureTaskServerBeans() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(TaskServer.class);
            assertThat(context).hasSingleBean(JobPublisher.class);
            assertThat(context).hasSingleBean(TaskServerLifecycle.class);
            assertThat(context).hasSingleBean(TaskServerProperties.class);
            assertThat(context).hasSingleBean(TaskServerMongoIndexConfig.class);
            assertThat(context.getBean(TaskServerProperties.class).getKeyPrefix()).isEqualTo("demo:");
        });
    }

    @Test
    void shouldDiscoverJobBeans() {
        contextRunner.run(context -> {
            TaskServerJobs jobs = context.getBean(TaskServerJobs.class);

            assertThat(jobs.schedules()).containsExactly(new JobSchedule("demo-report", "@every 1m"));
            assertThat(jobs.catalog().recurringJobClasses())
                    .containsExactlyInAnyOrder("demo-report", UnscheduledJob.class.getName());
            assertThat(jobs.catalog().oneShotJobClasses()).containsExactly("demo-email");
            assertThat(jobs.catalog().newOneShot("demo-email", Map.of("to", "a@b.com")).getParams())
                    .containsEntry("to", "a@b.com");
        });
    }

    @Test
    void lifecycleShouldStartTheServerWithDiscoveredSchedules() {
        contextRunner.run(context -> {
            TaskServer server = context.getBean(TaskServer.class);

            assertThat(server.isRunning()).isTrue();
            List<RecurringJobDescriptor> jobs = server.recurringJobs();
            assertThat(jobs).containsExactly(RecurringJobDescriptor.interval("demo-report", 60));
        });
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner.withPropertyValues("tasker.enabled=false").run(context -> {
            assertThat(context).doesNotHaveBean(TaskServer.class);
            assertThat(context).doesNotHaveBean(TaskServerLifecycle.class);
        });
    }

    @Recurring(value = "@every 1m", name = "demo-report")
    static class DemoReportJob implements RecurringJob {
        @Override
        public void run() {
            // no-op for context bootstrap test
        }
    }

    static class UnscheduledJob implements RecurringJob {
        @Override
        public void run() {
            // no-op for context bootstrap test
        }
    }

    static class DemoEmailFactory implements OneShotJobFactory {
        @Override
        public String jobClass() {
            return "demo-email";
        }

        @Override
        public OneShotJob create(Map<String, Object> params) {
            return new AbstractOneShotJob(params) {
                @Override
                public boolean process() {
                    return true;
                }
            };
        }
    }
}
