package io.tasker4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.tasker4j.TaskServer;
import io.tasker4j.core.JobPublisher;
import io.tasker4j.internal.mongo.MongoTaskServer;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.SmartInitializingSingleton;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.data.mongodb.core.MongoTemplate;

/**
 * Spring Boot auto-configuration entrypoint for the task server.
 */
@AutoConfiguration
@ConditionalOnClass({TaskServer.class, MongoTemplate.class})
@EnableConfigurationProperties(TaskServerProperties.class)
@ConditionalOnProperty(prefix = "tasker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TaskServerConfig {

    @Bean
    @ConditionalOnMissingBean
    protected TaskServerMongoIndexConfig taskServerMongoIndexConfig(MongoTemplate mongoTemplate) {
        return new TaskServerMongoIndexConfig(mongoTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskServerJobs taskServerJobs(ListableBeanFactory beanFactory) {
        return TaskServerJobs.scan(beanFactory);
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskServer taskServer(TaskServerProperties props,
                                 MongoTemplate mongoTemplate,
                                 TaskServerJobs jobs,
                                 ObjectProvider<ObjectMapper> objectMapper) {
        return new MongoTaskServer(props, mongoTemplate, jobs.catalog(), jobs.schedules(),
                objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public JobPublisher jobPublisher(TaskServer taskServer) {
        return taskServer.publisher();
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskServerLifecycle taskServerLifecycle(TaskServer taskServer) {
        return new TaskServerLifecycle(taskServer);
    }

    @Bean
    @ConditionalOnProperty(prefix = "tasker", name = "ensure-indexes-on-startup", havingValue = "true")
    public SmartInitializingSingleton taskServerIndexesInitializer(TaskServerMongoIndexConfig indexConfig) {
        return indexConfig::ensureIndexes;
    }
}
