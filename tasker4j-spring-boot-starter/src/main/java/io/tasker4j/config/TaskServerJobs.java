package io.tasker4j.config;

import io.tasker4j.OneShotJobFactory;
import io.tasker4j.Recurring;
import io.tasker4j.RecurringJob;
import io.tasker4j.core.JobCatalog;
import io.tasker4j.core.JobSchedule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.util.ClassUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Jobs discovered in the application context.
 *
 * <p>Every {@link RecurringJob} bean is registered under its {@link Recurring#name()} or, when that is blank,
 * its class name, and scheduled with {@link Recurring#value()}. Recurring beans without the annotation are
 * registered but never scheduled. Every {@link OneShotJobFactory} bean is registered under its own id.
 */
public record TaskServerJobs(JobCatalog catalog, List<JobSchedule> schedules) {
    private static final Logger log = LoggerFactory.getLogger(TaskServerJobs.class);

    public TaskServerJobs {
        Objects.requireNonNull(catalog, "catalog must not be null");
        schedules = List.copyOf(schedules);
    }

    public static TaskServerJobs scan(ListableBeanFactory beanFactory) {
        JobCatalog catalog = new JobCatalog();
        List<JobSchedule> schedules = new ArrayList<>();

        for (String beanName : beanFactory.getBeanNamesForType(RecurringJob.class)) {
            Class<?> type = beanFactory.getType(beanName);
            Recurring recurring = beanFactory.findAnnotationOnBean(beanName, Recurring.class);

            String jobClass = recurring != null && !recurring.name().isBlank()
                    ? recurring.name()
                    : (type == null ? beanName : ClassUtils.getUserClass(type).getName());

            catalog.registerRecurring(jobClass, () -> beanFactory.getBean(beanName, RecurringJob.class));
            if (recurring != null) {
                schedules.add(new JobSchedule(jobClass, recurring.value()));
            } else {
                log.info("tasker recurring job bean has no @Recurring schedule bean={} jobClass={}", beanName, jobClass);
            }
        }

        Map<String, OneShotJobFactory> factories = beanFactory.getBeansOfType(OneShotJobFactory.class);
        for (OneShotJobFactory factory : factories.values()) {
            catalog.registerOneShot(factory);
        }

        log.info("tasker discovered jobs recurring={} scheduled={} oneShot={}",
                catalog.recurringJobClasses().size(), schedules.size(), catalog.oneShotJobClasses().size());
        return new TaskServerJobs(catalog, schedules);
    }
}
