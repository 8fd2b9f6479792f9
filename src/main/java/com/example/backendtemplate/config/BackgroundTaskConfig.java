package com.example.backendtemplate.config;

import com.example.backendtemplate.domain.repository.ScheduledJobRepository;
import com.example.backendtemplate.service.event.BackoffPolicy;
import com.example.backendtemplate.service.event.EventMessageSource;
import com.example.backendtemplate.service.event.EventPoller;
import com.example.backendtemplate.service.event.EventProcessor;
import com.example.backendtemplate.service.job.CronJobScheduler;
import com.example.backendtemplate.service.job.InMemoryJobStore;
import com.example.backendtemplate.service.job.JobStore;
import com.example.backendtemplate.service.job.JpaJobStore;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.core.LockingTaskExecutor;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;

/**
 * Wiring of the background subsystems: the event poller and the cron job scheduler.
 * Both are started and stopped by {@code BackgroundTaskCoordinator}.
 */
@Slf4j
@Configuration
public class BackgroundTaskConfig {

    @Bean
    public BackoffPolicy eventPollingBackoffPolicy(EventPollingProperties properties) {
        return BackoffPolicy.ofSeconds(properties.getBackoffInitialSeconds(), properties.getBackoffMaxSeconds());
    }

    @Bean
    public EventPoller sampleEventPoller(EventMessageSource messageSource,
                                         EventProcessor eventProcessor,
                                         BackoffPolicy eventPollingBackoffPolicy,
                                         @Qualifier("messageFetchExecutor") ExecutorService messageFetchExecutor,
                                         MetricsConfig metricsConfig) {
        return new EventPoller(messageSource.getName(), messageSource, eventProcessor,
                eventPollingBackoffPolicy, messageFetchExecutor, metricsConfig);
    }

    @Bean
    public JobStore jobStore(JobSchedulerProperties properties, ScheduledJobRepository repository) {
        log.info("Using {} job store", properties.getJobStore());
        return switch (properties.getJobStore()) {
            case DATABASE -> new JpaJobStore(repository);
            case MEMORY -> new InMemoryJobStore();
        };
    }

    @Bean
    public CronJobScheduler cronJobScheduler(JobStore jobStore, LockingTaskExecutor lockingTaskExecutor,
                                             MetricsConfig metricsConfig, JobSchedulerProperties properties) {
        return new CronJobScheduler(jobStore, lockingTaskExecutor, metricsConfig, properties);
    }
}
