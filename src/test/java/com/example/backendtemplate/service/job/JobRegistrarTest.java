package com.example.backendtemplate.service.job;

import com.example.backendtemplate.config.JobSchedulerProperties;
import com.example.backendtemplate.config.MetricsConfig;
import com.example.backendtemplate.exception.InvalidConfigurationException;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import net.javacrumbs.shedlock.core.DefaultLockingTaskExecutor;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.core.SimpleLock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("JobRegistrar Tests")
class JobRegistrarTest {

    private JobSchedulerProperties properties;
    private CronJobScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new JobSchedulerProperties();
        SimpleLock lock = () -> {
        };
        LockProvider lockProvider = config -> Optional.of(lock);
        scheduler = new CronJobScheduler(new InMemoryJobStore(), new DefaultLockingTaskExecutor(lockProvider),
                new MetricsConfig(new SimpleMeterRegistry()), properties);
    }

    private static class CountingJob extends BaseJob {

        private final AtomicInteger runs = new AtomicInteger();
        private final boolean fail;

        CountingJob(String name, String cron, boolean replaceExisting, boolean fail) {
            super(name, cron, replaceExisting);
            this.fail = fail;
        }

        @Override
        protected void execute() throws Exception {
            runs.incrementAndGet();
            if (fail) {
                throw new Exception("job failed");
            }
        }
    }

    @Nested
    @DisplayName("registerJobs Tests")
    class RegisterJobsTests {

        @Test
        @DisplayName("Should register every job bean")
        void shouldRegisterAllJobs() {
            // Given
            var registrar = new JobRegistrar(scheduler, List.of(
                    new SampleJob(properties),
                    new CountingJob("cleanup", "0 3 * * *", true, false)));

            // When
            registrar.registerJobs();

            // Then
            assertThat(scheduler.getJobs())
                    .extracting(ScheduledJobInfo::getName)
                    .containsExactly("cleanup", SampleJob.NAME);
            assertThat(scheduler.getJob(SampleJob.NAME)).get()
                    .extracting(ScheduledJobInfo::getCronExpression).isEqualTo("*/5 * * * *");
        }

        @Test
        @DisplayName("Should keep the last registration for duplicate names that allow replacement")
        void shouldReplaceDuplicateJob() {
            // Given
            var registrar = new JobRegistrar(scheduler, List.of(
                    new CountingJob("cleanup", "0 3 * * *", true, false),
                    new CountingJob("cleanup", "0 4 * * *", true, false)));

            // When
            registrar.registerJobs();

            // Then
            assertThat(scheduler.getJobs()).hasSize(1);
            assertThat(scheduler.getJob("cleanup")).get()
                    .extracting(ScheduledJobInfo::getCronExpression).isEqualTo("0 4 * * *");
        }

        @Test
        @DisplayName("Should fail on an invalid job cron expression")
        void shouldFailOnInvalidCron() {
            // Given
            properties.setSampleJobCron("not a cron");
            var registrar = new JobRegistrar(scheduler, List.of(new SampleJob(properties)));

            // When / Then
            assertThatThrownBy(registrar::registerJobs).isInstanceOf(InvalidConfigurationException.class);
        }

        @Test
        @DisplayName("Should accept an empty job list")
        void shouldHandleNoJobs() {
            var registrar = new JobRegistrar(scheduler, List.of());

            assertThatCode(registrar::registerJobs).doesNotThrowAnyException();
            assertThat(scheduler.getJobs()).isEmpty();
        }
    }

    @Nested
    @DisplayName("BaseJob Tests")
    class BaseJobTests {

        @Test
        @DisplayName("Should contain failures of the job body")
        void shouldContainJobFailure() {
            // Given
            var job = new CountingJob("failing", "0 3 * * *", true, true);

            // When / Then
            assertThatCode(job::run).doesNotThrowAnyException();
            assertThat(job.runs).hasValue(1);
        }

        @Test
        @DisplayName("Should run the sample job without error")
        void shouldRunSampleJob() {
            assertThatCode(new SampleJob(properties)::run).doesNotThrowAnyException();
        }
    }
}
