package com.example.backendtemplate.service.lifecycle;

import com.example.backendtemplate.config.EventPollingProperties;
import com.example.backendtemplate.config.JobSchedulerProperties;
import com.example.backendtemplate.config.MetricsConfig;
import com.example.backendtemplate.service.event.BackoffPolicy;
import com.example.backendtemplate.service.event.EventPoller;
import com.example.backendtemplate.service.event.EventProcessingResult;
import com.example.backendtemplate.service.job.CronJobScheduler;
import com.example.backendtemplate.service.job.InMemoryJobStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import net.javacrumbs.shedlock.core.DefaultLockingTaskExecutor;
import net.javacrumbs.shedlock.core.LockProvider;
import net.javacrumbs.shedlock.core.SimpleLock;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import javax.sql.DataSource;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.mock;

/**
 * Start/stop of the real poller and scheduler, without a Spring context
 */
@DisplayName("Background task lifecycle Tests")
class BackgroundTaskLifecycleTest {

    private ExecutorService pollerExecutor;
    private ExecutorService fetchExecutor;
    private EventPoller eventPoller;
    private CronJobScheduler jobScheduler;
    private BackgroundTaskCoordinator coordinator;

    @BeforeEach
    void setUp() {
        pollerExecutor = Executors.newSingleThreadExecutor();
        fetchExecutor = Executors.newCachedThreadPool();
        var metricsConfig = new MetricsConfig(new SimpleMeterRegistry());

        eventPoller = new EventPoller("lifecycle", List::of, message -> EventProcessingResult.success(),
                BackoffPolicy.ofSeconds(30, 60), fetchExecutor, metricsConfig);

        SimpleLock lock = () -> {
        };
        LockProvider lockProvider = config -> Optional.of(lock);
        var schedulerProperties = new JobSchedulerProperties();
        schedulerProperties.setShutdownTimeoutSeconds(5);
        jobScheduler = new CronJobScheduler(new InMemoryJobStore(), new DefaultLockingTaskExecutor(lockProvider),
                metricsConfig, schedulerProperties);
        jobScheduler.register(jobScheduler.newJob("nightly", "0 0 * * *", () -> {
        }).build());

        var pollingProperties = new EventPollingProperties();
        pollingProperties.setShutdownTimeoutSeconds(5);
        coordinator = new BackgroundTaskCoordinator(eventPoller, jobScheduler,
                new ConnectionPoolManager(mock(DataSource.class)), pollerExecutor, pollingProperties);
    }

    @AfterEach
    void tearDown() {
        pollerExecutor.shutdownNow();
        fetchExecutor.shutdownNow();
    }

    @Test
    @DisplayName("Should treat stop before start as a no-op")
    void shouldIgnoreStopBeforeStart() {
        assertThatCode(coordinator::stop).doesNotThrowAnyException();
        assertThat(coordinator.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Should stop promptly right after start")
    void shouldStopPromptlyAfterStart() {
        // Given
        coordinator.start();
        await().atMost(Duration.ofSeconds(5)).until(eventPoller::isRunning);

        // When
        long started = System.nanoTime();
        coordinator.stop();
        var elapsed = Duration.ofNanos(System.nanoTime() - started);

        // Then
        assertThat(elapsed).isLessThan(Duration.ofSeconds(5));
        assertThat(coordinator.isRunning()).isFalse();
        assertThat(eventPoller.isRunning()).isFalse();
        assertThat(jobScheduler.isRunning()).isFalse();
    }
}
