package com.example.backendtemplate.service.lifecycle;

import com.example.backendtemplate.config.EventPollingProperties;
import com.example.backendtemplate.service.event.CancellationToken;
import com.example.backendtemplate.service.event.EventPoller;
import com.example.backendtemplate.service.job.CronJobScheduler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.web.context.WebServerGracefulShutdownLifecycle;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Starts and stops the background subsystems together with the application context.
 * <p>
 * Startup:
 * 1. Spawn the event poll loop on its own thread
 * 2. Start the cron job scheduler
 * <p>
 * Shutdown, each step attempted even if an earlier one failed:
 * 1. Cancel the poll loop and wait for it to exit (bounded)
 * 2. Shut down the scheduler, waiting for running jobs (bounded)
 * 3. Close the database connection pool
 * <p>
 * Runs in a phase below the embedded web server's, so it stops only after the server
 * has drained in-flight requests and the connection pool is closed last.
 */
@Slf4j
@Component
public class BackgroundTaskCoordinator implements SmartLifecycle {

    /**
     * Below the web server start/stop phase, which sits 1024 under the graceful shutdown phase
     */
    static final int PHASE = WebServerGracefulShutdownLifecycle.SMART_LIFECYCLE_PHASE - 2048;

    private final EventPoller eventPoller;
    private final CronJobScheduler jobScheduler;
    private final ConnectionPoolManager connectionPoolManager;
    private final ExecutorService eventPollerExecutor;
    private final EventPollingProperties pollingProperties;

    private final Object monitor = new Object();
    private volatile boolean started;
    private CancellationToken pollCancellation;
    private Future<?> pollTask;

    public BackgroundTaskCoordinator(EventPoller eventPoller,
                                     CronJobScheduler jobScheduler,
                                     ConnectionPoolManager connectionPoolManager,
                                     @Qualifier("eventPollerExecutor") ExecutorService eventPollerExecutor,
                                     EventPollingProperties pollingProperties) {
        this.eventPoller = eventPoller;
        this.jobScheduler = jobScheduler;
        this.connectionPoolManager = connectionPoolManager;
        this.eventPollerExecutor = eventPollerExecutor;
        this.pollingProperties = pollingProperties;
    }

    @Override
    public void start() {
        synchronized (monitor) {
            if (started) {
                log.debug("Background tasks already started");
                return;
            }
            log.info("Starting application services...");

            if (pollingProperties.isEnabled()) {
                var cancellation = new CancellationToken();
                pollCancellation = cancellation;
                pollTask = eventPollerExecutor.submit(() -> eventPoller.pollMessages(cancellation));
                log.info("Event poller '{}' spawned", eventPoller.getName());
            } else {
                log.info("Event polling disabled");
            }

            try {
                if (!jobScheduler.isRunning()) {
                    jobScheduler.start();
                    log.info("Scheduler started successfully");
                }
            } catch (RuntimeException e) {
                log.error("Failed to start scheduler, cancelling event poller: {}", e.getMessage(), e);
                cancelSpawnedPoller();
                throw e;
            }

            started = true;
            log.info("Application startup complete");
        }
    }

    @Override
    public void stop() {
        synchronized (monitor) {
            if (!started) {
                return;
            }
            log.info("Shutting down application services...");

            try {
                stopEventPoller();
            } catch (Exception e) {
                log.error("Error stopping event poller: {}", e.getMessage(), e);
            }

            try {
                if (jobScheduler.isRunning()) {
                    jobScheduler.shutdown(true);
                }
                log.info("Scheduler shutdown complete");
            } catch (Exception e) {
                log.error("Error shutting down scheduler: {}", e.getMessage(), e);
            }

            try {
                connectionPoolManager.dispose();
                log.info("Database connections closed");
            } catch (Exception e) {
                log.error("Error closing database connections: {}", e.getMessage(), e);
            }

            started = false;
            log.info("Application shutdown complete");
        }
    }

    @Override
    public boolean isRunning() {
        return started;
    }

    @Override
    public int getPhase() {
        return PHASE;
    }

    private void cancelSpawnedPoller() {
        if (pollCancellation != null) {
            pollCancellation.cancel();
        }
        if (pollTask != null) {
            pollTask.cancel(true);
        }
        pollTask = null;
        pollCancellation = null;
    }

    private void stopEventPoller() {
        var task = pollTask;
        if (task == null) {
            return;
        }
        pollCancellation.cancel();
        try {
            task.get(pollingProperties.getShutdownTimeoutSeconds(), TimeUnit.SECONDS);
            log.info("Event poller stopped");
        } catch (CancellationException e) {
            log.info("Event poller cancelled successfully");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof CancellationException) {
                log.info("Event poller cancelled successfully");
            } else {
                log.error("Event poller terminated with an error: {}", e.getCause().getMessage(), e.getCause());
            }
        } catch (TimeoutException e) {
            log.warn("Event poller did not stop within {}s, interrupting", pollingProperties.getShutdownTimeoutSeconds());
            task.cancel(true);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for event poller to stop");
            task.cancel(true);
        } finally {
            pollTask = null;
            pollCancellation = null;
        }
    }
}
