package com.example.backendtemplate.config;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Metrics for the background subsystems.
 * <p>
 * Exposes Prometheus metrics for:
 * - Messages processed and failed per poller
 * - Fetch failures and current backoff delay
 * - Job run times and outcomes
 * - Skipped job fires by reason
 */
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;

    /**
     * Register a gauge reporting the current backoff delay of a poller
     */
    public <T> void registerBackoffGauge(String poller, T owner, Supplier<Duration> delay) {
        Gauge.builder("event_poller_backoff_seconds", owner, o -> delay.get().toMillis() / 1000.0)
                .tag("poller", poller)
                .description("Current delay applied after a failed or empty fetch")
                .register(meterRegistry);
    }

    /**
     * Record a successfully processed message
     */
    public void recordMessageProcessed(String poller) {
        meterRegistry.counter("event_poller_messages_processed", "poller", poller).increment();
    }

    /**
     * Record a message the processor failed on
     */
    public void recordMessageFailure(String poller, String errorType) {
        meterRegistry.counter("event_poller_messages_failed",
                "poller", poller,
                "error_type", errorType != null ? errorType : "unknown"
        ).increment();
    }

    /**
     * Record a failed batch fetch
     */
    public void recordFetchFailure(String poller) {
        meterRegistry.counter("event_poller_fetch_failures", "poller", poller).increment();
    }

    /**
     * Create a timer for a job run
     */
    public Timer.Sample startJobTimer() {
        return Timer.start(meterRegistry);
    }

    /**
     * Record job run time and outcome
     */
    public void recordJobRun(Timer.Sample sample, String job, boolean success) {
        sample.stop(Timer.builder("job_scheduler_run_time")
                .tag("job", job)
                .tag("success", String.valueOf(success))
                .description("Job run time")
                .register(meterRegistry));
    }

    /**
     * Record a fire that did not result in a run
     */
    public void recordJobSkipped(String job, String reason) {
        meterRegistry.counter("job_scheduler_skipped_fires", "job", job, "reason", reason).increment();
    }
}
