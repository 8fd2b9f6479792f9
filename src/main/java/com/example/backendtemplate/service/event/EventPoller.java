package com.example.backendtemplate.service.event;

import com.example.backendtemplate.config.MetricsConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Long-running loop that fetches message batches and dispatches them to a processor.
 * <p>
 * Flow per cycle:
 * 1. Fetch a batch on the fetch executor, waiting through the cancellation token
 * 2. Fetch failed: sleep the current delay, then double it (capped)
 * 3. Empty batch: sleep the current delay, then reset it
 * 4. Otherwise process every message in order, reset the delay and fetch again at once
 * <p>
 * A failing message is logged and skipped; it never stops the batch or the loop.
 * The loop has no retry limit and only ends through cancellation. A processor that
 * never returns blocks the loop, since messages are not preempted.
 */
@Slf4j
public class EventPoller {

    private final String name;
    private final EventMessageSource messageSource;
    private final EventProcessor eventProcessor;
    private final BackoffPolicy backoffPolicy;
    private final ExecutorService fetchExecutor;
    private final MetricsConfig metricsConfig;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile CancellationToken activeCancellation;
    private volatile Duration currentDelay;

    public EventPoller(String name, EventMessageSource messageSource, EventProcessor eventProcessor,
                       BackoffPolicy backoffPolicy, ExecutorService fetchExecutor, MetricsConfig metricsConfig) {
        this.name = name;
        this.messageSource = messageSource;
        this.eventProcessor = eventProcessor;
        this.backoffPolicy = backoffPolicy;
        this.fetchExecutor = fetchExecutor;
        this.metricsConfig = metricsConfig;
        this.currentDelay = backoffPolicy.reset();
        metricsConfig.registerBackoffGauge(name, this, this::getCurrentDelay);
    }

    /**
     * Run the poll loop on the calling thread until cancelled.
     * <p>
     * The running flag is cleared on every exit path.
     *
     * @param cancellation token checked at the top of every cycle and during sleeps and fetches
     * @throws CancellationException when the loop ends because of cancellation or interruption
     * @throws IllegalStateException if the loop is already running
     */
    public void pollMessages(CancellationToken cancellation) {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Event poller '" + name + "' is already running");
        }
        activeCancellation = cancellation;
        currentDelay = backoffPolicy.reset();
        log.info("Event poller '{}' started", name);

        try {
            while (true) {
                cancellation.throwIfCancellationRequested();
                pollOnce(cancellation);
            }
        } catch (CancellationException e) {
            log.info("Polling cancelled, shutting down event poller '{}' gracefully", name);
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Event poller '{}' interrupted, shutting down gracefully", name);
            var cancelled = new CancellationException("Event poller '" + name + "' interrupted");
            cancelled.initCause(e);
            throw cancelled;
        } finally {
            running.set(false);
            activeCancellation = null;
            log.info("Event poller '{}' stopped", name);
        }
    }

    /**
     * Signal the running loop to stop. Has no effect if the loop is not running.
     */
    public void stop() {
        var cancellation = activeCancellation;
        if (cancellation != null) {
            cancellation.cancel();
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public Duration getCurrentDelay() {
        return currentDelay;
    }

    public String getName() {
        return name;
    }

    /**
     * Sleep between cycles. Must honour the cancellation token.
     */
    protected void pause(Duration delay, CancellationToken cancellation) throws InterruptedException {
        cancellation.sleep(delay);
    }

    private void pollOnce(CancellationToken cancellation) throws InterruptedException {
        List<EventMessage> messages;
        try {
            messages = fetch(cancellation);
        } catch (ExecutionException e) {
            var cause = e.getCause() != null ? e.getCause() : e;
            log.error("Top-level polling error in '{}'; backing off {}s", name, toSeconds(currentDelay), cause);
            metricsConfig.recordFetchFailure(name);
            pause(currentDelay, cancellation);
            currentDelay = backoffPolicy.next(currentDelay);
            return;
        }

        if (messages == null || messages.isEmpty()) {
            log.debug("No messages from '{}', sleeping {}s", name, toSeconds(currentDelay));
            pause(currentDelay, cancellation);
            currentDelay = backoffPolicy.reset();
            return;
        }

        log.debug("Fetched {} message(s) from '{}'", messages.size(), name);
        for (var message : messages) {
            dispatch(message);
        }
        currentDelay = backoffPolicy.reset();
    }

    private List<EventMessage> fetch(CancellationToken cancellation) throws InterruptedException, ExecutionException {
        var future = CompletableFuture.supplyAsync(messageSource::receive, fetchExecutor);
        return cancellation.await(future);
    }

    private void dispatch(EventMessage message) {
        if (message == null) {
            log.warn("Skipping null message in batch from '{}'", name);
            metricsConfig.recordMessageFailure(name, "NullMessage");
            return;
        }
        try {
            var result = eventProcessor.process(message);
            if (result != null && !result.isSuccess()) {
                log.error("Error processing message {}: {}", message.getId(), result.getErrorMessage());
                metricsConfig.recordMessageFailure(name, result.getErrorType());
                return;
            }
            log.info("Processed message {} successfully", message.getId());
            metricsConfig.recordMessageProcessed(name);
        } catch (Exception e) {
            log.error("Error processing message {}: {}", message.getId(), e.getMessage(), e);
            metricsConfig.recordMessageFailure(name, e.getClass().getSimpleName());
        }
    }

    private static double toSeconds(Duration delay) {
        return delay.toMillis() / 1000.0;
    }
}
