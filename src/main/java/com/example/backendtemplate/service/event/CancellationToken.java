package com.example.backendtemplate.service.event;

import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cooperative cancellation signal handed to a background task when it is spawned.
 * <p>
 * Sleeping and waiting go through the token, so a {@link #cancel()} wakes the task
 * immediately instead of letting it finish a fixed-length block. Every wait method
 * throws {@link CancellationException} once cancellation has been requested.
 */
public final class CancellationToken {

    private final CompletableFuture<Void> signal = new CompletableFuture<>();

    public void cancel() {
        signal.complete(null);
    }

    public boolean isCancellationRequested() {
        return signal.isDone();
    }

    public void throwIfCancellationRequested() {
        if (isCancellationRequested()) {
            throw new CancellationException("Cancellation requested");
        }
    }

    /**
     * Sleep for the given delay, returning early by throwing if cancelled.
     *
     * @throws CancellationException if cancelled before or during the sleep
     * @throws InterruptedException  if the sleeping thread is interrupted
     */
    public void sleep(Duration delay) throws InterruptedException {
        throwIfCancellationRequested();
        try {
            signal.get(Math.max(0, delay.toNanos()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            // full delay elapsed without cancellation
            return;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Cancellation signal completed exceptionally", e);
        }
        throw new CancellationException("Cancelled while sleeping");
    }

    /**
     * Wait for a result, giving up as soon as cancellation is requested.
     * A result that is already available is returned even if cancellation races with it.
     *
     * @throws CancellationException if cancelled before the future completes; the future is cancelled too
     * @throws ExecutionException    if the future completed exceptionally
     * @throws InterruptedException  if the waiting thread is interrupted; the future is cancelled too
     */
    public <T> T await(CompletableFuture<T> future) throws InterruptedException, ExecutionException {
        throwIfCancellationRequested();
        try {
            CompletableFuture.anyOf(future, signal).handle((result, error) -> null).get();
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
        if (!future.isDone()) {
            future.cancel(true);
            throw new CancellationException("Cancelled while waiting");
        }
        return future.get();
    }
}
