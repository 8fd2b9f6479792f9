package com.example.backendtemplate.service.event;

import com.example.backendtemplate.exception.InvalidConfigurationException;
import lombok.Getter;

import java.time.Duration;

/**
 * Exponential backoff bounded by a ceiling.
 * <p>
 * Stateless: callers hold the current delay and ask for the next one.
 * Every returned delay lies in {@code [initialDelay, maxDelay]}.
 */
@Getter
public class BackoffPolicy {

    private final Duration initialDelay;
    private final Duration maxDelay;

    /**
     * @throws InvalidConfigurationException if a delay is missing or not positive,
     *                                       or if {@code initialDelay > maxDelay}
     */
    public BackoffPolicy(Duration initialDelay, Duration maxDelay) {
        if (initialDelay == null || maxDelay == null) {
            throw new InvalidConfigurationException("backoff", "initial and max delay are required");
        }
        if (initialDelay.isZero() || initialDelay.isNegative()) {
            throw new InvalidConfigurationException("backoff", "initial delay must be positive, got " + initialDelay);
        }
        if (initialDelay.compareTo(maxDelay) > 0) {
            throw new InvalidConfigurationException("backoff",
                    String.format("max delay %s must be greater than or equal to initial delay %s", maxDelay, initialDelay));
        }
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
    }

    public static BackoffPolicy ofSeconds(long initialSeconds, long maxSeconds) {
        return new BackoffPolicy(Duration.ofSeconds(initialSeconds), Duration.ofSeconds(maxSeconds));
    }

    /**
     * Delay to use after another failure: double the current one, capped at the max.
     */
    public Duration next(Duration current) {
        if (current == null || current.compareTo(initialDelay) < 0) {
            current = initialDelay;
        }
        // halving the ceiling avoids overflow in multipliedBy
        if (current.compareTo(maxDelay.dividedBy(2)) > 0) {
            return maxDelay;
        }
        var doubled = current.multipliedBy(2);
        return doubled.compareTo(maxDelay) > 0 ? maxDelay : doubled;
    }

    /**
     * Delay to use after a successful fetch.
     */
    public Duration reset() {
        return initialDelay;
    }
}
