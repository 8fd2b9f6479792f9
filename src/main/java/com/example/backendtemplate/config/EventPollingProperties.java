package com.example.backendtemplate.config;

import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the sample event poller.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "event-polling")
public class EventPollingProperties {

    /**
     * Whether the poll loop is started with the application
     */
    private boolean enabled = true;

    /**
     * Delay in seconds after the first failed or empty fetch
     */
    @Min(1)
    private long backoffInitialSeconds = 1;

    /**
     * Upper bound in seconds for the backoff delay
     */
    @Min(1)
    private long backoffMaxSeconds = 30;

    /**
     * Number of threads available for blocking fetch calls
     */
    @Min(1)
    private int fetchPoolSize = 1;

    /**
     * Seconds to wait for the poll task to finish on shutdown
     */
    @Min(1)
    private long shutdownTimeoutSeconds = 30;

    @AssertTrue(message = "backoff-max-seconds must be greater than or equal to backoff-initial-seconds")
    public boolean isBackoffRangeValid() {
        return backoffMaxSeconds >= backoffInitialSeconds;
    }
}
