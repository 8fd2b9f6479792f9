package com.example.backendtemplate.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Executors used by the background event poller.
 * <p>
 * The poll loop owns a single long-lived thread. Blocking fetch calls run on
 * a separate pool so the loop thread stays free to observe cancellation.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    /**
     * Single thread hosting the long-running poll loop.
     */
    @Bean(name = "eventPollerExecutor", destroyMethod = "shutdownNow")
    public ExecutorService eventPollerExecutor() {
        log.info("Creating event poller executor");
        return Executors.newSingleThreadExecutor(new CustomizableThreadFactory("event-poller-"));
    }

    /**
     * Pool for blocking message-source fetch calls.
     */
    @Bean(name = "messageFetchExecutor", destroyMethod = "shutdownNow")
    public ExecutorService messageFetchExecutor(EventPollingProperties properties) {
        log.info("Creating message fetch executor with {} thread(s)", properties.getFetchPoolSize());
        return Executors.newFixedThreadPool(properties.getFetchPoolSize(), new CustomizableThreadFactory("message-fetch-"));
    }
}
