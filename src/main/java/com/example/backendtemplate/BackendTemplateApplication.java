package com.example.backendtemplate;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Backend Template Application
 * <p>
 * Starter service wiring an HTTP layer, a PostgreSQL access layer,
 * a cron job scheduler and a background event poller around one
 * illustrative CRUD resource.
 * <p>
 * Features:
 * - Sample entity CRUD API with soft delete and search
 * - Cron jobs with misfire grace, coalescing and single-instance execution
 * - Event polling loop with exponential backoff and graceful cancellation
 * - Ordered, best-effort shutdown of poller, scheduler and connection pool
 */
@SpringBootApplication
public class BackendTemplateApplication {

    public static void main(String[] args) {
        SpringApplication.run(BackendTemplateApplication.class, args);
    }
}
