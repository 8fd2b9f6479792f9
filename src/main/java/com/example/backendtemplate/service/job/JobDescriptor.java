package com.example.backendtemplate.service.job;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.time.Duration;

/**
 * Registration data of a cron job. Never mutated: re-registering a job
 * under the same name replaces the descriptor wholesale.
 */
@Value
@Builder(toBuilder = true)
public class JobDescriptor {

    /**
     * Unique job id
     */
    @NonNull
    String name;

    /**
     * Five-field crontab or six-field (with seconds) expression
     */
    @NonNull
    String cronExpression;

    @NonNull
    Runnable task;

    /**
     * Replace the trigger of an already registered job with the same name instead of failing
     */
    @Builder.Default
    boolean replaceExisting = true;

    /**
     * Collapse fires missed while the job was busy or the scheduler was down into one run
     */
    @Builder.Default
    boolean coalesce = true;

    @Builder.Default
    int maxInstances = 1;

    /**
     * How late a fire may start and still run
     */
    @Builder.Default
    Duration misfireGraceTime = Duration.ofSeconds(60);
}
