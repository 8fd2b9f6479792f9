package com.example.backendtemplate.service.job;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;

/**
 * Point-in-time view of a registered job
 */
@Value
@Builder
public class ScheduledJobInfo {

    String name;
    String cronExpression;
    boolean coalesce;
    int maxInstances;
    Duration misfireGraceTime;
    Instant nextRunTime;
    Instant lastRunTime;
    int runningInstances;
}
