package com.example.backendtemplate.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the cron job scheduler.
 * The job defaults apply to every job registered through {@code BaseJob}.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "job-scheduler")
public class JobSchedulerProperties {

    /**
     * Number of scheduler threads (trigger handling and job bodies)
     */
    @Min(1)
    private int poolSize = 4;

    /**
     * Time zone used to evaluate cron expressions
     */
    @NotBlank
    private String timeZone = "UTC";

    /**
     * Where trigger state is persisted
     */
    @NotNull
    private JobStoreType jobStore = JobStoreType.DATABASE;

    /**
     * Collapse multiple pending executions of the same job into one
     */
    private boolean coalesce = true;

    /**
     * Maximum number of concurrently executing instances of a job
     */
    @Min(1)
    private int maxInstances = 1;

    /**
     * Seconds after the designated run time that a job is still allowed to run
     */
    @Min(0)
    private long misfireGraceSeconds = 60;

    /**
     * Seconds to wait for running jobs when the scheduler shuts down
     */
    @Min(1)
    private int shutdownTimeoutSeconds = 30;

    /**
     * Upper bound for the cross-instance job lock
     */
    @NotNull
    private Duration lockAtMostFor = Duration.ofMinutes(10);

    /**
     * Cron expression of the sample job (five or six fields)
     */
    @NotBlank
    private String sampleJobCron = "*/5 * * * *";

    public Duration getMisfireGraceTime() {
        return Duration.ofSeconds(misfireGraceSeconds);
    }

    public enum JobStoreType {
        DATABASE,
        MEMORY
    }
}
