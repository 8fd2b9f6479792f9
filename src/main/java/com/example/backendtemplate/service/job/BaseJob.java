package com.example.backendtemplate.service.job;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Base class for cron jobs.
 * <p>
 * Subclasses declared as Spring beans are registered with the {@link CronJobScheduler}
 * at startup by {@link JobRegistrar}. A failing {@link #execute()} is logged here and
 * never reaches the scheduler, so the job keeps its trigger.
 */
@Slf4j
@Getter
public abstract class BaseJob {

    private final String name;
    private final String cronExpression;
    private final boolean replaceExisting;

    protected BaseJob(String name, String cronExpression) {
        this(name, cronExpression, true);
    }

    protected BaseJob(String name, String cronExpression, boolean replaceExisting) {
        this.name = name;
        this.cronExpression = cronExpression;
        this.replaceExisting = replaceExisting;
    }

    /**
     * Job body
     */
    protected abstract void execute() throws Exception;

    public final void run() {
        try {
            execute();
        } catch (Exception e) {
            log.error("Job '{}' failed: {}", name, e.getMessage(), e);
        }
    }

    public void register(CronJobScheduler scheduler) {
        scheduler.register(scheduler.newJob(name, cronExpression, this::run)
                .replaceExisting(replaceExisting)
                .build());
    }
}
