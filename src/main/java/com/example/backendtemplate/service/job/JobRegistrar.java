package com.example.backendtemplate.service.job;

import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;

/**
 * Registers every {@link BaseJob} bean with the scheduler.
 * <p>
 * Runs while the context is refreshed, so an invalid cron expression fails startup
 * before any background task is started.
 */
@Slf4j
@Component
public class JobRegistrar {

    private final CronJobScheduler scheduler;
    private final List<BaseJob> jobs;

    public JobRegistrar(CronJobScheduler scheduler, List<BaseJob> jobs) {
        this.scheduler = scheduler;
        this.jobs = jobs;
    }

    @PostConstruct
    public void registerJobs() {
        var names = new HashSet<String>();
        for (var job : jobs) {
            if (!names.add(job.getName())) {
                log.warn("Duplicate job name '{}': {} will {} the earlier registration",
                        job.getName(), job.getClass().getSimpleName(),
                        job.isReplaceExisting() ? "replace" : "conflict with");
            }
            job.register(scheduler);
            log.info("Registered job '{}' ({}) with cron '{}'",
                    job.getName(), job.getClass().getSimpleName(), job.getCronExpression());
        }

        if (jobs.isEmpty()) {
            log.warn("No jobs registered");
        }
    }
}
