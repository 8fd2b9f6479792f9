package com.example.backendtemplate.service.job;

import com.example.backendtemplate.config.JobSchedulerProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Example job. Put periodic work here; the frequency comes from {@code SAMPLE_JOB_FREQUENCY}.
 */
@Slf4j
@Component
public class SampleJob extends BaseJob {

    public static final String NAME = "sample_job";

    public SampleJob(JobSchedulerProperties properties) {
        super(NAME, properties.getSampleJobCron());
    }

    @Override
    protected void execute() {
        log.info("Starting Sample Job...");
    }
}
