package com.example.backendtemplate.service.job;

import com.example.backendtemplate.domain.entity.ScheduledJobRecord;
import com.example.backendtemplate.domain.repository.ScheduledJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

/**
 * Job store backed by the scheduled_jobs table
 */
@Slf4j
@RequiredArgsConstructor
public class JpaJobStore implements JobStore {

    private final ScheduledJobRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<StoredJob> find(String jobId) {
        return repository.findById(jobId).map(this::toStoredJob);
    }

    @Override
    @Transactional(readOnly = true)
    public List<StoredJob> findAll() {
        return repository.findAll().stream().map(this::toStoredJob).toList();
    }

    @Override
    @Transactional
    public void save(StoredJob job) {
        var record = repository.findById(job.getId())
                .orElseGet(() -> ScheduledJobRecord.builder().id(job.getId()).build());
        record.setCronExpression(job.getCronExpression());
        record.setNextRunTime(job.getNextRunTime());
        record.setLastRunTime(job.getLastRunTime());
        repository.save(record);
        log.debug("Stored trigger state of job '{}', next run at {}", job.getId(), job.getNextRunTime());
    }

    @Override
    @Transactional
    public void remove(String jobId) {
        repository.deleteById(jobId);
    }

    private StoredJob toStoredJob(ScheduledJobRecord record) {
        return StoredJob.builder()
                .id(record.getId())
                .cronExpression(record.getCronExpression())
                .nextRunTime(record.getNextRunTime())
                .lastRunTime(record.getLastRunTime())
                .build();
    }
}
