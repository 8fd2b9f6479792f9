package com.example.backendtemplate.service.job;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Job store without persistence. Missed fires are not detected across restarts.
 */
public class InMemoryJobStore implements JobStore {

    private final Map<String, StoredJob> jobs = new ConcurrentHashMap<>();

    @Override
    public Optional<StoredJob> find(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(this::copy);
    }

    @Override
    public List<StoredJob> findAll() {
        return new ArrayList<>(jobs.values().stream().map(this::copy).toList());
    }

    @Override
    public void save(StoredJob job) {
        jobs.put(job.getId(), copy(job));
    }

    @Override
    public void remove(String jobId) {
        jobs.remove(jobId);
    }

    private StoredJob copy(StoredJob job) {
        return StoredJob.builder()
                .id(job.getId())
                .cronExpression(job.getCronExpression())
                .nextRunTime(job.getNextRunTime())
                .lastRunTime(job.getLastRunTime())
                .build();
    }
}
