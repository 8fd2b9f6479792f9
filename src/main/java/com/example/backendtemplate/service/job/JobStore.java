package com.example.backendtemplate.service.job;

import java.util.List;
import java.util.Optional;

/**
 * Storage backend for job trigger state.
 * <p>
 * Only trigger data is stored; job bodies are registered in code at startup.
 * A stored next run time that lies in the past when the scheduler starts is
 * treated as a missed fire.
 */
public interface JobStore {

    Optional<StoredJob> find(String jobId);

    List<StoredJob> findAll();

    void save(StoredJob job);

    void remove(String jobId);
}
