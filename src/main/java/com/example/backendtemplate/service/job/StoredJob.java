package com.example.backendtemplate.service.job;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Persisted trigger state of a job
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StoredJob {

    private String id;
    private String cronExpression;
    private Instant nextRunTime;
    private Instant lastRunTime;
}
