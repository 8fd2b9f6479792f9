package com.example.backendtemplate.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * Persisted trigger state of a cron job, keyed by job name
 */
@Entity
@Table(name = "scheduled_jobs", indexes = {
        @Index(name = "idx_scheduled_jobs_next_run_time", columnList = "next_run_time")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ScheduledJobRecord {

    @Id
    @Column(name = "id", length = 191, nullable = false, updatable = false)
    private String id;

    @Column(name = "cron_expression", nullable = false, length = 120)
    private String cronExpression;

    @Column(name = "next_run_time")
    private Instant nextRunTime;

    @Column(name = "last_run_time")
    private Instant lastRunTime;
}
