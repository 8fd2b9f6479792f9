package com.example.backendtemplate.domain.entity;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

/**
 * Columns shared by every table: UUID key, active/deleted flags for soft deletes
 * and audit timestamps.
 */
@MappedSuperclass
@Getter
@Setter
public abstract class BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "is_deleted", nullable = false)
    private boolean deleted = false;

    @Column(name = "created_on", nullable = false, updatable = false)
    private Instant createdOn;

    /**
     * Refreshed on every update
     */
    @Column(name = "modified_on", nullable = false)
    private Instant modifiedOn;

    @PrePersist
    protected void onCreate() {
        var now = Instant.now();
        if (createdOn == null) {
            createdOn = now;
        }
        modifiedOn = now;
    }

    @PreUpdate
    protected void onUpdate() {
        modifiedOn = Instant.now();
    }

    /**
     * Mark as deleted without removing the row
     */
    public void softDelete() {
        this.deleted = true;
        this.active = false;
    }
}
