package com.example.backendtemplate.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * Exception for sample entity not found
 */
@Getter
public class SampleEntityNotFoundException extends RuntimeException {

    private final UUID entityId;

    public SampleEntityNotFoundException(UUID entityId) {
        super("Sample entity with ID " + entityId + " not found");
        this.entityId = entityId;
    }
}
