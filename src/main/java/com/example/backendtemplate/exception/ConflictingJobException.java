package com.example.backendtemplate.exception;

import lombok.Getter;

/**
 * Exception for registering a job under a name that is already taken
 * when replacement was not requested.
 */
@Getter
public class ConflictingJobException extends RuntimeException {

    private final String jobName;

    public ConflictingJobException(String jobName) {
        super(String.format("Job '%s' is already registered and replaceExisting is false", jobName));
        this.jobName = jobName;
    }
}
