package com.example.backendtemplate.exception;

import lombok.Getter;

/**
 * Exception for background-task configuration that must stop startup
 * (backoff bounds, cron expressions, job options).
 */
@Getter
public class InvalidConfigurationException extends RuntimeException {

    private final String setting;

    public InvalidConfigurationException(String setting, String message) {
        super(String.format("Invalid configuration for '%s': %s", setting, message));
        this.setting = setting;
    }

    public InvalidConfigurationException(String setting, String message, Throwable cause) {
        super(String.format("Invalid configuration for '%s': %s", setting, message), cause);
        this.setting = setting;
    }
}
