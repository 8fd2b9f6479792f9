package com.example.backendtemplate.service.event;

import lombok.Builder;
import lombok.Data;

/**
 * Represents the result of processing one event message.
 */
@Data
@Builder
public class EventProcessingResult {

    /**
     * Whether the message was processed successfully
     */
    private boolean success;

    /**
     * Error message if failed
     */
    private String errorMessage;

    /**
     * Error type/classification for metrics
     */
    private String errorType;

    /**
     * Create a success result
     */
    public static EventProcessingResult success() {
        return EventProcessingResult.builder().success(true).build();
    }

    /**
     * Create a failure result
     */
    public static EventProcessingResult failure(String errorMessage, String errorType) {
        return EventProcessingResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errorType(errorType)
                .build();
    }

    /**
     * Create a failure result from exception
     */
    public static EventProcessingResult failure(Exception e) {
        return failure(e.getMessage(), e.getClass().getSimpleName());
    }
}
