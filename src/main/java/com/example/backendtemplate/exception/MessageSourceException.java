package com.example.backendtemplate.exception;

import lombok.Getter;

/**
 * Exception for a failed batch fetch from a message source
 */
@Getter
public class MessageSourceException extends RuntimeException {

    private final String sourceName;

    public MessageSourceException(String sourceName, String message) {
        super(String.format("[%s] %s", sourceName, message));
        this.sourceName = sourceName;
    }

    public MessageSourceException(String sourceName, String message, Exception cause) {
        super(String.format("[%s] %s", sourceName, message), cause);
        this.sourceName = sourceName;
    }
}
