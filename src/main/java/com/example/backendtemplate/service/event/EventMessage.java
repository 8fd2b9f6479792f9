package com.example.backendtemplate.service.event;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

/**
 * One message as returned by a {@link EventMessageSource}.
 * The body is opaque to the poll loop; only processors interpret it.
 */
@Value
@Builder
public class EventMessage {

    /**
     * Broker-assigned identifier, used for logging
     */
    String id;

    @Builder.Default
    Map<String, Object> body = Map.of();

    /**
     * Transport attributes (headers, receipt handles, ...)
     */
    @Builder.Default
    Map<String, String> attributes = Map.of();

    Instant receivedAt;
}
