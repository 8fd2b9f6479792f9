package com.example.backendtemplate.service.event;

/**
 * Business logic applied to each polled message.
 * <p>
 * Implementations should:
 * - Be stateless
 * - Treat each message independently
 * - Report failures through the result or by throwing; either way the
 *   poll loop logs the failure and moves on to the next message
 */
public interface EventProcessor {

    /**
     * Process an incoming event
     *
     * @param message The event to process
     * @return Result of the processing
     */
    EventProcessingResult process(EventMessage message);
}
