package com.example.backendtemplate.service.event;

import java.util.List;

/**
 * Adapter to an external message broker.
 * <p>
 * {@link #receive()} may block; the poll loop calls it from a worker pool.
 */
public interface EventMessageSource {

    /**
     * Fetch the next batch of messages.
     *
     * @return messages in delivery order, possibly empty
     * @throws com.example.backendtemplate.exception.MessageSourceException if the source is unavailable
     */
    List<EventMessage> receive();

    default String getName() {
        return getClass().getSimpleName();
    }
}
