package com.example.backendtemplate.service.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Placeholder message source. Replace {@link #receive()} with a call to the
 * real broker (SQS, Kafka, ...). It always reports an empty batch, so the
 * poller idles at its initial backoff delay.
 */
@Slf4j
@Component
public class SampleEventMessageSource implements EventMessageSource {

    @Override
    public List<EventMessage> receive() {
        log.trace("Sample message source has no messages");
        return List.of();
    }

    @Override
    public String getName() {
        return "sample";
    }
}
