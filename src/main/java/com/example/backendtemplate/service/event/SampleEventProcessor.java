package com.example.backendtemplate.service.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Sample processor. Implement the business logic for polled events here.
 */
@Slf4j
@Component
public class SampleEventProcessor implements EventProcessor {

    @Override
    public EventProcessingResult process(EventMessage message) {
        log.info("Processing event {}: {}", message.getId(), message.getBody());
        return EventProcessingResult.success();
    }
}
