package com.kotsin.grid.protection;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
@Slf4j
public class KafkaProtectionEventPublisher implements ProtectionEventPublisher {

    static final String PROTECTION_EVENTS_TOPIC = "grid-protection-events";

    private final KafkaTemplate<String, Object> kafkaTemplate;

    @Override
    public void publish(ProtectionEvent event) {
        try {
            kafkaTemplate.send(PROTECTION_EVENTS_TOPIC, event.getSymbol(), event);
            log.info("PROTECTION_EVENT_PUBLISHED type={} severity={} message={}",
                    event.getEventType(), event.getSeverity(), event.getMessage());
        } catch (Exception e) {
            log.error("PROTECTION_EVENT_PUBLISH_FAILED type={} error={}", event.getEventType(), e.getMessage());
        }
    }
}
