package com.kotsin.challenge.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.core.KafkaTemplate;

/**
 * Logs each transition and publishes it as JSON, keyed by symbol so a symbol's history stays ordered.
 */
@Slf4j
public class KafkaTransitionEventPublisher extends LoggingTransitionEventPublisher {

    private final KafkaTemplate<String, String> kafkaTemplate;
    private final ObjectMapper objectMapper;
    private final String topic;

    public KafkaTransitionEventPublisher(KafkaTemplate<String, String> kafkaTemplate,
                                         ObjectMapper objectMapper,
                                         String topic,
                                         int retain) {
        super(retain);
        this.kafkaTemplate = kafkaTemplate;
        this.objectMapper = objectMapper;
        this.topic = topic;
    }

    @Override
    public void publish(TransitionEvent event) {
        super.publish(event);
        String key = event.getSymbol() != null ? event.getSymbol() : event.getEntityId();
        try {
            String payload = objectMapper.writeValueAsString(event);
            kafkaTemplate.send(topic, key, payload).whenComplete((result, ex) -> {
                if (ex != null) {
                    log.error("[Events] Failed to publish {} for {}: {}", event.getType(), key, ex.getMessage());
                }
            });
        } catch (JsonProcessingException e) {
            log.error("[Events] Could not serialize {} for {}: {}", event.getType(), key, e.getMessage(), e);
        }
    }
}
