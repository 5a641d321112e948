package com.kotsin.challenge.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kotsin.challenge.event.KafkaTransitionEventPublisher;
import com.kotsin.challenge.event.LoggingTransitionEventPublisher;
import com.kotsin.challenge.event.TransitionEventPublisher;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;

@Configuration
public class EventConfig {

    @Bean
    @ConditionalOnProperty(prefix = "engine.events", name = "kafka-enabled", havingValue = "true")
    public TransitionEventPublisher kafkaTransitionEventPublisher(KafkaTemplate<String, String> kafkaTemplate,
                                                                 ObjectMapper objectMapper,
                                                                 EngineProperties properties) {
        return new KafkaTransitionEventPublisher(kafkaTemplate, objectMapper,
                properties.getEvents().getTopic(), properties.getEvents().getRetainInMemory());
    }

    @Bean
    @ConditionalOnProperty(prefix = "engine.events", name = "kafka-enabled", havingValue = "false", matchIfMissing = true)
    public TransitionEventPublisher loggingTransitionEventPublisher(EngineProperties properties) {
        return new LoggingTransitionEventPublisher(properties.getEvents().getRetainInMemory());
    }
}
