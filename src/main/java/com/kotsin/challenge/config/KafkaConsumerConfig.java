package com.kotsin.challenge.config;

import com.kotsin.challenge.broker.Quote;
import com.kotsin.challenge.model.Signal;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.annotation.EnableKafka;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.serializer.DeserializationException;
import org.springframework.kafka.support.serializer.ErrorHandlingDeserializer;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.util.backoff.FixedBackOff;

import java.util.HashMap;
import java.util.Map;

/**
 * Listener factories for signal and quote ingestion. Malformed messages are logged and skipped
 * by the ErrorHandlingDeserializer instead of blocking the partition.
 */
@Configuration
@EnableKafka
@ConditionalOnProperty(prefix = "engine.kafka", name = "listeners-enabled", havingValue = "true")
public class KafkaConsumerConfig {

    @Value("${spring.kafka.bootstrap-servers}")
    private String bootstrapServers;

    @Value("${engine.kafka.signal-group-id:challenge-engine-signals}")
    private String signalGroupId;

    @Value("${engine.kafka.quote-group-id:challenge-engine-quotes}")
    private String quoteGroupId;

    @Bean("signalConsumerFactory")
    public ConsumerFactory<String, Signal> signalConsumerFactory() {
        return new DefaultKafkaConsumerFactory<>(consumerProps(signalGroupId, Signal.class, "latest", 10));
    }

    @Bean("signalKafkaListenerContainerFactory")
    public ConcurrentKafkaListenerContainerFactory<String, Signal> signalKafkaListenerContainerFactory() {
        ConcurrentKafkaListenerContainerFactory<String, Signal> factory = new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(signalConsumerFactory());
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.MANUAL_IMMEDIATE);
        factory.setCommonErrorHandler(errorHandler());
        return factory;
    }

    @Bean("quoteConsumerFactory")
    public ConsumerFactory<String, Quote> quoteConsumerFactory() {
        return new DefaultKafkaConsumerFactory<>(consumerProps(quoteGroupId, Quote.class, "latest", 200));
    }

    @Bean("quoteKafkaListenerContainerFactory")
    public ConcurrentKafkaListenerContainerFactory<String, Quote> quoteKafkaListenerContainerFactory() {
        ConcurrentKafkaListenerContainerFactory<String, Quote> factory = new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(quoteConsumerFactory());
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.BATCH);
        factory.setCommonErrorHandler(errorHandler());
        return factory;
    }

    private Map<String, Object> consumerProps(String groupId, Class<?> valueType, String offsetReset, int maxPoll) {
        Map<String, Object> configProps = new HashMap<>();
        configProps.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        configProps.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
        configProps.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, ErrorHandlingDeserializer.class);
        configProps.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, ErrorHandlingDeserializer.class);
        configProps.put(ErrorHandlingDeserializer.KEY_DESERIALIZER_CLASS, StringDeserializer.class);
        configProps.put(ErrorHandlingDeserializer.VALUE_DESERIALIZER_CLASS, JsonDeserializer.class);
        configProps.put(JsonDeserializer.TRUSTED_PACKAGES, "*");
        configProps.put(JsonDeserializer.VALUE_DEFAULT_TYPE, valueType.getName());
        configProps.put(JsonDeserializer.USE_TYPE_INFO_HEADERS, false);
        configProps.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, offsetReset);
        configProps.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        configProps.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, maxPoll);
        return configProps;
    }

    private DefaultErrorHandler errorHandler() {
        DefaultErrorHandler errorHandler = new DefaultErrorHandler(new FixedBackOff(1000L, 3L));
        errorHandler.addNotRetryableExceptions(
                DeserializationException.class,
                org.apache.kafka.common.errors.SerializationException.class
        );
        return errorHandler;
    }
}
