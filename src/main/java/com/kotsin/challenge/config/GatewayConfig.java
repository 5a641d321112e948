package com.kotsin.challenge.config;

import com.kotsin.challenge.broker.ExecutionGateway;
import com.kotsin.challenge.broker.ResilientExecutionGateway;
import com.kotsin.challenge.paper.PaperExecutionGateway;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

import java.time.Clock;

/**
 * The engine always trades through the resilient wrapper. The paper venue is the bundled
 * implementation; a live venue adapter replaces the {@code venue} bean.
 */
@Configuration
public class GatewayConfig {

    @Bean
    public PaperExecutionGateway venue(Clock engineClock) {
        return new PaperExecutionGateway(engineClock);
    }

    @Bean
    @Primary
    public ExecutionGateway executionGateway(PaperExecutionGateway venue, EngineProperties properties) {
        return new ResilientExecutionGateway(venue, properties.getBroker());
    }
}
