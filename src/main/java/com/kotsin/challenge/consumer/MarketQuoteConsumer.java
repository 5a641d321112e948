package com.kotsin.challenge.consumer;

import com.kotsin.challenge.broker.Quote;
import com.kotsin.challenge.paper.PaperExecutionGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;

/**
 * Drives the paper venue's book from the quote topic.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "engine.kafka", name = "listeners-enabled", havingValue = "true")
public class MarketQuoteConsumer {

    private final PaperExecutionGateway venue;

    @KafkaListener(
            topics = "${engine.kafka.quote-topic:market-quotes}",
            containerFactory = "quoteKafkaListenerContainerFactory"
    )
    public void onQuote(@Payload Quote quote) {
        if (quote == null || quote.symbol() == null || quote.symbol().isBlank()) {
            log.debug("Skipping quote with blank symbol: {}", quote);
            return;
        }
        if (quote.bid() <= 0 || quote.ask() < quote.bid()) {
            log.warn("quote_invalid symbol={} bid={} ask={}", quote.symbol(), quote.bid(), quote.ask());
            return;
        }
        venue.updateQuote(quote);
    }
}
