package com.kotsin.challenge.consumer;

import com.kotsin.challenge.model.Signal;
import com.kotsin.challenge.service.ChallengeEngine;
import com.kotsin.challenge.service.EntryQueue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Service;

/**
 * Feeds signals from the signal topic into the entry queue. Rejections are logged and
 * acknowledged; a redelivered signal is rejected as a duplicate by the queue.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "engine.kafka", name = "listeners-enabled", havingValue = "true")
public class SignalConsumer {

    private final ChallengeEngine engine;

    @KafkaListener(
            topics = "${engine.kafka.signal-topic:trading-signals}",
            containerFactory = "signalKafkaListenerContainerFactory"
    )
    public void onSignal(Signal signal, Acknowledgment ack, ConsumerRecord<?, ?> rec) {
        if (signal == null || signal.symbol() == null || signal.symbol().isBlank()) {
            log.warn("signal_invalid symbol=blank topic={} partition={} offset={}",
                    rec.topic(), rec.partition(), rec.offset());
            ack.acknowledge();
            return;
        }
        EntryQueue.SubmitResult result = engine.submit(signal);
        if (result.isAccepted()) {
            log.info("signal_queued id={} symbol={} entryId={} offset={}",
                    signal.signalId(), signal.symbol(), result.getEntry().getEntryId(), rec.offset());
        } else {
            log.warn("signal_rejected id={} symbol={} reason={}", signal.signalId(), signal.symbol(), result.getReason());
        }
        ack.acknowledge();
    }
}
