package com.kotsin.challenge.scheduler;

import com.kotsin.challenge.service.ChallengeEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Runs recovery once the context is ready, then ticks the engine at a fixed delay so ticks never overlap.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "engine.tick", name = "enabled", havingValue = "true", matchIfMissing = true)
public class EngineScheduler {

    private final ChallengeEngine engine;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        engine.start().ifPresentOrElse(
                report -> log.info("ENGINE_STARTED report={}", report),
                () -> log.warn("ENGINE_START_DEFERRED recovery will be retried on the next tick"));
    }

    @Scheduled(fixedDelayString = "${engine.tick.interval-ms:1000}")
    public void tick() {
        try {
            engine.tick().ifPresent(report -> log.debug(
                    "TICK at={} open={} active={} equity={} halted={}",
                    report.at(), report.openPositions(), report.activeEntries(),
                    String.format("%.2f", report.equity()), report.decision().halted()));
        } catch (RuntimeException e) {
            // A failed tick must not cancel the schedule.
            log.error("TICK_FAILED error={}", e.getMessage(), e);
        }
    }
}
