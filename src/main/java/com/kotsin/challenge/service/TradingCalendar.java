package com.kotsin.challenge.service;

import com.kotsin.challenge.config.EngineProperties;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Maps instants to trading dates. A trading date starts at the configured rollover time in the
 * server zone.
 */
@Component
public class TradingCalendar {

    private final Clock clock;
    private final ZoneId zone;
    private final EngineProperties.Drawdown props;

    public TradingCalendar(Clock clock, EngineProperties properties) {
        this.clock = clock;
        this.props = properties.getDrawdown();
        this.zone = ZoneId.of(props.getRolloverZone());
    }

    public Instant now() {
        return clock.instant();
    }

    public LocalDate currentTradingDate() {
        return tradingDate(clock.instant());
    }

    public LocalDate tradingDate(Instant instant) {
        ZonedDateTime local = instant.atZone(zone);
        LocalDate date = local.toLocalDate();
        return local.toLocalTime().isBefore(props.getRolloverTime()) ? date.minusDays(1) : date;
    }

    /** First instant of the trading date after the one containing {@code instant}. */
    public Instant nextRollover(Instant instant) {
        return tradingDate(instant).plusDays(1).atTime(props.getRolloverTime()).atZone(zone).toInstant();
    }
}
