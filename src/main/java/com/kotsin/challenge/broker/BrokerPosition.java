package com.kotsin.challenge.broker;

import com.kotsin.challenge.model.Direction;

import java.time.Instant;

/**
 * Venue view of an open position, used for startup reconciliation.
 *
 * @param stopLoss 0 when the venue holds no stop
 */
public record BrokerPosition(
        String handle,
        String symbol,
        Direction direction,
        double size,
        double openPrice,
        double stopLoss,
        Instant openedAt
) {
}
