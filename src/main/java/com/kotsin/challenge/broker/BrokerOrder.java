package com.kotsin.challenge.broker;

import com.kotsin.challenge.model.Direction;

/**
 * Venue view of an order. {@code positionHandle} and {@code fillPrice} are set once filled.
 */
public record BrokerOrder(
        String orderId,
        String clientOrderId,
        String symbol,
        Direction direction,
        double size,
        double limitPrice,
        OrderStatus status,
        String positionHandle,
        double fillPrice
) {
}
