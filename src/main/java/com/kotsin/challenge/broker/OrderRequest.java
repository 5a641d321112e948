package com.kotsin.challenge.broker;

import com.kotsin.challenge.model.Direction;

/**
 * @param clientOrderId deterministic id used to find the order again after a timed-out placement
 * @param stopPrice     protective stop attached at the venue
 */
public record OrderRequest(String clientOrderId, String symbol, Direction direction, double size, double stopPrice) {
}
