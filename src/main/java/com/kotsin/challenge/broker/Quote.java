package com.kotsin.challenge.broker;

import java.time.Instant;

/**
 * Top of book plus the high/low traded since the previous tick.
 */
public record Quote(String symbol, double bid, double ask, double high, double low, Instant timestamp) {

    public double spread() {
        return ask - bid;
    }

    public double mid() {
        return (bid + ask) / 2.0;
    }
}
