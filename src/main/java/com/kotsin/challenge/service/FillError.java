package com.kotsin.challenge.service;

public enum FillError {
    HALTED,
    RISK_SANITY_VIOLATION,
    SIZE_TOO_SMALL,
    MAX_POSITIONS,
    /** Daily trade count reached; the entry waits for the next trading day. */
    MAX_TRADES_PER_DAY,
    PORTFOLIO_RISK_CAP,
    /** Venue refused the order; the entry is dropped. */
    REJECTED,
    /** Outcome unknown or venue unreachable; retried on a later tick. */
    TRANSIENT
}
