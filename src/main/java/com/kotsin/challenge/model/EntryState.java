package com.kotsin.challenge.model;

public enum EntryState {
    AWAITING_PROXIMITY,
    /** Immediate fill was due but the spread was too wide; still holds the symbol. */
    AWAITING_SPREAD,
    PENDING,
    FILLED,
    EXPIRED,
    CANCELLED;

    public boolean isActive() {
        return this == AWAITING_PROXIMITY || this == AWAITING_SPREAD || this == PENDING;
    }

    public boolean isTerminal() {
        return !isActive();
    }
}
