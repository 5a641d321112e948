package com.kotsin.challenge.service;

public enum EntryAction {
    /** Price is at the entry: fill at market, subject to the spread check. */
    IMMEDIATE,
    /** Price is close: rest a limit order at the entry price. */
    PROMOTE_TO_LIMIT,
    KEEP,
    EXPIRE,
    /** Price ran too far from the entry (only when enabled). */
    CANCEL
}
