package com.kotsin.challenge.model;

public enum TotalDrawdownTier {
    NORMAL,
    WARNING,
    EMERGENCY,
    /** Terminal: the account is breached. */
    STOP_OUT
}
