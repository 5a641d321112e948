package com.kotsin.challenge.event;

/**
 * Every state change the engine records in its event log.
 */
public enum TransitionType {
    // Entry queue
    SIGNAL_QUEUED,
    SIGNAL_REJECTED,
    ENTRY_SPREAD_WAIT,
    ENTRY_PROMOTED_TO_LIMIT,
    ENTRY_DEMOTED,
    ENTRY_PLACEMENT_UNCONFIRMED,
    ENTRY_FILLED,
    ENTRY_EXPIRED,
    ENTRY_CANCELLED,
    FILL_REFUSED,

    // Positions
    POSITION_OPENED,
    POSITION_TRIMMED,
    POSITION_RESIZED,
    TAKE_PROFIT_HIT,
    STOP_RATCHETED,
    POSITION_CLOSED,
    POSITION_ADOPTED,
    POSITION_DISCARDED,

    // Account and drawdown
    DAILY_TIER_CHANGED,
    TOTAL_TIER_CHANGED,
    CLOSE_ALL_ISSUED,
    WEEKEND_REVIEW,
    ROLLOVER,
    RECORD_QUARANTINED,
    RECOVERY_COMPLETED
}
