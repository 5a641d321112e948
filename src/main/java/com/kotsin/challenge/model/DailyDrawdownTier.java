package com.kotsin.challenge.model;

public enum DailyDrawdownTier {
    NORMAL,
    WARNING,
    /** Shrinks the effective risk fraction for new fills. */
    REDUCE,
    /** Close everything, no new fills until rollover. */
    HALT
}
