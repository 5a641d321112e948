package com.kotsin.challenge.model;

public enum Direction {
    LONG,
    SHORT;

    /** +1 for long, -1 for short. Multiplies a price move into P&L sign. */
    public int sign() {
        return this == LONG ? 1 : -1;
    }

    /** True if {@code candidate} is a tighter (less risky) stop than {@code current}. */
    public boolean isTighterStop(double candidate, double current) {
        return this == LONG ? candidate > current : candidate < current;
    }

    /** True once {@code price} has reached or passed the protective stop. */
    public boolean isStopCrossed(double stop, double high, double low) {
        return this == LONG ? low <= stop : high >= stop;
    }

    /** True once the bar has traded through a profit target. */
    public boolean isTargetCrossed(double target, double high, double low) {
        return this == LONG ? high >= target : low <= target;
    }
}
