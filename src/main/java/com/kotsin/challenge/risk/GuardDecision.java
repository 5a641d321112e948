package com.kotsin.challenge.risk;

import com.kotsin.challenge.model.DailyDrawdownTier;
import com.kotsin.challenge.model.DrawdownSnapshot;
import com.kotsin.challenge.model.TotalDrawdownTier;

/**
 * Outcome of one guard evaluation, consumed by the tick before any other work.
 *
 * @param halted          no new fills may happen this tick
 * @param closeAll        every open position must be liquidated now
 * @param demotePending   resting limit orders must be pulled from the venue
 */
public record GuardDecision(
        boolean halted,
        boolean closeAll,
        boolean demotePending,
        DailyDrawdownTier dailyTier,
        TotalDrawdownTier totalTier,
        DrawdownSnapshot drawdown,
        String reason
) {
}
