package com.kotsin.challenge.model;

/**
 * Derived drawdown figures in percent (3.2 means 3.2 %).
 */
public record DrawdownSnapshot(double totalDdPct, double dailyDdPct, double equity) {

    public static DrawdownSnapshot of(AccountState account) {
        double equity = account.getEquity();
        double total = pct(account.getInitialBalance(), equity);
        double daily = pct(account.getDayStartBaseline(), equity);
        return new DrawdownSnapshot(total, daily, equity);
    }

    private static double pct(double reference, double equity) {
        if (reference <= 0) {
            return 0.0;
        }
        return Math.max(0.0, (reference - equity) / reference * 100.0);
    }
}
