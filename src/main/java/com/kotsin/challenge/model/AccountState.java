package com.kotsin.challenge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.time.LocalDate;

/**
 * Account-level money state. Only mutated through {@code AccountLedger}.
 * <p>
 * {@code initialBalance} is the total drawdown reference and is never reassigned after creation.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AccountState {

    @Setter(AccessLevel.NONE)
    private double initialBalance;

    private double balance;
    private double equity;
    private double peakEquity;

    // Daily drawdown reference
    private double dayStartBaseline;
    private LocalDate lastRolloverDate;
    private int rolloverCount;

    private Instant haltedUntil;
    private String haltReason;
    private boolean stoppedOut;

    @Builder.Default
    private DailyDrawdownTier dailyTier = DailyDrawdownTier.NORMAL;
    @Builder.Default
    private TotalDrawdownTier totalTier = TotalDrawdownTier.NORMAL;

    private int winStreak;
    private int lossStreak;
    private int closedTrades;

    // Positions opened since the last rollover
    private int tradesToday;
    private LocalDate lastWeekendReview;

    public static AccountState opening(double initialBalance, LocalDate tradingDate) {
        return AccountState.builder()
                .initialBalance(initialBalance)
                .balance(initialBalance)
                .equity(initialBalance)
                .peakEquity(initialBalance)
                .dayStartBaseline(initialBalance)
                .lastRolloverDate(tradingDate)
                .build();
    }

    @JsonIgnore
    public boolean isHalted(Instant now) {
        return stoppedOut || (haltedUntil != null && now.isBefore(haltedUntil));
    }

    public AccountState copy() {
        return toBuilder().build();
    }
}
