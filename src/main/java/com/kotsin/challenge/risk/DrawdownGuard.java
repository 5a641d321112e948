package com.kotsin.challenge.risk;

import com.kotsin.challenge.config.EngineProperties;
import com.kotsin.challenge.event.TransitionEvent;
import com.kotsin.challenge.event.TransitionEventPublisher;
import com.kotsin.challenge.event.TransitionType;
import com.kotsin.challenge.model.AccountState;
import com.kotsin.challenge.model.DailyDrawdownTier;
import com.kotsin.challenge.model.DrawdownSnapshot;
import com.kotsin.challenge.model.TotalDrawdownTier;
import com.kotsin.challenge.service.AccountLedger;
import com.kotsin.challenge.service.TradingCalendar;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Enforces the funded-account drawdown contract.
 * <p>
 * Total drawdown is always measured from the immutable initial balance; daily drawdown from the
 * baseline captured at the last rollover. Percentages are compared at two decimals, the precision
 * they are reported in.
 */
@Service
@Slf4j
public class DrawdownGuard {

    private final AccountLedger ledger;
    private final TradingCalendar calendar;
    private final EngineProperties.Drawdown props;
    private final EngineProperties.Sizing sizing;
    private final TransitionEventPublisher events;

    private Instant lastWarningLog;

    public DrawdownGuard(AccountLedger ledger, TradingCalendar calendar, EngineProperties properties,
                         TransitionEventPublisher events) {
        this.ledger = ledger;
        this.calendar = calendar;
        this.props = properties.getDrawdown();
        this.sizing = properties.getSizing();
        this.events = events;
    }

    /**
     * Rolls the day if a boundary was crossed, then re-tiers the account against current equity.
     */
    public GuardDecision evaluate(Instant now, boolean hasOpenPositions) {
        List<TransitionEvent> pending = new ArrayList<>();
        GuardDecision decision = ledger.update(state -> {
            rolloverIfDue(state, now, pending);

            DrawdownSnapshot dd = DrawdownSnapshot.of(state);
            DailyDrawdownTier previousDaily = state.getDailyTier();
            TotalDrawdownTier previousTotal = state.getTotalTier();

            DailyDrawdownTier daily = dailyTierFor(dd.dailyDdPct());
            if (previousDaily == DailyDrawdownTier.HALT && state.isHalted(now)) {
                daily = DailyDrawdownTier.HALT;
            }
            TotalDrawdownTier total = previousTotal == TotalDrawdownTier.STOP_OUT
                    ? TotalDrawdownTier.STOP_OUT
                    : totalTierFor(dd.totalDdPct());

            String reason = null;
            if (total != previousTotal) {
                state.setTotalTier(total);
                pending.add(TransitionEvent.of(now, TransitionType.TOTAL_TIER_CHANGED, null, "account",
                                String.format("total drawdown %.2f%%", dd.totalDdPct()))
                        .before("tier", previousTotal).after("tier", total)
                        .after("equity", dd.equity()).after("initialBalance", state.getInitialBalance()));
                if (total == TotalDrawdownTier.STOP_OUT) {
                    state.setStoppedOut(true);
                    reason = String.format("TDD %.2f%% >= %.2f%% stop-out", dd.totalDdPct(), props.getTotalStopOutPct());
                    state.setHaltReason(reason);
                    log.error("[DrawdownGuard] ACCOUNT STOPPED OUT: {}", reason);
                }
            }
            if (total == TotalDrawdownTier.EMERGENCY && !state.isHalted(now)) {
                reason = String.format("TDD %.2f%% >= %.2f%% emergency", dd.totalDdPct(), props.getTotalEmergencyPct());
                halt(state, now, reason);
            }
            if (daily != previousDaily) {
                state.setDailyTier(daily);
                pending.add(TransitionEvent.of(now, TransitionType.DAILY_TIER_CHANGED, null, "account",
                                String.format("daily drawdown %.2f%%", dd.dailyDdPct()))
                        .before("tier", previousDaily).after("tier", daily)
                        .after("equity", dd.equity()).after("baseline", state.getDayStartBaseline()));
                if (daily == DailyDrawdownTier.HALT) {
                    String haltReason = String.format("DDD %.2f%% >= %.2f%%", dd.dailyDdPct(), props.getDailyHaltPct());
                    halt(state, now, haltReason);
                    reason = reason == null ? haltReason : reason;
                } else if (daily == DailyDrawdownTier.REDUCE) {
                    log.warn("[DrawdownGuard] DDD TIER REDUCE: {}% below day start, risk x{}",
                            String.format("%.2f", dd.dailyDdPct()), props.getReduceRiskMultiplier());
                }
            }
            if (daily == DailyDrawdownTier.WARNING || total == TotalDrawdownTier.WARNING) {
                warnWithCooldown(now, dd);
            }

            boolean halted = state.isHalted(now);
            boolean closeAll = halted && hasOpenPositions;
            if (closeAll) {
                String why = reason != null ? reason : state.getHaltReason();
                pending.add(TransitionEvent.of(now, TransitionType.CLOSE_ALL_ISSUED, null, "account", why)
                        .after("equity", dd.equity()));
            }
            boolean demote = halted || (daily == DailyDrawdownTier.REDUCE && previousDaily != DailyDrawdownTier.REDUCE);
            return new GuardDecision(halted, closeAll, demote, daily, total, dd,
                    reason != null ? reason : state.getHaltReason());
        });
        pending.forEach(events::publish);
        return decision;
    }

    public boolean isFillBlocked(Instant now) {
        return ledger.snapshot().isHalted(now);
    }

    /**
     * Multiplier applied to the base risk fraction for new fills: the tightest of the daily REDUCE
     * factor, the total WARNING factor and, once the account is far enough in profit, the
     * ultra-safe fraction.
     */
    public double riskMultiplier() {
        AccountState state = ledger.snapshot();
        double multiplier = 1.0;
        if (isUltraSafe(state) && sizing.getBaseRiskFraction() > 0) {
            multiplier = Math.min(multiplier, sizing.getUltraSafeRiskFraction() / sizing.getBaseRiskFraction());
        }
        if (state.getDailyTier() == DailyDrawdownTier.REDUCE) {
            multiplier = Math.min(multiplier, props.getReduceRiskMultiplier());
        }
        if (state.getTotalTier() == TotalDrawdownTier.WARNING) {
            multiplier = Math.min(multiplier, props.getTotalWarningRiskMultiplier());
        }
        return multiplier;
    }

    public boolean isUltraSafe() {
        return isUltraSafe(ledger.snapshot());
    }

    private boolean isUltraSafe(AccountState state) {
        if (state.getInitialBalance() <= 0) {
            return false;
        }
        double profitPct = (state.getBalance() - state.getInitialBalance()) / state.getInitialBalance() * 100.0;
        return reported(profitPct) >= sizing.getProfitUltraSafeThresholdPct();
    }

    private void rolloverIfDue(AccountState state, Instant now, List<TransitionEvent> pending) {
        LocalDate tradingDate = calendar.tradingDate(now);
        LocalDate last = state.getLastRolloverDate();
        if (last != null && !tradingDate.isAfter(last)) {
            return;
        }
        double before = state.getDayStartBaseline();
        double baseline = Math.max(state.getBalance(), state.getEquity());
        state.setDayStartBaseline(baseline);
        state.setLastRolloverDate(tradingDate);
        state.setRolloverCount(state.getRolloverCount() + 1);
        state.setDailyTier(DailyDrawdownTier.NORMAL);
        state.setTradesToday(0);
        if (!state.isStoppedOut()) {
            state.setHaltedUntil(null);
            state.setHaltReason(null);
        }
        pending.add(TransitionEvent.of(now, TransitionType.ROLLOVER, null, "account", "trading date " + tradingDate)
                .before("baseline", before).before("date", last)
                .after("baseline", baseline).after("date", tradingDate));
        log.info("[DrawdownGuard] ROLLOVER date={} baseline {} -> {}", tradingDate,
                String.format("%.2f", before), String.format("%.2f", baseline));
    }

    private void halt(AccountState state, Instant now, String reason) {
        state.setHaltedUntil(calendar.nextRollover(now));
        state.setHaltReason(reason);
        log.error("[DrawdownGuard] HALT until {}: {}. Closing all positions.", state.getHaltedUntil(), reason);
    }

    private void warnWithCooldown(Instant now, DrawdownSnapshot dd) {
        if (lastWarningLog == null || Duration.between(lastWarningLog, now).compareTo(props.getWarningCooldown()) >= 0) {
            lastWarningLog = now;
            log.warn("RISK_WARNING ddd={}% tdd={}% equity={}", String.format("%.2f", dd.dailyDdPct()),
                    String.format("%.2f", dd.totalDdPct()), String.format("%.2f", dd.equity()));
        }
    }

    DailyDrawdownTier dailyTierFor(double ddPct) {
        double pct = reported(ddPct);
        if (pct >= props.getDailyHaltPct()) {
            return DailyDrawdownTier.HALT;
        }
        if (pct >= props.getDailyReducePct()) {
            return DailyDrawdownTier.REDUCE;
        }
        if (pct >= props.getDailyWarningPct()) {
            return DailyDrawdownTier.WARNING;
        }
        return DailyDrawdownTier.NORMAL;
    }

    TotalDrawdownTier totalTierFor(double ddPct) {
        double pct = reported(ddPct);
        if (pct >= props.getTotalStopOutPct()) {
            return TotalDrawdownTier.STOP_OUT;
        }
        if (pct >= props.getTotalEmergencyPct()) {
            return TotalDrawdownTier.EMERGENCY;
        }
        if (pct >= props.getTotalWarningPct()) {
            return TotalDrawdownTier.WARNING;
        }
        return TotalDrawdownTier.NORMAL;
    }

    private static double reported(double pct) {
        return Math.round(pct * 100.0) / 100.0;
    }
}
