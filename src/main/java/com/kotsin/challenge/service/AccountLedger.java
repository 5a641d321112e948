package com.kotsin.challenge.service;

import com.kotsin.challenge.config.EngineProperties;
import com.kotsin.challenge.model.AccountState;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Single serialization point for {@link AccountState}. Every read-then-write of balance or
 * equity goes through this lock; callers only ever see copies.
 */
@Service
@Slf4j
public class AccountLedger {

    private final ReentrantLock lock = new ReentrantLock();
    private AccountState state;

    public AccountLedger(EngineProperties properties, TradingCalendar calendar) {
        this.state = AccountState.opening(properties.getAccount().getInitialBalance(), calendar.currentTradingDate());
    }

    public AccountState snapshot() {
        lock.lock();
        try {
            return state.copy();
        } finally {
            lock.unlock();
        }
    }

    public void restore(AccountState restored) {
        lock.lock();
        try {
            this.state = restored.copy();
            log.info("ACCOUNT_RESTORED initial={} balance={} baseline={} rollover={}",
                    restored.getInitialBalance(), restored.getBalance(),
                    restored.getDayStartBaseline(), restored.getLastRolloverDate());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Books realized P&L straight into balance. Equity already carried it as floating P&L.
     */
    public double bookRealized(String positionId, double pnl) {
        lock.lock();
        try {
            double before = state.getBalance();
            state.setBalance(before + pnl);
            log.info("ACCOUNT_PNL_CREDIT position={} pnl={} balanceBefore={} balanceAfter={}",
                    positionId, String.format("%.2f", pnl), String.format("%.2f", before),
                    String.format("%.2f", state.getBalance()));
            return state.getBalance();
        } finally {
            lock.unlock();
        }
    }

    public void recordTradeOutcome(double tradePnl) {
        lock.lock();
        try {
            state.setClosedTrades(state.getClosedTrades() + 1);
            if (tradePnl > 0) {
                state.setWinStreak(state.getWinStreak() + 1);
                state.setLossStreak(0);
            } else if (tradePnl < 0) {
                state.setLossStreak(state.getLossStreak() + 1);
                state.setWinStreak(0);
            }
        } finally {
            lock.unlock();
        }
    }

    public AccountState markToMarket(double floatingPnl) {
        lock.lock();
        try {
            state.setEquity(state.getBalance() + floatingPnl);
            state.setPeakEquity(Math.max(state.getPeakEquity(), state.getEquity()));
            return state.copy();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Runs a read-modify-write against the live state under the ledger lock.
     */
    public <T> T update(Function<AccountState, T> mutation) {
        lock.lock();
        try {
            return mutation.apply(state);
        } finally {
            lock.unlock();
        }
    }

    public LocalDate lastRolloverDate() {
        return snapshot().getLastRolloverDate();
    }
}
