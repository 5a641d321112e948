package com.kotsin.challenge.service;

import com.kotsin.challenge.broker.BrokerException;
import com.kotsin.challenge.broker.ExecutionGateway;
import com.kotsin.challenge.broker.Quote;
import com.kotsin.challenge.model.AccountState;
import com.kotsin.challenge.model.Position;
import com.kotsin.challenge.model.QueuedEntry;
import com.kotsin.challenge.model.Signal;
import com.kotsin.challenge.risk.DrawdownGuard;
import com.kotsin.challenge.risk.GuardDecision;
import com.kotsin.challenge.risk.WeekendGapGuard;
import com.kotsin.challenge.state.ReconcileReport;
import com.kotsin.challenge.state.RecoveryService;
import com.kotsin.challenge.state.StateCheckpointer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Drives one evaluation per tick, in a fixed order: mark to market, drawdown guard (and any
 * forced liquidation), Friday weekend protection, entry queue unless halted, open positions,
 * then persist.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ChallengeEngine {

    private final Clock clock;
    private final ExecutionGateway gateway;
    private final EntryQueue entryQueue;
    private final EntryQueueProcessor entryQueueProcessor;
    private final PositionManager positionManager;
    private final PositionBook positionBook;
    private final AccountLedger ledger;
    private final DrawdownGuard drawdownGuard;
    private final WeekendGapGuard weekendGapGuard;
    private final RecoveryService recoveryService;
    private final StateCheckpointer checkpointer;

    private final ReentrantLock tickLock = new ReentrantLock();
    private volatile boolean recovered;

    public record TickReport(Instant at, GuardDecision decision, int openPositions, int activeEntries, double equity) {
    }

    /**
     * Loads the snapshot and reconciles with the venue. Until this succeeds ticks keep retrying it.
     */
    public Optional<ReconcileReport> start() {
        tickLock.lock();
        try {
            if (recovered) {
                return Optional.empty();
            }
            ReconcileReport report = recoveryService.recover(clock.instant());
            recovered = true;
            return Optional.of(report);
        } catch (BrokerException e) {
            log.error("[Engine] Recovery failed, will retry on next tick: {}", e.getMessage(), e);
            return Optional.empty();
        } finally {
            tickLock.unlock();
        }
    }

    public boolean isStarted() {
        return recovered;
    }

    /**
     * Queues a signal. Runs under the tick lock so the queue and its checkpoint never interleave
     * with a tick.
     */
    public EntryQueue.SubmitResult submit(Signal signal) {
        tickLock.lock();
        try {
            EntryQueue.SubmitResult result = entryQueue.submit(signal, clock.instant());
            if (result.isAccepted()) {
                checkpointer.checkpoint("signal queued");
            }
            return result;
        } finally {
            tickLock.unlock();
        }
    }

    /** Copies of the active entries, taken between ticks. */
    public List<QueuedEntry> queueView() {
        tickLock.lock();
        try {
            List<QueuedEntry> out = new ArrayList<>();
            entryQueue.active().forEach(entry -> out.add(entry.copy()));
            return out;
        } finally {
            tickLock.unlock();
        }
    }

    /** Copies of the open positions, taken between ticks. */
    public List<Position> positionsView() {
        tickLock.lock();
        try {
            List<Position> out = new ArrayList<>();
            positionBook.all().forEach(position -> out.add(position.copy()));
            return out;
        } finally {
            tickLock.unlock();
        }
    }

    public Optional<TickReport> tick() {
        tickLock.lock();
        try {
            if (!recovered) {
                start();
                if (!recovered) {
                    return Optional.empty();
                }
            }
            Instant now = clock.instant();
            AccountState before = ledger.snapshot();

            Map<String, Quote> quotes = fetchQuotes();
            ledger.markToMarket(positionManager.floatingPnl(quotes));

            GuardDecision decision = drawdownGuard.evaluate(now, !positionBook.isEmpty());
            if (decision.closeAll()) {
                int left = positionManager.closeAll(decision.reason(), now);
                if (left > 0) {
                    log.error("[Engine] {} positions still open after forced close; retrying next tick", left);
                }
            }
            if (decision.demotePending()) {
                entryQueueProcessor.demoteAllPending(
                        decision.halted() ? "trading halted: " + decision.reason() : "daily drawdown reduce tier", now);
            }
            if (!decision.closeAll()) {
                protectWeekend(decision, now);
            }
            if (!decision.halted()) {
                entryQueueProcessor.process(quotes, now);
            }
            positionManager.evaluateAll(quotes, now);

            AccountState after = ledger.markToMarket(positionManager.floatingPnl(quotes));
            if (accountChanged(before, after)) {
                checkpointer.checkpoint("account state changed");
            }
            return Optional.of(new TickReport(now, decision, positionBook.size(), entryQueue.active().size(), after.getEquity()));
        } finally {
            tickLock.unlock();
        }
    }

    private void protectWeekend(GuardDecision decision, Instant now) {
        if (!positionBook.isEmpty() && weekendGapGuard.shouldCloseAll(now, decision.drawdown().dailyDdPct())) {
            int left = positionManager.closeAll("weekend gap protection", now);
            if (left > 0) {
                log.error("[Engine] {} positions still open after weekend close; retrying next tick", left);
            }
            return;
        }
        if (!weekendGapGuard.isReviewDue(now, ledger.snapshot().getLastWeekendReview())) {
            return;
        }
        WeekendGapGuard.WeekendPlan plan = weekendGapGuard.plan(positionBook.all(), now);
        for (Position position : plan.close()) {
            try {
                positionManager.close(position, "weekend gap review", now);
            } catch (BrokerException e) {
                log.error("[Engine] Weekend close of {} {} failed: {}", position.getSymbol(), position.getPositionId(), e.getMessage());
            }
        }
        for (Position position : plan.reduce()) {
            try {
                positionManager.reduce(position, weekendGapGuard.reduceFraction(), "weekend gap review", now);
            } catch (BrokerException e) {
                log.error("[Engine] Weekend reduce of {} {} failed: {}", position.getSymbol(), position.getPositionId(), e.getMessage());
            }
        }
        ledger.update(state -> {
            state.setLastWeekendReview(plan.reviewDate());
            return null;
        });
        log.info("[Engine] Weekend review {}: held {}, closed {}, reduced {}", plan.reviewDate(), plan.hold().size(),
                plan.close().size(), plan.reduce().size());
    }

    private Map<String, Quote> fetchQuotes() {
        Set<String> symbols = new LinkedHashSet<>();
        for (QueuedEntry entry : entryQueue.active()) {
            symbols.add(entry.getSymbol());
        }
        for (Position position : positionBook.all()) {
            symbols.add(position.getSymbol());
        }
        Map<String, Quote> quotes = new LinkedHashMap<>();
        for (String symbol : symbols) {
            try {
                quotes.put(symbol, gateway.currentPrice(symbol));
            } catch (BrokerException e) {
                log.warn("[Engine] No quote for {} this tick: {}", symbol, e.getMessage());
            }
        }
        return quotes;
    }

    private static boolean accountChanged(AccountState a, AccountState b) {
        return a.getBalance() != b.getBalance()
                || a.getDayStartBaseline() != b.getDayStartBaseline()
                || !Objects.equals(a.getLastRolloverDate(), b.getLastRolloverDate())
                || a.getDailyTier() != b.getDailyTier()
                || a.getTotalTier() != b.getTotalTier()
                || !Objects.equals(a.getHaltedUntil(), b.getHaltedUntil())
                || a.isStoppedOut() != b.isStoppedOut()
                || a.getTradesToday() != b.getTradesToday()
                || !Objects.equals(a.getLastWeekendReview(), b.getLastWeekendReview());
    }
}
