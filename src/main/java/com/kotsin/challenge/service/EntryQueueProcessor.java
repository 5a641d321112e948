package com.kotsin.challenge.service;

import com.kotsin.challenge.broker.BrokerException;
import com.kotsin.challenge.broker.BrokerOrder;
import com.kotsin.challenge.broker.ExecutionGateway;
import com.kotsin.challenge.broker.OrderRejectedException;
import com.kotsin.challenge.broker.OrderStatus;
import com.kotsin.challenge.broker.Quote;
import com.kotsin.challenge.config.EngineProperties;
import com.kotsin.challenge.event.TransitionType;
import com.kotsin.challenge.model.Direction;
import com.kotsin.challenge.model.EntryState;
import com.kotsin.challenge.model.InstrumentSpec;
import com.kotsin.challenge.model.QueuedEntry;
import com.kotsin.challenge.state.StateCheckpointer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-tick driver for the entry queue: classifies waiting entries, watches resting limit orders
 * and resolves placements with an unknown outcome. A venue failure only affects its own symbol.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class EntryQueueProcessor {

    private final EntryQueue entryQueue;
    private final ProximityClassifier classifier;
    private final FillEngine fillEngine;
    private final ExecutionGateway gateway;
    private final InstrumentCatalog catalog;
    private final EngineProperties properties;
    private final StateCheckpointer checkpointer;
    private final SymbolLockRegistry locks;

    public void process(Map<String, Quote> quotes, Instant now) {
        for (QueuedEntry entry : entryQueue.active()) {
            Quote quote = quotes.get(entry.getSymbol());
            if (quote == null) {
                continue;
            }
            ReentrantLock lock = locks.lockFor(entry.getSymbol());
            lock.lock();
            try {
                if (entry.isActive()) {
                    processEntry(entry, quote, now);
                }
            } catch (BrokerException e) {
                log.warn("[EntryQueue] {} skipped this tick: {}", entry.getSymbol(), e.getMessage());
            } finally {
                lock.unlock();
            }
        }
    }

    /**
     * Pulls every resting limit order from the venue and returns its entry to waiting. Used when
     * the guard halts trading or enters the reduce tier.
     */
    public void demoteAllPending(String reason, Instant now) {
        for (QueuedEntry entry : entryQueue.active()) {
            if (entry.getState() != EntryState.PENDING) {
                continue;
            }
            ReentrantLock lock = locks.lockFor(entry.getSymbol());
            lock.lock();
            try {
                demote(entry, reason, now);
            } catch (BrokerException e) {
                log.warn("[EntryQueue] Could not pull order {} for {}: {}", entry.getOrderId(), entry.getSymbol(), e.getMessage());
            } finally {
                lock.unlock();
            }
        }
    }

    private void processEntry(QueuedEntry entry, Quote quote, Instant now) {
        if (entry.hasInFlightPlacement()) {
            fillEngine.resolveInFlight(entry, now);
            return;
        }
        if (entry.getState() == EntryState.PENDING) {
            pollPending(entry, quote, now);
            return;
        }

        double price = referencePrice(entry, quote);
        EntryAction action = classifier.classify(entry, price, now);
        switch (action) {
            case IMMEDIATE -> immediate(entry, quote, price, now);
            case PROMOTE_TO_LIMIT -> fillEngine.placeLimit(entry, now);
            case EXPIRE -> {
                entryQueue.transition(entry, EntryState.EXPIRED, TransitionType.ENTRY_EXPIRED,
                        "not reached within " + maxWaitFor(entry), now);
                checkpointer.checkpoint("entry expired");
            }
            case CANCEL -> {
                entryQueue.transition(entry, EntryState.CANCELLED, TransitionType.ENTRY_CANCELLED,
                        String.format("price %.5f beyond %.2fR", price, properties.getEntry().getMaxDistanceR()), now);
                checkpointer.checkpoint("entry cancelled");
            }
            case KEEP -> {
            }
        }
    }

    private void immediate(QueuedEntry entry, Quote quote, double price, Instant now) {
        InstrumentSpec spec = catalog.spec(entry.getSymbol());
        double spreadPips = spec.toPips(quote.spread());
        double maxSpread = properties.getEntry().maxSpreadPipsFor(entry.getSymbol());
        if (spreadPips > maxSpread + 1e-9) {
            entry.setSpreadRetries(entry.getSpreadRetries() + 1);
            if (entry.getState() != EntryState.AWAITING_SPREAD) {
                entry.setSpreadWaitSince(now);
                entryQueue.transition(entry, EntryState.AWAITING_SPREAD, TransitionType.ENTRY_SPREAD_WAIT,
                        String.format("spread %.1f pips > %.1f", spreadPips, maxSpread), now);
                checkpointer.checkpoint("spread wait");
            } else {
                log.debug("[EntryQueue] {} spread still {} pips (retry {})", entry.getSymbol(), spreadPips, entry.getSpreadRetries());
            }
            return;
        }
        fillEngine.fill(entry, price, now);
    }

    private void pollPending(QueuedEntry entry, Quote quote, Instant now) {
        BrokerOrder order = gateway.orderStatus(entry.getOrderId());
        switch (order.status()) {
            case FILLED -> fillEngine.completeLimitFill(entry, order, now);
            case CANCELLED, REJECTED -> {
                entryQueue.transition(entry, EntryState.CANCELLED, TransitionType.ENTRY_CANCELLED,
                        "order " + order.status() + " at venue", now);
                checkpointer.checkpoint("order closed at venue");
            }
            case OPEN -> {
                Direction direction = entry.getSignal().direction();
                if (properties.getEntry().isCancelPendingOnStopBreach()
                        && direction.isStopCrossed(entry.getSignal().stopPrice(), quote.high(), quote.low())) {
                    cancelPending(entry, EntryState.CANCELLED, TransitionType.ENTRY_CANCELLED,
                            "price breached stop before fill", now);
                } else if (Duration.between(entry.getOrderPlacedAt(), now)
                        .compareTo(properties.getEntry().getPendingOrderExpiry()) >= 0) {
                    cancelPending(entry, EntryState.EXPIRED, TransitionType.ENTRY_EXPIRED,
                            "limit order unfilled after " + properties.getEntry().getPendingOrderExpiry(), now);
                }
            }
        }
    }

    private void cancelPending(QueuedEntry entry, EntryState to, TransitionType type, String reason, Instant now) {
        BrokerOrder after = pullOrder(entry);
        if (after.status() == OrderStatus.FILLED) {
            fillEngine.completeLimitFill(entry, after, now);
            return;
        }
        entryQueue.transition(entry, to, type, reason, now);
        checkpointer.checkpoint(reason);
    }

    private void demote(QueuedEntry entry, String reason, Instant now) {
        BrokerOrder after = pullOrder(entry);
        if (after.status() == OrderStatus.FILLED) {
            fillEngine.completeLimitFill(entry, after, now);
            return;
        }
        String orderId = entry.getOrderId();
        entry.setOrderId(null);
        entry.setOrderPlacedAt(null);
        entry.setOrderSize(0);
        entryQueue.transition(entry, EntryState.AWAITING_PROXIMITY, TransitionType.ENTRY_DEMOTED,
                reason + " (order " + orderId + " pulled)", now);
        checkpointer.checkpoint("entry demoted");
    }

    /** Cancels at the venue, then re-reads the order: it may have filled in between. */
    private BrokerOrder pullOrder(QueuedEntry entry) {
        try {
            gateway.cancelOrder(entry.getOrderId());
        } catch (OrderRejectedException e) {
            log.info("[EntryQueue] Cancel of {} refused ({}); re-reading status", entry.getOrderId(), e.getMessage());
        }
        return gateway.orderStatus(entry.getOrderId());
    }

    /** Longs are triggered off the bid, shorts off the ask. */
    private static double referencePrice(QueuedEntry entry, Quote quote) {
        return entry.getSignal().direction() == Direction.LONG ? quote.bid() : quote.ask();
    }

    private Duration maxWaitFor(QueuedEntry entry) {
        Duration maxWait = properties.getEntry().getMaxWait();
        if (entry.getState() == EntryState.AWAITING_SPREAD) {
            Duration spreadWait = properties.getEntry().getSpreadRetryMaxWait();
            return spreadWait.compareTo(maxWait) < 0 ? spreadWait : maxWait;
        }
        return maxWait;
    }
}
