package com.kotsin.challenge.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.kotsin.challenge.config.EngineProperties;
import com.kotsin.challenge.event.TransitionEvent;
import com.kotsin.challenge.event.TransitionEventPublisher;
import com.kotsin.challenge.event.TransitionType;
import com.kotsin.challenge.model.Direction;
import com.kotsin.challenge.model.EntryState;
import com.kotsin.challenge.model.QueuedEntry;
import com.kotsin.challenge.model.Signal;
import com.kotsin.challenge.model.TakeProfitLevel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns every signal that has not filled yet.
 * <p>
 * A symbol is claimed when its entry is queued and released only when that entry reaches a
 * terminal state, so at most one entry per symbol is ever awaiting proximity, awaiting spread
 * or resting at the venue.
 */
@Service
@Slf4j
public class EntryQueue {

    private final Map<String, QueuedEntry> entries = new ConcurrentHashMap<>();
    private final Map<String, String> activeBySymbol = new ConcurrentHashMap<>();

    private final SymbolLockRegistry locks;
    private final PositionBook positionBook;
    private final EngineProperties properties;
    private final TransitionEventPublisher events;
    private final Cache<String, Boolean> processedSignalsCache;

    public EntryQueue(SymbolLockRegistry locks,
                      PositionBook positionBook,
                      EngineProperties properties,
                      TransitionEventPublisher events,
                      Cache<String, Boolean> processedSignalsCache) {
        this.locks = locks;
        this.positionBook = positionBook;
        this.properties = properties;
        this.events = events;
        this.processedSignalsCache = processedSignalsCache;
    }

    /**
     * Validates and queues a signal. Refused if the symbol already has an active entry.
     */
    public SubmitResult submit(Signal signal, Instant now) {
        Optional<String> invalid = validate(signal);
        if (invalid.isPresent()) {
            return reject(signal, invalid.get(), now);
        }
        if (signal.signalId() != null && processedSignalsCache.getIfPresent(signal.signalId()) != null) {
            log.info("Duplicate signal {} for {} ignored", signal.signalId(), signal.symbol());
            return SubmitResult.rejected("duplicate signal id " + signal.signalId());
        }

        ReentrantLock lock = locks.lockFor(signal.symbol());
        lock.lock();
        try {
            String holder = activeBySymbol.get(signal.symbol());
            if (holder != null) {
                return reject(signal, "symbol already has active entry " + holder, now);
            }
            if (properties.getEntry().isBlockWhilePositionOpen() && positionBook.hasOpenPosition(signal.symbol())) {
                return reject(signal, "symbol already has an open position", now);
            }

            QueuedEntry entry = QueuedEntry.builder()
                    .entryId(UUID.randomUUID().toString())
                    .signal(signal)
                    .queuedAt(now)
                    .state(EntryState.AWAITING_PROXIMITY)
                    .stateChangedAt(now)
                    .build();
            entries.put(entry.getEntryId(), entry);
            activeBySymbol.put(signal.symbol(), entry.getEntryId());
            if (signal.signalId() != null) {
                processedSignalsCache.put(signal.signalId(), Boolean.TRUE);
            }

            events.publish(TransitionEvent.of(now, TransitionType.SIGNAL_QUEUED, signal.symbol(), entry.getEntryId(),
                            "queued " + signal.direction() + " @" + signal.entryPrice())
                    .after("state", EntryState.AWAITING_PROXIMITY)
                    .after("entryPrice", signal.entryPrice())
                    .after("stopPrice", signal.stopPrice()));
            log.info("[EntryQueue] Queued {} {} entry={} stop={} (active: {})", signal.symbol(), signal.direction(),
                    signal.entryPrice(), signal.stopPrice(), activeBySymbol.size());
            return SubmitResult.accepted(entry);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves an entry to a new state. Terminal states drop the entry and release its symbol.
     */
    public void transition(QueuedEntry entry, EntryState to, TransitionType type, String reason, Instant now) {
        ReentrantLock lock = locks.lockFor(entry.getSymbol());
        lock.lock();
        try {
            EntryState from = entry.getState();
            entry.setState(to);
            entry.setStateChangedAt(now);
            if (to.isTerminal()) {
                entry.setCloseReason(reason);
                entries.remove(entry.getEntryId());
                activeBySymbol.remove(entry.getSymbol(), entry.getEntryId());
            }
            events.publish(TransitionEvent.of(now, type, entry.getSymbol(), entry.getEntryId(), reason)
                    .before("state", from)
                    .after("state", to)
                    .after("orderId", entry.getOrderId()));
        } finally {
            lock.unlock();
        }
    }

    /** Active entries, oldest first. */
    public List<QueuedEntry> active() {
        List<QueuedEntry> out = new ArrayList<>(entries.values());
        out.removeIf(e -> !e.isActive());
        out.sort(Comparator.comparing(QueuedEntry::getQueuedAt));
        return out;
    }

    public Optional<QueuedEntry> activeFor(String symbol) {
        String id = activeBySymbol.get(symbol);
        return id == null ? Optional.empty() : Optional.ofNullable(entries.get(id));
    }

    public Optional<QueuedEntry> get(String entryId) {
        return Optional.ofNullable(entries.get(entryId));
    }

    public int size() {
        return entries.size();
    }

    /**
     * Reloads persisted entries. When several active entries claim the same symbol the oldest
     * keeps it and the rest are returned for cancellation.
     */
    public List<QueuedEntry> restore(Collection<QueuedEntry> restored) {
        entries.clear();
        activeBySymbol.clear();
        List<QueuedEntry> duplicates = new ArrayList<>();
        restored.stream()
                .filter(QueuedEntry::isActive)
                .sorted(Comparator.comparing(QueuedEntry::getQueuedAt))
                .forEach(entry -> {
                    if (activeBySymbol.putIfAbsent(entry.getSymbol(), entry.getEntryId()) == null) {
                        entries.put(entry.getEntryId(), entry);
                        if (entry.getSignal().signalId() != null) {
                            processedSignalsCache.put(entry.getSignal().signalId(), Boolean.TRUE);
                        }
                    } else {
                        duplicates.add(entry);
                    }
                });
        log.info("[EntryQueue] Restored {} entries ({} duplicates dropped)", entries.size(), duplicates.size());
        return duplicates;
    }

    private SubmitResult reject(Signal signal, String reason, Instant now) {
        events.publish(TransitionEvent.of(now, TransitionType.SIGNAL_REJECTED, signal.symbol(), signal.signalId(), reason));
        log.warn("[EntryQueue] Rejected signal {} for {}: {}", signal.signalId(), signal.symbol(), reason);
        return SubmitResult.rejected(reason);
    }

    private Optional<String> validate(Signal signal) {
        if (signal.symbol() == null || signal.symbol().isBlank() || signal.direction() == null) {
            return Optional.of("symbol and direction are required");
        }
        if (!(signal.riskDistance() > 0)) {
            return Optional.of("entry price equals stop price");
        }
        boolean stopOnProtectiveSide = signal.direction() == Direction.LONG
                ? signal.stopPrice() < signal.entryPrice()
                : signal.stopPrice() > signal.entryPrice();
        if (!stopOnProtectiveSide) {
            return Optional.of("stop is on the wrong side of entry");
        }
        double fractionSum = 0.0;
        double lastR = 0.0;
        for (TakeProfitLevel level : signal.takeProfits()) {
            if (level.rMultiple() <= lastR) {
                return Optional.of("take-profit targets must be positive and ascending");
            }
            if (level.closeFraction() <= 0) {
                return Optional.of("take-profit close fraction must be positive");
            }
            lastR = level.rMultiple();
            fractionSum += level.closeFraction();
        }
        if (fractionSum > 1.0 + properties.getExits().getFractionTolerance()) {
            return Optional.of(String.format("take-profit fractions sum to %.4f", fractionSum));
        }
        return Optional.empty();
    }

    public static class SubmitResult {
        private final boolean accepted;
        private final String reason;
        private final QueuedEntry entry;

        private SubmitResult(boolean accepted, String reason, QueuedEntry entry) {
            this.accepted = accepted;
            this.reason = reason;
            this.entry = entry;
        }

        public static SubmitResult accepted(QueuedEntry entry) {
            return new SubmitResult(true, "queued", entry);
        }

        public static SubmitResult rejected(String reason) {
            return new SubmitResult(false, reason, null);
        }

        public boolean isAccepted() { return accepted; }
        public String getReason() { return reason; }
        public QueuedEntry getEntry() { return entry; }
    }
}
