package com.kotsin.challenge.state;

import com.kotsin.challenge.broker.BrokerException;
import com.kotsin.challenge.broker.BrokerOrder;
import com.kotsin.challenge.broker.BrokerPosition;
import com.kotsin.challenge.broker.ExecutionGateway;
import com.kotsin.challenge.broker.OrderRejectedException;
import com.kotsin.challenge.config.EngineProperties;
import com.kotsin.challenge.event.TransitionEvent;
import com.kotsin.challenge.event.TransitionEventPublisher;
import com.kotsin.challenge.event.TransitionType;
import com.kotsin.challenge.model.EntryState;
import com.kotsin.challenge.model.Position;
import com.kotsin.challenge.model.QueuedEntry;
import com.kotsin.challenge.service.AccountLedger;
import com.kotsin.challenge.service.EntryQueue;
import com.kotsin.challenge.service.FillEngine;
import com.kotsin.challenge.service.InstrumentCatalog;
import com.kotsin.challenge.service.PositionBook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Rebuilds engine state after a restart and reconciles it with the venue.
 * <ul>
 *   <li>positions known to both sides keep their history, with the venue's size</li>
 *   <li>venue positions unknown locally are adopted in degraded mode: stop enforcement only</li>
 *   <li>snapshot positions the venue no longer holds are discarded as stale</li>
 *   <li>resting orders are re-read; over-age waiting entries expire</li>
 *   <li>entries for a symbol that already holds a kept or adopted position are cancelled</li>
 * </ul>
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class RecoveryService {

    private final EngineStateRepository repository;
    private final ExecutionGateway gateway;
    private final EntryQueue entryQueue;
    private final PositionBook positionBook;
    private final AccountLedger ledger;
    private final FillEngine fillEngine;
    private final InstrumentCatalog catalog;
    private final EngineProperties properties;
    private final TransitionEventPublisher events;
    private final StateCheckpointer checkpointer;

    public ReconcileReport recover(Instant now) {
        EngineStateRepository.LoadResult loaded = repository.load();
        EngineSnapshot snapshot = loaded.snapshot();
        for (String key : loaded.quarantinedKeys()) {
            events.publish(TransitionEvent.of(now, TransitionType.RECORD_QUARANTINED, null, key, "record failed to decode"));
        }

        if (snapshot.account() != null) {
            ledger.restore(snapshot.account());
        } else {
            log.warn("[Recovery] No account record; starting from configured initial balance {}",
                    properties.getAccount().getInitialBalance());
        }

        // Venue is read first so a failure here leaves local state untouched
        List<BrokerPosition> venuePositions = gateway.listOpenPositions();
        Map<String, BrokerPosition> venueByHandle = new LinkedHashMap<>();
        venuePositions.forEach(p -> venueByHandle.put(p.handle(), p));

        List<Position> kept = new ArrayList<>();
        int discarded = 0;
        for (Position position : snapshot.positions()) {
            BrokerPosition venue = venueByHandle.get(position.getHandle());
            if (venue == null) {
                discarded++;
                events.publish(TransitionEvent.of(now, TransitionType.POSITION_DISCARDED, position.getSymbol(),
                                position.getPositionId(), "not held at venue")
                        .before("remaining", position.getRemainingSize()));
                log.warn("[Recovery] Discarding stale position {} {} (handle {})", position.getSymbol(),
                        position.getPositionId(), position.getHandle());
                continue;
            }
            if (Math.abs(venue.size() - position.getRemainingSize()) > 1e-9) {
                log.warn("[Recovery] {} size differs: local={} venue={}; using venue", position.getPositionId(),
                        position.getRemainingSize(), venue.size());
                position.setRemainingSize(venue.size());
            }
            kept.add(position);
        }
        positionBook.replaceAll(kept);

        List<QueuedEntry> duplicates = entryQueue.restore(snapshot.entries());
        for (QueuedEntry duplicate : duplicates) {
            events.publish(TransitionEvent.of(now, TransitionType.ENTRY_CANCELLED, duplicate.getSymbol(),
                    duplicate.getEntryId(), "duplicate active entry for symbol in snapshot"));
        }
        int dropped = duplicates.size();
        for (QueuedEntry entry : entryQueue.active()) {
            if (!reconcileEntry(entry, now)) {
                dropped++;
            }
        }

        int adopted = 0;
        for (BrokerPosition venue : venuePositions) {
            if (positionBook.findByHandle(venue.handle()).isEmpty()) {
                adopt(venue, now);
                adopted++;
            }
        }
        dropped += cancelEntriesBehindOpenPositions(now);

        ReconcileReport report = new ReconcileReport(entryQueue.size(), dropped, kept.size(), adopted, discarded,
                loaded.quarantinedKeys());
        checkpointer.checkpoint("recovery");
        events.publish(TransitionEvent.of(now, TransitionType.RECOVERY_COMPLETED, null, "engine", report.toString()));
        log.info("[Recovery] {}", report);
        return report;
    }

    /** @return false if the entry was dropped */
    private boolean reconcileEntry(QueuedEntry entry, Instant now) {
        if (entry.hasInFlightPlacement()) {
            return true;
        }
        if (entry.getState() == EntryState.PENDING) {
            BrokerOrder order;
            try {
                order = gateway.orderStatus(entry.getOrderId());
            } catch (OrderRejectedException e) {
                entryQueue.transition(entry, EntryState.CANCELLED, TransitionType.ENTRY_CANCELLED,
                        "order unknown to venue after restart", now);
                return false;
            }
            switch (order.status()) {
                case FILLED -> fillEngine.completeLimitFill(entry, order, now);
                case OPEN -> {
                    return true;
                }
                default -> {
                    entryQueue.transition(entry, EntryState.CANCELLED, TransitionType.ENTRY_CANCELLED,
                            "order " + order.status() + " while offline", now);
                    return false;
                }
            }
            return true;
        }
        if (entry.age(now).compareTo(properties.getEntry().getMaxWait()) >= 0) {
            entryQueue.transition(entry, EntryState.EXPIRED, TransitionType.ENTRY_EXPIRED, "expired while offline", now);
            return false;
        }
        return true;
    }

    /** @return number of entries cancelled */
    private int cancelEntriesBehindOpenPositions(Instant now) {
        if (!properties.getEntry().isBlockWhilePositionOpen()) {
            return 0;
        }
        int cancelled = 0;
        for (QueuedEntry entry : entryQueue.active()) {
            if (entry.hasInFlightPlacement() || !positionBook.hasOpenPosition(entry.getSymbol())) {
                continue;
            }
            if (entry.getState() == EntryState.PENDING && entry.getOrderId() != null) {
                try {
                    gateway.cancelOrder(entry.getOrderId());
                } catch (BrokerException e) {
                    log.warn("[Recovery] Cancel of resting order {} for {} failed: {}", entry.getOrderId(),
                            entry.getSymbol(), e.getMessage());
                    continue;
                }
            }
            entryQueue.transition(entry, EntryState.CANCELLED, TransitionType.ENTRY_CANCELLED,
                    "symbol already has an open position", now);
            log.warn("[Recovery] Cancelled entry {} for {}: position already open", entry.getEntryId(), entry.getSymbol());
            cancelled++;
        }
        return cancelled;
    }

    private void adopt(BrokerPosition venue, Instant now) {
        double risk = venue.stopLoss() > 0
                ? venue.size() * Math.abs(venue.openPrice() - venue.stopLoss()) * catalog.spec(venue.symbol()).valuePerUnit()
                : 0.0;
        Position position = Position.builder()
                .positionId(UUID.randomUUID().toString())
                .handle(venue.handle())
                .symbol(venue.symbol())
                .direction(venue.direction())
                .entryPrice(venue.openPrice())
                .originalSize(venue.size())
                .remainingSize(venue.size())
                .initialStop(venue.stopLoss())
                .currentStop(venue.stopLoss())
                .riskAmountAtFill(risk)
                .openedAt(venue.openedAt() != null ? venue.openedAt() : now)
                .lastPrice(venue.openPrice())
                .degraded(true)
                .build();
        positionBook.add(position);
        events.publish(TransitionEvent.of(now, TransitionType.POSITION_ADOPTED, venue.symbol(), position.getPositionId(),
                        venue.stopLoss() > 0 ? "adopted, stop enforcement only" : "adopted without stop, needs manual review")
                .after("handle", venue.handle())
                .after("size", venue.size())
                .after("stop", venue.stopLoss()));
        if (venue.stopLoss() <= 0) {
            log.error("[Recovery] Adopted {} {} has NO stop at the venue; manual handling required", venue.symbol(), venue.handle());
        } else {
            log.warn("[Recovery] Adopted unknown venue position {} {} in degraded mode", venue.symbol(), venue.handle());
        }
    }
}
