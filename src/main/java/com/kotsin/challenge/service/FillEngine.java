package com.kotsin.challenge.service;

import com.kotsin.challenge.broker.BrokerException;
import com.kotsin.challenge.broker.BrokerOrder;
import com.kotsin.challenge.broker.ExecutionGateway;
import com.kotsin.challenge.broker.Fill;
import com.kotsin.challenge.broker.OrderRejectedException;
import com.kotsin.challenge.broker.OrderRequest;
import com.kotsin.challenge.broker.OrderStatus;
import com.kotsin.challenge.config.EngineProperties;
import com.kotsin.challenge.event.TransitionEvent;
import com.kotsin.challenge.event.TransitionEventPublisher;
import com.kotsin.challenge.event.TransitionType;
import com.kotsin.challenge.model.AccountState;
import com.kotsin.challenge.model.EntryState;
import com.kotsin.challenge.model.InstrumentSpec;
import com.kotsin.challenge.model.Position;
import com.kotsin.challenge.model.PositionLevel;
import com.kotsin.challenge.model.QueuedEntry;
import com.kotsin.challenge.model.Signal;
import com.kotsin.challenge.model.TakeProfitLevel;
import com.kotsin.challenge.risk.DrawdownGuard;
import com.kotsin.challenge.state.StateCheckpointer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Turns queued entries into positions.
 * <p>
 * Size is always computed from the account as it is at the moment the order is committed to the
 * venue, never from the account when the signal was generated or queued.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class FillEngine {

    private final ExecutionGateway gateway;
    private final EntryQueue entryQueue;
    private final PositionBook positionBook;
    private final AccountLedger ledger;
    private final DrawdownGuard drawdownGuard;
    private final PositionSizer sizer;
    private final InstrumentCatalog catalog;
    private final EngineProperties properties;
    private final TransitionEventPublisher events;
    private final StateCheckpointer checkpointer;
    private final SymbolLockRegistry locks;

    /**
     * Fills an entry at market. {@code expectedPrice} is the reference price that triggered the fill;
     * the position opens at the venue's reported fill price.
     */
    public FillResult fill(QueuedEntry entry, double expectedPrice, Instant now) {
        ReentrantLock lock = locks.lockFor(entry.getSymbol());
        lock.lock();
        try {
            PreTrade check = preTrade(entry, now);
            if (check.refusal != null) {
                return check.refusal;
            }
            Signal signal = entry.getSignal();
            String clientOrderId = nextClientOrderId(entry, "M");
            OrderRequest request = new OrderRequest(clientOrderId, signal.symbol(), signal.direction(),
                    check.sizing.size(), signal.stopPrice());
            try {
                Fill fill = gateway.placeMarketOrder(request);
                log.info("FILL_OK symbol={} expected={} filled={} size={} risk={}", signal.symbol(), expectedPrice,
                        fill.price(), fill.size(), String.format("%.2f", check.sizing.actualRisk()));
                return FillResult.filled(openPosition(entry, fill.positionHandle(), fill.price(), fill.size(), now));
            } catch (OrderRejectedException e) {
                return dropRejected(entry, e, now);
            } catch (BrokerException e) {
                return markInFlight(entry, clientOrderId, false, e, now);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rests a limit order at the signal's entry price. Sized now, at commit time.
     */
    public FillResult placeLimit(QueuedEntry entry, Instant now) {
        ReentrantLock lock = locks.lockFor(entry.getSymbol());
        lock.lock();
        try {
            PreTrade check = preTrade(entry, now);
            if (check.refusal != null) {
                return check.refusal;
            }
            Signal signal = entry.getSignal();
            String clientOrderId = nextClientOrderId(entry, "L");
            OrderRequest request = new OrderRequest(clientOrderId, signal.symbol(), signal.direction(),
                    check.sizing.size(), signal.stopPrice());
            try {
                String orderId = gateway.placeLimitOrder(request, signal.entryPrice());
                markPending(entry, orderId, check.sizing.size(), now);
                return FillResult.resting(orderId);
            } catch (OrderRejectedException e) {
                return dropRejected(entry, e, now);
            } catch (BrokerException e) {
                return markInFlight(entry, clientOrderId, true, e, now);
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Converts a venue-filled limit order into a position, then brings it to the size the balance
     * allows now: the excess is trimmed if the balance fell while the order rested, and the
     * position is reopened at the larger size if the balance grew.
     */
    public FillResult completeLimitFill(QueuedEntry entry, BrokerOrder order, Instant now) {
        ReentrantLock lock = locks.lockFor(entry.getSymbol());
        lock.lock();
        try {
            Position position = openPosition(entry, order.positionHandle(), order.fillPrice(), order.size(), now);
            resizeToBalance(entry, position, now);
            return FillResult.filled(position);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resolves a placement whose outcome was unknown, by asking the venue for the client order id.
     * Nothing is resubmitted until the venue confirms it never received the order.
     */
    public FillResult resolveInFlight(QueuedEntry entry, Instant now) {
        ReentrantLock lock = locks.lockFor(entry.getSymbol());
        lock.lock();
        try {
            String clientOrderId = entry.getInFlightClientOrderId();
            Optional<BrokerOrder> found;
            try {
                found = gateway.findOrderByClientId(clientOrderId);
            } catch (BrokerException e) {
                log.warn("IN_FLIGHT_LOOKUP_FAILED symbol={} clientOrderId={} reason={}", entry.getSymbol(),
                        clientOrderId, e.getMessage());
                return FillResult.failed(FillError.TRANSIENT, e.getMessage());
            }

            if (found.isEmpty() || found.get().status() == OrderStatus.REJECTED || found.get().status() == OrderStatus.CANCELLED) {
                entry.setInFlightClientOrderId(null);
                log.info("IN_FLIGHT_CLEARED symbol={} clientOrderId={} venue={}", entry.getSymbol(), clientOrderId,
                        found.map(o -> o.status().name()).orElse("NOT_FOUND"));
                checkpointer.checkpoint("in-flight cleared");
                return FillResult.failed(FillError.TRANSIENT, "placement never executed");
            }

            BrokerOrder order = found.get();
            entry.setInFlightClientOrderId(null);
            if (entry.isInFlightLimit()) {
                markPending(entry, order.orderId(), order.size(), now);
                if (order.status() == OrderStatus.FILLED) {
                    return completeLimitFill(entry, order, now);
                }
                return FillResult.resting(order.orderId());
            }
            if (order.status() == OrderStatus.FILLED) {
                log.info("IN_FLIGHT_RECOVERED symbol={} clientOrderId={} handle={}", entry.getSymbol(), clientOrderId,
                        order.positionHandle());
                return FillResult.filled(openPosition(entry, order.positionHandle(), order.fillPrice(), order.size(), now));
            }
            // Market order still working at the venue; look again next tick
            entry.setInFlightClientOrderId(clientOrderId);
            return FillResult.failed(FillError.TRANSIENT, "market order still open at venue");
        } finally {
            lock.unlock();
        }
    }

    // ===== CHECKS =====

    private PreTrade preTrade(QueuedEntry entry, Instant now) {
        Signal signal = entry.getSignal();
        if (drawdownGuard.isFillBlocked(now)) {
            return PreTrade.refused(FillResult.failed(FillError.HALTED, "trading halted"));
        }
        int maxOpen = properties.getSizing().getMaxOpenPositions();
        if (maxOpen > 0 && positionBook.size() >= maxOpen) {
            return PreTrade.refused(FillResult.failed(FillError.MAX_POSITIONS, "max open positions " + maxOpen));
        }

        AccountState account = ledger.snapshot();
        int maxTrades = properties.getSizing().getMaxTradesPerDay();
        if (maxTrades > 0 && account.getTradesToday() >= maxTrades) {
            return PreTrade.refused(FillResult.failed(FillError.MAX_TRADES_PER_DAY,
                    "daily trade limit reached: " + account.getTradesToday()));
        }
        InstrumentSpec spec = catalog.spec(signal.symbol());
        PositionSizer.Sizing sizing = sizer.size(signal, account, drawdownGuard.riskMultiplier(), spec);

        if (sizing.riskAmount() <= 0 || sizing.size() <= 0) {
            return PreTrade.refused(refuse(entry, FillError.SIZE_TOO_SMALL,
                    "no risk budget at balance " + account.getBalance(), now, true));
        }
        if (sizing.violatesSanity()) {
            return PreTrade.refused(refuse(entry, FillError.RISK_SANITY_VIOLATION,
                    String.format("risk %.2f exceeds sanity limit %.2f (size %.2f)",
                            sizing.actualRisk(), sizing.sanityLimit(), sizing.size()), now, true));
        }
        if (properties.getSizing().isPortfolioRiskCapEnabled()) {
            double cap = properties.getSizing().getMaxPortfolioRiskFraction() * account.getBalance();
            double committed = positionBook.committedRisk();
            if (committed + sizing.actualRisk() > cap) {
                return PreTrade.refused(FillResult.failed(FillError.PORTFOLIO_RISK_CAP,
                        String.format("portfolio risk %.2f + %.2f > cap %.2f", committed, sizing.actualRisk(), cap)));
            }
        }
        log.debug("SIZING symbol={} balance={} confluence={} streak={} dd={} risk={} size={}", signal.symbol(),
                account.getBalance(), sizing.confluenceMultiplier(), sizing.streakMultiplier(),
                sizing.drawdownMultiplier(), sizing.riskAmount(), sizing.size());
        return new PreTrade(sizing, null);
    }

    private FillResult refuse(QueuedEntry entry, FillError error, String message, Instant now, boolean dropEntry) {
        log.warn("FILL_REFUSED symbol={} entry={} error={} msg={}", entry.getSymbol(), entry.getEntryId(), error, message);
        events.publish(TransitionEvent.of(now, TransitionType.FILL_REFUSED, entry.getSymbol(), entry.getEntryId(), message)
                .after("error", error));
        if (dropEntry) {
            entryQueue.transition(entry, EntryState.CANCELLED, TransitionType.ENTRY_CANCELLED, error + ": " + message, now);
            checkpointer.checkpoint("fill refused");
        }
        return FillResult.failed(error, message);
    }

    // ===== TRANSITIONS =====

    private Position openPosition(QueuedEntry entry, String handle, double fillPrice, double size, Instant now) {
        Signal signal = entry.getSignal();
        InstrumentSpec spec = catalog.spec(signal.symbol());
        List<TakeProfitLevel> ladder = signal.takeProfits().isEmpty()
                ? properties.getExits().getDefaultLevels()
                : signal.takeProfits();
        List<PositionLevel> levels = new ArrayList<>();
        for (TakeProfitLevel tp : ladder) {
            levels.add(PositionLevel.builder()
                    .targetR(tp.rMultiple())
                    .closeFraction(tp.closeFraction())
                    .targetPrice(signal.priceAtR(tp.rMultiple()))
                    .build());
        }

        Position position = Position.builder()
                .positionId(UUID.randomUUID().toString())
                .handle(handle)
                .entryId(entry.getEntryId())
                .symbol(signal.symbol())
                .direction(signal.direction())
                .entryPrice(fillPrice)
                .originalSize(size)
                .remainingSize(size)
                .initialStop(signal.stopPrice())
                .currentStop(signal.stopPrice())
                .riskAmountAtFill(size * Math.abs(fillPrice - signal.stopPrice()) * spec.valuePerUnit())
                .levels(levels)
                .openedAt(now)
                .lastPrice(fillPrice)
                .build();

        positionBook.add(position);
        ledger.update(s -> {
            s.setTradesToday(s.getTradesToday() + 1);
            return null;
        });
        entryQueue.transition(entry, EntryState.FILLED, TransitionType.ENTRY_FILLED, "filled @" + fillPrice, now);
        events.publish(TransitionEvent.of(now, TransitionType.POSITION_OPENED, position.getSymbol(), position.getPositionId(),
                        position.getDirection() + " " + size + " @" + fillPrice)
                .after("size", size)
                .after("entryPrice", fillPrice)
                .after("stop", position.getCurrentStop())
                .after("riskAmount", position.getRiskAmountAtFill())
                .after("handle", handle));
        checkpointer.checkpoint("position opened");
        return position;
    }

    private void resizeToBalance(QueuedEntry entry, Position position, Instant now) {
        Signal signal = entry.getSignal();
        InstrumentSpec spec = catalog.spec(signal.symbol());
        PositionSizer.Sizing current = sizer.size(signal, ledger.snapshot(), drawdownGuard.riskMultiplier(), spec);
        if (current.size() <= 0) {
            return;
        }
        double diff = spec.normalize(current.size() - position.getRemainingSize());
        if (diff <= -(spec.lotStep() - 1e-9)) {
            trim(position, -diff, now);
        } else if (diff >= spec.lotStep() - 1e-9) {
            reopenAtSize(entry, position, current, now);
        }
    }

    private void trim(Position position, double excess, Instant now) {
        InstrumentSpec spec = catalog.spec(position.getSymbol());
        double sizeBefore = position.getRemainingSize();
        try {
            Fill fill = gateway.partialClose(position.getHandle(), excess);
            double pnl = spec.pnl(position.getDirection(), position.getEntryPrice(), fill.price(), excess);
            position.setRemainingSize(spec.normalize(sizeBefore - excess));
            position.setOriginalSize(position.getRemainingSize());
            position.setRiskAmountAtFill(position.getRemainingSize() * position.riskDistance() * spec.valuePerUnit());
            position.setRealizedPnl(position.getRealizedPnl() + pnl);
            ledger.bookRealized(position.getPositionId(), pnl);
            events.publish(TransitionEvent.of(now, TransitionType.POSITION_TRIMMED, position.getSymbol(),
                            position.getPositionId(), "balance fell since order placement")
                    .before("size", sizeBefore)
                    .after("size", position.getRemainingSize()));
            checkpointer.checkpoint("position trimmed");
        } catch (BrokerException e) {
            log.warn("TRIM_FAILED position={} excess={} reason={}", position.getPositionId(), excess, e.getMessage());
        }
    }

    /**
     * Replaces an undersized position with one at the current size: the replacement is opened
     * first and the original closed after, so the symbol is never left flat by a failed swap.
     */
    private void reopenAtSize(QueuedEntry entry, Position position, PositionSizer.Sizing current, Instant now) {
        Signal signal = entry.getSignal();
        InstrumentSpec spec = catalog.spec(signal.symbol());
        double sizeBefore = position.getRemainingSize();
        if (current.violatesSanity()) {
            log.warn("RESIZE_SKIPPED position={} reason=sanity risk={} limit={}", position.getPositionId(),
                    current.actualRisk(), current.sanityLimit());
            return;
        }
        if (properties.getSizing().isPortfolioRiskCapEnabled()) {
            double cap = properties.getSizing().getMaxPortfolioRiskFraction() * ledger.snapshot().getBalance();
            double others = positionBook.committedRisk() - position.getRiskAmountAtFill();
            if (others + current.actualRisk() > cap) {
                log.info("RESIZE_SKIPPED position={} reason=portfolio cap {} + {} > {}", position.getPositionId(),
                        others, current.actualRisk(), cap);
                return;
            }
        }

        String clientOrderId = nextClientOrderId(entry, "R");
        Fill replacement;
        try {
            replacement = gateway.placeMarketOrder(new OrderRequest(clientOrderId, signal.symbol(), signal.direction(),
                    current.size(), signal.stopPrice()));
        } catch (BrokerException e) {
            log.warn("RESIZE_FAILED position={} clientOrderId={} keeping {} lots: {}", position.getPositionId(),
                    clientOrderId, sizeBefore, e.getMessage());
            return;
        }

        Fill closed;
        try {
            closed = gateway.close(position.getHandle());
        } catch (BrokerException e) {
            log.warn("RESIZE_UNWIND position={} original close failed, closing replacement {}: {}",
                    position.getPositionId(), replacement.positionHandle(), e.getMessage());
            unwindReplacement(position, replacement, now);
            return;
        }

        double pnl = spec.pnl(position.getDirection(), position.getEntryPrice(), closed.price(), sizeBefore);
        String oldHandle = position.getHandle();
        position.setRealizedPnl(position.getRealizedPnl() + pnl);
        ledger.bookRealized(position.getPositionId(), pnl);
        position.setHandle(replacement.positionHandle());
        position.setEntryPrice(replacement.price());
        position.setOriginalSize(replacement.size());
        position.setRemainingSize(replacement.size());
        position.setRiskAmountAtFill(replacement.size() * position.riskDistance() * spec.valuePerUnit());
        position.setLastPrice(replacement.price());

        events.publish(TransitionEvent.of(now, TransitionType.POSITION_RESIZED, position.getSymbol(),
                        position.getPositionId(), "balance grew since order placement")
                .before("size", sizeBefore)
                .before("handle", oldHandle)
                .after("size", position.getRemainingSize())
                .after("handle", position.getHandle())
                .after("entryPrice", position.getEntryPrice())
                .after("riskAmount", position.getRiskAmountAtFill()));
        log.info("POSITION_RESIZED symbol={} position={} size={}->{} entry={}", position.getSymbol(),
                position.getPositionId(), sizeBefore, position.getRemainingSize(), position.getEntryPrice());
        checkpointer.checkpoint("position resized");
    }

    private void unwindReplacement(Position position, Fill replacement, Instant now) {
        try {
            gateway.close(replacement.positionHandle());
        } catch (BrokerException e) {
            double risk = replacement.size() * position.riskDistance() * catalog.spec(position.getSymbol()).valuePerUnit();
            Position stray = Position.builder()
                    .positionId(UUID.randomUUID().toString())
                    .handle(replacement.positionHandle())
                    .symbol(position.getSymbol())
                    .direction(position.getDirection())
                    .entryPrice(replacement.price())
                    .originalSize(replacement.size())
                    .remainingSize(replacement.size())
                    .initialStop(position.getInitialStop())
                    .currentStop(position.getInitialStop())
                    .riskAmountAtFill(risk)
                    .openedAt(now)
                    .lastPrice(replacement.price())
                    .degraded(true)
                    .build();
            positionBook.add(stray);
            events.publish(TransitionEvent.of(now, TransitionType.POSITION_ADOPTED, stray.getSymbol(), stray.getPositionId(),
                            "resize replacement could not be closed, stop enforcement only")
                    .after("handle", stray.getHandle())
                    .after("size", stray.getRemainingSize()));
            log.error("RESIZE_UNWIND_FAILED position={} replacement={} tracked as degraded {}: {}", position.getPositionId(),
                    replacement.positionHandle(), stray.getPositionId(), e.getMessage());
            checkpointer.checkpoint("resize unwind failed");
        }
    }

    private void markPending(QueuedEntry entry, String orderId, double size, Instant now) {
        entry.setOrderId(orderId);
        entry.setOrderPlacedAt(now);
        entry.setOrderSize(size);
        entryQueue.transition(entry, EntryState.PENDING, TransitionType.ENTRY_PROMOTED_TO_LIMIT,
                "limit " + size + " @" + entry.getSignal().entryPrice(), now);
        checkpointer.checkpoint("limit placed");
    }

    private FillResult dropRejected(QueuedEntry entry, OrderRejectedException e, Instant now) {
        log.warn("ORDER_REJECTED symbol={} entry={} reason={}", entry.getSymbol(), entry.getEntryId(), e.getMessage());
        entryQueue.transition(entry, EntryState.CANCELLED, TransitionType.ENTRY_CANCELLED, "rejected: " + e.getMessage(), now);
        checkpointer.checkpoint("order rejected");
        return FillResult.failed(FillError.REJECTED, e.getMessage());
    }

    private FillResult markInFlight(QueuedEntry entry, String clientOrderId, boolean limit, BrokerException e, Instant now) {
        entry.setInFlightClientOrderId(clientOrderId);
        entry.setInFlightLimit(limit);
        log.warn("PLACEMENT_UNCONFIRMED symbol={} clientOrderId={} reason={}", entry.getSymbol(), clientOrderId, e.getMessage());
        events.publish(TransitionEvent.of(now, TransitionType.ENTRY_PLACEMENT_UNCONFIRMED, entry.getSymbol(),
                        entry.getEntryId(), e.getMessage())
                .after("clientOrderId", clientOrderId));
        checkpointer.checkpoint("placement unconfirmed");
        return FillResult.failed(FillError.TRANSIENT, e.getMessage());
    }

    private static String nextClientOrderId(QueuedEntry entry, String kind) {
        entry.setPlacements(entry.getPlacements() + 1);
        return entry.getEntryId() + "-" + kind + entry.getPlacements();
    }

    private static final class PreTrade {
        final PositionSizer.Sizing sizing;
        final FillResult refusal;

        PreTrade(PositionSizer.Sizing sizing, FillResult refusal) {
            this.sizing = sizing;
            this.refusal = refusal;
        }

        static PreTrade refused(FillResult refusal) {
            return new PreTrade(null, refusal);
        }
    }
}
