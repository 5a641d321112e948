package com.kotsin.challenge.service;

import com.kotsin.challenge.broker.BrokerException;
import com.kotsin.challenge.broker.ExecutionGateway;
import com.kotsin.challenge.broker.Fill;
import com.kotsin.challenge.broker.OrderRejectedException;
import com.kotsin.challenge.broker.Quote;
import com.kotsin.challenge.config.EngineProperties;
import com.kotsin.challenge.event.TransitionEvent;
import com.kotsin.challenge.event.TransitionEventPublisher;
import com.kotsin.challenge.event.TransitionType;
import com.kotsin.challenge.model.ClosedTrade;
import com.kotsin.challenge.model.Direction;
import com.kotsin.challenge.model.InstrumentSpec;
import com.kotsin.challenge.model.Position;
import com.kotsin.challenge.model.PositionLevel;
import com.kotsin.challenge.state.EngineStateRepository;
import com.kotsin.challenge.state.StateCheckpointer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Manages open positions tick by tick: partial take-profits, the ratcheting stop and final exits.
 * <p>
 * The stop only ever tightens. A take-profit level is marked hit only after the venue confirmed
 * the partial close, so a failed close is simply retried on the next tick.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PositionManager {

    private final PositionBook positionBook;
    private final ExecutionGateway gateway;
    private final AccountLedger ledger;
    private final InstrumentCatalog catalog;
    private final EngineProperties properties;
    private final TransitionEventPublisher events;
    private final EngineStateRepository repository;
    private final StateCheckpointer checkpointer;

    // Last bar applied per position id; touched only from the tick thread
    private final Map<String, Quote> lastApplied = new HashMap<>();

    /**
     * Applies each symbol's latest bar to its positions. A bar already applied to a position is
     * not applied again, so an idle tick with no new market data never re-reads an old high/low.
     */
    public void evaluateAll(Map<String, Quote> quotes, Instant now) {
        List<Position> open = positionBook.all();
        lastApplied.keySet().retainAll(open.stream().map(Position::getPositionId).collect(Collectors.toSet()));
        for (Position position : open) {
            Quote quote = quotes.get(position.getSymbol());
            if (quote == null) {
                continue;
            }
            position.setLastPrice(exitSidePrice(position.getDirection(), quote));
            if (quote.equals(lastApplied.get(position.getPositionId()))) {
                continue;
            }
            try {
                onPriceUpdate(position, quote.high(), quote.low(), now);
                lastApplied.put(position.getPositionId(), quote);
            } catch (BrokerException e) {
                log.warn("[PositionManager] {} {} skipped this tick: {}", position.getSymbol(),
                        position.getPositionId(), e.getMessage());
            }
        }
    }

    /**
     * Applies one bar to a position. The stop is checked first, against the stop in force before
     * this bar; a stop moved by this bar is only enforced from the next one.
     */
    public void onPriceUpdate(Position position, double high, double low, Instant now) {
        Direction direction = position.getDirection();
        if (position.getCurrentStop() > 0 && direction.isStopCrossed(position.getCurrentStop(), high, low)) {
            closeRemaining(position, "stop hit @" + position.getCurrentStop(), null, now);
            return;
        }
        if (position.isDegraded()) {
            return;
        }

        Optional<PositionLevel> next = position.firstUnhitLevel();
        if (next.isPresent() && direction.isTargetCrossed(next.get().getTargetPrice(), high, low)) {
            takeProfit(position, next.get(), now);
            if (!positionBook.get(position.getPositionId()).isPresent()) {
                return;
            }
        }
        progressiveTrail(position, high, low, now);
    }

    /**
     * Closes every open position. Positions the venue could not close stay in the book and are
     * retried on the next call.
     *
     * @return positions still open
     */
    public int closeAll(String reason, Instant now) {
        for (Position position : positionBook.all()) {
            try {
                closeRemaining(position, reason, null, now);
            } catch (BrokerException e) {
                log.error("[PositionManager] Forced close of {} {} failed, retrying next tick: {}",
                        position.getSymbol(), position.getPositionId(), e.getMessage());
            }
        }
        return positionBook.size();
    }

    /** Closes what is left of one position at the venue's price. */
    public void close(Position position, String reason, Instant now) {
        closeRemaining(position, reason, null, now);
    }

    /**
     * Closes a fraction of the remaining size, rounded to the lot step. A cut that would leave less
     * than a step closes the position; one smaller than a step does nothing.
     */
    public void reduce(Position position, double fraction, String reason, Instant now) {
        InstrumentSpec spec = catalog.spec(position.getSymbol());
        double remainingBefore = position.getRemainingSize();
        double closeSize = spec.normalize(Math.round(fraction * remainingBefore / spec.lotStep()) * spec.lotStep());
        if (closeSize < spec.lotStep() - 1e-9) {
            log.info("REDUCE_SKIPPED position={} size={} below one step", position.getPositionId(), remainingBefore);
            return;
        }
        if (spec.isEffectivelyZero(remainingBefore - closeSize)) {
            closeRemaining(position, reason, null, now);
            return;
        }
        Fill fill = gateway.partialClose(position.getHandle(), closeSize);
        double pnl = spec.pnl(position.getDirection(), position.getEntryPrice(), fill.price(), closeSize);
        position.setRemainingSize(spec.normalize(remainingBefore - closeSize));
        position.setRealizedPnl(position.getRealizedPnl() + pnl);
        ledger.bookRealized(position.getPositionId(), pnl);
        events.publish(TransitionEvent.of(now, TransitionType.POSITION_TRIMMED, position.getSymbol(), position.getPositionId(), reason)
                .before("remaining", remainingBefore)
                .after("remaining", position.getRemainingSize())
                .after("pnl", pnl)
                .after("price", fill.price()));
        log.info("POSITION_REDUCED symbol={} position={} closed={} remaining={} reason={}", position.getSymbol(),
                position.getPositionId(), closeSize, position.getRemainingSize(), reason);
        checkpointer.checkpoint("position reduced");
    }

    public double floatingPnl(Map<String, Quote> quotes) {
        double total = 0.0;
        for (Position position : positionBook.all()) {
            Quote quote = quotes.get(position.getSymbol());
            double mark = quote != null ? exitSidePrice(position.getDirection(), quote) : position.getLastPrice();
            if (mark <= 0) {
                continue;
            }
            InstrumentSpec spec = catalog.spec(position.getSymbol());
            total += spec.pnl(position.getDirection(), position.getEntryPrice(), mark, position.getRemainingSize());
        }
        return total;
    }

    // ===== TAKE PROFIT =====

    private void takeProfit(Position position, PositionLevel level, Instant now) {
        InstrumentSpec spec = catalog.spec(position.getSymbol());
        double closeSize = Math.max(spec.lotStep(),
                spec.normalize(Math.round(level.getCloseFraction() * position.getOriginalSize() / spec.lotStep()) * spec.lotStep()));
        boolean finalClose = position.isLastLevel(level)
                || closeSize >= position.getRemainingSize() - 1e-9
                || spec.isEffectivelyZero(position.getRemainingSize() - closeSize);

        if (finalClose) {
            level.setHit(true);
            try {
                closeRemaining(position, "final take-profit " + level.getTargetR() + "R", level.getTargetPrice(), now);
            } catch (BrokerException e) {
                level.setHit(false);
                throw e;
            }
            return;
        }

        try {
            gateway.partialClose(position.getHandle(), closeSize);
        } catch (BrokerException e) {
            log.warn("TP_PARTIAL_FAILED position={} level={}R size={} reason={}", position.getPositionId(),
                    level.getTargetR(), closeSize, e.getMessage());
            return;
        }

        double pnl = spec.pnl(position.getDirection(), position.getEntryPrice(), level.getTargetPrice(), closeSize);
        double remainingBefore = position.getRemainingSize();
        position.setRemainingSize(spec.normalize(remainingBefore - closeSize));
        position.setRealizedPnl(position.getRealizedPnl() + pnl);
        level.setHit(true);
        ledger.bookRealized(position.getPositionId(), pnl);

        events.publish(TransitionEvent.of(now, TransitionType.TAKE_PROFIT_HIT, position.getSymbol(), position.getPositionId(),
                        "TP " + level.getTargetR() + "R closed " + closeSize)
                .before("remaining", remainingBefore)
                .after("remaining", position.getRemainingSize())
                .after("pnl", pnl)
                .after("price", level.getTargetPrice()));
        log.info("TP_HIT symbol={} level={}R closed={} remaining={} pnl={}", position.getSymbol(), level.getTargetR(),
                closeSize, position.getRemainingSize(), String.format("%.2f", pnl));

        int index = position.getLevels().indexOf(level);
        double candidate = index == 0
                ? position.getEntryPrice()
                : position.getLevels().get(index - 1).getTargetPrice()
                        + position.getDirection().sign() * properties.getExits().getRatchetBufferR() * position.riskDistance();
        ratchet(position, candidate, "TP" + (index + 1), now);
        checkpointer.checkpoint("take profit");
    }

    /** After TP1 and before TP2, reaching the trigger R locks the stop at the TP1 price. */
    private void progressiveTrail(Position position, double high, double low, Instant now) {
        double triggerR = properties.getExits().getProgressiveTrailTriggerR();
        if (triggerR <= 0 || position.hitCount() != 1 || position.getLevels().size() < 2) {
            return;
        }
        PositionLevel first = position.getLevels().get(0);
        if (triggerR <= first.getTargetR()) {
            return;
        }
        if (position.getDirection().isTargetCrossed(position.priceAtR(triggerR), high, low)) {
            if (ratchet(position, first.getTargetPrice(), "progressive " + triggerR + "R", now)) {
                checkpointer.checkpoint("progressive trail");
            }
        }
    }

    private boolean ratchet(Position position, double candidate, String rule, Instant now) {
        double before = position.getCurrentStop();
        if (!position.ratchetStop(candidate)) {
            return false;
        }
        events.publish(TransitionEvent.of(now, TransitionType.STOP_RATCHETED, position.getSymbol(), position.getPositionId(), rule)
                .before("stop", before)
                .after("stop", position.getCurrentStop()));
        try {
            gateway.modifyStop(position.getHandle(), position.getCurrentStop());
        } catch (BrokerException e) {
            // The engine enforces the local stop itself; the venue copy catches up on a later ratchet
            log.warn("STOP_SYNC_FAILED position={} stop={} reason={}", position.getPositionId(),
                    position.getCurrentStop(), e.getMessage());
        }
        return true;
    }

    // ===== EXITS =====

    /**
     * Closes what is left of a position and archives it.
     *
     * @param bookPrice price to realize at, or null for the venue's fill price
     */
    private void closeRemaining(Position position, String reason, Double bookPrice, Instant now) {
        InstrumentSpec spec = catalog.spec(position.getSymbol());
        double price;
        try {
            Fill fill = gateway.close(position.getHandle());
            price = bookPrice != null ? bookPrice : fill.price();
        } catch (OrderRejectedException e) {
            // Venue no longer holds it, typically closed by its own stop
            price = bookPrice != null ? bookPrice : position.getCurrentStop() > 0 ? position.getCurrentStop() : position.getLastPrice();
            log.warn("CLOSE_ALREADY_GONE position={} handle={} assuming exit @{}: {}", position.getPositionId(),
                    position.getHandle(), price, e.getMessage());
        }

        double size = position.getRemainingSize();
        double pnl = spec.pnl(position.getDirection(), position.getEntryPrice(), price, size);
        position.setRealizedPnl(position.getRealizedPnl() + pnl);
        position.setRemainingSize(0.0);
        ledger.bookRealized(position.getPositionId(), pnl);
        ledger.recordTradeOutcome(position.getRealizedPnl());
        positionBook.remove(position.getPositionId());

        ClosedTrade trade = ClosedTrade.builder()
                .positionId(position.getPositionId())
                .symbol(position.getSymbol())
                .direction(position.getDirection())
                .entryPrice(position.getEntryPrice())
                .exitPrice(price)
                .originalSize(position.getOriginalSize())
                .riskAmount(position.getRiskAmountAtFill())
                .realizedPnl(position.getRealizedPnl())
                .resultR(position.getRiskAmountAtFill() > 0 ? position.getRealizedPnl() / position.getRiskAmountAtFill() : 0.0)
                .levelsHit(position.hitCount())
                .closedFraction(position.hitFractionSum())
                .openedAt(position.getOpenedAt())
                .closedAt(now)
                .reason(reason)
                .degraded(position.isDegraded())
                .build();
        try {
            repository.appendClosedTrade(trade);
        } catch (RuntimeException e) {
            log.error("CLOSED_TRADE_ARCHIVE_FAILED position={} trade={} error={}", position.getPositionId(), trade, e.getMessage(), e);
        }

        events.publish(TransitionEvent.of(now, TransitionType.POSITION_CLOSED, position.getSymbol(), position.getPositionId(), reason)
                .before("remaining", size)
                .after("remaining", 0.0)
                .after("exitPrice", price)
                .after("realizedPnl", position.getRealizedPnl()));
        log.info("POSITION_CLOSED symbol={} position={} reason={} exit={} pnl={}", position.getSymbol(),
                position.getPositionId(), reason, price, String.format("%.2f", position.getRealizedPnl()));
        checkpointer.checkpoint("position closed");
    }

    private static double exitSidePrice(Direction direction, Quote quote) {
        return direction == Direction.LONG ? quote.bid() : quote.ask();
    }
}
