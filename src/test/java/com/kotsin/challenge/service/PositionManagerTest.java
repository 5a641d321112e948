package com.kotsin.challenge.service;

import com.kotsin.challenge.event.TransitionType;
import com.kotsin.challenge.model.ClosedTrade;
import com.kotsin.challenge.model.Direction;
import com.kotsin.challenge.model.Position;
import com.kotsin.challenge.model.PositionLevel;
import com.kotsin.challenge.paper.PaperExecutionGateway;
import com.kotsin.challenge.support.EngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PositionManagerTest {

    private EngineFixture f;
    private Instant now;

    @BeforeEach
    void setUp() {
        f = new EngineFixture();
        now = f.clock.instant();
    }

    private Position open(Direction direction, double entry, double stop, double size, double[][] ladder) {
        String handle = f.venue.seedPosition("EURUSD", direction, size, entry, stop);
        double r = Math.abs(entry - stop);
        List<PositionLevel> levels = new ArrayList<>();
        for (double[] l : ladder) {
            levels.add(PositionLevel.builder()
                    .targetR(l[0])
                    .closeFraction(l[1])
                    .targetPrice(entry + direction.sign() * l[0] * r)
                    .build());
        }
        Position position = Position.builder()
                .positionId("pos-" + handle)
                .handle(handle)
                .symbol("EURUSD")
                .direction(direction)
                .entryPrice(entry)
                .originalSize(size)
                .remainingSize(size)
                .initialStop(stop)
                .currentStop(stop)
                .riskAmountAtFill(size * r * 100_000)
                .levels(levels)
                .openedAt(now)
                .lastPrice(entry)
                .build();
        f.positionBook.add(position);
        return position;
    }

    // ======================== TAKE PROFIT ========================

    @Test
    @DisplayName("TP at 0.9R closes 20% of 0.40 and moves the stop to breakeven")
    void firstTakeProfitClosesFractionAndRatchetsToBreakeven() {
        Position p = open(Direction.LONG, 1.1000, 1.0950, 0.40, new double[][]{{0.9, 0.2}, {2.0, 0.8}});

        f.positionManager.onPriceUpdate(p, 1.1046, 1.1040, now);

        assertEquals(0.32, p.getRemainingSize(), 1e-9, "0.08 closed");
        assertEquals(1.1000, p.getCurrentStop(), 1e-9, "stop at entry");
        assertTrue(p.getLevels().get(0).isHit());
        assertEquals(36.0, p.getRealizedPnl(), 1e-6, "booked at the 1.1045 target");
        assertEquals(20_036.0, f.ledger.snapshot().getBalance(), 1e-6);
        assertEquals(0.32, f.venue.position(p.getHandle()).orElseThrow().size(), 1e-9);
        assertEquals(1.1000, f.venue.position(p.getHandle()).orElseThrow().stopLoss(), 1e-9, "venue stop synced");
        assertEquals(1, f.count(TransitionType.TAKE_PROFIT_HIT));
    }

    @Test
    @DisplayName("Only one level is taken per bar even if the bar spans several")
    void oneLevelPerBar() {
        Position p = open(Direction.LONG, 1.1000, 1.0950, 0.40, new double[][]{{0.6, 0.35}, {1.2, 0.30}, {2.0, 0.35}});

        f.positionManager.onPriceUpdate(p, 1.1110, 1.1000, now);
        assertEquals(1, p.hitCount());

        f.positionManager.onPriceUpdate(p, 1.1110, 1.1070, now);
        assertEquals(2, p.hitCount());
        assertEquals(p.getLevels().get(0).getTargetPrice() + 0.5 * 0.0050, p.getCurrentStop(), 1e-9,
                "second level ratchets to TP1 plus half R");
    }

    @Test
    @DisplayName("Final level closes whatever remains and archives the trade")
    void finalLevelClosesRemainder() {
        Position p = open(Direction.LONG, 1.1000, 1.0950, 0.40, new double[][]{{0.6, 0.35}, {1.2, 0.30}, {2.0, 0.35}});

        f.positionManager.onPriceUpdate(p, 1.1031, 1.1029, now);
        f.positionManager.onPriceUpdate(p, 1.1061, 1.1059, now);
        f.positionManager.onPriceUpdate(p, 1.1101, 1.1099, now);

        assertTrue(f.positionBook.isEmpty());
        assertTrue(f.venue.position(p.getHandle()).isEmpty());
        List<ClosedTrade> trades = f.repository.closedTrades();
        assertEquals(1, trades.size());
        ClosedTrade trade = trades.get(0);
        assertEquals(3, trade.getLevelsHit());
        assertEquals(1.0, trade.getClosedFraction(), 1e-9);
        // 0.14 @ 0.6R + 0.12 @ 1.2R + 0.14 @ 2.0R, each R = $200 on 0.40 lots
        double expected = 0.14 * 30 * 10 + 0.12 * 60 * 10 + 0.14 * 100 * 10;
        assertEquals(expected, trade.getRealizedPnl(), 1e-6);
        assertEquals(1, f.ledger.snapshot().getWinStreak());
    }

    @Test
    @DisplayName("Progressive trail locks TP1 once price reaches 0.9R")
    void progressiveTrailAfterFirstLevel() {
        Position p = open(Direction.LONG, 1.1000, 1.0950, 0.40, new double[][]{{0.6, 0.35}, {1.2, 0.30}, {2.0, 0.35}});
        f.positionManager.onPriceUpdate(p, 1.1031, 1.1029, now);
        assertEquals(1.1000, p.getCurrentStop(), 1e-9);

        f.positionManager.onPriceUpdate(p, 1.1046, 1.1040, now);

        assertEquals(1.1030, p.getCurrentStop(), 1e-9);
        assertEquals(1, p.hitCount(), "0.9R is short of TP2");
    }

    @Test
    @DisplayName("Stop never loosens for shorts either")
    void shortStopOnlyTightens() {
        Position p = open(Direction.SHORT, 1.1000, 1.1050, 0.40, new double[][]{{0.6, 0.35}, {1.2, 0.30}, {2.0, 0.35}});

        f.positionManager.onPriceUpdate(p, 1.0971, 1.0969, now);
        assertEquals(1.1000, p.getCurrentStop(), 1e-9);

        assertFalse(p.ratchetStop(1.1020), "looser stop refused");
        assertEquals(1.1000, p.getCurrentStop(), 1e-9);
        assertTrue(p.ratchetStop(1.0990));
    }

    @Test
    @DisplayName("Stop is checked before targets, using the stop in force before the bar")
    void stopCheckedFirst() {
        Position p = open(Direction.LONG, 1.1000, 1.0950, 0.40, new double[][]{{0.6, 0.35}, {2.0, 0.65}});
        f.venue.updateQuote("EURUSD", 1.0949, 1.0950);

        f.positionManager.onPriceUpdate(p, 1.1040, 1.0940, now);

        assertTrue(f.positionBook.isEmpty());
        assertEquals(0, p.hitCount(), "no take-profit on a bar that also hit the stop");
        assertEquals(1, f.ledger.snapshot().getLossStreak());
        assertTrue(f.ledger.snapshot().getBalance() < 20_000);
    }

    @Test
    @DisplayName("Failed partial close leaves the level unhit for retry")
    void failedPartialIsRetried() {
        Position p = open(Direction.LONG, 1.1000, 1.0950, 0.40, new double[][]{{0.6, 0.35}, {2.0, 0.65}});
        f.props.getBroker().setMaxAttempts(1);
        f.venue.queueFault("partialClose", PaperExecutionGateway.Fault.TRANSIENT);

        f.positionManager.onPriceUpdate(p, 1.1031, 1.1029, now);
        assertEquals(0, p.hitCount());
        assertEquals(0.40, p.getRemainingSize(), 1e-9);

        f.positionManager.onPriceUpdate(p, 1.1031, 1.1029, now);
        assertEquals(1, p.hitCount());
        assertEquals(0.26, p.getRemainingSize(), 1e-9);
    }

    @Test
    @DisplayName("Degraded positions only get stop enforcement")
    void degradedPositionsIgnoreTargets() {
        Position p = open(Direction.LONG, 1.1000, 1.0950, 0.40, new double[][]{{0.6, 0.35}, {2.0, 0.65}});
        p.setDegraded(true);

        f.positionManager.onPriceUpdate(p, 1.1200, 1.1100, now);
        assertEquals(0, p.hitCount());

        f.positionManager.onPriceUpdate(p, 1.1000, 1.0900, now);
        assertTrue(f.positionBook.isEmpty());
    }

    @Test
    @DisplayName("Close-all treats a position already gone at the venue as closed at its stop")
    void closeAllHandlesVanishedPosition() {
        Position p = open(Direction.LONG, 1.1000, 1.0950, 0.40, new double[][]{{2.0, 1.0}});
        f.venue.close(p.getHandle());

        int left = f.positionManager.closeAll("test", now);

        assertEquals(0, left);
        assertEquals(-200.0, f.repository.closedTrades().get(0).getRealizedPnl(), 1e-6);
    }
}
