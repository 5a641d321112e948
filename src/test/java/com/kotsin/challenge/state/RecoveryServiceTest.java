package com.kotsin.challenge.state;

import com.kotsin.challenge.broker.OrderStatus;
import com.kotsin.challenge.event.TransitionType;
import com.kotsin.challenge.model.Direction;
import com.kotsin.challenge.model.EntryState;
import com.kotsin.challenge.model.Position;
import com.kotsin.challenge.model.QueuedEntry;
import com.kotsin.challenge.support.EngineFixture;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class RecoveryServiceTest {

    private EngineFixture first;
    private EngineFixture second;

    @BeforeEach
    void setUp() {
        first = new EngineFixture();
        first.engine.start();
    }

    @AfterEach
    void tearDown() {
        first.gateway.close();
        if (second != null) {
            second.gateway.close();
        }
    }

    private Position openEurUsd() {
        first.venue.updateQuote("EURUSD", 1.1000, 1.1001);
        assertTrue(first.engine.submit(EngineFixture.longEurUsd(1.1000, 1.0950)).isAccepted());
        first.engine.tick();
        return first.positionBook.all().get(0);
    }

    private ReconcileReport restart() {
        second = first.restart();
        return second.engine.start().orElseThrow();
    }

    @Test
    @DisplayName("Position held by both sides keeps its history after a restart")
    void matchedPositionRestored() {
        Position before = openEurUsd();
        first.positionManager.onPriceUpdate(before, 1.1031, 1.1029, first.clock.instant());
        double balance = first.ledger.snapshot().getBalance();

        ReconcileReport report = restart();

        assertEquals(1, report.positionsMatched());
        assertEquals(0, report.positionsAdopted());
        Position after = second.positionBook.findByHandle(before.getHandle()).orElseThrow();
        assertEquals(before.getPositionId(), after.getPositionId());
        assertEquals(1, after.hitCount(), "take-profit history kept");
        assertEquals(before.getCurrentStop(), after.getCurrentStop(), 1e-12);
        assertEquals(balance, second.ledger.snapshot().getBalance(), 1e-9);
    }

    @Test
    @DisplayName("Unknown venue position is adopted with stop enforcement only")
    void unknownVenuePositionAdopted() {
        openEurUsd();
        String handle = first.venue.seedPosition("GBPUSD", Direction.LONG, 0.10, 1.2500, 1.2450);

        ReconcileReport report = restart();

        assertEquals(1, report.positionsAdopted());
        Position adopted = second.positionBook.findByHandle(handle).orElseThrow();
        assertTrue(adopted.isDegraded());
        assertEquals(1.2450, adopted.getCurrentStop(), 1e-12);
        assertEquals(1, second.count(TransitionType.POSITION_ADOPTED));

        second.positionManager.onPriceUpdate(adopted, 1.2460, 1.2440, second.clock.instant());
        assertTrue(second.positionBook.findByHandle(handle).isEmpty(), "adopted stop is enforced");
    }

    @Test
    @DisplayName("Snapshot position the venue no longer holds is discarded")
    void stalePositionDiscarded() {
        Position position = openEurUsd();
        first.venue.close(position.getHandle());

        ReconcileReport report = restart();

        assertEquals(1, report.positionsDiscarded());
        assertTrue(second.positionBook.isEmpty());
    }

    @Test
    @DisplayName("Venue size wins when it differs from the snapshot")
    void venueSizeWins() {
        Position position = openEurUsd();
        first.venue.partialClose(position.getHandle(), 0.10);

        restart();

        assertEquals(0.14, second.positionBook.findByHandle(position.getHandle()).orElseThrow().getRemainingSize(), 1e-9);
    }

    @Test
    @DisplayName("Limit order that filled while offline becomes a position")
    void pendingFilledWhileOffline() {
        first.venue.updateQuote("EURUSD", 1.1010, 1.1011);
        first.engine.submit(EngineFixture.longEurUsd(1.1000, 1.0950));
        first.engine.tick();
        assertEquals(EntryState.PENDING, first.entryQueue.active().get(0).getState());

        first.venue.updateQuote("EURUSD", 1.0999, 1.1000);
        restart();

        assertEquals(1, second.positionBook.size());
        assertEquals(0, second.entryQueue.size());
    }

    @Test
    @DisplayName("Resting order still open is kept")
    void pendingStillOpenKept() {
        first.venue.updateQuote("EURUSD", 1.1010, 1.1011);
        first.engine.submit(EngineFixture.longEurUsd(1.1000, 1.0950));
        first.engine.tick();

        ReconcileReport report = restart();

        assertEquals(1, report.entriesRestored());
        assertEquals(EntryState.PENDING, second.entryQueue.active().get(0).getState());
    }

    @Test
    @DisplayName("Waiting entries older than max wait expire during recovery")
    void overAgeEntryExpired() {
        first.venue.updateQuote("EURUSD", 1.1100, 1.1101);
        first.engine.submit(EngineFixture.longEurUsd(1.1000, 1.0950));
        first.engine.tick();

        first.clock.advance(Duration.ofHours(121));
        ReconcileReport report = restart();

        assertEquals(1, report.entriesDropped());
        assertEquals(0, second.entryQueue.size());
    }

    @Test
    @DisplayName("Entry for a symbol the venue already holds is cancelled on restart")
    void entryBehindAdoptedPositionCancelled() {
        first.venue.updateQuote("EURUSD", 1.1100, 1.1101);
        QueuedEntry entry = first.engine.submit(EngineFixture.longEurUsd(1.1000, 1.0950)).getEntry();
        first.engine.tick();
        first.venue.seedPosition("EURUSD", Direction.LONG, 0.10, 1.1050, 1.0900);

        ReconcileReport report = restart();
        second.venue.updateQuote("EURUSD", 1.1000, 1.1001);
        second.engine.tick();

        assertEquals(1, report.positionsAdopted());
        assertEquals(1, report.entriesDropped());
        assertTrue(second.entryQueue.get(entry.getEntryId()).isEmpty());
        assertEquals(1, second.count(TransitionType.ENTRY_CANCELLED));
        assertTrue(second.entryQueue.activeFor("EURUSD").isEmpty());
        assertEquals(1, second.venue.listOpenPositions().stream().filter(p -> p.symbol().equals("EURUSD")).count());
        assertEquals(1, second.positionBook.size());
    }

    @Test
    @DisplayName("Resting order behind a kept position is cancelled at the venue on restart")
    void restingOrderBehindKeptPositionCancelled() {
        first.props.getEntry().setBlockWhilePositionOpen(false);
        Position position = openEurUsd();
        first.venue.updateQuote("EURUSD", 1.1030, 1.1031);
        QueuedEntry entry = first.engine.submit(EngineFixture.longEurUsd(1.1025, 1.0975)).getEntry();
        first.engine.tick();
        assertEquals(EntryState.PENDING, entry.getState());
        first.props.getEntry().setBlockWhilePositionOpen(true);

        restart();

        assertTrue(second.entryQueue.activeFor("EURUSD").isEmpty());
        assertEquals(OrderStatus.CANCELLED, second.venue.orderStatus(entry.getOrderId()).status());
        assertTrue(second.positionBook.findByHandle(position.getHandle()).isPresent());
    }

    @Test
    @DisplayName("Corrupt snapshot record does not block recovery")
    void corruptRecordSkipped() {
        openEurUsd();
        first.store.put("challenge:engine:snap:entry:garbage", "not json");

        ReconcileReport report = restart();

        assertEquals(1, report.quarantinedKeys().size());
        assertEquals(1, report.positionsMatched());
        assertEquals(1, second.count(TransitionType.RECORD_QUARANTINED));
    }
}
