package com.kotsin.challenge.state;

import com.kotsin.challenge.config.EngineProperties;
import com.kotsin.challenge.model.AccountState;
import com.kotsin.challenge.model.ClosedTrade;
import com.kotsin.challenge.model.DailyDrawdownTier;
import com.kotsin.challenge.model.Direction;
import com.kotsin.challenge.model.EntryState;
import com.kotsin.challenge.model.Position;
import com.kotsin.challenge.model.PositionLevel;
import com.kotsin.challenge.model.QueuedEntry;
import com.kotsin.challenge.model.TakeProfitLevel;
import com.kotsin.challenge.support.EngineFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EngineStateRepositoryTest {

    private static final String PREFIX = "challenge:engine:";
    private static final Instant NOW = EngineFixture.START;

    private final InMemorySnapshotStore store = new InMemorySnapshotStore();
    private final EngineStateRepository repository = new EngineStateRepository(store, new EngineProperties());

    private static QueuedEntry entry(String id) {
        return QueuedEntry.builder()
                .entryId(id)
                .signal(EngineFixture.signal("EURUSD", Direction.LONG, 1.1000, 1.0950,
                        List.of(new TakeProfitLevel(0.9, 0.2), new TakeProfitLevel(2.0, 0.8))))
                .queuedAt(NOW)
                .state(EntryState.PENDING)
                .stateChangedAt(NOW)
                .orderId("O7")
                .orderPlacedAt(NOW)
                .orderSize(0.24)
                .placements(2)
                .build();
    }

    private static Position position(String id) {
        return Position.builder()
                .positionId(id)
                .handle("P3")
                .symbol("GBPUSD")
                .direction(Direction.SHORT)
                .entryPrice(1.2500)
                .originalSize(0.30)
                .remainingSize(0.20)
                .initialStop(1.2550)
                .currentStop(1.2500)
                .riskAmountAtFill(150)
                .levels(new ArrayList<>(List.of(
                        PositionLevel.builder().targetR(0.6).closeFraction(0.35).targetPrice(1.2470).hit(true).build(),
                        PositionLevel.builder().targetR(2.0).closeFraction(0.65).targetPrice(1.2400).build())))
                .openedAt(NOW)
                .realizedPnl(31.5)
                .build();
    }

    @Test
    @DisplayName("Entries, positions and account survive a save and load")
    void snapshotRoundTrip() {
        AccountState account = AccountState.opening(20_000, LocalDate.of(2026, 3, 2));
        account.setBalance(20_031.5);
        account.setDailyTier(DailyDrawdownTier.WARNING);
        account.setHaltedUntil(Instant.parse("2026-03-03T00:00:00Z"));
        account.setWinStreak(2);

        repository.save(new EngineSnapshot(List.of(entry("e1")), List.of(position("p1")), account));
        EngineStateRepository.LoadResult loaded = repository.load();

        assertTrue(loaded.quarantinedKeys().isEmpty());
        QueuedEntry e = loaded.snapshot().entries().get(0);
        assertEquals("O7", e.getOrderId());
        assertEquals(EntryState.PENDING, e.getState());
        assertEquals(2, e.getSignal().takeProfits().size());
        assertEquals(0.9, e.getSignal().takeProfits().get(0).rMultiple(), 1e-12);

        Position p = loaded.snapshot().positions().get(0);
        assertEquals(Direction.SHORT, p.getDirection());
        assertEquals(0.20, p.getRemainingSize(), 1e-12);
        assertTrue(p.getLevels().get(0).isHit());
        assertFalse(p.getLevels().get(1).isHit());

        AccountState a = loaded.snapshot().account();
        assertEquals(20_000, a.getInitialBalance(), 1e-12);
        assertEquals(20_031.5, a.getBalance(), 1e-12);
        assertEquals(LocalDate.of(2026, 3, 2), a.getLastRolloverDate());
        assertEquals(Instant.parse("2026-03-03T00:00:00Z"), a.getHaltedUntil());
        assertEquals(DailyDrawdownTier.WARNING, a.getDailyTier());
        assertEquals(2, a.getWinStreak());
    }

    @Test
    @DisplayName("Saving a smaller snapshot removes records that are gone")
    void saveReplacesPreviousSnapshot() {
        repository.save(new EngineSnapshot(List.of(entry("e1"), entry("e2")), List.of(position("p1")), null));
        repository.save(new EngineSnapshot(List.of(entry("e2")), List.of(), null));

        EngineSnapshot snapshot = repository.load().snapshot();
        assertEquals(1, snapshot.entries().size());
        assertEquals("e2", snapshot.entries().get(0).getEntryId());
        assertTrue(snapshot.positions().isEmpty());
    }

    @Test
    @DisplayName("Undecodable record is quarantined and the rest still load")
    void corruptRecordQuarantined() {
        repository.save(new EngineSnapshot(List.of(entry("e1")), List.of(position("p1")), null));
        String bad = PREFIX + "snap:entry:broken";
        store.put(bad, "{\"entryId\": \"broken\", \"state\": ");

        EngineStateRepository.LoadResult loaded = repository.load();

        assertEquals(List.of(bad), loaded.quarantinedKeys());
        assertEquals(1, loaded.snapshot().entries().size());
        assertEquals(1, loaded.snapshot().positions().size());
        assertFalse(store.readAll(PREFIX + "snap:").containsKey(bad), "removed from the live snapshot");
        assertEquals(1, repository.quarantinedRecords().size());
    }

    @Test
    @DisplayName("Record missing required fields is quarantined")
    void incompleteRecordQuarantined() {
        store.put(PREFIX + "snap:position:p9", "{\"positionId\":\"p9\"}");

        EngineStateRepository.LoadResult loaded = repository.load();

        assertEquals(1, loaded.quarantinedKeys().size());
        assertTrue(loaded.snapshot().positions().isEmpty());
    }

    @Test
    @DisplayName("Closed trades append in order")
    void closedTradesArchive() {
        repository.appendClosedTrade(ClosedTrade.builder().positionId("p1").symbol("EURUSD").realizedPnl(40).build());
        repository.appendClosedTrade(ClosedTrade.builder().positionId("p2").symbol("EURUSD").realizedPnl(-20).build());

        List<ClosedTrade> trades = repository.closedTrades();
        assertEquals(2, trades.size());
        assertEquals("p1", trades.get(0).getPositionId());
        assertEquals(-20, trades.get(1).getRealizedPnl(), 1e-12);
    }
}
