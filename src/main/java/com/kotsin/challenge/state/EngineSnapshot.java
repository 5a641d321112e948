package com.kotsin.challenge.state;

import com.kotsin.challenge.model.AccountState;
import com.kotsin.challenge.model.Position;
import com.kotsin.challenge.model.QueuedEntry;

import java.util.List;

/**
 * Everything needed to rebuild the engine: queue, open positions and account baselines.
 */
public record EngineSnapshot(List<QueuedEntry> entries, List<Position> positions, AccountState account) {

    public EngineSnapshot {
        entries = entries == null ? List.of() : List.copyOf(entries);
        positions = positions == null ? List.of() : List.copyOf(positions);
    }
}
