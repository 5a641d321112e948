package com.kotsin.challenge.state;

import com.kotsin.challenge.service.AccountLedger;
import com.kotsin.challenge.service.EntryQueue;
import com.kotsin.challenge.service.PositionBook;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Writes the full engine snapshot after a mutation. A failed write is logged and the next
 * checkpoint rewrites everything.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StateCheckpointer {

    private final EntryQueue entryQueue;
    private final PositionBook positionBook;
    private final AccountLedger ledger;
    private final EngineStateRepository repository;

    public EngineSnapshot capture() {
        return new EngineSnapshot(entryQueue.active(), positionBook.all(), ledger.snapshot());
    }

    /**
     * Serialized: a stale capture must never sweep keys written by a newer one.
     */
    public synchronized boolean checkpoint(String reason) {
        try {
            repository.save(capture());
            return true;
        } catch (StatePersistenceException | DataAccessException e) {
            log.error("SNAPSHOT_FAILED reason={} error={}", reason, e.getMessage(), e);
            return false;
        }
    }
}
