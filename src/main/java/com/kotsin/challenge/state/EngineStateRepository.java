package com.kotsin.challenge.state;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.kotsin.challenge.config.EngineProperties;
import com.kotsin.challenge.model.AccountState;
import com.kotsin.challenge.model.ClosedTrade;
import com.kotsin.challenge.model.Position;
import com.kotsin.challenge.model.QueuedEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Encodes engine state as one JSON document per record.
 * <p>
 * Loading never fails as a whole: a record that does not decode is moved under the quarantine
 * prefix and skipped, and every other record still loads.
 */
@Repository
@Slf4j
public class EngineStateRepository {

    private static final String SNAPSHOT = "snap:";
    private static final String ENTRY = "entry:";
    private static final String POSITION = "position:";
    private static final String ACCOUNT = "account";
    private static final String QUARANTINE = "quarantine:";
    private static final String CLOSED_TRADES = "closed-trades";

    private final SnapshotStore store;
    private final String prefix;
    private final ObjectMapper objectMapper;

    public EngineStateRepository(SnapshotStore store, EngineProperties properties) {
        this.store = store;
        this.prefix = properties.getState().getKeyPrefix();
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        this.objectMapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    public record LoadResult(EngineSnapshot snapshot, List<String> quarantinedKeys) {
    }

    public void save(EngineSnapshot snapshot) {
        Map<String, String> records = new LinkedHashMap<>();
        for (QueuedEntry entry : snapshot.entries()) {
            records.put(snapshotKey(ENTRY + entry.getEntryId()), encode(entry));
        }
        for (Position position : snapshot.positions()) {
            records.put(snapshotKey(POSITION + position.getPositionId()), encode(position));
        }
        if (snapshot.account() != null) {
            records.put(snapshotKey(ACCOUNT), encode(snapshot.account()));
        }
        store.replaceAll(prefix + SNAPSHOT, records);
        log.debug("SNAPSHOT_SAVED entries={} positions={}", snapshot.entries().size(), snapshot.positions().size());
    }

    public LoadResult load() {
        List<QueuedEntry> entries = new ArrayList<>();
        List<Position> positions = new ArrayList<>();
        AccountState account = null;
        List<String> quarantined = new ArrayList<>();

        for (Map.Entry<String, String> record : store.readAll(prefix + SNAPSHOT).entrySet()) {
            String key = record.getKey();
            String suffix = key.substring((prefix + SNAPSHOT).length());
            try {
                if (suffix.startsWith(ENTRY)) {
                    QueuedEntry entry = decode(key, record.getValue(), QueuedEntry.class);
                    require(key, entry.getEntryId() != null && entry.getSignal() != null && entry.getState() != null);
                    entries.add(entry);
                } else if (suffix.startsWith(POSITION)) {
                    Position position = decode(key, record.getValue(), Position.class);
                    require(key, position.getPositionId() != null && position.getSymbol() != null
                            && position.getDirection() != null);
                    positions.add(position);
                } else if (suffix.equals(ACCOUNT)) {
                    account = decode(key, record.getValue(), AccountState.class);
                } else {
                    log.warn("Ignoring unrecognised snapshot key {}", key);
                }
            } catch (CorruptSnapshotRecordException e) {
                quarantine(key, record.getValue(), e);
                quarantined.add(key);
            }
        }
        return new LoadResult(new EngineSnapshot(entries, positions, account), quarantined);
    }

    public void appendClosedTrade(ClosedTrade trade) {
        store.append(prefix + CLOSED_TRADES, encode(trade));
    }

    public List<ClosedTrade> closedTrades() {
        List<ClosedTrade> out = new ArrayList<>();
        for (String raw : store.readList(prefix + CLOSED_TRADES)) {
            try {
                out.add(decode(prefix + CLOSED_TRADES, raw, ClosedTrade.class));
            } catch (CorruptSnapshotRecordException e) {
                log.warn("Skipping unreadable closed-trade record: {}", e.getMessage());
            }
        }
        return out;
    }

    public Map<String, String> quarantinedRecords() {
        return store.readAll(prefix + QUARANTINE);
    }

    private void quarantine(String key, String raw, CorruptSnapshotRecordException cause) {
        String target = prefix + QUARANTINE + key.substring(prefix.length());
        store.put(target, raw);
        store.delete(key);
        log.error("RECORD_QUARANTINED key={} movedTo={} reason={}", key, target, cause.getMessage());
    }

    private static void require(String key, boolean complete) {
        if (!complete) {
            throw new CorruptSnapshotRecordException(key, new IllegalStateException("required fields missing"));
        }
    }

    private String snapshotKey(String suffix) {
        return prefix + SNAPSHOT + suffix;
    }

    private String encode(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new StatePersistenceException("Failed to encode " + value.getClass().getSimpleName(), e);
        }
    }

    private <T> T decode(String key, String raw, Class<T> type) {
        try {
            T value = objectMapper.readValue(raw, type);
            if (value == null) {
                throw new CorruptSnapshotRecordException(key, new IllegalStateException("null record"));
            }
            return value;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CorruptSnapshotRecordException(key, e);
        }
    }
}
