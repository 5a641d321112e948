package com.kotsin.challenge.service;

import com.kotsin.challenge.model.Position;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory book of open positions, keyed by position id.
 */
@Service
@Slf4j
public class PositionBook {

    private final Map<String, Position> open = new ConcurrentHashMap<>();

    public void add(Position position) {
        open.put(position.getPositionId(), position);
        log.info("Added position {} for {} (open: {})", position.getPositionId(), position.getSymbol(), open.size());
    }

    public void remove(String positionId) {
        if (open.remove(positionId) != null) {
            log.info("Removed position {} (open: {})", positionId, open.size());
        }
    }

    public List<Position> all() {
        return new ArrayList<>(open.values());
    }

    public Optional<Position> get(String positionId) {
        return Optional.ofNullable(open.get(positionId));
    }

    public Optional<Position> findByHandle(String handle) {
        return open.values().stream().filter(p -> handle.equals(p.getHandle())).findFirst();
    }

    public boolean hasOpenPosition(String symbol) {
        return open.values().stream().anyMatch(p -> symbol.equals(p.getSymbol()));
    }

    public int size() {
        return open.size();
    }

    public boolean isEmpty() {
        return open.isEmpty();
    }

    /** Sum of risk committed at fill across all open positions. */
    public double committedRisk() {
        return open.values().stream().mapToDouble(Position::getRiskAmountAtFill).sum();
    }

    public void replaceAll(Collection<Position> positions) {
        open.clear();
        positions.forEach(p -> open.put(p.getPositionId(), p));
    }
}
