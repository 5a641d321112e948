package com.kotsin.challenge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An open trade at the venue with its take-profit ladder and trailing stop.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class Position {

    private String positionId;
    /** Venue ticket used for close / modify calls. */
    private String handle;
    private String entryId;
    private String symbol;
    private Direction direction;

    private double entryPrice;
    private double originalSize;
    private double remainingSize;
    private double initialStop;
    private double currentStop;
    private double riskAmountAtFill;

    @Builder.Default
    private List<PositionLevel> levels = new ArrayList<>();

    private Instant openedAt;
    private double realizedPnl;
    private double lastPrice;

    /** Adopted from the venue without local history: stop enforcement only. */
    private boolean degraded;

    @JsonIgnore
    public double riskDistance() {
        return Math.abs(entryPrice - initialStop);
    }

    public double priceAtR(double r) {
        return entryPrice + direction.sign() * r * riskDistance();
    }

    /**
     * Moves the stop only if the candidate is tighter for this direction.
     *
     * @return true if the stop changed
     */
    public boolean ratchetStop(double candidate) {
        if (direction.isTighterStop(candidate, currentStop)) {
            currentStop = candidate;
            return true;
        }
        return false;
    }

    public Optional<PositionLevel> firstUnhitLevel() {
        return levels.stream().filter(l -> !l.isHit()).findFirst();
    }

    @JsonIgnore
    public int hitCount() {
        return (int) levels.stream().filter(PositionLevel::isHit).count();
    }

    @JsonIgnore
    public double hitFractionSum() {
        return levels.stream().filter(PositionLevel::isHit).mapToDouble(PositionLevel::getCloseFraction).sum();
    }

    public boolean isLastLevel(PositionLevel level) {
        return !levels.isEmpty() && levels.get(levels.size() - 1) == level;
    }

    /** Detached copy, levels included, for readers outside the tick thread. */
    public Position copy() {
        List<PositionLevel> copiedLevels = new ArrayList<>();
        levels.forEach(level -> copiedLevels.add(level.copy()));
        return toBuilder().levels(copiedLevels).build();
    }
}
