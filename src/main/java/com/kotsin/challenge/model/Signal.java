package com.kotsin.challenge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.time.Instant;
import java.util.List;

/**
 * Externally generated trade idea. Immutable; the engine never rewrites it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Signal(
        String signalId,
        String symbol,
        Direction direction,
        double entryPrice,
        double stopPrice,
        List<TakeProfitLevel> takeProfits,
        double qualityScore,
        Instant generatedAt
) {

    public Signal {
        takeProfits = takeProfits == null ? List.of() : List.copyOf(takeProfits);
    }

    /** R: absolute price distance between entry and stop. */
    @JsonIgnore
    public double riskDistance() {
        return Math.abs(entryPrice - stopPrice);
    }

    /** Price at {@code r} multiples of R in the trade's favourable direction. */
    public double priceAtR(double r) {
        return entryPrice + direction.sign() * r * riskDistance();
    }
}
