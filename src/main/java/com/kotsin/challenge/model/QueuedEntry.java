package com.kotsin.challenge.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

/**
 * A signal waiting for price to come to it, or resting at the venue as a limit order.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class QueuedEntry {

    private String entryId;
    private Signal signal;
    private Instant queuedAt;
    private EntryState state;
    private Instant stateChangedAt;

    // Resting limit order, set once PENDING
    private String orderId;
    private Instant orderPlacedAt;
    private double orderSize;
    /** Placements sent so far; numbers each client order id. */
    private int placements;

    // Placement sent but outcome unknown (timeout); resolved by venue lookup next tick
    private String inFlightClientOrderId;
    private boolean inFlightLimit;

    private Instant spreadWaitSince;
    private int spreadRetries;

    private String closeReason;

    @JsonIgnore
    public String getSymbol() {
        return signal.symbol();
    }

    @JsonIgnore
    public boolean isActive() {
        return state != null && state.isActive();
    }

    @JsonIgnore
    public boolean hasInFlightPlacement() {
        return inFlightClientOrderId != null;
    }

    public Duration age(Instant now) {
        return Duration.between(queuedAt, now);
    }

    /** Detached copy for readers outside the tick thread. */
    public QueuedEntry copy() {
        return toBuilder().build();
    }
}
