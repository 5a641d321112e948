package com.kotsin.challenge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only archive record written when a position is fully closed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ClosedTrade {
    private String positionId;
    private String symbol;
    private Direction direction;
    private double entryPrice;
    private double exitPrice;
    private double originalSize;
    private double riskAmount;
    private double realizedPnl;
    private double resultR;
    private int levelsHit;
    private double closedFraction;
    private Instant openedAt;
    private Instant closedAt;
    private String reason;
    private boolean degraded;
}
