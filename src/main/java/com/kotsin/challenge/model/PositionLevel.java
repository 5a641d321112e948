package com.kotsin.challenge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class PositionLevel {
    private double targetR;
    private double closeFraction;
    private double targetPrice;
    private boolean hit;

    public PositionLevel copy() {
        return toBuilder().build();
    }
}
