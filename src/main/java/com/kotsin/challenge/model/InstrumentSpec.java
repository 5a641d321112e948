package com.kotsin.challenge.model;

/**
 * Contract specification for one tradable symbol. Sizes are in lots.
 */
public record InstrumentSpec(
        String symbol,
        double pipSize,
        double pipValuePerLot,
        double minLot,
        double maxLot,
        double lotStep
) {

    /** Money per one unit of price movement per lot. */
    public double valuePerUnit() {
        return pipValuePerLot / pipSize;
    }

    public double toPips(double priceDistance) {
        return priceDistance / pipSize;
    }

    /** Rounds to the nearest lot step, then clamps into [minLot, maxLot]. */
    public double roundLots(double lots) {
        double steps = Math.round(lots / lotStep);
        double rounded = normalize(steps * lotStep);
        return Math.max(minLot, Math.min(maxLot, rounded));
    }

    /** True when a size is below half a step, i.e. nothing left to trade. */
    public boolean isEffectivelyZero(double lots) {
        return lots < lotStep / 2.0;
    }

    public double normalize(double lots) {
        return Math.round(lots * 1e8) / 1e8;
    }

    /** Money P&L of moving {@code lots} from {@code from} to {@code to} in the given direction. */
    public double pnl(Direction direction, double from, double to, double lots) {
        return direction.sign() * (to - from) * valuePerUnit() * lots;
    }
}
