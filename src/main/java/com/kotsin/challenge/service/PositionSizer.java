package com.kotsin.challenge.service;

import com.kotsin.challenge.config.EngineProperties;
import com.kotsin.challenge.model.AccountState;
import com.kotsin.challenge.model.InstrumentSpec;
import com.kotsin.challenge.model.Signal;
import org.springframework.stereotype.Component;

/**
 * Turns the balance at fill time into a lot size.
 * <p>
 * {@code effectiveRisk = base x confluence x streak x drawdown}, each factor clamped, then
 * {@code size = balance x effectiveRisk / (R x valuePerUnit)} rounded to the lot step.
 */
@Component
public class PositionSizer {

    private final EngineProperties.Sizing props;

    public PositionSizer(EngineProperties properties) {
        this.props = properties.getSizing();
    }

    public record Sizing(
            double confluenceMultiplier,
            double streakMultiplier,
            double drawdownMultiplier,
            double effectiveRiskFraction,
            double riskAmount,
            double size,
            double actualRisk,
            double sanityLimit
    ) {
        public boolean violatesSanity() {
            return actualRisk > sanityLimit;
        }
    }

    public Sizing size(Signal signal, AccountState account, double drawdownMultiplier, InstrumentSpec spec) {
        double balance = account.getBalance();
        double confluence = confluenceMultiplier(signal.qualityScore());
        double streak = streakMultiplier(account.getWinStreak(), account.getLossStreak());
        double drawdown = clamp(drawdownMultiplier, 0.0, 1.0);

        double effective = props.getBaseRiskFraction() * confluence * streak * drawdown;
        double riskAmount = balance * effective;
        double riskPerLot = signal.riskDistance() * spec.valuePerUnit();
        double size = riskAmount > 0 ? spec.roundLots(riskAmount / riskPerLot) : 0.0;
        double actualRisk = size * riskPerLot;
        double sanityLimit = props.getBaseRiskFraction() * balance * props.getRiskSanityMultiple();
        return new Sizing(confluence, streak, drawdown, effective, riskAmount, size, actualRisk, sanityLimit);
    }

    public double confluenceMultiplier(double score) {
        double raw = 1.0 + (score - props.getConfluenceBaseScore()) * props.getConfluenceStep();
        return clamp(raw, props.getConfluenceMin(), props.getConfluenceMax());
    }

    public double streakMultiplier(int winStreak, int lossStreak) {
        double raw = 1.0 + winStreak * props.getWinStreakStep() - lossStreak * props.getLossStreakStep();
        return clamp(raw, props.getStreakMin(), props.getStreakMax());
    }

    private static double clamp(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }
}
