package com.kotsin.challenge.service;

import com.kotsin.challenge.config.EngineProperties;
import com.kotsin.challenge.model.EntryState;
import com.kotsin.challenge.model.QueuedEntry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides what a queued entry should do given how far price is from its entry, measured in R.
 */
@Component
public class ProximityClassifier {

    private final EngineProperties.Entry props;

    public ProximityClassifier(EngineProperties properties) {
        this.props = properties.getEntry();
    }

    public EntryAction classify(QueuedEntry entry, double currentPrice, Instant now) {
        if (entry.getState() == EntryState.AWAITING_SPREAD && isOverdue(entry, now)) {
            return EntryAction.EXPIRE;
        }
        double distanceR = distanceR(entry, currentPrice);

        if (distanceR <= props.getImmediateThresholdR()) {
            return EntryAction.IMMEDIATE;
        }
        if (distanceR <= props.getProximityThresholdR()) {
            return EntryAction.PROMOTE_TO_LIMIT;
        }
        if (props.isCancelBeyondMaxDistance() && distanceR > props.getMaxDistanceR()) {
            return EntryAction.CANCEL;
        }
        return isOverdue(entry, now) ? EntryAction.EXPIRE : EntryAction.KEEP;
    }

    public double distanceR(QueuedEntry entry, double currentPrice) {
        return Math.abs(currentPrice - entry.getSignal().entryPrice()) / entry.getSignal().riskDistance();
    }

    /** Entry age is always bounded by max wait; a spread wait is additionally bounded by its own limit. */
    private boolean isOverdue(QueuedEntry entry, Instant now) {
        if (entry.age(now).compareTo(props.getMaxWait()) >= 0) {
            return true;
        }
        return entry.getState() == EntryState.AWAITING_SPREAD && entry.getSpreadWaitSince() != null
                && Duration.between(entry.getSpreadWaitSince(), now).compareTo(props.getSpreadRetryMaxWait()) >= 0;
    }
}
