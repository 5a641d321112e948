package com.kotsin.challenge.state;

import java.util.List;

/**
 * What startup recovery did with the persisted snapshot and the venue's live positions.
 */
public record ReconcileReport(
        int entriesRestored,
        int entriesDropped,
        int positionsMatched,
        int positionsAdopted,
        int positionsDiscarded,
        List<String> quarantinedKeys
) {
}
