package com.dispatchplatform.common.ledger;

import com.dispatchplatform.common.model.Prediction;

import java.util.List;

/** Result of a ledger transition: the new ledger plus the predictions resolved by it. */
public record LedgerUpdate(PredictionLedger ledger, List<Prediction> hits, List<Prediction> expired) {

    public LedgerUpdate {
        hits    = List.copyOf(hits);
        expired = List.copyOf(expired);
    }

    public boolean changed() {
        return !hits.isEmpty() || !expired.isEmpty();
    }
}
