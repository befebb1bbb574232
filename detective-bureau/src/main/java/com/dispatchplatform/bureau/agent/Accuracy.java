package com.dispatchplatform.bureau.agent;

import com.dispatchplatform.common.ledger.PredictionLedger;

import java.util.Locale;

/** Human-readable prediction accuracy, as shown to agents and in briefings. */
public final class Accuracy {

    private Accuracy() {}

    /** {@code No predictions yet} or e.g. {@code 66.7% (2/3)}. */
    public static String describe(PredictionLedger ledger) {
        if (ledger.total() == 0) return "No predictions yet";
        return String.format(Locale.ROOT, "%.1f%% (%d/%d)",
            ledger.accuracy() * 100, ledger.correct(), ledger.total());
    }
}
