package com.dispatchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Snapshot of a city's prediction ledger. {@code total} counts resolved predictions. */
public record PredictionStats(
    @JsonProperty("total")    long total,
    @JsonProperty("correct")  long correct,
    @JsonProperty("accuracy") double accuracy,
    @JsonProperty("pending")  List<Prediction> pending
) {
    public PredictionStats {
        pending = pending == null ? List.of() : List.copyOf(pending);
    }

    /** Whole-percent accuracy for prompts and logs. */
    public long accuracyPercent() {
        return Math.round(accuracy * 100);
    }
}
