package com.dispatchplatform.bureau.dto;

import com.dispatchplatform.common.model.Prediction;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/** Ledger counters plus the pending list and the most recently issued predictions. */
public record PredictionStatsDTO(
    @JsonProperty("total")             long total,
    @JsonProperty("correct")           long correct,
    @JsonProperty("accuracyRatio")     double accuracyRatio,
    @JsonProperty("accuracy")          String accuracy,
    @JsonProperty("pending")           List<Prediction> pending,
    @JsonProperty("recentPredictions") List<Prediction> recentPredictions
) {}
