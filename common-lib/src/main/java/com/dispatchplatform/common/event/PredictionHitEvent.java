package com.dispatchplatform.common.event;

import com.dispatchplatform.common.model.Prediction;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** Published when an incident resolves a pending prediction. {@code accuracy} is after the hit. */
public record PredictionHitEvent(
    @JsonProperty("prediction")        Prediction prediction,
    @JsonProperty("matchedIncidentId") long matchedIncidentId,
    @JsonProperty("accuracy")          double accuracy,
    @JsonProperty("city")              String city,
    @JsonProperty("timestamp")         Instant timestamp
) implements DispatchEvent {

    @Override @JsonIgnore
    public DispatchChannel channel() { return DispatchChannel.PREDICTIONS; }

    @Override @JsonIgnore
    public String eventName() { return "prediction_hit"; }
}
