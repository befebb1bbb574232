package com.dispatchplatform.common.event;

import com.dispatchplatform.common.model.Prediction;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record PredictionEvent(
    @JsonProperty("prediction") Prediction prediction,
    @JsonProperty("city")       String city,
    @JsonProperty("timestamp")  Instant timestamp
) implements DispatchEvent {

    @Override @JsonIgnore
    public DispatchChannel channel() { return DispatchChannel.PREDICTIONS; }

    @Override @JsonIgnore
    public String eventName() { return "prediction"; }
}
