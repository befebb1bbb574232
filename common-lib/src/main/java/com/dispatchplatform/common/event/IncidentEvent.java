package com.dispatchplatform.common.event;

import com.dispatchplatform.common.model.Incident;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record IncidentEvent(
    @JsonProperty("incident")  Incident incident,
    @JsonProperty("city")      String city,
    @JsonProperty("timestamp") Instant timestamp
) implements DispatchEvent {

    public static IncidentEvent of(Incident incident, Instant timestamp) {
        return new IncidentEvent(incident, incident.city(), timestamp);
    }

    @Override @JsonIgnore
    public DispatchChannel channel() { return DispatchChannel.INCIDENTS; }

    @Override @JsonIgnore
    public String eventName() { return "incident"; }
}
