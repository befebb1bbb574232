package com.dispatchplatform.common.event;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** Analysis produced by one bureau agent. {@code incidentId} is null for cycle-driven insights. */
public record AgentInsightEvent(
    @JsonProperty("agent")      String agent,
    @JsonProperty("agentIcon")  String agentIcon,
    @JsonProperty("incidentId") Long incidentId,
    @JsonProperty("analysis")   String analysis,
    @JsonProperty("urgency")    String urgency,
    @JsonProperty("city")       String city,
    @JsonProperty("timestamp")  Instant timestamp
) implements DispatchEvent {

    @Override @JsonIgnore
    public DispatchChannel channel() { return DispatchChannel.AGENT_INSIGHTS; }

    @Override @JsonIgnore
    public String eventName() { return "agent_insight"; }
}
