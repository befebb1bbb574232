package com.dispatchplatform.bureau.dto;

import com.dispatchplatform.bureau.agent.AgentStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record BriefingDTO(
    @JsonProperty("briefing")  String briefing,
    @JsonProperty("stats")     Stats stats,
    @JsonProperty("agents")    List<AgentStatus> agents,
    @JsonProperty("timestamp") Instant timestamp
) {
    public record Stats(
        @JsonProperty("incidentsLastHour")  int incidentsLastHour,
        @JsonProperty("totalIncidents")     int totalIncidents,
        @JsonProperty("activePatterns")     int activePatterns,
        @JsonProperty("pendingPredictions") int pendingPredictions,
        @JsonProperty("predictionAccuracy") String predictionAccuracy
    ) {}
}
