package com.dispatchplatform.bureau.agent;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Point-in-time view of an agent for the status endpoint. */
public record AgentStatus(
    @JsonProperty("id")                String id,
    @JsonProperty("name")              String name,
    @JsonProperty("role")              String role,
    @JsonProperty("icon")              String icon,
    @JsonProperty("status")            String status,
    @JsonProperty("currentCase")       Long currentCase,
    @JsonProperty("activePredictions") int activePredictions,
    @JsonProperty("activePatterns")    int activePatterns
) {
    public static AgentStatus of(AgentProfile profile, String status) {
        return new AgentStatus(profile.id(), profile.name(), profile.role(), profile.icon(), status, null, 0, 0);
    }
}
