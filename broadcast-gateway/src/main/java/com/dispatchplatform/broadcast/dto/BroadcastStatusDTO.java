package com.dispatchplatform.broadcast.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

public record BroadcastStatusDTO(
    @JsonProperty("connections")      Map<String, Integer> connections,
    @JsonProperty("totalConnections") int totalConnections,
    @JsonProperty("timestamp")        Instant timestamp
) {}
