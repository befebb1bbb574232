package com.dispatchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * A cluster of related incidents identified by the pattern agent.
 * Expires when no new incident has been linked within its validity window.
 */
public record Pattern(
    @JsonProperty("id")                String id,
    @JsonProperty("name")              String name,
    @JsonProperty("connections")       List<String> connections,
    @JsonProperty("linkedIncidentIds") List<Long> linkedIncidentIds,
    @JsonProperty("confidence")        double confidence,
    @JsonProperty("analysis")          String analysis,
    @JsonProperty("status")            PatternStatus status,
    @JsonProperty("detectedAt")        Instant detectedAt,
    @JsonProperty("lastLinkedAt")      Instant lastLinkedAt
) {
    public Pattern {
        connections       = connections == null ? List.of() : List.copyOf(connections);
        linkedIncidentIds = linkedIncidentIds == null ? List.of() : List.copyOf(linkedIncidentIds);
    }

    public static Pattern detected(String id, String name, List<String> connections, List<Long> linkedIncidentIds,
                                   double confidence, String analysis, Instant at) {
        return new Pattern(id, name, connections, linkedIncidentIds, confidence, analysis,
            PatternStatus.ACTIVE, at, at);
    }

    @JsonIgnore
    public boolean isActive() {
        return status == PatternStatus.ACTIVE;
    }

    public boolean sharesIncidentWith(List<Long> incidentIds) {
        return incidentIds.stream().anyMatch(linkedIncidentIds::contains);
    }

    /** Merges newly linked incident ids and refreshes the validity window. */
    public Pattern relink(List<Long> incidentIds, double newConfidence, Instant at) {
        Set<Long> merged = new LinkedHashSet<>(linkedIncidentIds);
        merged.addAll(incidentIds);
        return new Pattern(id, name, connections, List.copyOf(merged),
            Math.max(confidence, newConfidence), analysis, status, detectedAt, at);
    }

    public boolean isStale(Instant now, Duration validity) {
        return isActive() && now.isAfter(lastLinkedAt.plus(validity));
    }

    public Pattern expire() {
        return new Pattern(id, name, connections, linkedIncidentIds, confidence, analysis,
            PatternStatus.EXPIRED, detectedAt, lastLinkedAt);
    }
}
