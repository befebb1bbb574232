package com.dispatchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * An accepted incident. Ids are assigned by the owning city and strictly increase.
 *
 * <p>Immutable. Downstream annotation ({@link #matchedPredictionId}) produces a copy.
 */
public record Incident(
    @JsonProperty("id")                  long id,
    @JsonProperty("incidentType")        String type,
    @JsonProperty("location")            String location,
    @JsonProperty("borough")             String borough,
    @JsonProperty("priority")            Priority priority,
    @JsonProperty("summary")             String summary,
    @JsonProperty("transcript")          String sourceTranscript,
    @JsonProperty("sourceFeedId")        String sourceFeedId,
    @JsonProperty("city")                String city,
    @JsonProperty("createdAt")           Instant createdAt,
    @JsonProperty("isArrest")            boolean arrest,
    @JsonProperty("units")               List<String> units,
    @JsonProperty("rawCodes")            List<String> rawCodes,
    @JsonProperty("precinct")            String precinct,
    @JsonProperty("matchedPredictionId") String matchedPredictionId
) {
    public static final String UNKNOWN = "Unknown";

    public Incident {
        units    = units    == null ? List.of() : List.copyOf(units);
        rawCodes = rawCodes == null ? List.of() : List.copyOf(rawCodes);
    }

    public static Incident of(long id, IncidentCandidate candidate, Transcript transcript, Instant createdAt) {
        return new Incident(id, candidate.incidentType(), candidate.location(), candidate.borough(),
            candidate.priority(), candidate.summary(), transcript.text(), transcript.sourceFeedId(),
            transcript.city(), createdAt, candidate.arrest(), candidate.units(), candidate.rawCodes(),
            candidate.precinct(), null);
    }

    public Incident withMatchedPrediction(String predictionId) {
        return new Incident(id, type, location, borough, priority, summary, sourceTranscript,
            sourceFeedId, city, createdAt, arrest, units, rawCodes, precinct, predictionId);
    }

    /** True when the location is usable for address-level correlation. */
    public boolean hasKnownLocation() {
        return isKnown(location);
    }

    /** A place value is known when it is neither blank nor {@link #UNKNOWN}. */
    public static boolean isKnown(String place) {
        return place != null && !place.isBlank() && !UNKNOWN.equalsIgnoreCase(place.trim());
    }

    /** Key used by hotspot counting: {@code borough-location}. */
    public String hotspotKey() {
        return (borough == null ? UNKNOWN : borough) + "-" + (location == null ? UNKNOWN : location);
    }
}
