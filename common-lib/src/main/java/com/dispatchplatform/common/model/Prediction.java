package com.dispatchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Locale;

/**
 * A forecast issued by an agent. Starts {@link PredictionStatus#PENDING} and transitions exactly
 * once, either to {@link PredictionStatus#HIT} or to {@link PredictionStatus#EXPIRED}.
 */
public record Prediction(
    @JsonProperty("id")                String id,
    @JsonProperty("agent")             String agent,
    @JsonProperty("location")          String location,
    @JsonProperty("district")          String district,
    @JsonProperty("incidentType")      String incidentType,
    @JsonProperty("confidence")        double confidence,
    @JsonProperty("reasoning")         String reasoning,
    @JsonProperty("createdAt")         Instant createdAt,
    @JsonProperty("expiresAt")         Instant expiresAt,
    @JsonProperty("status")            PredictionStatus status,
    @JsonProperty("matchedIncidentId") Long matchedIncidentId,
    @JsonProperty("resolvedAt")        Instant resolvedAt
) {
    public static Prediction pending(String id, String agent, String location, String district,
                                     String incidentType, double confidence, String reasoning,
                                     Instant createdAt, Instant expiresAt) {
        return new Prediction(id, agent, location, district, incidentType, confidence, reasoning,
            createdAt, expiresAt, PredictionStatus.PENDING, null, null);
    }

    @JsonIgnore
    public boolean isPending() {
        return status == PredictionStatus.PENDING;
    }

    /** A prediction is due for expiry once {@code now} is strictly after {@code expiresAt}. */
    public boolean isExpiredAt(Instant now) {
        return now.isAfter(expiresAt);
    }

    /**
     * The incident type must contain the predicted type (case-insensitive), and either the
     * district matches or the incident location contains the predicted location. Blank and
     * {@link Incident#UNKNOWN} places never match anything.
     */
    public boolean matches(Incident incident) {
        String predictedType = lower(incidentType);
        String actualType    = lower(incident.type());
        if (predictedType.isEmpty() || !actualType.contains(predictedType)) return false;

        boolean districtMatch = Incident.isKnown(district) && Incident.isKnown(incident.borough())
            && lower(district).equals(lower(incident.borough()));
        boolean locationMatch = Incident.isKnown(location) && Incident.isKnown(incident.location())
            && lower(incident.location()).contains(lower(location));
        return districtMatch || locationMatch;
    }

    public Prediction hit(long incidentId, Instant at) {
        requirePending();
        return new Prediction(id, agent, location, district, incidentType, confidence, reasoning,
            createdAt, expiresAt, PredictionStatus.HIT, incidentId, at);
    }

    public Prediction expire(Instant at) {
        requirePending();
        return new Prediction(id, agent, location, district, incidentType, confidence, reasoning,
            createdAt, expiresAt, PredictionStatus.EXPIRED, null, at);
    }

    private void requirePending() {
        if (!isPending()) {
            throw new IllegalStateException("Prediction already resolved. id=" + id + " status=" + status);
        }
    }

    private static String lower(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }
}
