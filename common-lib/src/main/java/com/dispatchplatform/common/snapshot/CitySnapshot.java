package com.dispatchplatform.common.snapshot;

import com.dispatchplatform.common.model.Incident;
import com.dispatchplatform.common.model.Transcript;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Point-in-time view of one city's ingestion state, shared through Redis so a new live client
 * can be primed without waiting for the next event.
 */
public record CitySnapshot(
    @JsonProperty("city")           String city,
    @JsonProperty("incidents")      List<Incident> incidents,
    @JsonProperty("transcripts")    List<Transcript> transcripts,
    @JsonProperty("cameraCount")    int cameraCount,
    @JsonProperty("lastIncidentId") long lastIncidentId,
    @JsonProperty("updatedAt")      Instant updatedAt
) {
    public static final String WORKER_STATS_KEY = "dispatch:worker:stats";

    public static String key(String city) {
        return "dispatch:city:" + city;
    }
}
