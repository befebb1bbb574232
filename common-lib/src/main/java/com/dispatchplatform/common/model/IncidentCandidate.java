package com.dispatchplatform.common.model;

import java.util.List;

/**
 * Structured result of extraction before it is accepted into city state.
 * Location and borough are already normalised: never null, {@code "Unknown"} when absent.
 */
public record IncidentCandidate(
    String incidentType,
    String location,
    String borough,
    Priority priority,
    String summary,
    List<String> units,
    List<String> rawCodes,
    String precinct,
    boolean arrest
) {
    public IncidentCandidate {
        units    = units    == null ? List.of() : List.copyOf(units);
        rawCodes = rawCodes == null ? List.of() : List.copyOf(rawCodes);
    }
}
