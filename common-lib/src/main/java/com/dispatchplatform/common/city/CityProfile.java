package com.dispatchplatform.common.city;

import java.util.List;

/**
 * Static knowledge about one metropolitan area, passed to extraction and to the agents.
 *
 * @param radioSystem       agency label used in prompts, e.g. {@code NYPD}
 * @param speechVocabulary  hint sent with every transcription request
 * @param extractionRules   city-specific location rules for the extraction prompt
 * @param usesPrecinctTable whether borough can be derived from a reported precinct number
 * @param openMhzSystem     OpenMHz system short name for call polling
 */
public record CityProfile(
    String id,
    String name,
    String shortName,
    List<String> districts,
    List<String> landmarks,
    String streetTopology,
    String radioSystem,
    String speechVocabulary,
    String extractionRules,
    boolean usesPrecinctTable,
    String openMhzSystem
) {
    public CityProfile {
        districts = List.copyOf(districts);
        landmarks = List.copyOf(landmarks);
    }

    /** Slash-joined district names plus {@code Unknown}, as offered to the extraction service. */
    public String districtChoices() {
        return String.join("/", districts) + "/Unknown";
    }
}
