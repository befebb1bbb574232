package com.dispatchplatform.ingestion.extract;

import com.dispatchplatform.common.ai.JsonBlocks;
import com.dispatchplatform.common.ai.ReasoningClient;
import com.dispatchplatform.common.ai.ReasoningRequest;
import com.dispatchplatform.common.city.CityProfile;
import com.dispatchplatform.common.city.PrecinctRegionTable;
import com.dispatchplatform.common.model.Incident;
import com.dispatchplatform.common.model.IncidentCandidate;
import com.dispatchplatform.common.model.Priority;
import com.dispatchplatform.common.model.Transcript;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Turns a transcript into an incident candidate through the external reasoning service.
 *
 * <p>Each city gets its own system prompt built from its {@link CityProfile}. The reply is
 * free-form text expected to embed one JSON object; the object is located defensively and any
 * failure (network, timeout, missing or malformed block) becomes {@link ExtractionResult.ParseError}.
 * This method never signals an error.
 */
@Service
public class ExtractionGateway {

    private static final Logger log = LoggerFactory.getLogger(ExtractionGateway.class);

    static final int MAX_TOKENS = 800;

    private final ReasoningClient reasoningClient;
    private final ObjectMapper objectMapper;

    public ExtractionGateway(ReasoningClient reasoningClient, ObjectMapper objectMapper) {
        this.reasoningClient = reasoningClient;
        this.objectMapper    = objectMapper;
    }

    public Mono<ExtractionResult> extract(Transcript transcript, CityProfile profile) {
        ReasoningRequest request = ReasoningRequest.of("extraction-" + profile.id(),
            systemPrompt(profile),
            "Parse this " + profile.radioSystem() + " radio transmission:\n\n\"" + transcript.text() + "\"",
            MAX_TOKENS);

        return reasoningClient.complete(request)
            .map(reply -> parse(reply, profile))
            .defaultIfEmpty(new ExtractionResult.ParseError("empty reply"))
            .onErrorResume(e -> {
                log.warn("[Extraction] Call failed, treating as no incident. city={} reason={}",
                         profile.id(), e.getMessage());
                return Mono.just(new ExtractionResult.ParseError(e.getMessage()));
            });
    }

    /** Interprets one reply. Package-private for tests. */
    ExtractionResult parse(String reply, CityProfile profile) {
        Optional<JsonNode> block = JsonBlocks.extract(reply, objectMapper);
        if (block.isEmpty()) {
            return new ExtractionResult.ParseError("no structured block in reply");
        }
        JsonNode json = block.get();
        if (!json.path("hasIncident").asBoolean(false)) {
            return new ExtractionResult.Rejected(
                Optional.ofNullable(JsonBlocks.text(json, "summary")).orElse("no incident reported"));
        }

        String type     = Optional.ofNullable(JsonBlocks.text(json, "incidentType")).orElse("Unknown incident");
        String location = JsonBlocks.text(json, "location");
        String borough  = Optional.ofNullable(JsonBlocks.text(json, "borough"))
            .or(() -> Optional.ofNullable(JsonBlocks.text(json, "region")))
            .orElse(null);
        String precinct = JsonBlocks.text(json, "precinctMentioned");

        if (profile.usesPrecinctTable() && precinct != null && !isKnown(borough)) {
            Optional<String> derived = PrecinctRegionTable.regionFor(precinct);
            if (derived.isPresent()) {
                borough = derived.get();
                if (!isKnown(location)) {
                    location = PrecinctRegionTable.areaName(precinct).orElse(location);
                }
            }
        }

        IncidentCandidate candidate = new IncidentCandidate(
            type,
            isKnown(location) ? location : Incident.UNKNOWN,
            isKnown(borough) ? borough : Incident.UNKNOWN,
            Priority.parse(JsonBlocks.text(json, "priority")),
            Optional.ofNullable(JsonBlocks.text(json, "summary")).orElse(type),
            textList(json.path("units")),
            textList(json.path("rawCodes")),
            precinct,
            json.path("isArrest").asBoolean(false));
        return new ExtractionResult.Accepted(candidate);
    }

    // ── prompt construction ───────────────────────────────────────────────────

    String systemPrompt(CityProfile profile) {
        return """
            You are an expert %s radio parser. Your PRIMARY job is to extract LOCATION information.

            LOCATION EXTRACTION RULES:
            %s

            Known landmarks: %s

            If NO location can be determined, set location to null.

            ARREST DETECTION:
            Look for keywords: "under arrest", "in custody", "collar", "perp", "prisoner", "apprehended", "cuffed".
            Set isArrest true if arrest-related.

            Respond ONLY with valid JSON:
            {
              "hasIncident": boolean,
              "incidentType": "string describing incident",
              "location": "specific location or null if none found",
              "borough": "%s",
              "units": ["unit IDs mentioned"],
              "priority": "CRITICAL/HIGH/MEDIUM/LOW",
              "summary": "brief summary",
              "rawCodes": ["any 10-codes heard"],
              "precinctMentioned": "number or null",
              "isArrest": boolean
            }
            """.formatted(profile.radioSystem(), profile.extractionRules(),
                          String.join(", ", profile.landmarks()), profile.districtChoices());
    }

    // ── private ───────────────────────────────────────────────────────────────

    private static boolean isKnown(String value) {
        return value != null && !value.isBlank() && !Incident.UNKNOWN.equalsIgnoreCase(value)
            && !"null".equalsIgnoreCase(value);
    }

    private static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(n -> {
                if (!n.isNull() && !n.asText().isBlank()) values.add(n.asText());
            });
        }
        return values;
    }
}
