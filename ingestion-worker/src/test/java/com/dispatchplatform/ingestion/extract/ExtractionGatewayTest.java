package com.dispatchplatform.ingestion.extract;

import com.dispatchplatform.common.city.CityProfiles;
import com.dispatchplatform.common.model.IncidentCandidate;
import com.dispatchplatform.common.model.Priority;
import com.dispatchplatform.common.model.Transcript;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.TimeoutException;

import static org.junit.jupiter.api.Assertions.*;

class ExtractionGatewayTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final ExtractionGateway gateway = new ExtractionGateway(request -> Mono.empty(), mapper);

    // ── parse() ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("parse()")
    class Parse {

        @Test
        @DisplayName("incident reply becomes Accepted with all fields")
        void accepted() {
            String reply = """
                Here you go:
                {"hasIncident": true, "incidentType": "Robbery", "location": "Flatbush Ave & Church Ave",
                 "borough": "Brooklyn", "units": ["72 Sergeant", "Central"], "priority": "HIGH",
                 "summary": "Robbery in progress", "rawCodes": ["10-30"], "precinctMentioned": null,
                 "isArrest": false}
                """;

            ExtractionResult result = gateway.parse(reply, CityProfiles.NYC);

            assertInstanceOf(ExtractionResult.Accepted.class, result);
            IncidentCandidate c = ((ExtractionResult.Accepted) result).candidate();
            assertEquals("Robbery", c.incidentType());
            assertEquals("Flatbush Ave & Church Ave", c.location());
            assertEquals("Brooklyn", c.borough());
            assertEquals(Priority.HIGH, c.priority());
            assertEquals(List.of("72 Sergeant", "Central"), c.units());
            assertEquals(List.of("10-30"), c.rawCodes());
            assertFalse(c.arrest());
        }

        @Test
        @DisplayName("hasIncident false becomes Rejected")
        void rejected() {
            ExtractionResult result = gateway.parse("{\"hasIncident\": false, \"summary\": \"radio check\"}",
                CityProfiles.NYC);

            assertEquals(new ExtractionResult.Rejected("radio check"), result);
        }

        @Test
        @DisplayName("reply without a JSON block becomes ParseError")
        void noBlock() {
            assertInstanceOf(ExtractionResult.ParseError.class,
                gateway.parse("I could not parse that transmission.", CityProfiles.NYC));
        }

        @Test
        @DisplayName("precinct fills in borough and location when both are missing")
        void precinctDerivation() {
            String reply = "{\"hasIncident\": true, \"incidentType\": \"Shots fired\", \"location\": null, "
                + "\"borough\": \"Unknown\", \"priority\": \"CRITICAL\", \"precinctMentioned\": \"75\"}";

            IncidentCandidate c = ((ExtractionResult.Accepted) gateway.parse(reply, CityProfiles.NYC)).candidate();

            assertEquals("Brooklyn", c.borough());
            assertEquals("75th Precinct area", c.location());
            assertEquals("75", c.precinct());
        }

        @Test
        @DisplayName("precinct area names use the right ordinal suffix")
        void precinctOrdinal() {
            String reply = "{\"hasIncident\": true, \"incidentType\": \"Assault\", \"location\": null, "
                + "\"borough\": null, \"priority\": \"HIGH\", \"precinctMentioned\": \"1\"}";

            IncidentCandidate c = ((ExtractionResult.Accepted) gateway.parse(reply, CityProfiles.NYC)).candidate();

            assertEquals("Manhattan", c.borough());
            assertEquals("1st Precinct area", c.location());
        }

        @Test
        @DisplayName("precinct table is not used for cities without one")
        void noPrecinctTableForMinneapolis() {
            String reply = "{\"hasIncident\": true, \"incidentType\": \"Fire\", \"location\": null, "
                + "\"region\": null, \"priority\": \"HIGH\", \"precinctMentioned\": \"75\"}";

            IncidentCandidate c = ((ExtractionResult.Accepted) gateway.parse(reply, CityProfiles.MPLS)).candidate();

            assertEquals("Unknown", c.borough());
            assertEquals("Unknown", c.location());
        }

        @Test
        @DisplayName("unparseable priority defaults to MEDIUM")
        void priorityDefault() {
            String reply = "{\"hasIncident\": true, \"incidentType\": \"Noise\", \"location\": \"Lake St\", "
                + "\"region\": \"South\", \"priority\": \"urgent-ish\"}";

            IncidentCandidate c = ((ExtractionResult.Accepted) gateway.parse(reply, CityProfiles.MPLS)).candidate();

            assertEquals(Priority.MEDIUM, c.priority());
            assertEquals("South", c.borough());
        }
    }

    // ── extract() ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("extract()")
    class Extract {

        private final Transcript transcript = new Transcript("shots fired at the corner of Flatbush and Church",
            "40184", "NYPD Citywide 1", "nyc", Instant.now());

        @Test
        @DisplayName("network failure or timeout becomes ParseError, never an error signal")
        void failureBecomesParseError() {
            ExtractionGateway failing = new ExtractionGateway(
                request -> Mono.error(new TimeoutException("no reply in 20000ms")), mapper);

            ExtractionResult result = failing.extract(transcript, CityProfiles.NYC).block(Duration.ofSeconds(5));

            assertInstanceOf(ExtractionResult.ParseError.class, result);
        }

        @Test
        @DisplayName("empty reply becomes ParseError")
        void emptyReply() {
            ExtractionResult result = gateway.extract(transcript, CityProfiles.NYC).block(Duration.ofSeconds(5));

            assertEquals(new ExtractionResult.ParseError("empty reply"), result);
        }

        @Test
        @DisplayName("request carries the city prompt and the 800-token budget")
        void requestShape() {
            ExtractionGateway capturing = new ExtractionGateway(request -> {
                assertEquals(800, request.maxTokens());
                assertTrue(request.system().contains("NYPD"));
                assertTrue(request.prompt().contains(transcript.text()));
                return Mono.just("{\"hasIncident\": false}");
            }, mapper);

            assertInstanceOf(ExtractionResult.Rejected.class,
                capturing.extract(transcript, CityProfiles.NYC).block(Duration.ofSeconds(5)));
        }
    }
}
