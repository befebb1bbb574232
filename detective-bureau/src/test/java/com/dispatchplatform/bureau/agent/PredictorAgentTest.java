package com.dispatchplatform.bureau.agent;

import com.dispatchplatform.bureau.config.BureauProperties;
import com.dispatchplatform.bureau.memory.CityMemory;
import com.dispatchplatform.common.ai.ReasoningRequest;
import com.dispatchplatform.common.city.CityProfiles;
import com.dispatchplatform.common.model.Prediction;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.dispatchplatform.bureau.TestIncidents.T0;
import static com.dispatchplatform.bureau.TestIncidents.robbery;
import static org.junit.jupiter.api.Assertions.*;

class PredictorAgentTest {

    private static final String FORECAST = """
        Here is my forecast:
        {"predictions": [
           {"location": "Flatbush Ave", "borough": "Brooklyn", "incidentType": "Robbery",
            "timeWindowMinutes": 2, "confidence": 0.7, "reasoning": "cluster"},
           {"location": "Times Square", "borough": "Manhattan", "incidentType": "Assault",
            "timeWindowMinutes": 1000, "confidence": 1.6, "reasoning": "crowds"},
           {"location": "Jamaica Ave", "borough": "Queens", "reasoning": "no type given"},
           {"borough": "Bronx", "incidentType": "Burglary", "confidence": 0.4},
           {"location": "Canal St", "borough": "Manhattan", "incidentType": "Theft", "timeWindowMinutes": 60}
         ],
         "overallAssessment": "Quiet night outside Brooklyn."}
        """;

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
    private List<ReasoningRequest> requests;
    private List<AgentInsight> submitted;
    private PredictorAgent agent;
    private CityMemory memory;
    private AgentContext ctx;

    @BeforeEach
    void setUp() {
        requests  = new CopyOnWriteArrayList<>();
        submitted = new CopyOnWriteArrayList<>();
        agent     = new PredictorAgent(request -> {
            requests.add(request);
            return Mono.just(FORECAST);
        }, mapper, new BureauProperties.Predictor());
        memory    = new CityMemory("nyc", 200, 50);
        ctx       = new AgentContext(CityProfiles.NYC, memory, Clock.fixed(T0, ZoneOffset.UTC), insight -> {
            submitted.add(insight);
            return Mono.empty();
        });
    }

    // ── interpret() ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("interpret()")
    class Interpret {

        @Test
        @DisplayName("takes at most three usable forecasts and skips entries without a type")
        void limits() {
            List<Prediction> predictions = agent.interpret(FORECAST, T0).orElseThrow().predictions();

            assertEquals(List.of("Robbery", "Assault", "Burglary"),
                predictions.stream().map(Prediction::incidentType).toList());
            assertTrue(predictions.stream().allMatch(Prediction::isPending));
            assertTrue(predictions.stream().allMatch(p -> "PROPHET".equals(p.agent())));
        }

        @Test
        @DisplayName("time windows are clamped and default to thirty minutes")
        void windows() {
            List<Prediction> predictions = agent.interpret(FORECAST, T0).orElseThrow().predictions();

            assertEquals(T0.plus(Duration.ofMinutes(5)), predictions.get(0).expiresAt());
            assertEquals(T0.plus(Duration.ofMinutes(360)), predictions.get(1).expiresAt());
            assertEquals(T0.plus(Duration.ofMinutes(30)), predictions.get(2).expiresAt());
        }

        @Test
        @DisplayName("confidence is clamped to 0..1")
        void confidence() {
            List<Prediction> predictions = agent.interpret(FORECAST, T0).orElseThrow().predictions();

            assertEquals(1.0, predictions.get(1).confidence());
        }

        @Test
        @DisplayName("the overall assessment becomes the insight text")
        void assessment() {
            AgentInsight insight = agent.interpret(FORECAST, T0).orElseThrow();

            assertEquals("Quiet night outside Brooklyn.", insight.analysis());
            assertNull(insight.incidentId());
        }

        @Test
        @DisplayName("Unknown places are treated as absent")
        void unknownPlaces() {
            String reply = """
                {"predictions": [
                   {"location": "Unknown", "borough": "Unknown", "incidentType": "Robbery"},
                   {"location": "Fulton St", "borough": "Unknown", "incidentType": "Assault"}
                 ]}
                """;

            List<Prediction> predictions = agent.interpret(reply, T0).orElseThrow().predictions();

            assertEquals(1, predictions.size());
            assertEquals("Fulton St", predictions.get(0).location());
            assertNull(predictions.get(0).district());
        }

        @Test
        @DisplayName("a reply without a JSON block yields nothing")
        void unparseable() {
            assertTrue(agent.interpret("I cannot predict anything tonight.", T0).isEmpty());
        }
    }

    // ── onTick() ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("onTick()")
    class OnTick {

        @Test
        @DisplayName("does nothing below five incidents")
        void belowThreshold() {
            for (long id = 1; id <= 4; id++) memory.record(robbery(id, "Flatbush Ave", T0));

            agent.onTick(ctx).block();

            assertTrue(requests.isEmpty());
            assertTrue(submitted.isEmpty());
        }

        @Test
        @DisplayName("submits forecasts and reports the current accuracy in the request")
        void submits() {
            for (long id = 1; id <= 5; id++) memory.record(robbery(id, "Flatbush Ave", T0));

            agent.onTick(ctx).block();

            assertEquals(1, requests.size());
            assertTrue(requests.get(0).system().contains("No predictions yet"));
            assertTrue(requests.get(0).prompt().contains("Saturday"));
            assertEquals(1, submitted.size());
            assertEquals(3, submitted.get(0).predictions().size());
            assertEquals(3, agent.status(ctx).activePredictions());
            assertEquals("analyzing", agent.status(ctx).status());
        }
    }
}
