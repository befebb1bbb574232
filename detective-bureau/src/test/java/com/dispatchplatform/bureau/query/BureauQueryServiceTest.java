package com.dispatchplatform.bureau.query;

import com.dispatchplatform.bureau.MutableClock;
import com.dispatchplatform.bureau.RecordingEventBus;
import com.dispatchplatform.bureau.config.BureauProperties;
import com.dispatchplatform.bureau.dto.AnswerDTO;
import com.dispatchplatform.bureau.dto.BriefingDTO;
import com.dispatchplatform.bureau.dto.PredictionStatsDTO;
import com.dispatchplatform.bureau.memory.CityMemory;
import com.dispatchplatform.bureau.orchestrator.BureauRegistry;
import com.dispatchplatform.common.ai.ReasoningRequest;
import com.dispatchplatform.common.ledger.PredictionLedger;
import com.dispatchplatform.common.model.Prediction;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static com.dispatchplatform.bureau.TestIncidents.T0;
import static com.dispatchplatform.bureau.TestIncidents.robbery;
import static org.junit.jupiter.api.Assertions.*;

class BureauQueryServiceTest {

    private AtomicReference<Function<ReasoningRequest, Mono<String>>> reasoning;
    private List<ReasoningRequest> requests;
    private BureauRegistry registry;
    private BureauQueryService service;

    @BeforeEach
    void setUp() {
        reasoning = new AtomicReference<>(request -> Mono.just("All quiet."));
        requests  = new CopyOnWriteArrayList<>();
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        BureauProperties properties = new BureauProperties();
        MutableClock clock = new MutableClock(T0);
        registry = new BureauRegistry(properties, request -> {
            requests.add(request);
            return reasoning.get().apply(request);
        }, mapper, new RecordingEventBus(), clock);
        service  = new BureauQueryService(registry, request -> {
            requests.add(request);
            return reasoning.get().apply(request);
        }, mapper, properties, clock);
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    // ── routing ───────────────────────────────────────────────────────────────

    @Test
    @DisplayName("questions are routed by keyword with PATTERN as the default")
    void route() {
        assertEquals("CHASE", BureauQueryService.route("Where did the suspect who fled go?"));
        assertEquals("PROPHET", BureauQueryService.route("What should we expect tonight?"));
        assertEquals("HISTORIAN", BureauQueryService.route("Has this happened BEFORE?"));
        assertEquals("PATTERN", BureauQueryService.route("Are these robberies linked?"));
        assertEquals("PATTERN", BureauQueryService.route(null));
    }

    // ── read views ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("read views")
    class Views {

        @Test
        @DisplayName("unknown cities complete empty")
        void unknownCity() {
            assertNull(service.getAgentStatuses("chicago").block());
            assertNull(service.getPredictionStats("chicago").block());
            assertNull(service.getActivePatterns("chicago").block());
            assertNull(service.getHotspots("chicago").block());
            assertNull(service.askAgents("chicago", "anything?", null).block());
            assertNull(service.generateBriefing("chicago").block());
        }

        @Test
        @DisplayName("prediction stats report the ledger counters and accuracy text")
        void predictionStats() {
            CityMemory memory = memory();
            PredictionLedger ledger = PredictionLedger.empty();
            for (int i = 1; i <= 3; i++) {
                ledger = ledger.register(Prediction.pending("pred-" + i, "PROPHET", null, "Brooklyn", "Robbery",
                    0.6, "", T0, T0.plus(Duration.ofMinutes(30))));
            }
            ledger = ledger.recordHit("pred-1", 10, T0).ledger();
            ledger = ledger.recordHit("pred-2", 11, T0).ledger();
            ledger = ledger.recordExpiry("pred-3", T0).ledger();
            memory.applyLedger(ledger);

            PredictionStatsDTO stats = service.getPredictionStats("nyc").block();

            assertNotNull(stats);
            assertEquals(3, stats.total());
            assertEquals(2, stats.correct());
            assertEquals("66.7% (2/3)", stats.accuracy());
            assertTrue(stats.pending().isEmpty());
        }

        @Test
        @DisplayName("agent statuses list all four agents")
        void statuses() {
            assertEquals(4, service.getAgentStatuses("nyc").block().size());
        }

        @Test
        @DisplayName("hotspots come from city memory")
        void hotspots() {
            memory().record(robbery(1, "Flatbush Ave", T0));

            assertEquals(1, service.getHotspots("nyc").block().get(0).count());
        }
    }

    // ── ask ───────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("askAgents()")
    class Ask {

        @Test
        @DisplayName("answers through the routed agent")
        void answers() {
            AnswerDTO answer = service.askAgents("nyc", "What do you predict next?", null).block();

            assertNotNull(answer);
            assertEquals("PROPHET", answer.agent());
            assertEquals("All quiet.", answer.answer());
            assertNull(answer.error());
            assertEquals("ask-PROPHET", requests.get(0).purpose());
        }

        @Test
        @DisplayName("focuses on the referenced incident when it is in memory")
        void focus() {
            memory().record(robbery(7, "Flatbush Ave", T0));

            service.askAgents("nyc", "Is this linked?", 7L).block();

            assertTrue(requests.get(0).prompt().contains("Specific incident"));
        }

        @Test
        @DisplayName("a failed call becomes an answer carrying the error")
        void failure() {
            reasoning.set(request -> Mono.error(new IllegalStateException("timeout")));

            AnswerDTO answer = service.askAgents("nyc", "Anything linked?", null).block();

            assertNotNull(answer);
            assertNull(answer.answer());
            assertEquals("timeout", answer.error());
        }
    }

    // ── briefing ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("generateBriefing()")
    class Briefing {

        @Test
        @DisplayName("includes stats and agent statuses")
        void briefing() {
            memory().record(robbery(1, "Flatbush Ave", T0.minus(Duration.ofMinutes(10))));
            memory().record(robbery(2, "Flatbush Ave", T0.minus(Duration.ofHours(2))));

            BriefingDTO briefing = service.generateBriefing("nyc").block();

            assertNotNull(briefing);
            assertEquals("All quiet.", briefing.briefing());
            assertEquals(1, briefing.stats().incidentsLastHour());
            assertEquals(2, briefing.stats().totalIncidents());
            assertEquals("No predictions yet", briefing.stats().predictionAccuracy());
            assertEquals(4, briefing.agents().size());
        }

        @Test
        @DisplayName("falls back to a fixed text when the call fails")
        void fallback() {
            reasoning.set(request -> Mono.error(new IllegalStateException("timeout")));

            BriefingDTO briefing = service.generateBriefing("nyc").block();

            assertNotNull(briefing);
            assertEquals(BureauQueryService.BRIEFING_FALLBACK, briefing.briefing());
            assertNotNull(briefing.stats());
            assertEquals(4, briefing.agents().size());
        }
    }

    private CityMemory memory() {
        return registry.find("nyc").orElseThrow().memory();
    }
}
