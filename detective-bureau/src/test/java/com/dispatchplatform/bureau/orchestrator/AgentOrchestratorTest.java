package com.dispatchplatform.bureau.orchestrator;

import com.dispatchplatform.bureau.MutableClock;
import com.dispatchplatform.bureau.RecordingEventBus;
import com.dispatchplatform.bureau.agent.Agent;
import com.dispatchplatform.bureau.agent.AgentContext;
import com.dispatchplatform.bureau.agent.AgentInsight;
import com.dispatchplatform.bureau.agent.AgentProfile;
import com.dispatchplatform.bureau.agent.AgentStatus;
import com.dispatchplatform.bureau.agent.Urgency;
import com.dispatchplatform.bureau.memory.CityMemory;
import com.dispatchplatform.common.city.CityProfiles;
import com.dispatchplatform.common.event.AgentInsightEvent;
import com.dispatchplatform.common.event.PredictionHitEvent;
import com.dispatchplatform.common.model.Incident;
import com.dispatchplatform.common.model.Pattern;
import com.dispatchplatform.common.model.Prediction;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.function.BiFunction;

import static com.dispatchplatform.bureau.TestIncidents.T0;
import static com.dispatchplatform.bureau.TestIncidents.robbery;
import static org.junit.jupiter.api.Assertions.*;

class AgentOrchestratorTest {

    private MutableClock clock;
    private RecordingEventBus bus;
    private Scheduler cityScheduler;
    private CityMemory memory;

    @BeforeEach
    void setUp() {
        clock         = new MutableClock(T0);
        bus           = new RecordingEventBus();
        cityScheduler = Schedulers.newSingle("bureau-test");
        memory        = new CityMemory("nyc", 200, 50);
    }

    @AfterEach
    void tearDown() {
        cityScheduler.dispose();
    }

    // ── prediction resolution ─────────────────────────────────────────────────

    @Nested
    @DisplayName("prediction resolution")
    class Resolution {

        @Test
        @DisplayName("a matching incident inside the window is a hit, counted once")
        void hit() {
            AgentOrchestrator orchestrator = orchestrator();
            orchestrator.onIncident(robbery(1, "Flatbush Ave", T0)).block();
            orchestrator.apply(forecast("pred-1", T0.plus(Duration.ofMinutes(30)))).block();

            clock.advance(Duration.ofMinutes(10));
            orchestrator.onIncident(robbery(2, "Atlantic Ave", clock.instant())).block();

            assertEquals(1, memory.ledger().total());
            assertEquals(1, memory.ledger().correct());
            assertTrue(memory.ledger().pending().isEmpty());
            assertEquals("pred-1", memory.incidents().get(1).matchedPredictionId());
            assertNull(memory.incidents().get(0).matchedPredictionId());

            PredictionHitEvent hit = bus.published().stream()
                .filter(PredictionHitEvent.class::isInstance)
                .map(PredictionHitEvent.class::cast)
                .findFirst().orElseThrow();
            assertEquals(2L, hit.matchedIncidentId());
            assertEquals(1.0, hit.accuracy());
            assertEquals("nyc", hit.city());

            clock.advance(Duration.ofMinutes(1));
            orchestrator.onIncident(robbery(3, "Atlantic Ave", clock.instant())).block();
            assertEquals(1, memory.ledger().total());
        }

        @Test
        @DisplayName("an overdue prediction expires before the incident is matched")
        void expiresFirst() {
            AgentOrchestrator orchestrator = orchestrator();
            orchestrator.apply(forecast("pred-1", T0.plus(Duration.ofMinutes(30)))).block();

            clock.advance(Duration.ofMinutes(31));
            orchestrator.onIncident(robbery(1, "Atlantic Ave", clock.instant())).block();

            assertEquals(1, memory.ledger().total());
            assertEquals(0, memory.ledger().correct());
            assertFalse(bus.names().contains("prediction_hit"));
            assertNull(memory.incidents().get(0).matchedPredictionId());
        }

        @Test
        @DisplayName("sweep expires overdue predictions and stale patterns")
        void sweep() {
            AgentOrchestrator orchestrator = orchestrator();
            orchestrator.apply(new AgentInsight("PATTERN", "🔗", null, null, Urgency.MEDIUM,
                List.of(Pattern.detected("pat-1", "Flatbush", List.of(), List.of(1L, 2L), 0.7, "", T0)),
                List.of(prediction("pred-1", T0.plus(Duration.ofMinutes(30)))))).block();

            clock.advance(Duration.ofHours(7));
            orchestrator.sweep().block();

            assertEquals(1, memory.ledger().total());
            assertTrue(memory.ledger().pending().isEmpty());
            assertTrue(memory.activePatterns().isEmpty());
            assertEquals("EXPIRED", memory.recentPredictions(1).get(0).status().name());
        }
    }

    // ── agent results ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("agent results")
    class Results {

        @Test
        @DisplayName("analysis and predictions are published in that order")
        void publishes() {
            AgentOrchestrator orchestrator = orchestrator();

            orchestrator.apply(forecast("pred-1", T0.plus(Duration.ofMinutes(30)))).block();

            assertEquals(List.of("agent_insight", "prediction"), bus.names());
            assertEquals(1, memory.ledger().pending().size());
            assertEquals(1, memory.recentPredictions(10).size());
        }

        @Test
        @DisplayName("a result the agent no longer accepts is discarded")
        void stale() {
            StubAgent picky = new StubAgent("CHASE", (incident, ctx) ->
                Mono.just(AgentInsight.text(profile("CHASE"), incident.id(), "go north", Urgency.CRITICAL)));
            picky.accepting = false;
            AgentOrchestrator orchestrator = orchestrator(picky);

            orchestrator.onIncident(robbery(1, "Flatbush Ave", T0)).block();

            assertTrue(bus.published().isEmpty());
            assertEquals(1, memory.incidentCount());
        }

        @Test
        @DisplayName("a failing agent does not stop the others")
        void isolation() {
            StubAgent broken = new StubAgent("HISTORIAN", (incident, ctx) -> {
                throw new IllegalStateException("boom");
            });
            StubAgent erroring = new StubAgent("PROPHET", (incident, ctx) -> Mono.error(new IllegalStateException("down")));
            StubAgent working = new StubAgent("CHASE", (incident, ctx) ->
                Mono.just(AgentInsight.text(profile("CHASE"), incident.id(), "go north", Urgency.CRITICAL)));
            AgentOrchestrator orchestrator = orchestrator(broken, erroring, working);

            orchestrator.onIncident(robbery(1, "Flatbush Ave", T0)).block();

            assertEquals(List.of("agent_insight"), bus.names());
            AgentInsightEvent event = (AgentInsightEvent) bus.published().get(0);
            assertEquals("CHASE", event.agent());
            assertEquals("critical", event.urgency());
            assertEquals(1L, event.incidentId());
        }

        @Test
        @DisplayName("agents see the incident already recorded")
        void recordedBeforeTrigger() {
            StubAgent observer = new StubAgent("HISTORIAN", (incident, ctx) ->
                Mono.just(AgentInsight.text(profile("HISTORIAN"), incident.id(),
                    "memory holds " + ctx.memory().incidentCount(), Urgency.MEDIUM)));
            AgentOrchestrator orchestrator = orchestrator(observer);

            orchestrator.onIncident(robbery(1, "Flatbush Ave", T0)).block();

            assertEquals("memory holds 1", ((AgentInsightEvent) bus.published().get(0)).analysis());
        }

        @Test
        @DisplayName("incidents are recorded in arrival order")
        void arrivalOrder() {
            AgentOrchestrator orchestrator = orchestrator();
            for (long id = 1; id <= 20; id++) {
                orchestrator.onIncident(robbery(id, "Flatbush Ave", T0)).subscribe();
            }
            orchestrator.sweep().block();

            assertEquals(20, memory.incidentCount());
            for (int i = 0; i < 20; i++) {
                assertEquals(i + 1L, memory.incidents().get(i).id());
            }
        }
    }

    @Test
    @DisplayName("tick runs only the named agent")
    void tick() {
        StubAgent chase = new StubAgent("CHASE", (incident, ctx) -> Mono.empty());
        StubAgent prophet = new StubAgent("PROPHET", (incident, ctx) -> Mono.empty());
        AgentOrchestrator orchestrator = orchestrator(chase, prophet);

        orchestrator.tick("PROPHET").block();
        orchestrator.tick("UNKNOWN").block();

        assertEquals(0, chase.ticks);
        assertEquals(1, prophet.ticks);
    }

    // ── helpers ───────────────────────────────────────────────────────────────

    private AgentOrchestrator orchestrator(Agent... agents) {
        return new AgentOrchestrator(CityProfiles.NYC, memory, List.of(agents), bus, clock, cityScheduler,
            new CityTaskScheduler("nyc", Schedulers.parallel()), Duration.ofHours(6));
    }

    private AgentInsight forecast(String id, Instant expiresAt) {
        return new AgentInsight("PROPHET", "🔮", null, "Brooklyn robberies likely", Urgency.MEDIUM,
            List.of(), List.of(prediction(id, expiresAt)));
    }

    private Prediction prediction(String id, Instant expiresAt) {
        return Prediction.pending(id, "PROPHET", null, "Brooklyn", "Robbery", 0.7, "cluster",
            clock.instant(), expiresAt);
    }

    private static AgentProfile profile(String id) {
        return new AgentProfile(id, id, "Test", "*", "test persona");
    }

    private static class StubAgent implements Agent {

        private final AgentProfile profile;
        private final BiFunction<Incident, AgentContext, Mono<AgentInsight>> onIncident;
        volatile boolean accepting = true;
        volatile int ticks;

        StubAgent(String id, BiFunction<Incident, AgentContext, Mono<AgentInsight>> onIncident) {
            this.profile    = AgentOrchestratorTest.profile(id);
            this.onIncident = onIncident;
        }

        @Override
        public AgentProfile profile() {
            return profile;
        }

        @Override
        public Mono<AgentInsight> onIncident(Incident incident, AgentContext ctx) {
            return onIncident.apply(incident, ctx);
        }

        @Override
        public Mono<Void> onTick(AgentContext ctx) {
            ticks++;
            return Mono.empty();
        }

        @Override
        public AgentStatus status(AgentContext ctx) {
            return AgentStatus.of(profile, "idle");
        }

        @Override
        public boolean accepts(AgentInsight insight, Instant now) {
            return accepting;
        }
    }
}
