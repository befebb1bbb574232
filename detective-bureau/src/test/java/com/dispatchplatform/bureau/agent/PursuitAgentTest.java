package com.dispatchplatform.bureau.agent;

import com.dispatchplatform.bureau.MutableClock;
import com.dispatchplatform.bureau.memory.CityMemory;
import com.dispatchplatform.common.ai.ReasoningRequest;
import com.dispatchplatform.common.city.CityProfiles;
import com.dispatchplatform.common.model.Incident;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static com.dispatchplatform.bureau.TestIncidents.T0;
import static com.dispatchplatform.bureau.TestIncidents.incident;
import static org.junit.jupiter.api.Assertions.*;

class PursuitAgentTest {

    private MutableClock clock;
    private List<ReasoningRequest> requests;
    private PursuitAgent agent;
    private AgentContext ctx;

    @BeforeEach
    void setUp() {
        clock    = new MutableClock(T0);
        requests = new CopyOnWriteArrayList<>();
        agent    = new PursuitAgent(request -> {
            requests.add(request);
            return Mono.just("Suspect heading north toward the bridge.");
        }, new ObjectMapper().registerModule(new JavaTimeModule()), Duration.ofMinutes(30), 400);
        ctx      = new AgentContext(CityProfiles.NYC, new CityMemory("nyc", 200, 50), clock, insight -> Mono.empty());
    }

    @Test
    @DisplayName("pursuit keywords are matched over type and summary")
    void keywords() {
        assertTrue(PursuitAgent.isPursuit(pursuit(1)));
        assertTrue(PursuitAgent.isPursuit(incident(2, "Robbery", "Broadway", "Manhattan",
            "Perp fled on foot southbound", T0)));
        assertTrue(PursuitAgent.isPursuit(incident(3, "Traffic stop", "FDR", "Manhattan",
            "Vehicle failed to stop at checkpoint", T0)));
        assertFalse(PursuitAgent.isPursuit(incident(4, "Noise complaint", "Broadway", "Manhattan",
            "Loud music", T0)));
    }

    @Test
    @DisplayName("non-pursuit incidents do not engage")
    void ignoresOthers() {
        Incident noise = incident(4, "Noise complaint", "Broadway", "Manhattan", "Loud music", T0);

        assertNull(agent.onIncident(noise, ctx).block());
        assertTrue(requests.isEmpty());
        assertEquals("idle", agent.status(ctx).status());
    }

    @Test
    @DisplayName("a pursuit produces critical analysis seeded with the city's street topology")
    void analysis() {
        AgentInsight insight = agent.onIncident(pursuit(1), ctx).block();

        assertNotNull(insight);
        assertEquals(Urgency.CRITICAL, insight.urgency());
        assertEquals(1L, insight.incidentId());
        assertEquals("CHASE", insight.agent());
        assertEquals(400, requests.get(0).maxTokens());
        assertTrue(requests.get(0).system().contains(CityProfiles.NYC.streetTopology()));
        assertEquals("active", agent.status(ctx).status());
        assertEquals(1L, agent.status(ctx).currentCase());
    }

    @Test
    @DisplayName("results for a superseded case are rejected")
    void superseded() {
        AgentInsight first = agent.onIncident(pursuit(1), ctx).block();
        AgentInsight second = agent.onIncident(pursuit(2), ctx).block();

        assertFalse(agent.accepts(first, clock.instant()));
        assertTrue(agent.accepts(second, clock.instant()));
    }

    @Test
    @DisplayName("results arriving after the active window are rejected")
    void expired() {
        AgentInsight insight = agent.onIncident(pursuit(1), ctx).block();

        clock.advance(Duration.ofMinutes(30));

        assertFalse(agent.accepts(insight, clock.instant()));
    }

    @Test
    @DisplayName("cool-down closes the case once the window has passed")
    void cooldown() {
        agent.onIncident(pursuit(1), ctx).block();

        clock.advance(Duration.ofMinutes(29));
        agent.onTick(ctx).block();
        assertEquals(1L, agent.currentCase());

        clock.advance(Duration.ofMinutes(1));
        agent.onTick(ctx).block();
        assertNull(agent.currentCase());
        assertEquals("idle", agent.status(ctx).status());
    }

    private static Incident pursuit(long id) {
        return incident(id, "Vehicle pursuit", "FDR Drive & 96th St", "Manhattan",
            "Black sedan fleeing northbound at high speed", T0);
    }
}
