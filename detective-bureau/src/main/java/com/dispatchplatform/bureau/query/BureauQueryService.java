package com.dispatchplatform.bureau.query;

import com.dispatchplatform.bureau.agent.Accuracy;
import com.dispatchplatform.bureau.agent.Agent;
import com.dispatchplatform.bureau.agent.AgentStatus;
import com.dispatchplatform.bureau.config.BureauProperties;
import com.dispatchplatform.bureau.dto.AnswerDTO;
import com.dispatchplatform.bureau.dto.BriefingDTO;
import com.dispatchplatform.bureau.dto.PatternsDTO;
import com.dispatchplatform.bureau.dto.PredictionStatsDTO;
import com.dispatchplatform.bureau.memory.CityMemory;
import com.dispatchplatform.bureau.memory.Hotspot;
import com.dispatchplatform.bureau.orchestrator.AgentOrchestrator;
import com.dispatchplatform.bureau.orchestrator.BureauRegistry;
import com.dispatchplatform.common.ai.ReasoningClient;
import com.dispatchplatform.common.ai.ReasoningRequest;
import com.dispatchplatform.common.ledger.PredictionLedger;
import com.dispatchplatform.common.model.Incident;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Read-only views over a city's bureau plus the two on-demand reasoning features: routed
 * questions and the briefing. Every method completes empty for a city without a bureau.
 */
@Service
public class BureauQueryService {

    private static final Logger log = LoggerFactory.getLogger(BureauQueryService.class);

    static final String BRIEFING_FALLBACK =
        "Briefing unavailable: the analysis service did not respond. Statistics below are current.";

    private final BureauRegistry registry;
    private final ReasoningClient reasoningClient;
    private final ObjectMapper objectMapper;
    private final BureauProperties.Query settings;
    private final Clock clock;

    public BureauQueryService(BureauRegistry registry, ReasoningClient reasoningClient, ObjectMapper objectMapper,
                              BureauProperties properties, Clock clock) {
        this.registry        = registry;
        this.reasoningClient = reasoningClient;
        this.objectMapper    = objectMapper;
        this.settings        = properties.getQuery();
        this.clock           = clock;
    }

    public Mono<List<AgentStatus>> getAgentStatuses(String city) {
        return Mono.justOrEmpty(registry.find(city)).map(this::statuses);
    }

    public Mono<PredictionStatsDTO> getPredictionStats(String city) {
        return Mono.justOrEmpty(registry.find(city)).map(o -> {
            CityMemory memory = o.memory();
            PredictionLedger ledger = memory.ledger();
            return new PredictionStatsDTO(ledger.total(), ledger.correct(), ledger.accuracy(),
                Accuracy.describe(ledger), ledger.pending(), memory.recentPredictions(settings.getRecentPredictions()));
        });
    }

    public Mono<PatternsDTO> getActivePatterns(String city) {
        return Mono.justOrEmpty(registry.find(city))
            .map(o -> new PatternsDTO(o.memory().activePatterns(), o.memory().patterns().size()));
    }

    public Mono<List<Hotspot>> getHotspots(String city) {
        return Mono.justOrEmpty(registry.find(city))
            .map(o -> o.memory().topHotspots(settings.getHotspotLimit()));
    }

    // ── questions ─────────────────────────────────────────────────────────────

    /** Agent best placed to answer {@code question}, by keyword. */
    public static String route(String question) {
        String q = question == null ? "" : question.toLowerCase(Locale.ROOT);
        if (q.contains("pursuit") || q.contains("chase") || q.contains("fled")) return "CHASE";
        if (q.contains("predict") || q.contains("next") || q.contains("expect")) return "PROPHET";
        if (q.contains("before") || q.contains("history") || q.contains("last time")) return "HISTORIAN";
        return "PATTERN";
    }

    /** Answers through the routed agent. A failed call yields an answer carrying {@code error}. */
    public Mono<AnswerDTO> askAgents(String city, String question, Long incidentId) {
        return Mono.justOrEmpty(registry.find(city)).flatMap(o -> {
            String agentId = route(question);
            Agent agent = o.agent(agentId).orElseThrow();
            CityMemory memory = o.memory();
            long activeCases = statuses(o).stream().filter(s -> s.currentCase() != null).count();

            String system = agent.profile().systemPrompt() + """


                You are responding to a user question. Be helpful, specific, and reference actual data when possible.

                Current prediction accuracy: %s
                Active cases: %d
                Incidents in memory: %d""".formatted(Accuracy.describe(memory.ledger()), activeCases,
                                                     memory.incidentCount());
            String focus = incidentId == null ? "" : memory.incidents().stream()
                .filter(i -> i.id() == incidentId)
                .findFirst()
                .map(i -> "\n- Specific incident: " + json(i))
                .orElse("");
            String prompt = """
                Question: %s

                Context:
                - Recent incidents: %s
                - Active patterns: %s
                - Pending predictions: %s%s""".formatted(question, json(memory.newestIncidents(10)),
                    json(memory.activePatterns()), json(memory.ledger().pending().stream().limit(5).toList()), focus);

            return reasoningClient.complete(ReasoningRequest.of("ask-" + agentId, system, prompt,
                                                                settings.getAskMaxTokens()))
                .map(answer -> new AnswerDTO(agentId, agent.profile().icon(), answer, null, clock.instant()))
                .switchIfEmpty(Mono.fromSupplier(() ->
                    new AnswerDTO(agentId, agent.profile().icon(), null, "empty reply", clock.instant())))
                .onErrorResume(e -> {
                    log.warn("[{}] Question failed. city={} reason={}", agentId, city, e.getMessage());
                    return Mono.just(new AnswerDTO(agentId, agent.profile().icon(), null, e.getMessage(),
                        clock.instant()));
                });
        });
    }

    // ── briefing ──────────────────────────────────────────────────────────────

    /** Synthesized briefing. Statistics and agent statuses are returned even when the call fails. */
    public Mono<BriefingDTO> generateBriefing(String city) {
        return Mono.justOrEmpty(registry.find(city)).flatMap(o -> {
            CityMemory memory = o.memory();
            Instant now = clock.instant();
            Instant hourAgo = now.minus(Duration.ofHours(1));
            List<Incident> lastHour = memory.newestIncidents(memory.incidentCount()).stream()
                .filter(i -> i.createdAt().isAfter(hourAgo))
                .toList();
            String accuracy = Accuracy.describe(memory.ledger());
            BriefingDTO.Stats stats = new BriefingDTO.Stats(lastHour.size(), memory.incidentCount(),
                memory.activePatterns().size(), memory.ledger().pending().size(), accuracy);
            List<AgentStatus> agents = statuses(o);

            String roster = o.agents().stream()
                .map(a -> "- " + a.profile().name() + " (" + a.profile().role() + ")"
                    + ("PROPHET".equals(a.id()) ? " - Accuracy: " + accuracy : ""))
                .collect(Collectors.joining("\n"));
            String system = """
                You are the Detective Bureau briefing system for %s. Synthesize reports from all agents into a cohesive briefing.

                Agents reporting:
                %s

                Be concise, actionable, and highlight what matters most.""".formatted(o.context().profile().name(), roster);
            String prompt = """
                Generate a Detective Bureau briefing.

                ACTIVITY SUMMARY:
                - Incidents (last hour): %d
                - Incidents (total in memory): %d
                - Active patterns: %d
                - Pending predictions: %d
                - Prediction accuracy: %s

                RECENT INCIDENTS:
                %s

                ACTIVE PATTERNS:
                %s

                CURRENT PREDICTIONS:
                %s

                TOP HOTSPOTS:
                %s

                Provide:
                1. Executive Summary (2-3 sentences)
                2. Key Developments (bullet points)
                3. Active Threats/Patterns
                4. Predictions for the coming hours
                5. Recommended Actions""".formatted(stats.incidentsLastHour(), stats.totalIncidents(),
                    stats.activePatterns(), stats.pendingPredictions(), accuracy,
                    json(lastHour.stream().limit(15).toList()), json(memory.activePatterns()),
                    json(memory.ledger().pending()), json(memory.topHotspots(5)));

            return reasoningClient.complete(ReasoningRequest.of("briefing-" + city, system, prompt,
                                                                settings.getBriefingMaxTokens()))
                .filter(text -> !text.isBlank())
                .onErrorResume(e -> {
                    log.warn("[Briefing] Generation failed. city={} reason={}", city, e.getMessage());
                    return Mono.empty();
                })
                .defaultIfEmpty(BRIEFING_FALLBACK)
                .map(text -> new BriefingDTO(text, stats, agents, now));
        });
    }

    // ── private ───────────────────────────────────────────────────────────────

    private List<AgentStatus> statuses(AgentOrchestrator orchestrator) {
        return orchestrator.agents().stream().map(a -> a.status(orchestrator.context())).toList();
    }

    private String json(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
