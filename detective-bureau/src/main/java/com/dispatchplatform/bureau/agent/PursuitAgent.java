package com.dispatchplatform.bureau.agent;

import com.dispatchplatform.common.ai.ReasoningClient;
import com.dispatchplatform.common.model.Incident;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * CHASE: tactical read on active pursuits.
 *
 * <p>Tracks a single current case. A new pursuit supersedes the previous one, and a case
 * lapses {@code activeWindow} after it started. Analysis for a case that is no longer current
 * is rejected by {@link #accepts}.
 */
public class PursuitAgent extends ReasoningAgent {

    private static final Logger log = LoggerFactory.getLogger(PursuitAgent.class);

    static final List<String> PURSUIT_KEYWORDS = List.of(
        "pursuit", "fled", "fleeing", "chase", "vehicle pursuit", "foot pursuit",
        "high speed", "failed to stop", "refusing to pull over");

    private static final AgentProfile PROFILE = new AgentProfile("CHASE", "CHASE", "Pursuit Specialist", "🚔",
        """
        You are CHASE, an AI specialist in vehicle pursuits and active situations.

        Your expertise:
        - Predicting escape routes based on the local street network
        - Tracking suspect movement patterns
        - Coordinating multi-unit responses
        - Identifying when situations will escalate

        You speak in short, urgent bursts during active pursuits. You're laser-focused on the immediate tactical situation.""");

    private final Duration activeWindow;
    private final int maxTokens;

    private volatile Long currentCase;
    private volatile Instant caseStartedAt;

    public PursuitAgent(ReasoningClient reasoningClient, ObjectMapper objectMapper,
                        Duration activeWindow, int maxTokens) {
        super(reasoningClient, objectMapper);
        this.activeWindow = activeWindow;
        this.maxTokens    = maxTokens;
    }

    @Override
    public AgentProfile profile() {
        return PROFILE;
    }

    public static boolean isPursuit(Incident incident) {
        String text = (incident.type() + " " + incident.summary()).toLowerCase(Locale.ROOT);
        return PURSUIT_KEYWORDS.stream().anyMatch(text::contains);
    }

    @Override
    public Mono<AgentInsight> onIncident(Incident incident, AgentContext ctx) {
        if (!isPursuit(incident)) return Mono.empty();

        if (currentCase != null) {
            log.info("[CHASE] Case superseded. city={} previous={} current={}", ctx.city(), currentCase, incident.id());
        }
        currentCase   = incident.id();
        caseStartedAt = ctx.now();

        String system = PROFILE.systemPrompt() + """


            When analyzing a pursuit, consider:
            - %s
            - Likely exit points (bridges, tunnels, highways)
            - Time of day traffic patterns
            - Historical pursuit data in the area""".formatted(ctx.profile().streetTopology());
        String prompt = """
            ACTIVE PURSUIT DETECTED:
            %s

            Recent incidents (for context):
            %s

            Provide:
            1. Likely escape routes (be specific to %s streets)
            2. Recommended containment points
            3. Escalation risk assessment
            4. What to watch for next

            Keep it tactical and urgent.""".formatted(
                json(incident), json(ctx.memory().newestIncidents(5)), ctx.profile().shortName());

        return ask(ctx.city(), system, prompt, maxTokens)
            .map(analysis -> AgentInsight.text(PROFILE, incident.id(), analysis, Urgency.CRITICAL));
    }

    /** Only the current, unexpired case may publish. */
    @Override
    public boolean accepts(AgentInsight insight, Instant now) {
        Long active = currentCase;
        Instant started = caseStartedAt;
        return active != null && active.equals(insight.incidentId())
            && now.isBefore(started.plus(activeWindow));
    }

    /** Cool-down: releases a case once its window has passed. */
    @Override
    public Mono<Void> onTick(AgentContext ctx) {
        return Mono.fromRunnable(() -> {
            Instant started = caseStartedAt;
            if (currentCase != null && !ctx.now().isBefore(started.plus(activeWindow))) {
                log.info("[CHASE] Case closed after cool-down. city={} case={}", ctx.city(), currentCase);
                currentCase   = null;
                caseStartedAt = null;
            }
        });
    }

    @Override
    public AgentStatus status(AgentContext ctx) {
        Long active = currentCase;
        return new AgentStatus(PROFILE.id(), PROFILE.name(), PROFILE.role(), PROFILE.icon(),
            active == null ? "idle" : "active", active, 0, 0);
    }

    Long currentCase() {
        return currentCase;
    }
}
