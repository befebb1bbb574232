package com.dispatchplatform.bureau.agent;

import com.dispatchplatform.bureau.config.BureauProperties;
import com.dispatchplatform.common.ai.JsonBlocks;
import com.dispatchplatform.common.ai.ReasoningClient;
import com.dispatchplatform.common.model.Incident;
import com.dispatchplatform.common.model.Pattern;
import com.dispatchplatform.common.model.Prediction;
import com.dispatchplatform.common.text.TextSimilarity;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * PATTERN: links incidents that look like the same series.
 *
 * <p>The reasoning service is consulted only when memory already holds at least
 * {@code minRelated} other incidents from the lookback window that share the incident's type,
 * or its borough together with a similar summary. A detected pattern may carry a forecast;
 * forecasts above {@code minPredictionConfidence} are registered as predictions.
 */
public class PatternAgent extends ReasoningAgent {

    private static final Logger log = LoggerFactory.getLogger(PatternAgent.class);

    static final int PROMPT_INCIDENTS = 10;
    static final double HIGH_URGENCY_CONFIDENCE = 0.7;
    static final double DEFAULT_CONFIDENCE = 0.5;

    private static final AgentProfile PROFILE = new AgentProfile("PATTERN", "PATTERN", "Serial Crime Analyst", "🔗",
        """
        You are PATTERN, an AI analyst specializing in detecting serial crimes and criminal patterns.

        Your expertise:
        - Identifying MO (modus operandi) similarities
        - Geographic clustering analysis
        - Temporal pattern recognition
        - Linking seemingly unrelated incidents

        You're methodical and data-driven. You don't jump to conclusions - you build cases with evidence. You track multiple potential patterns simultaneously.

        When you detect a pattern:
        1. Identify the common elements
        2. Estimate confidence level
        3. Predict likely next occurrence
        4. Suggest investigative actions""");

    private final BureauProperties.PatternSettings settings;

    private volatile String state = "monitoring";

    public PatternAgent(ReasoningClient reasoningClient, ObjectMapper objectMapper,
                        BureauProperties.PatternSettings settings) {
        super(reasoningClient, objectMapper);
        this.settings = settings;
    }

    @Override
    public AgentProfile profile() {
        return PROFILE;
    }

    /**
     * Other incidents in memory, newest first, that qualify as related to {@code incident}:
     * created within the lookback window and either of the same type, or in the same borough
     * with a summary similarity above the threshold.
     */
    public List<Incident> relatedIncidents(Incident incident, List<Incident> memory, Instant now) {
        Instant cutoff = now.minus(settings.getLookback());
        List<Incident> related = new ArrayList<>();
        for (int i = memory.size() - 1; i >= 0; i--) {
            Incident other = memory.get(i);
            if (other.id() == incident.id() || other.createdAt().isBefore(cutoff)) continue;
            boolean sameType    = other.type() != null && other.type().equalsIgnoreCase(incident.type());
            boolean sameBorough = Objects.equals(other.borough(), incident.borough());
            boolean similar     = TextSimilarity.jaccard(other.summary(), incident.summary())
                                  > settings.getSimilarityThreshold();
            if (sameType || (sameBorough && similar)) related.add(other);
        }
        return related;
    }

    @Override
    public Mono<AgentInsight> onIncident(Incident incident, AgentContext ctx) {
        Instant now = ctx.now();
        List<Incident> related = relatedIncidents(incident, ctx.memory().incidents(), now);
        if (related.size() < settings.getMinRelated()) return Mono.empty();

        log.info("[PATTERN] Checking candidate series. city={} incident={} related={}",
                 ctx.city(), incident.id(), related.size());
        String prompt = """
            New incident that may be part of a pattern:
            %s

            Similar recent incidents:
            %s

            Analyze:
            1. Is this part of a pattern? (be skeptical, require real evidence)
            2. If yes, what connects them?
            3. Predicted next occurrence (location, time, type)
            4. Confidence level (0.0-1.0)

            Respond in JSON:
            {
              "patternDetected": true/false,
              "patternName": "string (creative name if pattern exists)",
              "connections": ["list of connecting factors"],
              "linkedIncidentIds": [ids],
              "prediction": {
                "location": "specific area",
                "timeWindow": "e.g., next 4 hours",
                "confidence": 0.0-1.0
              },
              "confidence": 0.0-1.0,
              "analysis": "string explanation"
            }""".formatted(json(incident), json(related.subList(0, Math.min(PROMPT_INCIDENTS, related.size()))));

        return ask(ctx.city(), PROFILE.systemPrompt(), prompt, settings.getMaxTokens())
            .flatMap(reply -> Mono.justOrEmpty(interpret(reply, incident, related, now)));
    }

    /** Reads a pattern-check reply. Empty when no pattern was detected or the reply is unusable. */
    Optional<AgentInsight> interpret(String reply, Incident incident, List<Incident> related, Instant now) {
        Optional<JsonNode> block = JsonBlocks.extract(reply, objectMapper);
        if (block.isEmpty() || !block.get().path("patternDetected").asBoolean(false)) return Optional.empty();
        JsonNode json = block.get();

        Set<Long> known = related.stream().map(Incident::id).collect(Collectors.toCollection(HashSet::new));
        known.add(incident.id());
        Set<Long> linked = new LinkedHashSet<>();
        JsonNode ids = json.has("linkedIncidentIds") ? json.path("linkedIncidentIds") : json.path("involvedIncidents");
        ids.forEach(n -> {
            if (n.canConvertToLong() && known.contains(n.asLong())) linked.add(n.asLong());
        });
        linked.add(incident.id());
        if (linked.size() < 2) related.forEach(i -> linked.add(i.id()));

        JsonNode forecast = json.path("prediction");
        double forecastConfidence = confidence(forecast.path("confidence"), 0.0);
        double patternConfidence  = confidence(json.path("confidence"),
            forecastConfidence > 0 ? forecastConfidence : DEFAULT_CONFIDENCE);
        String name     = Optional.ofNullable(JsonBlocks.text(json, "patternName")).orElse("Unnamed pattern");
        String analysis = Optional.ofNullable(JsonBlocks.text(json, "analysis")).orElse("");

        Pattern pattern = Pattern.detected(newId("pattern"), name, textList(json.path("connections")),
            List.copyOf(linked), patternConfidence, analysis, now);

        List<Prediction> predictions = new ArrayList<>();
        String forecastLocation = JsonBlocks.text(forecast, "location");
        if (Incident.isKnown(forecastLocation) && forecastConfidence > settings.getMinPredictionConfidence()) {
            String district = Incident.isKnown(incident.borough()) ? incident.borough() : null;
            predictions.add(Prediction.pending(newId("pred"), PROFILE.id(), forecastLocation, district,
                incident.type(), forecastConfidence, name + ": " + analysis, now,
                now.plus(settings.getPredictionTtl())));
        }

        Urgency urgency = forecastConfidence > HIGH_URGENCY_CONFIDENCE ? Urgency.HIGH : Urgency.MEDIUM;
        String text = "Pattern detected: " + name + (analysis.isEmpty() ? "" : ". " + analysis);
        return Optional.of(new AgentInsight(PROFILE.id(), PROFILE.icon(), incident.id(), text, urgency,
            List.of(pattern), predictions));
    }

    /** Deep scan over recent memory when enough incidents have accumulated. */
    @Override
    public Mono<Void> onTick(AgentContext ctx) {
        if (ctx.memory().incidentCount() < settings.getDeepScanMinIncidents()) return Mono.empty();

        List<Incident> window = ctx.memory().newestIncidents(settings.getDeepScanWindow());
        Instant now = ctx.now();
        String prompt = """
            Deep pattern analysis of recent activity:

            %s

            Known active patterns:
            %s

            Perform comprehensive analysis:
            1. New patterns not yet detected
            2. Updates to existing patterns
            3. Patterns that should be closed (no new activity)
            4. Cross-pattern connections

            Be thorough but skeptical. Only report real patterns. Respond in JSON:
            {
              "patterns": [
                {"patternName": "string", "connections": ["..."], "linkedIncidentIds": [ids],
                 "confidence": 0.0-1.0, "analysis": "string"}
              ],
              "summary": "1-2 sentence overview"
            }""".formatted(json(window), json(ctx.memory().activePatterns()));

        state = "analyzing";
        return ask(ctx.city(), PROFILE.systemPrompt(), prompt, settings.getDeepScanMaxTokens())
            .flatMap(reply -> Mono.justOrEmpty(interpretScan(reply, window, now)))
            .flatMap(ctx::submit)
            .doFinally(signal -> state = "monitoring");
    }

    /** Reads a deep-scan reply; patterns linking fewer than {@code minRelated} known incidents are ignored. */
    Optional<AgentInsight> interpretScan(String reply, List<Incident> window, Instant now) {
        Optional<JsonNode> block = JsonBlocks.extract(reply, objectMapper);
        if (block.isEmpty()) return Optional.empty();
        Set<Long> known = window.stream().map(Incident::id).collect(Collectors.toSet());

        List<Pattern> patterns = new ArrayList<>();
        for (JsonNode node : block.get().path("patterns")) {
            List<Long> linked = new ArrayList<>();
            node.path("linkedIncidentIds").forEach(n -> {
                if (n.canConvertToLong() && known.contains(n.asLong()) && !linked.contains(n.asLong())) {
                    linked.add(n.asLong());
                }
            });
            if (linked.size() < settings.getMinRelated()) continue;
            patterns.add(Pattern.detected(newId("pattern"),
                Optional.ofNullable(JsonBlocks.text(node, "patternName")).orElse("Unnamed pattern"),
                textList(node.path("connections")), linked,
                confidence(node.path("confidence"), DEFAULT_CONFIDENCE),
                Optional.ofNullable(JsonBlocks.text(node, "analysis")).orElse(""), now));
        }
        String summary = JsonBlocks.text(block.get(), "summary");
        if (patterns.isEmpty() && summary == null) return Optional.empty();
        return Optional.of(new AgentInsight(PROFILE.id(), PROFILE.icon(), null, summary, Urgency.LOW,
            patterns, List.of()));
    }

    @Override
    public AgentStatus status(AgentContext ctx) {
        return new AgentStatus(PROFILE.id(), PROFILE.name(), PROFILE.role(), PROFILE.icon(), state, null, 0,
            ctx.memory().activePatterns().size());
    }

    // ── private ───────────────────────────────────────────────────────────────

    /** Numeric confidence, or a LOW/MEDIUM/HIGH label mapped onto 0..1. */
    static double confidence(JsonNode node, double fallback) {
        if (node.isNumber()) return Math.max(0.0, Math.min(1.0, node.asDouble()));
        if (!node.isTextual()) return fallback;
        return switch (node.asText().trim().toUpperCase(Locale.ROOT)) {
            case "HIGH"   -> 0.85;
            case "MEDIUM" -> 0.6;
            case "LOW"    -> 0.3;
            default       -> fallback;
        };
    }
}
