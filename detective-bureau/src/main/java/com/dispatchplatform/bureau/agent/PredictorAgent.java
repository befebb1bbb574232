package com.dispatchplatform.bureau.agent;

import com.dispatchplatform.bureau.config.BureauProperties;
import com.dispatchplatform.common.ai.JsonBlocks;
import com.dispatchplatform.common.ai.ReasoningClient;
import com.dispatchplatform.common.model.Incident;
import com.dispatchplatform.common.model.Prediction;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * PROPHET: periodic, testable forecasts built from hotspots and recent incidents.
 *
 * <p>Its own running accuracy is fed back into every request. Each forecast becomes a pending
 * prediction that expires after its time window, clamped to {@code minWindow..maxWindow}.
 */
public class PredictorAgent extends ReasoningAgent {

    private static final Logger log = LoggerFactory.getLogger(PredictorAgent.class);

    private static final AgentProfile PROFILE = new AgentProfile("PROPHET", "PROPHET", "Predictive Analyst", "🔮",
        """
        You are PROPHET, an AI specializing in predictive crime analysis.

        Your expertise:
        - Forecasting crime hotspots based on historical patterns
        - Predicting escalation likelihood
        - Time-based crime probability modeling
        - Resource allocation recommendations

        You make specific, testable predictions with confidence levels. You track your accuracy rigorously. You're honest about uncertainty.""");

    private final BureauProperties.Predictor settings;

    private volatile String state = "analyzing";
    private volatile int lastIssued;

    public PredictorAgent(ReasoningClient reasoningClient, ObjectMapper objectMapper,
                          BureauProperties.Predictor settings) {
        super(reasoningClient, objectMapper);
        this.settings = settings;
    }

    @Override
    public AgentProfile profile() {
        return PROFILE;
    }

    @Override
    public Mono<AgentInsight> onIncident(Incident incident, AgentContext ctx) {
        return Mono.empty();
    }

    @Override
    public Mono<Void> onTick(AgentContext ctx) {
        if (ctx.memory().incidentCount() < settings.getMinIncidents()) return Mono.empty();

        Instant now = ctx.now();
        String system = PROFILE.systemPrompt() + """


            Your current prediction accuracy: %s
            Be calibrated - if you've been overconfident, adjust down.""".formatted(Accuracy.describe(ctx.memory().ledger()));
        String prompt = """
            Generate predictions for the next few hours.

            Recent incidents:
            %s

            Current hotspots (borough, location, incident count):
            %s

            Current time: %s
            Day of week: %s

            Provide up to %d specific predictions in JSON:
            {
              "predictions": [
                {
                  "location": "specific location",
                  "borough": "one of: %s",
                  "incidentType": "predicted type",
                  "timeWindowMinutes": number,
                  "confidence": 0.0-1.0,
                  "reasoning": "why you predict this"
                }
              ],
              "overallAssessment": "1-2 sentence city-wide assessment"
            }""".formatted(
                json(ctx.memory().newestIncidents(settings.getRecentIncidents())),
                json(ctx.memory().topHotspots(settings.getHotspotCount())),
                now,
                now.atZone(ZoneOffset.UTC).getDayOfWeek().getDisplayName(TextStyle.FULL, Locale.US),
                settings.getMaxPredictions(),
                String.join(", ", ctx.profile().districts()));

        state = "predicting";
        return ask(ctx.city(), system, prompt, settings.getMaxTokens())
            .flatMap(reply -> Mono.justOrEmpty(interpret(reply, now)))
            .doOnNext(insight -> {
                lastIssued = insight.predictions().size();
                log.info("[PROPHET] Predictions issued. city={} count={}", ctx.city(), lastIssued);
            })
            .flatMap(ctx::submit)
            .doFinally(signal -> state = "analyzing");
    }

    /** Reads a forecast reply. Entries without a type or without any place are skipped. */
    Optional<AgentInsight> interpret(String reply, Instant now) {
        Optional<JsonNode> block = JsonBlocks.extract(reply, objectMapper);
        if (block.isEmpty()) return Optional.empty();

        List<Prediction> predictions = new ArrayList<>();
        for (JsonNode node : block.get().path("predictions")) {
            if (predictions.size() >= settings.getMaxPredictions()) break;
            String type     = JsonBlocks.text(node, "incidentType");
            String location = knownOrNull(JsonBlocks.text(node, "location"));
            String borough  = knownOrNull(JsonBlocks.text(node, "borough"));
            if (type == null || (location == null && borough == null)) continue;

            Duration window = window(node.path("timeWindowMinutes"));
            double confidence = Math.max(0.0, Math.min(1.0, node.path("confidence").asDouble(0.0)));
            predictions.add(Prediction.pending(newId("pred"), PROFILE.id(), location, borough, type,
                confidence, JsonBlocks.text(node, "reasoning"), now, now.plus(window)));
        }
        if (predictions.isEmpty()) return Optional.empty();

        String assessment = Optional.ofNullable(JsonBlocks.text(block.get(), "overallAssessment"))
            .orElse("Issued " + predictions.size() + " prediction(s).");
        return Optional.of(new AgentInsight(PROFILE.id(), PROFILE.icon(), null, assessment, Urgency.MEDIUM,
            List.of(), predictions));
    }

    /** Forecast lifetime: the reply's window in minutes, or the default, clamped to the bounds. */
    Duration window(JsonNode minutes) {
        if (!minutes.isNumber() && !(minutes.isTextual() && minutes.asText().trim().matches("\\d+"))) {
            return settings.getDefaultWindow();
        }
        Duration requested = Duration.ofMinutes(minutes.asLong());
        if (requested.compareTo(settings.getMinWindow()) < 0) return settings.getMinWindow();
        if (requested.compareTo(settings.getMaxWindow()) > 0) return settings.getMaxWindow();
        return requested;
    }

    private static String knownOrNull(String place) {
        return Incident.isKnown(place) ? place : null;
    }

    @Override
    public AgentStatus status(AgentContext ctx) {
        return new AgentStatus(PROFILE.id(), PROFILE.name(), PROFILE.role(), PROFILE.icon(), state, null,
            lastIssued, 0);
    }
}
