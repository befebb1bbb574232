package com.dispatchplatform.bureau.agent;

import com.dispatchplatform.common.model.Pattern;
import com.dispatchplatform.common.model.Prediction;

import java.util.List;

/**
 * What one agent run produced. The orchestrator applies {@link #patterns()} and
 * {@link #predictions()} to city memory and publishes {@link #analysis()} when present.
 *
 * @param incidentId triggering incident, {@code null} for periodic runs
 * @param analysis   text for the {@code agent_insight} event, {@code null} to publish nothing
 */
public record AgentInsight(
    String agent,
    String agentIcon,
    Long incidentId,
    String analysis,
    Urgency urgency,
    List<Pattern> patterns,
    List<Prediction> predictions
) {
    public AgentInsight {
        patterns    = patterns == null ? List.of() : List.copyOf(patterns);
        predictions = predictions == null ? List.of() : List.copyOf(predictions);
    }

    public static AgentInsight text(AgentProfile profile, Long incidentId, String analysis, Urgency urgency) {
        return new AgentInsight(profile.id(), profile.icon(), incidentId, analysis, urgency, List.of(), List.of());
    }

    public boolean hasAnalysis() {
        return analysis != null && !analysis.isBlank();
    }
}
