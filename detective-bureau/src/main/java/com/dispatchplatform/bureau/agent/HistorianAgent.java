package com.dispatchplatform.bureau.agent;

import com.dispatchplatform.common.ai.ReasoningClient;
import com.dispatchplatform.common.model.Incident;
import com.dispatchplatform.common.text.SuspectDescriptors;
import com.fasterxml.jackson.databind.ObjectMapper;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Set;

/**
 * HISTORIAN: context from earlier incidents at the same address or with a matching suspect
 * description. Stays silent when memory holds neither.
 */
public class HistorianAgent extends ReasoningAgent {

    static final int RELATED_LIMIT = 5;
    static final int SUSPECT_LIMIT = 3;
    static final int HIGH_URGENCY_ADDRESS_COUNT = 3;

    private static final AgentProfile PROFILE = new AgentProfile("HISTORIAN", "HISTORIAN", "Historical Analyst", "📚",
        """
        You are HISTORIAN, an AI with perfect memory of all past incidents.

        Your expertise:
        - Recognizing repeat addresses and locations
        - Tracking suspect descriptions across time
        - Identifying escalation patterns at specific locations
        - Providing historical context for new incidents

        When a new incident comes in, you check:
        1. Has this address had previous calls? What kind?
        2. Does this suspect description match anyone from the past week?
        3. Is this part of an ongoing situation?
        4. What happened last time at this location?

        You provide crucial context that helps other agents make better decisions.""");

    private final int maxTokens;

    public HistorianAgent(ReasoningClient reasoningClient, ObjectMapper objectMapper, int maxTokens) {
        super(reasoningClient, objectMapper);
        this.maxTokens = maxTokens;
    }

    @Override
    public AgentProfile profile() {
        return PROFILE;
    }

    @Override
    public Mono<AgentInsight> onIncident(Incident incident, AgentContext ctx) {
        List<Incident> others = ctx.memory().incidents().stream()
            .filter(i -> i.id() != incident.id())
            .toList();
        List<Incident> atAddress = incident.hasKnownLocation()
            ? others.stream().filter(i -> incident.location().equalsIgnoreCase(i.location())).toList()
            : List.of();
        List<Incident> suspectMatches = suspectMatches(incident, others);
        if (atAddress.isEmpty() && suspectMatches.isEmpty()) return Mono.empty();

        List<Incident> related = others.stream()
            .filter(i -> sameLocation(i, incident) || sameBorough(i, incident))
            .sorted((a, b) -> Long.compare(b.id(), a.id()))
            .limit(RELATED_LIMIT)
            .toList();
        int addressCount = ctx.memory().addressCount(incident.location());
        Urgency urgency = addressCount > HIGH_URGENCY_ADDRESS_COUNT ? Urgency.HIGH : Urgency.MEDIUM;

        String prompt = """
            New incident:
            %s

            Previous incidents at this location (%d):
            %s

            Possible suspect matches from other incidents:
            %s

            Provide relevant historical context in 2-3 sentences. What should we know about this location or these suspects?"""
            .formatted(json(incident), atAddress.size(), json(related),
                       json(suspectMatches.subList(0, Math.min(SUSPECT_LIMIT, suspectMatches.size()))));

        return ask(ctx.city(), PROFILE.systemPrompt(), prompt, maxTokens)
            .map(context -> AgentInsight.text(PROFILE, incident.id(), context, urgency));
    }

    @Override
    public Mono<Void> onTick(AgentContext ctx) {
        return Mono.empty();
    }

    @Override
    public AgentStatus status(AgentContext ctx) {
        return AgentStatus.of(PROFILE, "monitoring");
    }

    static List<Incident> suspectMatches(Incident incident, List<Incident> others) {
        Set<String> descriptors = SuspectDescriptors.extract(incident.summary());
        if (descriptors.isEmpty()) return List.of();
        return others.stream()
            .filter(i -> SuspectDescriptors.sameSuspect(descriptors, SuspectDescriptors.extract(i.summary())))
            .toList();
    }

    private static boolean sameLocation(Incident a, Incident b) {
        return b.hasKnownLocation() && b.location().equalsIgnoreCase(a.location());
    }

    private static boolean sameBorough(Incident a, Incident b) {
        return b.borough() != null && !Incident.UNKNOWN.equalsIgnoreCase(b.borough())
            && b.borough().equalsIgnoreCase(a.borough());
    }
}
