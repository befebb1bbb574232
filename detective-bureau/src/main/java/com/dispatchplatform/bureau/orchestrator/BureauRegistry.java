package com.dispatchplatform.bureau.orchestrator;

import com.dispatchplatform.bureau.agent.Agent;
import com.dispatchplatform.bureau.agent.HistorianAgent;
import com.dispatchplatform.bureau.agent.PatternAgent;
import com.dispatchplatform.bureau.agent.PredictorAgent;
import com.dispatchplatform.bureau.agent.PursuitAgent;
import com.dispatchplatform.bureau.config.BureauProperties;
import com.dispatchplatform.bureau.memory.CityMemory;
import com.dispatchplatform.common.ai.ReasoningClient;
import com.dispatchplatform.common.bus.EventBus;
import com.dispatchplatform.common.city.CityProfile;
import com.dispatchplatform.common.city.CityProfiles;
import com.dispatchplatform.common.event.DispatchChannel;
import com.dispatchplatform.common.event.IncidentEvent;
import com.dispatchplatform.common.model.Incident;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One {@link AgentOrchestrator} per configured city, fed from the incidents channel.
 */
@Component
public class BureauRegistry {

    private static final Logger log = LoggerFactory.getLogger(BureauRegistry.class);

    private final BureauProperties properties;
    private final EventBus eventBus;
    private final Map<String, AgentOrchestrator> orchestrators = new LinkedHashMap<>();
    private final List<Scheduler> schedulers = new ArrayList<>();

    private volatile Disposable intake;

    public BureauRegistry(BureauProperties properties, ReasoningClient reasoningClient,
                          ObjectMapper objectMapper, EventBus eventBus, Clock clock) {
        this.properties = properties;
        this.eventBus   = eventBus;
        for (String cityId : properties.getCities()) {
            CityProfile profile = CityProfiles.require(cityId.trim());
            CityMemory memory = new CityMemory(profile.id(), properties.getMemory().getIncidentRing(),
                properties.getMemory().getPatternCap(), properties.getMemory().getPlaceCap());
            List<Agent> agents = List.of(
                new PursuitAgent(reasoningClient, objectMapper, properties.getPursuit().getActiveWindow(),
                                 properties.getPursuit().getMaxTokens()),
                new HistorianAgent(reasoningClient, objectMapper, properties.getHistorian().getMaxTokens()),
                new PatternAgent(reasoningClient, objectMapper, properties.getPattern()),
                new PredictorAgent(reasoningClient, objectMapper, properties.getPredictor()));
            Scheduler cityScheduler = Schedulers.newSingle("bureau-" + profile.id());
            schedulers.add(cityScheduler);
            orchestrators.put(profile.id(), new AgentOrchestrator(profile, memory, agents, eventBus, clock,
                cityScheduler, new CityTaskScheduler(profile.id(), Schedulers.parallel()),
                properties.getPattern().getValidity()));
            log.info("Bureau created. city={} incidentRing={} patternCap={}", profile.id(),
                     properties.getMemory().getIncidentRing(), properties.getMemory().getPatternCap());
        }
    }

    @PostConstruct
    public void start() {
        orchestrators.values().forEach(o -> o.start(properties.getSchedule()));
        intake = eventBus.subscribe(DispatchChannel.INCIDENTS)
            .ofType(IncidentEvent.class)
            .subscribe(event -> route(event.incident()),
                       e -> log.error("[Bureau] Incident intake terminated", e));
        log.info("[Bureau] Listening for incidents. cities={}", orchestrators.keySet());
    }

    /** Hands an incident to its city's orchestrator; incidents for other cities are ignored. */
    void route(Incident incident) {
        AgentOrchestrator orchestrator = orchestrators.get(incident.city());
        if (orchestrator == null) {
            log.debug("[Bureau] Incident for unmanaged city ignored. city={} incident={}",
                      incident.city(), incident.id());
            return;
        }
        orchestrator.onIncident(incident).subscribe();
    }

    public Optional<AgentOrchestrator> find(String city) {
        return Optional.ofNullable(city == null ? null : orchestrators.get(city));
    }

    public Collection<AgentOrchestrator> all() {
        return orchestrators.values();
    }

    @PreDestroy
    public void shutdown() {
        if (intake != null) intake.dispose();
        orchestrators.values().forEach(AgentOrchestrator::stop);
        schedulers.forEach(Scheduler::dispose);
        log.info("[Bureau] Stopped. cities={}", orchestrators.keySet());
    }
}
