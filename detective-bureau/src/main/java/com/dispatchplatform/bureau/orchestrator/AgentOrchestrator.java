package com.dispatchplatform.bureau.orchestrator;

import com.dispatchplatform.bureau.agent.Agent;
import com.dispatchplatform.bureau.agent.AgentContext;
import com.dispatchplatform.bureau.agent.AgentInsight;
import com.dispatchplatform.bureau.config.BureauProperties;
import com.dispatchplatform.bureau.memory.CityMemory;
import com.dispatchplatform.common.bus.EventBus;
import com.dispatchplatform.common.city.CityProfile;
import com.dispatchplatform.common.event.AgentInsightEvent;
import com.dispatchplatform.common.event.DispatchEvent;
import com.dispatchplatform.common.event.PredictionEvent;
import com.dispatchplatform.common.event.PredictionHitEvent;
import com.dispatchplatform.common.exception.AgentException;
import com.dispatchplatform.common.ledger.LedgerUpdate;
import com.dispatchplatform.common.model.Incident;
import com.dispatchplatform.common.model.Pattern;
import com.dispatchplatform.common.model.Prediction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The Detective Bureau of one city.
 *
 * <p>Every write to {@link CityMemory} and every agent trigger runs on {@code cityScheduler},
 * which is single-threaded. Incidents are taken in arrival order: a single scheduler task
 * resolves pending predictions, records the incident and asks each agent whether to engage.
 * Agent calls then run concurrently, and each result is applied back on the city scheduler
 * once the agent confirms it is still wanted.
 */
public class AgentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AgentOrchestrator.class);

    static final String PREDICTOR_CYCLE  = "predictor-cycle";
    static final String PATTERN_SCAN     = "pattern-scan";
    static final String PREDICTION_SWEEP = "prediction-sweep";
    static final String PURSUIT_COOLDOWN = "pursuit-cooldown";

    private final CityProfile profile;
    private final CityMemory memory;
    private final List<Agent> agents;
    private final EventBus eventBus;
    private final Clock clock;
    private final Scheduler cityScheduler;
    private final CityTaskScheduler tasks;
    private final Duration patternValidity;
    private final AgentContext context;

    public AgentOrchestrator(CityProfile profile, CityMemory memory, List<Agent> agents, EventBus eventBus,
                             Clock clock, Scheduler cityScheduler, CityTaskScheduler tasks,
                             Duration patternValidity) {
        this.profile         = profile;
        this.memory          = memory;
        this.agents          = List.copyOf(agents);
        this.eventBus        = eventBus;
        this.clock           = clock;
        this.cityScheduler   = cityScheduler;
        this.tasks           = tasks;
        this.patternValidity = patternValidity;
        this.context         = new AgentContext(profile, memory, clock, this::apply);
    }

    public String city() {
        return profile.id();
    }

    public CityMemory memory() {
        return memory;
    }

    public List<Agent> agents() {
        return agents;
    }

    public AgentContext context() {
        return context;
    }

    public Optional<Agent> agent(String id) {
        return agents.stream().filter(a -> a.id().equalsIgnoreCase(id)).findFirst();
    }

    // ── lifecycle ─────────────────────────────────────────────────────────────

    public void start(BureauProperties.Schedule schedule) {
        tasks.schedule(PREDICTOR_CYCLE, schedule.getPredictorInitialDelay(), schedule.getPredictorInterval(),
            () -> tick("PROPHET"));
        tasks.schedule(PATTERN_SCAN, schedule.getPatternScanInterval(), schedule.getPatternScanInterval(),
            () -> tick("PATTERN"));
        tasks.schedule(PREDICTION_SWEEP, schedule.getPredictionSweepInterval(), schedule.getPredictionSweepInterval(),
            this::sweep);
        tasks.schedule(PURSUIT_COOLDOWN, schedule.getPursuitCooldownInterval(), schedule.getPursuitCooldownInterval(),
            () -> tick("CHASE"));
        log.info("[Bureau] Orchestrator started. city={} agents={}", city(),
                 agents.stream().map(Agent::id).toList());
    }

    public void stop() {
        tasks.cancelAll();
    }

    // ── incidents ─────────────────────────────────────────────────────────────

    /**
     * Processes one incident. Intake is queued on the city scheduler at subscription time, so
     * incidents subscribed in order are recorded in order. Completes once every engaged
     * agent's result has been applied or discarded.
     */
    public Mono<Void> onIncident(Incident incident) {
        return Mono.fromCallable(() -> intake(incident))
            .subscribeOn(cityScheduler)
            .flatMapMany(engaged -> Flux.merge(engaged))
            .concatMap(this::apply)
            .then()
            .onErrorResume(e -> {
                log.error("[Bureau] Incident processing failed. city={} incident={}", city(), incident.id(), e);
                return Mono.empty();
            });
    }

    /** Runs on the city scheduler. Returns the engaged agents' pending results. */
    private List<Mono<AgentInsight>> intake(Incident incident) {
        Instant now = clock.instant();
        List<DispatchEvent> events = new ArrayList<>();

        LedgerUpdate update = memory.ledger().resolve(incident, now);
        memory.applyLedger(update.ledger());
        update.expired().forEach(memory::trackResolved);
        Incident recorded = incident;
        for (Prediction hit : update.hits()) {
            memory.trackResolved(hit);
            if (recorded.matchedPredictionId() == null) recorded = recorded.withMatchedPrediction(hit.id());
            events.add(new PredictionHitEvent(hit, incident.id(), update.ledger().accuracy(), city(), now));
            log.info("[Bureau] Prediction hit. city={} prediction={} agent={} incident={} accuracy={}",
                     city(), hit.id(), hit.agent(), incident.id(), update.ledger().stats().accuracyPercent());
        }
        if (!update.expired().isEmpty()) {
            log.info("[Bureau] Predictions expired. city={} count={}", city(), update.expired().size());
        }
        memory.record(recorded);
        publishAll(events);

        List<Mono<AgentInsight>> engaged = new ArrayList<>();
        for (Agent agent : agents) {
            engaged.add(trigger(agent, recorded));
        }
        return engaged;
    }

    private Mono<AgentInsight> trigger(Agent agent, Incident incident) {
        Mono<AgentInsight> result;
        try {
            result = agent.onIncident(incident, context);
        } catch (RuntimeException e) {
            result = Mono.error(new AgentException(agent.id(), "Trigger check failed", e));
        }
        return result.onErrorResume(e -> {
            log.warn("[Bureau] Agent failed. city={} agent={} incident={} reason={}",
                     city(), agent.id(), incident.id(), e.getMessage());
            return Mono.empty();
        });
    }

    // ── results ───────────────────────────────────────────────────────────────

    /** Applies an agent result on the city scheduler and publishes what it produced. */
    Mono<Void> apply(AgentInsight insight) {
        return Mono.fromCallable(() -> applyResult(insight))
            .subscribeOn(cityScheduler)
            .flatMap(this::publishInOrder);
    }

    private List<DispatchEvent> applyResult(AgentInsight insight) {
        Instant now = clock.instant();
        Optional<Agent> source = agent(insight.agent());
        if (source.isPresent() && !source.get().accepts(insight, now)) {
            log.info("[Bureau] Stale agent result discarded. city={} agent={} incident={}",
                     city(), insight.agent(), insight.incidentId());
            return List.of();
        }

        List<DispatchEvent> events = new ArrayList<>();
        for (Pattern pattern : insight.patterns()) {
            Pattern stored = memory.addOrRelink(pattern);
            log.info("[Bureau] Pattern recorded. city={} pattern={} name={} linked={}",
                     city(), stored.id(), stored.name(), stored.linkedIncidentIds());
        }
        for (Prediction prediction : insight.predictions()) {
            memory.applyLedger(memory.ledger().register(prediction));
            memory.trackIssued(prediction);
            events.add(new PredictionEvent(prediction, city(), now));
        }
        if (insight.hasAnalysis()) {
            events.add(0, new AgentInsightEvent(insight.agent(), insight.agentIcon(), insight.incidentId(),
                insight.analysis(), insight.urgency().label(), city(), now));
        }
        return events;
    }

    // ── periodic ──────────────────────────────────────────────────────────────

    /** Runs one agent's periodic work; its trigger check runs on the city scheduler. */
    public Mono<Void> tick(String agentId) {
        return agent(agentId)
            .map(agent -> Mono.defer(() -> agent.onTick(context))
                .subscribeOn(cityScheduler)
                .onErrorResume(e -> {
                    log.warn("[Bureau] Periodic run failed. city={} agent={} reason={}",
                             city(), agentId, e.getMessage());
                    return Mono.empty();
                }))
            .orElseGet(Mono::empty);
    }

    /** Expires overdue predictions and stale patterns. */
    public Mono<Void> sweep() {
        return Mono.fromRunnable(() -> {
            Instant now = clock.instant();
            LedgerUpdate update = memory.ledger().expireDue(now);
            if (update.changed()) {
                memory.applyLedger(update.ledger());
                update.expired().forEach(memory::trackResolved);
                log.info("[Bureau] Predictions expired. city={} count={} accuracy={}",
                         city(), update.expired().size(), update.ledger().stats().accuracyPercent());
            }
            List<Pattern> closed = memory.expireStalePatterns(now, patternValidity);
            if (!closed.isEmpty()) {
                log.info("[Bureau] Patterns expired. city={} count={}", city(), closed.size());
            }
        }).subscribeOn(cityScheduler).then();
    }

    // ── private ───────────────────────────────────────────────────────────────

    private Mono<Void> publishInOrder(List<DispatchEvent> events) {
        return Flux.fromIterable(events)
            .concatMap(event -> eventBus.publish(event)
                .onErrorResume(e -> {
                    log.warn("[Bureau] Publish failed. city={} type={} reason={}",
                             city(), event.eventName(), e.getMessage());
                    return Mono.empty();
                }))
            .then();
    }

    private void publishAll(List<DispatchEvent> events) {
        if (!events.isEmpty()) publishInOrder(events).subscribe();
    }
}
