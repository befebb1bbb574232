package com.dispatchplatform.ingestion.poll;

import com.dispatchplatform.common.dedup.DedupCache;
import com.dispatchplatform.ingestion.config.IngestionProperties;
import com.dispatchplatform.ingestion.pipeline.IngestionPipeline;
import com.dispatchplatform.ingestion.state.CityContext;
import com.dispatchplatform.ingestion.state.CityContextRegistry;
import com.dispatchplatform.ingestion.status.IngestionStats;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs every configured {@link CallPoller} in its own loop:
 * <pre>
 *   delay(interval) → poll + process → repeat
 * </pre>
 * Each cycle is a fresh {@link Mono}; the next cycle is scheduled from the terminal callback,
 * so polls of one source never overlap. A poller that disabled itself is not rescheduled until
 * {@link #restart(String)}.
 */
@Component
public class CallPollerRunner {

    private static final Logger log = LoggerFactory.getLogger(CallPollerRunner.class);

    private final Map<String, CallPoller> pollers = new LinkedHashMap<>();
    private final Map<String, Duration> intervals = new LinkedHashMap<>();
    private final Map<String, Disposable> cycles = new ConcurrentHashMap<>();
    private final Duration initialDelay;
    private volatile boolean running = true;

    public CallPollerRunner(IngestionProperties properties,
                            CityContextRegistry registry,
                            IngestionPipeline pipeline,
                            IngestionStats stats,
                            WebClient apiWebClient,
                            ObjectMapper objectMapper,
                            Clock clock,
                            ObjectProvider<BroadcastifyCallsClient> broadcastifyCalls) {
        IngestionProperties.Calls calls = properties.getCalls();
        IngestionProperties.OpenMhz openMhz = properties.getOpenMhz();
        int dedupCapacity = properties.getState().getCallDedupCapacity();
        this.initialDelay = calls.getInitialDelay();

        broadcastifyCalls.ifAvailable(client -> register(
            new CallPoller(client, new DedupCache(dedupCapacity), unit -> {
                    stats.recordCall();
                    return pipeline.process(unit);
                }, Instant.EPOCH, Integer.MAX_VALUE, calls.getMaxConsecutiveFailures(), calls.getMinAudioBytes()),
            calls.getInterval()));

        if (openMhz.isEnabled()) {
            for (CityContext ctx : registry.all()) {
                String system = ctx.profile().openMhzSystem();
                if (system == null || system.isBlank()) continue;
                OpenMhzCallsClient client = new OpenMhzCallsClient(apiWebClient, objectMapper,
                    openMhz.getBaseUrl(), system, ctx.city(), calls.getDownloadTimeout());
                register(new CallPoller(client, new DedupCache(dedupCapacity), unit -> {
                        stats.recordCall();
                        return pipeline.process(unit);
                    }, clock.instant().minus(openMhz.getLookback()), openMhz.getMaxCallsPerPoll(),
                    openMhz.getMaxConsecutiveFailures(), calls.getMinAudioBytes()),
                    openMhz.getInterval());
            }
        }
    }

    @PostConstruct
    public void start() {
        if (pollers.isEmpty()) {
            log.info("[CallPollerRunner] No call-log sources configured.");
            return;
        }
        log.info("[CallPollerRunner] Starting pollers. sources={}", pollers.keySet());
        pollers.values().forEach(p -> scheduleNextCycle(p, initialDelay));
    }

    /** Re-enables a disabled source and polls it immediately. */
    public boolean restart(String name) {
        CallPoller poller = pollers.get(name);
        if (poller == null) return false;
        poller.restart();
        scheduleNextCycle(poller, Duration.ZERO);
        return true;
    }

    public Optional<CallPoller> find(String name) {
        return Optional.ofNullable(pollers.get(name));
    }

    public Collection<CallPoller> all() {
        return pollers.values();
    }

    @PreDestroy
    public void stop() {
        running = false;
        cycles.values().forEach(Disposable::dispose);
        cycles.clear();
    }

    // ── polling loop ─────────────────────────────────────────────────────────

    private void register(CallPoller poller, Duration interval) {
        pollers.put(poller.name(), poller);
        intervals.put(poller.name(), interval);
    }

    private void scheduleNextCycle(CallPoller poller, Duration delay) {
        if (!running) return;
        Duration interval = intervals.get(poller.name());

        Disposable cycle = Mono.delay(delay)
            .then(poller.pollAndProcess())
            .subscribe(
                processed -> {
                    if (poller.isDisabled()) {
                        log.warn("[CallPollerRunner] Source stopped until restarted. source={}", poller.name());
                        return;
                    }
                    scheduleNextCycle(poller, interval);
                },
                err -> {
                    log.error("[CallPollerRunner] Poll cycle failed, rescheduling. source={}", poller.name(), err);
                    scheduleNextCycle(poller, interval);
                }
            );
        Disposable previous = cycles.put(poller.name(), cycle);
        if (previous != null && previous != cycle) previous.dispose();
    }
}
