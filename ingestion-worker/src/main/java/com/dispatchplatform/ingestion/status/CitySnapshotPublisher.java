package com.dispatchplatform.ingestion.status;

import com.dispatchplatform.common.snapshot.CitySnapshot;
import com.dispatchplatform.ingestion.config.IngestionProperties;
import com.dispatchplatform.ingestion.state.CityContext;
import com.dispatchplatform.ingestion.state.CityContextRegistry;
import com.dispatchplatform.ingestion.stream.StreamSupervisor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every {@code snapshot.interval} logs the worker counters and, with the Redis bus, writes each
 * city's {@link CitySnapshot} and the worker stats under keys that expire after {@code snapshot.ttl}.
 */
@Component
public class CitySnapshotPublisher {

    private static final Logger log = LoggerFactory.getLogger(CitySnapshotPublisher.class);

    private final CityContextRegistry registry;
    private final IngestionStats stats;
    private final StreamSupervisor supervisor;
    private final ObjectMapper objectMapper;
    private final IngestionProperties.Snapshot settings;
    private final ReactiveStringRedisTemplate redis;

    private Disposable loop;

    public CitySnapshotPublisher(CityContextRegistry registry,
                                 IngestionStats stats,
                                 StreamSupervisor supervisor,
                                 ObjectMapper objectMapper,
                                 IngestionProperties properties,
                                 ObjectProvider<ReactiveStringRedisTemplate> redisTemplate,
                                 @Value("${dispatch.bus.mode:redis}") String busMode) {
        this.registry     = registry;
        this.stats        = stats;
        this.supervisor   = supervisor;
        this.objectMapper = objectMapper;
        this.settings     = properties.getSnapshot();
        this.redis        = "redis".equalsIgnoreCase(busMode) ? redisTemplate.getIfAvailable() : null;
    }

    @PostConstruct
    public void start() {
        if (!settings.isEnabled()) return;
        loop = Flux.interval(settings.getInterval())
            .concatMap(tick -> publishAll()
                .onErrorResume(e -> {
                    log.warn("[Snapshot] Publish failed. error={}", e.getMessage());
                    return Mono.empty();
                }))
            .subscribe();
    }

    @PreDestroy
    public void stop() {
        if (loop != null) loop.dispose();
    }

    Mono<Void> publishAll() {
        log.info("[Snapshot] Worker stats. streams={} counters={}", supervisor.activeFeedIds(), stats.snapshot());
        if (redis == null) return Mono.empty();

        return Flux.fromIterable(registry.all())
            .concatMap(ctx -> write(CitySnapshot.key(ctx.city()), snapshotOf(ctx)))
            .then(write(CitySnapshot.WORKER_STATS_KEY, workerStats()));
    }

    CitySnapshot snapshotOf(CityContext ctx) {
        return new CitySnapshot(
            ctx.city(),
            ctx.state().recentIncidents(settings.getRecentIncidents()),
            ctx.state().recentTranscripts(settings.getRecentIncidents()),
            ctx.state().cameras().size(),
            ctx.state().lastIncidentId(),
            Instant.now());
    }

    // ── private ──────────────────────────────────────────────────────────────

    private Map<String, Object> workerStats() {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("counters", stats.snapshot());
        out.put("streams", supervisor.statuses());
        out.put("updatedAt", Instant.now());
        return out;
    }

    private Mono<Void> write(String key, Object value) {
        String json;
        try {
            json = objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return Mono.error(e);
        }
        return redis.opsForValue().set(key, json, settings.getTtl()).then();
    }
}
