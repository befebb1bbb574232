package com.dispatchplatform.ingestion.stream;

import com.dispatchplatform.common.model.SourceFeed;
import com.dispatchplatform.ingestion.config.IngestionProperties;
import com.dispatchplatform.ingestion.pipeline.AudioUnit;
import com.dispatchplatform.ingestion.pipeline.IngestOutcome;
import com.dispatchplatform.ingestion.pipeline.IngestionPipeline;
import com.dispatchplatform.ingestion.state.CityContextRegistry;
import com.dispatchplatform.ingestion.status.IngestionStats;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Owns the live stream connectors and never runs more than {@code maxConcurrent} of them.
 *
 * <p>Feeds are taken greedily in configured order. A feed that fails to connect, or whose
 * transcripts are garbage, is dropped and benched for a cool-down so the next feed in line gets
 * its slot. Feeds beyond capacity simply wait.
 */
@Component
public class StreamSupervisor {

    private static final Logger log = LoggerFactory.getLogger(StreamSupervisor.class);

    private final List<SourceFeed> feeds;
    private final AudioStreamSource source;
    private final IngestionPipeline pipeline;
    private final IngestionStats stats;
    private final IngestionProperties.Streams streams;
    private final StreamSettings settings;
    private final Scheduler scheduler;

    private final Map<String, StreamConnector> active = new LinkedHashMap<>();
    private final Map<String, Instant> benchedUntil = new HashMap<>();

    @Autowired
    public StreamSupervisor(IngestionProperties properties,
                            CityContextRegistry registry,
                            AudioStreamSource source,
                            IngestionPipeline pipeline,
                            IngestionStats stats) {
        this(configuredFeeds(properties, registry), source, pipeline, stats, properties.getStreams(),
             Schedulers.parallel());
    }

    StreamSupervisor(List<SourceFeed> feeds,
                     AudioStreamSource source,
                     IngestionPipeline pipeline,
                     IngestionStats stats,
                     IngestionProperties.Streams streams,
                     Scheduler scheduler) {
        this.feeds     = List.copyOf(feeds);
        this.source    = source;
        this.pipeline  = pipeline;
        this.stats     = stats;
        this.streams   = streams;
        this.settings  = StreamSettings.from(streams);
        this.scheduler = scheduler;
    }

    /** Schedules the initial connects, one slot at a time, {@code connectStagger} apart. */
    @PostConstruct
    public void start() {
        if (!streams.isEnabled()) {
            log.info("[Supervisor] Live streams disabled.");
            return;
        }
        if (streams.getPassword() == null || streams.getPassword().isBlank()) {
            log.warn("[Supervisor] No stream password configured, live streams not started.");
            return;
        }
        int initial = Math.min(streams.getMaxConcurrent(), feeds.size());
        log.info("[Supervisor] Starting streams. feeds={} maxConcurrent={}", feeds.size(), streams.getMaxConcurrent());
        long stagger = streams.getConnectStagger().toMillis();
        for (int i = 0; i < initial; i++) {
            scheduler.schedule(this::startNextAvailable, stagger * i, TimeUnit.MILLISECONDS);
        }
    }

    /** Starts the first feed that is neither active nor benched, if a slot is free. */
    public synchronized Optional<StreamConnector> startNextAvailable() {
        if (active.size() >= streams.getMaxConcurrent()) {
            log.debug("[Supervisor] At capacity. active={}", active.size());
            return Optional.empty();
        }
        Instant now = now();
        benchedUntil.values().removeIf(until -> !until.isAfter(now));

        Optional<SourceFeed> next = feeds.stream()
            .filter(f -> !active.containsKey(f.id()) && !benchedUntil.containsKey(f.id()))
            .findFirst();
        if (next.isEmpty()) {
            log.debug("[Supervisor] No feed available. active={} benched={}", active.size(), benchedUntil.size());
            return Optional.empty();
        }

        SourceFeed feed = next.get();
        StreamConnector connector = new StreamConnector(feed, source, settings, scheduler,
            this::onChunk, this::onConnectFailed);
        active.put(feed.id(), connector);
        connector.connect();
        return Optional.of(connector);
    }

    /**
     * Stops a feed, benches it for {@code dropCooldown} and hands its slot to the next feed.
     * Unknown or already-dropped feeds are ignored.
     */
    public void drop(String feedId) {
        drop(feedId, "garbage output");
    }

    private synchronized void drop(String feedId, String reason) {
        StreamConnector connector = active.remove(feedId);
        if (connector == null) return;

        connector.stop();
        benchedUntil.put(feedId, now().plus(streams.getDropCooldown()));
        stats.recordDroppedFeed();
        log.warn("[Supervisor] Feed dropped. feed={} reason={} cooldown={}", feedId, reason, streams.getDropCooldown());
        startNextAvailable();
    }

    public synchronized int activeCount() {
        return active.size();
    }

    public synchronized List<String> activeFeedIds() {
        return new ArrayList<>(active.keySet());
    }

    public synchronized Map<String, StreamStatus> statuses() {
        Map<String, StreamStatus> out = new LinkedHashMap<>();
        active.forEach((id, connector) -> out.put(id, connector.status()));
        return out;
    }

    @PreDestroy
    public synchronized void stopAll() {
        active.values().forEach(StreamConnector::stop);
        log.info("[Supervisor] All streams stopped. count={}", active.size());
        active.clear();
    }

    // ── private ──────────────────────────────────────────────────────────────

    private void onChunk(SourceFeed feed, byte[] audio) {
        stats.recordChunk();
        pipeline.process(new AudioUnit(feed, audio, now()))
            .subscribe(
                outcome -> {
                    if (outcome == IngestOutcome.DROP_FEED) drop(feed.id());
                },
                error -> log.error("[Supervisor] Chunk processing failed. feed={} error={}", feed.id(), error.getMessage())
            );
    }

    private void onConnectFailed(SourceFeed feed, Throwable error) {
        drop(feed.id(), "connect failed");
    }

    private Instant now() {
        return Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS));
    }

    private static List<SourceFeed> configuredFeeds(IngestionProperties properties, CityContextRegistry registry) {
        List<SourceFeed> out = new ArrayList<>();
        for (IngestionProperties.Feed feed : properties.getStreams().getFeeds()) {
            if (registry.find(feed.getCity()).isEmpty()) {
                log.warn("[Supervisor] Feed for unconfigured city ignored. feed={} city={}", feed.getId(), feed.getCity());
                continue;
            }
            out.add(SourceFeed.stream(feed.getId(), feed.getName(), feed.getCity()));
        }
        return out;
    }
}
