package com.dispatchplatform.ingestion.poll;

import com.dispatchplatform.common.dedup.DedupCache;
import com.dispatchplatform.ingestion.pipeline.AudioUnit;
import com.dispatchplatform.ingestion.pipeline.IngestOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Polls one {@link CallLogClient}, keeps a high-water mark so each poll only takes newer calls,
 * dedups by call key and hands each new clip to the ingestion pipeline.
 *
 * <p>Fail-stop: after {@code maxConsecutiveFailures} failed polls in a row the poller disables
 * itself until {@link #restart()}. A successful poll resets the count.
 *
 * <p>Polls must not overlap; {@link CallPollerRunner} schedules the next one only after the
 * previous completes.
 */
public class CallPoller {

    private static final Logger log = LoggerFactory.getLogger(CallPoller.class);

    private final CallLogClient client;
    private final DedupCache callDedup;
    private final Function<AudioUnit, Mono<IngestOutcome>> processor;
    private final int maxCallsPerPoll;
    private final int maxConsecutiveFailures;
    private final int minAudioBytes;

    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private volatile Instant highWaterMark;
    private volatile boolean disabled;

    public CallPoller(CallLogClient client,
                      DedupCache callDedup,
                      Function<AudioUnit, Mono<IngestOutcome>> processor,
                      Instant initialHighWaterMark,
                      int maxCallsPerPoll,
                      int maxConsecutiveFailures,
                      int minAudioBytes) {
        this.client                 = client;
        this.callDedup              = callDedup;
        this.processor              = processor;
        this.highWaterMark          = initialHighWaterMark;
        this.maxCallsPerPoll        = maxCallsPerPoll;
        this.maxConsecutiveFailures = maxConsecutiveFailures;
        this.minAudioBytes          = minAudioBytes;
    }

    public String name() {
        return client.name();
    }

    /**
     * Fetches calls newer than the high-water mark and returns the ones not seen before, oldest
     * first, at most {@code maxCallsPerPoll}. Never signals an error: a failed fetch counts toward
     * fail-stop and yields an empty list.
     */
    public Mono<List<CallRecord>> poll() {
        if (disabled) return Mono.just(List.of());

        Instant since = highWaterMark;
        return client.fetchSince(since)
            .map(calls -> {
                consecutiveFailures.set(0);
                return accept(calls, since);
            })
            .onErrorResume(e -> {
                int failures = consecutiveFailures.incrementAndGet();
                log.warn("[CallPoller] Poll failed. source={} consecutiveFailures={} error={}",
                         client.name(), failures, e.getMessage());
                if (failures >= maxConsecutiveFailures && !disabled) {
                    disabled = true;
                    log.error("[CallPoller] Source disabled after repeated failures. source={} failures={}",
                              client.name(), failures);
                }
                return Mono.just(List.of());
            });
    }

    /** One poll plus processing of every new call. Emits the number of calls handed to the pipeline. */
    public Mono<Integer> pollAndProcess() {
        return poll()
            .flatMapMany(Flux::fromIterable)
            .concatMap(this::process)
            .count()
            .map(Long::intValue);
    }

    /** Re-enables a disabled poller and clears its failure count. */
    public void restart() {
        consecutiveFailures.set(0);
        disabled = false;
        log.info("[CallPoller] Restarted. source={}", client.name());
    }

    public boolean isDisabled() {
        return disabled;
    }

    public int consecutiveFailures() {
        return consecutiveFailures.get();
    }

    public Instant highWaterMark() {
        return highWaterMark;
    }

    // ── private ──────────────────────────────────────────────────────────────

    private List<CallRecord> accept(List<CallRecord> calls, Instant since) {
        List<CallRecord> newer = calls.stream()
            .filter(c -> !c.timestamp().isBefore(since))
            .sorted(Comparator.comparing(CallRecord::timestamp))
            .limit(maxCallsPerPoll)
            .collect(Collectors.toList());
        if (newer.isEmpty()) return List.of();

        highWaterMark = newer.get(newer.size() - 1).timestamp();
        List<CallRecord> fresh = newer.stream()
            .filter(c -> !callDedup.checkAndRemember(c.dedupKey()))
            .collect(Collectors.toList());

        if (!fresh.isEmpty()) {
            log.info("[CallPoller] New calls. source={} count={} highWaterMark={}",
                     client.name(), fresh.size(), highWaterMark);
        }
        return fresh;
    }

    private Mono<IngestOutcome> process(CallRecord call) {
        return client.resolveAudioUrl(call)
            .flatMap(client::download)
            .filter(audio -> {
                if (audio.length >= minAudioBytes) return true;
                log.debug("[CallPoller] Clip too small. source={} call={} bytes={}",
                          client.name(), call.dedupKey(), audio.length);
                return false;
            })
            .flatMap(audio -> processor.apply(new AudioUnit(call.asFeed(), audio, call.timestamp())))
            .onErrorResume(e -> {
                log.warn("[CallPoller] Call skipped. source={} call={} error={}",
                         client.name(), call.dedupKey(), e.getMessage());
                return Mono.empty();
            });
    }
}
