package com.dispatchplatform.ingestion.pipeline;

import com.dispatchplatform.common.bus.EventBus;
import com.dispatchplatform.common.dedup.DedupCache;
import com.dispatchplatform.common.event.CameraSwitchEvent;
import com.dispatchplatform.common.event.DispatchEvent;
import com.dispatchplatform.common.event.IncidentEvent;
import com.dispatchplatform.common.event.TranscriptEvent;
import com.dispatchplatform.common.filter.FilterVerdict;
import com.dispatchplatform.common.filter.TranscriptFilter;
import com.dispatchplatform.common.model.FeedKind;
import com.dispatchplatform.common.model.Incident;
import com.dispatchplatform.common.model.IncidentCandidate;
import com.dispatchplatform.common.model.Transcript;
import com.dispatchplatform.common.trace.TraceContextUtil;
import com.dispatchplatform.ingestion.config.IngestionProperties;
import com.dispatchplatform.ingestion.extract.ExtractionGateway;
import com.dispatchplatform.ingestion.extract.ExtractionResult;
import com.dispatchplatform.ingestion.state.CityContext;
import com.dispatchplatform.ingestion.state.CityContextRegistry;
import com.dispatchplatform.ingestion.status.IngestionStats;
import com.dispatchplatform.ingestion.transcribe.SpeechToTextClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;

/**
 * Turns audio into published transcripts and incidents:
 * transcribe, filter, dedup, record + publish the transcript, extract, record + publish the
 * incident and its camera switch.
 *
 * <p>Transcription and extraction run wherever their clients complete. Every write to city
 * state hops onto the city's single-threaded scheduler, so incident ids are assigned and
 * published in order per city.
 */
@Service
public class IngestionPipeline {

    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private final CityContextRegistry registry;
    private final SpeechToTextClient speechToText;
    private final ExtractionGateway extractionGateway;
    private final EventBus eventBus;
    private final IngestionStats stats;
    private final Clock clock;
    private final int minChunkBytes;
    private final int minCallBytes;

    public IngestionPipeline(CityContextRegistry registry,
                             SpeechToTextClient speechToText,
                             ExtractionGateway extractionGateway,
                             EventBus eventBus,
                             IngestionStats stats,
                             IngestionProperties properties,
                             Clock clock) {
        this.registry          = registry;
        this.speechToText      = speechToText;
        this.extractionGateway = extractionGateway;
        this.eventBus          = eventBus;
        this.stats             = stats;
        this.clock             = clock;
        this.minChunkBytes     = properties.getStreams().getMinChunkBytes();
        this.minCallBytes      = properties.getCalls().getMinAudioBytes();
    }

    /** Never signals an error; failures map to {@link IngestOutcome#FAILED}. */
    public Mono<IngestOutcome> process(AudioUnit unit) {
        CityContext ctx = registry.find(unit.feed().city()).orElse(null);
        if (ctx == null) {
            log.warn("[Pipeline] Audio for unconfigured city dropped. feed={} city={}",
                     unit.feed().id(), unit.feed().city());
            return Mono.just(IngestOutcome.SKIPPED);
        }
        int minBytes = unit.feed().kind() == FeedKind.STREAM ? minChunkBytes : minCallBytes;
        if (unit.audio().length < minBytes) {
            log.debug("[Pipeline] Audio too small. feed={} bytes={}", unit.feed().id(), unit.audio().length);
            return Mono.just(IngestOutcome.SKIPPED);
        }

        String traceId = TraceContextUtil.newTraceId(ctx.city());
        Mono<IngestOutcome> flow = speechToText.transcribe(unit.audio(), ctx.profile().speechVocabulary())
            .map(String::trim)
            .flatMap(text -> afterTranscription(ctx, unit, text, traceId))
            .defaultIfEmpty(IngestOutcome.SKIPPED)
            .onErrorResume(e -> {
                TraceContextUtil.withMdc(traceId, ctx.city(), () ->
                    log.error("[Pipeline] Processing failed. feed={} error={}", unit.feed().id(), e.getMessage(), e));
                return Mono.just(IngestOutcome.FAILED);
            });
        return TraceContextUtil.withTraceId(flow, traceId);
    }

    // ── stages ───────────────────────────────────────────────────────────────

    private Mono<IngestOutcome> afterTranscription(CityContext ctx, AudioUnit unit, String text, String traceId) {
        int minLength = unit.feed().kind() == FeedKind.STREAM
            ? TranscriptFilter.STREAM_MIN_LENGTH
            : TranscriptFilter.CALL_MIN_LENGTH;

        FilterVerdict verdict = TranscriptFilter.classify(text, minLength);
        if (!verdict.accepted()) {
            stats.recordFiltered();
            log.debug("[Pipeline] Transcript filtered. feed={} reason={} drop={}",
                      unit.feed().id(), verdict.reason(), verdict.dropConnection());
            return Mono.just(verdict.dropConnection() ? IngestOutcome.DROP_FEED : IngestOutcome.FILTERED);
        }

        Transcript transcript = Transcript.of(text, unit.feed(), unit.receivedAt());
        return Mono.fromCallable(() -> recordTranscript(ctx, transcript))
            .subscribeOn(ctx.scheduler())
            .flatMap(fresh -> {
                if (!fresh) {
                    stats.recordDuplicate();
                    return Mono.just(IngestOutcome.DUPLICATE);
                }
                stats.recordTranscript();
                return publish(TranscriptEvent.of(transcript))
                    .then(extractionGateway.extract(transcript, ctx.profile()))
                    .flatMap(result -> onExtraction(ctx, transcript, result, traceId));
            });
    }

    private Mono<IngestOutcome> onExtraction(CityContext ctx, Transcript transcript,
                                             ExtractionResult result, String traceId) {
        if (result instanceof ExtractionResult.Accepted accepted) {
            return Mono.fromCallable(() -> recordIncident(ctx, accepted.candidate(), transcript))
                .subscribeOn(ctx.scheduler())
                .flatMap(incident -> {
                    TraceContextUtil.withMdc(traceId, ctx.city(), () ->
                        log.info("[Pipeline] Incident. city={} id={} type={} location={} priority={}",
                                 ctx.city(), incident.id(), incident.type(), incident.location(), incident.priority()));
                    return publishIncident(ctx, incident);
                })
                .thenReturn(IngestOutcome.INCIDENT);
        }
        if (result instanceof ExtractionResult.Rejected rejected) {
            stats.recordRejected();
            log.debug("[Pipeline] No incident. city={} reason={}", ctx.city(), rejected.reason());
            return Mono.just(IngestOutcome.NO_INCIDENT);
        }
        ExtractionResult.ParseError error = (ExtractionResult.ParseError) result;
        stats.recordExtractionError();
        TraceContextUtil.withMdc(traceId, ctx.city(), () ->
            log.warn("[Pipeline] Extraction failed. city={} detail={}", ctx.city(), error.detail()));
        return Mono.just(IngestOutcome.EXTRACTION_FAILED);
    }

    // ── city-scheduler writes ────────────────────────────────────────────────

    private boolean recordTranscript(CityContext ctx, Transcript transcript) {
        String fingerprint = DedupCache.transcriptFingerprint(transcript.text());
        if (ctx.transcriptDedup().checkAndRemember(fingerprint)) return false;
        ctx.state().appendTranscript(transcript);
        return true;
    }

    private Incident recordIncident(CityContext ctx, IncidentCandidate candidate, Transcript transcript) {
        Incident incident = Incident.of(ctx.state().nextIncidentId(), candidate, transcript, Instant.now(clock));
        ctx.state().appendIncident(incident);
        stats.recordIncident();
        return incident;
    }

    // ── publishing ───────────────────────────────────────────────────────────

    private Mono<Void> publishIncident(CityContext ctx, Incident incident) {
        Mono<Void> cameraSwitch = ctx.state().cameras()
            .findCamera(incident.location(), incident.borough())
            .map(camera -> publish(new CameraSwitchEvent(camera,
                incident.type() + " at " + incident.location(),
                incident.priority(), ctx.city(), Instant.now(clock))))
            .orElse(Mono.empty());
        return publish(IncidentEvent.of(incident, Instant.now(clock))).then(cameraSwitch);
    }

    private Mono<Void> publish(DispatchEvent event) {
        return eventBus.publish(event)
            .onErrorResume(e -> {
                log.warn("[Pipeline] Publish failed. event={} city={} error={}",
                         event.eventName(), event.city(), e.getMessage());
                return Mono.empty();
            });
    }
}
