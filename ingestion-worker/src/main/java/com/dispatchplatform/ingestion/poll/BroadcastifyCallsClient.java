package com.dispatchplatform.ingestion.poll;

import com.dispatchplatform.common.exception.AuthExpiredException;
import com.dispatchplatform.common.exception.ExternalServiceException;
import com.dispatchplatform.ingestion.config.IngestionProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Broadcastify Calls API for one radio system.
 *
 * <p>Every request carries a freshly signed bearer token with the user session embedded. A 401
 * refreshes the session and retries that request once; a second 401 propagates.
 */
public class BroadcastifyCallsClient implements CallLogClient {

    private static final Logger log = LoggerFactory.getLogger(BroadcastifyCallsClient.class);

    static final String SOURCE = "BCFY Calls";

    private final WebClient apiWebClient;
    private final CallTokenSigner signer;
    private final BroadcastifySessionService sessions;
    private final ObjectMapper objectMapper;
    private final IngestionProperties.Calls settings;
    private final Clock clock;

    public BroadcastifyCallsClient(WebClient apiWebClient, CallTokenSigner signer,
                                   BroadcastifySessionService sessions, ObjectMapper objectMapper,
                                   IngestionProperties.Calls settings, Clock clock) {
        this.apiWebClient = apiWebClient;
        this.signer       = signer;
        this.sessions     = sessions;
        this.objectMapper = objectMapper;
        this.settings     = settings;
        this.clock        = clock;
    }

    @Override
    public String name() {
        return "broadcastify-calls";
    }

    @Override
    public String city() {
        return settings.getCity();
    }

    @Override
    public Mono<List<CallRecord>> fetchSince(Instant highWaterMark) {
        return authorizedGet(URI.create(settings.getBaseUrl() + "/calls/v1/live?sid=" + settings.getSystemId()))
            .map(this::parseLive)
            .doOnNext(calls -> log.debug("[BcfyCalls] Fetched live calls. count={}", calls.size()));
    }

    @Override
    public Mono<String> resolveAudioUrl(CallRecord call) {
        if (call.hasAudioUrl()) return Mono.just(call.audioUrl());

        URI detail = URI.create(settings.getBaseUrl() + "/calls/v1/call/" + call.groupId() + "/"
            + call.timestamp().getEpochSecond());
        return authorizedGet(detail).flatMap(json -> Mono.justOrEmpty(audioUrlOf(readTree(json))));
    }

    @Override
    public Mono<byte[]> download(String audioUrl) {
        return apiWebClient.get()
            .uri(URI.create(audioUrl))
            .retrieve()
            .bodyToMono(byte[].class)
            .timeout(settings.getDownloadTimeout());
    }

    // ── private ──────────────────────────────────────────────────────────────

    private Mono<String> authorizedGet(URI uri) {
        return sessions.session()
            .flatMap(session -> get(uri, session))
            .onErrorResume(AuthExpiredException.class, e -> {
                log.warn("[BcfyCalls] Session rejected, re-authenticating once. uri={}", uri.getPath());
                return sessions.refreshSession().flatMap(session -> get(uri, session));
            });
    }

    private Mono<String> get(URI uri, BroadcastifySession session) {
        return apiWebClient.get()
            .uri(uri)
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + signer.sign(session, clock.instant()))
            .exchangeToMono(response -> {
                if (response.statusCode().is2xxSuccessful()) {
                    return response.bodyToMono(String.class);
                }
                int status = response.statusCode().value();
                if (status == 401) {
                    return response.releaseBody()
                        .then(Mono.error(new AuthExpiredException(name(), "Unauthorized " + uri.getPath())));
                }
                return response.bodyToMono(String.class).defaultIfEmpty("")
                    .flatMap(body -> Mono.error(new ExternalServiceException(name(), "HTTP " + status + ": " + body)));
            })
            .timeout(settings.getDownloadTimeout());
    }

    List<CallRecord> parseLive(String json) {
        JsonNode root = readTree(json);
        JsonNode calls = root.path("data").path("calls");
        if (!calls.isArray()) calls = root.path("calls");
        if (!calls.isArray()) calls = root;

        List<CallRecord> out = new ArrayList<>();
        if (!calls.isArray()) return out;

        for (JsonNode call : calls) {
            String groupId = call.path("groupId").asText("");
            long ts = call.path("ts").asLong(0);
            if (groupId.isBlank() || ts <= 0) continue;

            String label = firstText(call, "tgName", "groupName", "tg");
            out.add(new CallRecord(SOURCE, groupId, Instant.ofEpochSecond(ts),
                label == null ? groupId : label, audioUrlOf(call), settings.getCity()));
        }
        return out;
    }

    private JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (Exception e) {
            throw new ExternalServiceException(name(), "Unreadable response", e);
        }
    }

    private static String audioUrlOf(JsonNode node) {
        JsonNode data = node.has("data") ? node.path("data") : node;
        return firstText(data, "audioUrl", "url");
    }

    private static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = node.path(field).asText("");
            if (!value.isBlank()) return value;
        }
        return null;
    }
}
