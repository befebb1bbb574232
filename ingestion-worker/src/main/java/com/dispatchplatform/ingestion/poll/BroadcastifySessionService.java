package com.dispatchplatform.ingestion.poll;

import com.dispatchplatform.common.exception.AuthExpiredException;
import com.dispatchplatform.common.exception.ExternalServiceException;
import com.dispatchplatform.ingestion.config.IngestionProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Broadcastify user login: username + password, signed with an app-only token, yields a
 * user id and user token that later requests embed in their bearer token.
 *
 * <p>The session is cached in memory for {@code sessionTtl} and refreshed on demand when the
 * API answers 401.
 */
public class BroadcastifySessionService {

    private static final Logger log = LoggerFactory.getLogger(BroadcastifySessionService.class);

    private static final String AUTH_PATH = "/common/v1/auth";

    private final WebClient apiWebClient;
    private final CallTokenSigner signer;
    private final ObjectMapper objectMapper;
    private final IngestionProperties.Calls settings;
    private final Clock clock;

    private final AtomicReference<BroadcastifySession> cached = new AtomicReference<>();

    public BroadcastifySessionService(WebClient apiWebClient, CallTokenSigner signer, ObjectMapper objectMapper,
                                      IngestionProperties.Calls settings, Clock clock) {
        this.apiWebClient = apiWebClient;
        this.signer       = signer;
        this.objectMapper = objectMapper;
        this.settings     = settings;
        this.clock        = clock;
    }

    /** Returns the cached session while valid, else logs in. */
    public Mono<BroadcastifySession> session() {
        BroadcastifySession current = cached.get();
        if (current != null && current.isValidAt(clock.instant())) {
            return Mono.just(current);
        }
        return login();
    }

    /** Forces a fresh login; call this when a 401 is received. */
    public Mono<BroadcastifySession> refreshSession() {
        cached.set(null);
        return login();
    }

    // ── private ──────────────────────────────────────────────────────────────

    private Mono<BroadcastifySession> login() {
        log.info("[BcfyAuth] Logging in. user={}", settings.getUsername());

        return apiWebClient.post()
            .uri(settings.getBaseUrl() + AUTH_PATH)
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + signer.sign(null, clock.instant()))
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue(Map.of("username", settings.getUsername(), "password", settings.getPassword()))
            .exchangeToMono(response -> {
                if (response.statusCode().is2xxSuccessful()) {
                    return response.bodyToMono(String.class);
                }
                int status = response.statusCode().value();
                return response.bodyToMono(String.class).defaultIfEmpty("")
                    .flatMap(body -> Mono.error(status == 401 || status == 403
                        ? new AuthExpiredException("broadcastify-auth", "Login rejected. status=" + status)
                        : new ExternalServiceException("broadcastify-auth", "HTTP " + status + ": " + body)));
            })
            .timeout(settings.getDownloadTimeout())
            .map(this::parseSession)
            .doOnSuccess(s -> log.info("[BcfyAuth] Login successful. userId={}", s.userId()))
            .doOnError(e -> log.error("[BcfyAuth] Login failed. error={}", e.getMessage()));
    }

    private BroadcastifySession parseSession(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new ExternalServiceException("broadcastify-auth", "Unreadable login response", e);
        }
        String userId    = root.path("userId").asText("");
        String userToken = root.path("userToken").asText("");
        if (userId.isBlank() || userToken.isBlank()) {
            throw new ExternalServiceException("broadcastify-auth", "Login response without userId/userToken");
        }
        BroadcastifySession session = new BroadcastifySession(userId, userToken,
            clock.instant().plus(settings.getSessionTtl()));
        cached.set(session);
        return session;
    }
}
