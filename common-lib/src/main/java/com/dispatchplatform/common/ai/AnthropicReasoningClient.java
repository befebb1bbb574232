package com.dispatchplatform.common.ai;

import com.dispatchplatform.common.exception.ExternalServiceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link ReasoningClient} over the Anthropic Messages API.
 *
 * <p>Fully non-blocking. Every call is bounded by the configured timeout; a timeout surfaces as an
 * error exactly like a failed call.
 */
public class AnthropicReasoningClient implements ReasoningClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicReasoningClient.class);

    static final String SERVICE = "reasoning";

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;
    private final Duration timeout;

    public AnthropicReasoningClient(WebClient anthropicClient, ObjectMapper objectMapper,
                                    String apiKey, String model, Duration timeout) {
        this.anthropicClient = anthropicClient;
        this.objectMapper    = objectMapper;
        this.apiKey          = apiKey;
        this.model           = model;
        this.timeout         = timeout;
    }

    @Override
    public Mono<String> complete(ReasoningRequest request) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(new ExternalServiceException(SERVICE, "No API key configured"));
        }

        Map<String, Object> body = new HashMap<>();
        body.put("model", model);
        body.put("max_tokens", request.maxTokens());
        body.put("messages", List.of(Map.of("role", "user", "content", request.prompt())));
        if (request.system() != null && !request.system().isBlank()) {
            body.put("system", request.system());
        }

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(body))
            .flatMap(json -> anthropicClient.post()
                .uri("/v1/messages")
                .header("x-api-key", apiKey)
                .bodyValue(json)
                .retrieve()
                .bodyToMono(String.class)
                .timeout(timeout))
            .map(this::extractText)
            .doOnSuccess(text -> log.debug("[Reasoning] Completed. purpose={} maxTokens={} chars={}",
                                           request.purpose(), request.maxTokens(), text.length()))
            .onErrorMap(e -> !(e instanceof ExternalServiceException),
                        e -> new ExternalServiceException(SERVICE,
                            "Call failed. purpose=" + request.purpose() + " reason=" + e.getMessage(), e));
    }

    private String extractText(String response) {
        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode first = root.path("content").path(0);
            if (first.isMissingNode()) {
                throw new ExternalServiceException(SERVICE, "Response has no content block");
            }
            return first.path("text").asText("");
        } catch (ExternalServiceException e) {
            throw e;
        } catch (Exception e) {
            throw new ExternalServiceException(SERVICE, "Unreadable response", e);
        }
    }
}
