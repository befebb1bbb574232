package com.dispatchplatform.bureau.agent;

import com.dispatchplatform.common.ai.ReasoningClient;
import com.dispatchplatform.common.ai.ReasoningRequest;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Base for agents that consult the reasoning service. A failed or empty call completes empty
 * after a warning; callers never see the error.
 */
public abstract class ReasoningAgent implements Agent {

    private static final Logger log = LoggerFactory.getLogger(ReasoningAgent.class);

    protected final ReasoningClient reasoningClient;
    protected final ObjectMapper objectMapper;

    protected ReasoningAgent(ReasoningClient reasoningClient, ObjectMapper objectMapper) {
        this.reasoningClient = reasoningClient;
        this.objectMapper    = objectMapper;
    }

    protected Mono<String> ask(String city, String system, String prompt, int maxTokens) {
        String agent = id();
        return reasoningClient.complete(ReasoningRequest.of(agent, system, prompt, maxTokens))
            .filter(reply -> !reply.isBlank())
            .onErrorResume(e -> {
                log.warn("[{}] Reasoning call failed. city={} reason={}", agent, city, e.getMessage());
                return Mono.empty();
            });
    }

    /** Short random id such as {@code pred-3f2a91c0}. */
    protected static String newId(String prefix) {
        return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    protected static List<String> textList(JsonNode node) {
        List<String> values = new ArrayList<>();
        node.forEach(n -> {
            if (!n.isNull() && !n.asText().isBlank()) values.add(n.asText());
        });
        return values;
    }

    /** JSON rendering of prompt material. Falls back to {@code toString()} if serialization fails. */
    protected String json(Object value) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }
}
