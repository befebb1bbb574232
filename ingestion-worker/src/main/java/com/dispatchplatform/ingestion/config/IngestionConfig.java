package com.dispatchplatform.ingestion.config;

import com.dispatchplatform.ingestion.poll.BroadcastifyCallsClient;
import com.dispatchplatform.ingestion.poll.BroadcastifySessionService;
import com.dispatchplatform.ingestion.poll.CallTokenSigner;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;

@Configuration
public class IngestionConfig {

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // ── Broadcastify Calls (premium API, off unless credentials are configured) ──

    @Bean
    @ConditionalOnProperty(prefix = "dispatch.ingestion.calls", name = "enabled", havingValue = "true")
    public CallTokenSigner callTokenSigner(IngestionProperties properties, ObjectMapper objectMapper) {
        IngestionProperties.Calls calls = properties.getCalls();
        return new CallTokenSigner(calls.getApiKeyId(), calls.getApiKeySecret(), calls.getAppId(),
            calls.getTokenTtl(), objectMapper);
    }

    @Bean
    @ConditionalOnProperty(prefix = "dispatch.ingestion.calls", name = "enabled", havingValue = "true")
    public BroadcastifySessionService broadcastifySessionService(WebClient apiWebClient, CallTokenSigner signer,
                                                                 ObjectMapper objectMapper,
                                                                 IngestionProperties properties, Clock clock) {
        return new BroadcastifySessionService(apiWebClient, signer, objectMapper, properties.getCalls(), clock);
    }

    @Bean
    @ConditionalOnProperty(prefix = "dispatch.ingestion.calls", name = "enabled", havingValue = "true")
    public BroadcastifyCallsClient broadcastifyCallsClient(WebClient apiWebClient, CallTokenSigner signer,
                                                           BroadcastifySessionService sessions,
                                                           ObjectMapper objectMapper,
                                                           IngestionProperties properties, Clock clock) {
        return new BroadcastifyCallsClient(apiWebClient, signer, sessions, objectMapper, properties.getCalls(), clock);
    }
}
