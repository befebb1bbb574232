package com.dispatchplatform.ingestion.poll;

import com.dispatchplatform.common.exception.ExternalServiceException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/** OpenMHz public call listing for one radio system. Unauthenticated; the API wants browser-like headers. */
public class OpenMhzCallsClient implements CallLogClient {

    static final String SOURCE = "OpenMHz";

    private final WebClient apiWebClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String system;
    private final String city;
    private final Duration timeout;

    public OpenMhzCallsClient(WebClient apiWebClient, ObjectMapper objectMapper,
                              String baseUrl, String system, String city, Duration timeout) {
        this.apiWebClient = apiWebClient;
        this.objectMapper = objectMapper;
        this.baseUrl      = baseUrl;
        this.system       = system;
        this.city         = city;
        this.timeout      = timeout;
    }

    @Override
    public String name() {
        return "openmhz-" + city;
    }

    @Override
    public String city() {
        return city;
    }

    @Override
    public Mono<List<CallRecord>> fetchSince(Instant highWaterMark) {
        URI uri = URI.create(baseUrl + "/" + system + "/calls/newer?time=" + highWaterMark.toEpochMilli());
        return apiWebClient.get()
            .uri(uri)
            .header(HttpHeaders.USER_AGENT, "Mozilla/5.0")
            .header(HttpHeaders.ORIGIN, "https://openmhz.com")
            .header(HttpHeaders.REFERER, "https://openmhz.com/")
            .accept(MediaType.APPLICATION_JSON)
            .exchangeToMono(response -> {
                if (response.statusCode().is2xxSuccessful()) {
                    return response.bodyToMono(String.class).defaultIfEmpty("{}");
                }
                int status = response.statusCode().value();
                return response.releaseBody()
                    .then(Mono.error(new ExternalServiceException(name(), "HTTP " + status)));
            })
            .timeout(timeout)
            .map(this::parseCalls);
    }

    @Override
    public Mono<String> resolveAudioUrl(CallRecord call) {
        return Mono.justOrEmpty(call.audioUrl());
    }

    @Override
    public Mono<byte[]> download(String audioUrl) {
        return apiWebClient.get()
            .uri(URI.create(audioUrl))
            .retrieve()
            .bodyToMono(byte[].class)
            .timeout(timeout);
    }

    List<CallRecord> parseCalls(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (Exception e) {
            throw new ExternalServiceException(name(), "Unreadable call listing", e);
        }
        JsonNode calls = root.has("calls") ? root.path("calls") : root;

        List<CallRecord> out = new ArrayList<>();
        if (!calls.isArray()) return out;

        for (JsonNode call : calls) {
            String url = call.path("url").asText("");
            Instant time = parseTime(call.path("time").asText(""));
            if (url.isBlank() || time == null) continue;

            String talkgroup = call.path("talkgroupNum").asText("");
            String label = call.path("talkgroupDescription").asText("");
            if (label.isBlank()) label = call.path("talkgroupTag").asText("");
            if (label.isBlank()) label = "TG " + talkgroup;

            out.add(new CallRecord(SOURCE, talkgroup.isBlank() ? system : talkgroup, time, label, url, city));
        }
        return out;
    }

    private static Instant parseTime(String value) {
        if (value.isBlank()) return null;
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            return null;
        }
    }
}
