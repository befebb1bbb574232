package com.dispatchplatform.ingestion.transcribe;

import com.dispatchplatform.ingestion.config.IngestionProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.MultipartBodyBuilder;
import org.springframework.stereotype.Service;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Speech-to-text over the OpenAI audio transcription endpoint. Failures and timeouts are logged
 * and complete empty, so one bad chunk never stalls a feed.
 */
@Service
public class WhisperSpeechToTextClient implements SpeechToTextClient {

    private static final Logger log = LoggerFactory.getLogger(WhisperSpeechToTextClient.class);

    private final WebClient speechWebClient;
    private final ObjectMapper objectMapper;
    private final IngestionProperties.Speech settings;

    public WhisperSpeechToTextClient(WebClient speechWebClient, ObjectMapper objectMapper,
                                     IngestionProperties properties) {
        this.speechWebClient = speechWebClient;
        this.objectMapper    = objectMapper;
        this.settings        = properties.getSpeech();
    }

    @Override
    public Mono<String> transcribe(byte[] audio, String vocabularyHint) {
        if (settings.getApiKey() == null || settings.getApiKey().isBlank()) {
            log.warn("[Whisper] No API key configured, skipping transcription. bytes={}", audio.length);
            return Mono.empty();
        }

        MultipartBodyBuilder body = new MultipartBodyBuilder();
        body.part("file", new ByteArrayResource(audio) {
            @Override
            public String getFilename() {
                return "audio.mp3";
            }
        }).contentType(MediaType.parseMediaType("audio/mpeg"));
        body.part("model", settings.getModel());
        body.part("language", "en");
        body.part("prompt", vocabularyHint);

        Duration timeout = settings.getTimeout();
        return speechWebClient.post()
            .uri("/v1/audio/transcriptions")
            .header(HttpHeaders.AUTHORIZATION, "Bearer " + settings.getApiKey())
            .contentType(MediaType.MULTIPART_FORM_DATA)
            .body(BodyInserters.fromMultipartData(body.build()))
            .retrieve()
            .bodyToMono(String.class)
            .timeout(timeout)
            .flatMap(this::extractText)
            .onErrorResume(e -> {
                log.warn("[Whisper] Transcription failed. bytes={} reason={}", audio.length, e.getMessage());
                return Mono.empty();
            });
    }

    private Mono<String> extractText(String response) {
        try {
            JsonNode root = objectMapper.readTree(response);
            String text = root.path("text").asText("");
            return text.isBlank() ? Mono.empty() : Mono.just(text.trim());
        } catch (Exception e) {
            return Mono.error(e);
        }
    }
}
