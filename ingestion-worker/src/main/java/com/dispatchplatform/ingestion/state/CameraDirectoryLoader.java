package com.dispatchplatform.ingestion.state;

import com.dispatchplatform.common.model.Camera;
import com.dispatchplatform.ingestion.config.IngestionProperties;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads each city's camera directory at startup. NYC reads the NYCTMC camera API (online
 * cameras only); other cities, or NYC when the API is unreachable, use the configured fallback.
 */
@Component
public class CameraDirectoryLoader {

    private static final Logger log = LoggerFactory.getLogger(CameraDirectoryLoader.class);

    private final CityContextRegistry registry;
    private final WebClient apiWebClient;
    private final ObjectMapper objectMapper;
    private final IngestionProperties.Cameras settings;

    public CameraDirectoryLoader(CityContextRegistry registry, WebClient apiWebClient,
                                 ObjectMapper objectMapper, IngestionProperties properties) {
        this.registry     = registry;
        this.apiWebClient = apiWebClient;
        this.objectMapper = objectMapper;
        this.settings     = properties.getCameras();
    }

    @PostConstruct
    public void loadAll() {
        for (CityContext ctx : registry.all()) {
            load(ctx).subscribe(
                count -> log.info("[{}] Camera directory loaded. cameras={}", ctx.profile().shortName(), count),
                err -> log.warn("[{}] Camera directory load failed. reason={}", ctx.profile().shortName(), err.getMessage()));
        }
    }

    Mono<Integer> load(CityContext ctx) {
        Mono<List<Camera>> cameras = "nyc".equals(ctx.city())
            ? fetchNyc().onErrorResume(e -> {
                  log.warn("[NYC] Camera API unavailable, using fallback. reason={}", e.getMessage());
                  return Mono.just(fallback(ctx.city()));
              })
            : Mono.just(fallback(ctx.city()));
        return cameras.map(list -> {
            ctx.state().cameras().replace(list);
            return list.size();
        });
    }

    private Mono<List<Camera>> fetchNyc() {
        return apiWebClient.get()
            .uri(settings.getNycApiUrl())
            .retrieve()
            .bodyToMono(String.class)
            .timeout(Duration.ofSeconds(20))
            .map(this::parseNyc);
    }

    List<Camera> parseNyc(String json) {
        try {
            JsonNode root = objectMapper.readTree(json);
            List<Camera> cameras = new ArrayList<>();
            for (JsonNode cam : root) {
                String online = cam.path("isOnline").asText("false");
                if (!"true".equalsIgnoreCase(online)) continue;
                String id = cam.path("id").asText();
                cameras.add(new Camera(id, cam.path("name").asText(), cam.path("area").asText("NYC"),
                    cam.path("latitude").asDouble(), cam.path("longitude").asDouble(),
                    settings.getNycApiUrl() + "/" + id + "/image"));
            }
            return cameras;
        } catch (Exception e) {
            throw new IllegalStateException("Unreadable NYC camera response", e);
        }
    }

    private List<Camera> fallback(String city) {
        return settings.getFallback().getOrDefault(city, List.of()).stream()
            .map(c -> new Camera(c.getId(), c.getLocation(), c.getArea(), c.getLat(), c.getLng(), c.getImageUrl()))
            .toList();
    }
}
