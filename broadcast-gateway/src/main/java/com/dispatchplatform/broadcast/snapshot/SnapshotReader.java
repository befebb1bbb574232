package com.dispatchplatform.broadcast.snapshot;

import com.dispatchplatform.common.snapshot.CitySnapshot;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Reads the city snapshot written by the ingestion worker. Empty when the Redis bus is not in
 * use, the key is absent or unreadable, or Redis does not answer within {@link #READ_TIMEOUT}.
 */
@Component
public class SnapshotReader {

    private static final Logger log = LoggerFactory.getLogger(SnapshotReader.class);

    static final Duration READ_TIMEOUT = Duration.ofSeconds(2);

    private final ReactiveStringRedisTemplate redis;
    private final ObjectMapper objectMapper;

    public SnapshotReader(ObjectProvider<ReactiveStringRedisTemplate> redisTemplate,
                          ObjectMapper objectMapper,
                          @Value("${dispatch.bus.mode:redis}") String busMode) {
        this.redis        = "redis".equalsIgnoreCase(busMode) ? redisTemplate.getIfAvailable() : null;
        this.objectMapper = objectMapper;
    }

    public Mono<CitySnapshot> read(String city) {
        if (redis == null) return Mono.empty();
        return redis.opsForValue().get(CitySnapshot.key(city))
            .timeout(READ_TIMEOUT)
            .flatMap(json -> Mono.justOrEmpty(parse(city, json)))
            .onErrorResume(e -> {
                log.warn("[Snapshot] Read failed. city={} error={}", city, e.getMessage());
                return Mono.empty();
            });
    }

    CitySnapshot parse(String city, String json) {
        try {
            return objectMapper.readValue(json, CitySnapshot.class);
        } catch (JsonProcessingException e) {
            log.warn("[Snapshot] Unreadable snapshot. city={} error={}", city, e.getOriginalMessage());
            return null;
        }
    }
}
