package com.dispatchplatform.broadcast.controller;

import com.dispatchplatform.broadcast.config.BroadcastProperties;
import com.dispatchplatform.broadcast.dto.BroadcastStatusDTO;
import com.dispatchplatform.broadcast.gateway.BroadcastGateway;
import com.dispatchplatform.broadcast.snapshot.SnapshotReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/broadcast")
public class BroadcastController {

    private static final Logger log = LoggerFactory.getLogger(BroadcastController.class);

    static final String SNAPSHOT_EVENT = "snapshot";

    private final BroadcastGateway gateway;
    private final SnapshotReader snapshotReader;
    private final String defaultCity;

    public BroadcastController(BroadcastGateway gateway, SnapshotReader snapshotReader,
                               BroadcastProperties properties) {
        this.gateway        = gateway;
        this.snapshotReader = snapshotReader;
        this.defaultCity    = properties.getDefaultCity();
    }

    /**
     * Live events of one city, each named after its payload type. Starts with a {@code snapshot}
     * event when the ingestion worker has published one.
     */
    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Object>> stream(@RequestParam(required = false) String city) {
        String resolved = gateway.serves(city) ? city : defaultCity;
        log.info("SSE stream client connected. requested={} city={}", city, resolved);

        Flux<ServerSentEvent<Object>> snapshot = snapshotReader.read(resolved)
            .map(s -> ServerSentEvent.<Object>builder()
                .event(SNAPSHOT_EVENT)
                .data(s)
                .build())
            .flux();
        Flux<ServerSentEvent<Object>> live = gateway.stream(resolved)
            .map(event -> ServerSentEvent.<Object>builder()
                .event(event.eventName())
                .data(event)
                .build());
        return Flux.concat(snapshot, live);
    }

    @GetMapping("/status")
    public Mono<BroadcastStatusDTO> status() {
        Map<String, Integer> connections = gateway.connections();
        int total = connections.values().stream().mapToInt(Integer::intValue).sum();
        return Mono.just(new BroadcastStatusDTO(connections, total, Instant.now()));
    }
}
