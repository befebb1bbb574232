package com.dispatchplatform.broadcast.gateway;

import com.dispatchplatform.broadcast.config.BroadcastProperties;
import com.dispatchplatform.common.bus.EventBus;
import com.dispatchplatform.common.event.DispatchChannel;
import com.dispatchplatform.common.event.DispatchEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Fans bus events out to live clients, one multicast sink per city.
 *
 * <p>Every channel is consumed. An event is delivered to the sink of its own city, or to every
 * city when its city is missing or not configured.
 */
@Component
public class BroadcastGateway {

    private static final Logger log = LoggerFactory.getLogger(BroadcastGateway.class);

    private final EventBus eventBus;
    private final Map<String, Sinks.Many<DispatchEvent>> sinks = new LinkedHashMap<>();
    private final Map<String, AtomicInteger> clients = new LinkedHashMap<>();

    private volatile Disposable intake;

    public BroadcastGateway(EventBus eventBus, BroadcastProperties properties) {
        this.eventBus = eventBus;
        for (String city : properties.getCities()) {
            String id = city.trim();
            sinks.put(id, Sinks.many().multicast().onBackpressureBuffer(properties.getBufferSize(), false));
            clients.put(id, new AtomicInteger());
        }
    }

    @PostConstruct
    public void start() {
        intake = Flux.merge(Arrays.stream(DispatchChannel.values()).map(eventBus::subscribe).toList())
            .subscribe(this::deliver, e -> log.error("[Broadcast] Bus intake terminated", e));
        log.info("[Broadcast] Gateway started. cities={} channels={}", sinks.keySet(), DispatchChannel.values().length);
    }

    @PreDestroy
    public void stop() {
        if (intake != null) intake.dispose();
        sinks.values().forEach(Sinks.Many::tryEmitComplete);
        log.info("[Broadcast] Gateway stopped. cities={}", sinks.keySet());
    }

    /** Live events of {@code city}; empty for a city that is not configured. */
    public Flux<DispatchEvent> stream(String city) {
        Sinks.Many<DispatchEvent> sink = sinks.get(city);
        if (sink == null) return Flux.empty();
        AtomicInteger count = clients.get(city);
        return sink.asFlux()
            .doOnSubscribe(s -> log.info("[Broadcast] Client connected. city={} clients={}", city, count.incrementAndGet()))
            .doFinally(signal -> log.info("[Broadcast] Client disconnected. city={} clients={} signal={}",
                                          city, count.decrementAndGet(), signal));
    }

    public boolean serves(String city) {
        return city != null && sinks.containsKey(city);
    }

    /** Connected clients per city. */
    public Map<String, Integer> connections() {
        Map<String, Integer> out = new LinkedHashMap<>();
        clients.forEach((city, count) -> out.put(city, count.get()));
        return out;
    }

    void deliver(DispatchEvent event) {
        Sinks.Many<DispatchEvent> own = event.city() == null ? null : sinks.get(event.city());
        if (own != null) {
            emit(event.city(), own, event);
        } else {
            sinks.forEach((city, sink) -> emit(city, sink, event));
        }
    }

    /** Events for a city without clients are dropped rather than held for the next client. */
    private void emit(String city, Sinks.Many<DispatchEvent> sink, DispatchEvent event) {
        if (sink.currentSubscriberCount() == 0) return;
        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(event);
        }
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("[Broadcast] Dropped event. city={} type={} result={}", city, event.eventName(), result);
        }
    }
}
