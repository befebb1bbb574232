package com.dispatchplatform.common.bus;

import com.dispatchplatform.common.event.DispatchChannel;
import com.dispatchplatform.common.event.DispatchEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.EnumMap;
import java.util.Map;

/**
 * In-process bus: one multicast sink per channel. Used when no broker is configured and as the
 * fallback path of {@link RedisEventBus}.
 */
public class LocalEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(LocalEventBus.class);

    private static final int BUFFER_SIZE = 256;

    private final Map<DispatchChannel, Sinks.Many<DispatchEvent>> sinks = new EnumMap<>(DispatchChannel.class);

    public LocalEventBus() {
        for (DispatchChannel channel : DispatchChannel.values()) {
            sinks.put(channel, Sinks.many().multicast().onBackpressureBuffer(BUFFER_SIZE, false));
        }
    }

    @Override
    public Mono<Void> publish(DispatchEvent event) {
        return Mono.fromRunnable(() -> deliver(event));
    }

    @Override
    public Flux<DispatchEvent> subscribe(DispatchChannel channel) {
        return sinks.get(channel).asFlux();
    }

    /** Emits to local subscribers. Emission is serialized per sink since publishers run on many threads. */
    void deliver(DispatchEvent event) {
        Sinks.Many<DispatchEvent> sink = sinks.get(event.channel());
        Sinks.EmitResult result;
        synchronized (sink) {
            result = sink.tryEmitNext(event);
        }
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.warn("[LocalBus] Dropped event. channel={} type={} city={} result={}",
                     event.channel().wireName(), event.eventName(), event.city(), result);
        }
    }
}
