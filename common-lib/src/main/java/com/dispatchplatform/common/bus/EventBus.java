package com.dispatchplatform.common.bus;

import com.dispatchplatform.common.event.DispatchChannel;
import com.dispatchplatform.common.event.DispatchEvent;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Pub/sub distribution of dispatch events between processes.
 *
 * <p>Delivery is best-effort. {@link #publish} never signals an error: a failing broker degrades
 * to in-process delivery for subscribers in the publishing process.
 */
public interface EventBus {

    /** Publishes {@code event} on its own channel. Completes once handed off. */
    Mono<Void> publish(DispatchEvent event);

    /** Hot stream of events arriving on {@code channel}. Never terminates with an error. */
    Flux<DispatchEvent> subscribe(DispatchChannel channel);
}
