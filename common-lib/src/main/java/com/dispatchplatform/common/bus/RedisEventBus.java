package com.dispatchplatform.common.bus;

import com.dispatchplatform.common.event.DispatchChannel;
import com.dispatchplatform.common.event.DispatchEvent;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;

/**
 * Redis pub/sub bus. Events are JSON on the channel's wire name.
 *
 * <p>When a publish fails (broker down, serialization error) the event is delivered to local
 * subscribers instead. Subscriptions merge the Redis channel with the local fallback stream and
 * resubscribe to Redis with a fixed backoff after errors.
 */
public class RedisEventBus implements EventBus {

    private static final Logger log = LoggerFactory.getLogger(RedisEventBus.class);

    static final Duration RESUBSCRIBE_DELAY = Duration.ofSeconds(5);

    private final ReactiveStringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final LocalEventBus fallback = new LocalEventBus();

    public RedisEventBus(ReactiveStringRedisTemplate redis, ObjectMapper objectMapper) {
        this.redis        = redis;
        this.objectMapper = objectMapper;
    }

    @Override
    public Mono<Void> publish(DispatchEvent event) {
        String channel = event.channel().wireName();
        return Mono.fromCallable(() -> objectMapper.writeValueAsString(event))
            .flatMap(json -> redis.convertAndSend(channel, json))
            .doOnNext(receivers -> log.debug("[RedisBus] Published. channel={} type={} receivers={}",
                                             channel, event.eventName(), receivers))
            .then()
            .onErrorResume(e -> {
                log.warn("[RedisBus] Publish failed, delivering locally. channel={} type={} reason={}",
                         channel, event.eventName(), e.getMessage());
                fallback.deliver(event);
                return Mono.empty();
            });
    }

    @Override
    public Flux<DispatchEvent> subscribe(DispatchChannel channel) {
        Flux<DispatchEvent> remote = redis.listenToChannel(channel.wireName())
            .flatMap(message -> decode(channel, message.getMessage()))
            .doOnError(e -> log.warn("[RedisBus] Subscription error, retrying. channel={} reason={}",
                                     channel.wireName(), e.getMessage()))
            .retryWhen(Retry.fixedDelay(Long.MAX_VALUE, RESUBSCRIBE_DELAY));
        return Flux.merge(remote, fallback.subscribe(channel));
    }

    private Mono<DispatchEvent> decode(DispatchChannel channel, String json) {
        try {
            return Mono.just(objectMapper.readValue(json, DispatchEvent.class));
        } catch (JsonProcessingException e) {
            log.warn("[RedisBus] Undecodable message skipped. channel={} reason={}",
                     channel.wireName(), e.getOriginalMessage());
            return Mono.empty();
        }
    }
}
