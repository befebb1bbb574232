package com.dispatchplatform.common.bus;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;

/**
 * Selects the bus implementation from {@code dispatch.bus.mode}: {@code redis} (default) or
 * {@code local} for single-process runs and tests.
 */
@Configuration
public class EventBusConfig {

    private static final Logger log = LoggerFactory.getLogger(EventBusConfig.class);

    @Value("${dispatch.bus.mode:redis}")
    private String mode;

    @Bean
    public EventBus eventBus(ObjectProvider<ReactiveStringRedisTemplate> redis, ObjectMapper objectMapper) {
        ReactiveStringRedisTemplate template = redis.getIfAvailable();
        if ("redis".equalsIgnoreCase(mode) && template != null) {
            log.info("Event bus initialised. mode=redis");
            return new RedisEventBus(template, objectMapper);
        }
        log.info("Event bus initialised. mode=local");
        return new LocalEventBus();
    }
}
