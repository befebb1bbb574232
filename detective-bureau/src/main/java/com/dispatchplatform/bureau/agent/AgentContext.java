package com.dispatchplatform.bureau.agent;

import com.dispatchplatform.bureau.memory.CityMemory;
import com.dispatchplatform.common.city.CityProfile;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.function.Function;

/**
 * What an agent may see and do for one city: read the shared memory and hand results back
 * through {@link #submit}, which applies them on the city's scheduler.
 */
public record AgentContext(
    CityProfile profile,
    CityMemory memory,
    Clock clock,
    Function<AgentInsight, Mono<Void>> submitter
) {
    public String city() {
        return profile.id();
    }

    public Instant now() {
        return clock.instant();
    }

    /** Applies a periodic run's results. Used by {@link Agent#onTick} implementations. */
    public Mono<Void> submit(AgentInsight insight) {
        return submitter.apply(insight);
    }
}
