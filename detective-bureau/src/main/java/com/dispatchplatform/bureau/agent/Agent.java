package com.dispatchplatform.bureau.agent;

import com.dispatchplatform.common.model.Incident;
import reactor.core.publisher.Mono;

import java.time.Instant;

/**
 * One specialist of a city's bureau. Each instance belongs to exactly one city and owns only
 * its own state; shared state is read through {@link AgentContext#memory()}.
 *
 * <p>{@link #onIncident} and {@link #onTick} are invoked on the city scheduler, so their
 * synchronous part (trigger checks, state changes) is serialized with every other write of
 * the city. The returned publishers may complete on any thread.
 */
public interface Agent {

    AgentProfile profile();

    /** Reacts to a newly recorded incident. Empty when the agent does not engage. */
    Mono<AgentInsight> onIncident(Incident incident, AgentContext ctx);

    /** Periodic work. Results are handed back through {@link AgentContext#submit}. */
    Mono<Void> onTick(AgentContext ctx);

    AgentStatus status(AgentContext ctx);

    /**
     * Whether a completed result may still be applied. Checked on the city scheduler just
     * before application.
     */
    default boolean accepts(AgentInsight insight, Instant now) {
        return true;
    }

    default String id() {
        return profile().id();
    }
}
