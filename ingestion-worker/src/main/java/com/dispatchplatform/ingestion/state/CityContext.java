package com.dispatchplatform.ingestion.state;

import com.dispatchplatform.common.city.CityProfile;
import com.dispatchplatform.common.dedup.DedupCache;
import reactor.core.scheduler.Scheduler;

/**
 * Everything the ingestion path needs for one city, built once at startup.
 *
 * <p>{@link #scheduler()} is single-threaded: every write to {@link #state()} and
 * {@link #transcriptDedup()} runs on it, which keeps per-city writes serialized without locks.
 */
public record CityContext(
    CityProfile profile,
    CityState state,
    DedupCache transcriptDedup,
    Scheduler scheduler
) {
    public String city() {
        return profile.id();
    }
}
