package com.dispatchplatform.ingestion.state;

import com.dispatchplatform.common.city.CityProfile;
import com.dispatchplatform.common.city.CityProfiles;
import com.dispatchplatform.common.dedup.DedupCache;
import com.dispatchplatform.ingestion.config.IngestionProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Schedulers;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** One {@link CityContext} per configured city. */
@Component
public class CityContextRegistry {

    private static final Logger log = LoggerFactory.getLogger(CityContextRegistry.class);

    private final Map<String, CityContext> contexts = new LinkedHashMap<>();

    public CityContextRegistry(IngestionProperties properties) {
        IngestionProperties.State sizes = properties.getState();
        for (String cityId : properties.getCities()) {
            CityProfile profile = CityProfiles.require(cityId.trim());
            CityContext ctx = new CityContext(
                profile,
                new CityState(profile.id(), sizes.getIncidentRing(), sizes.getTranscriptRing()),
                new DedupCache(sizes.getTranscriptDedupCapacity()),
                Schedulers.newSingle("ingest-" + profile.id()));
            contexts.put(profile.id(), ctx);
            log.info("City context created. city={} incidentRing={} transcriptRing={}",
                     profile.id(), sizes.getIncidentRing(), sizes.getTranscriptRing());
        }
    }

    public Optional<CityContext> find(String city) {
        return Optional.ofNullable(contexts.get(city));
    }

    public Collection<CityContext> all() {
        return contexts.values();
    }

    @PreDestroy
    public void shutdown() {
        contexts.values().forEach(ctx -> ctx.scheduler().dispose());
        log.info("City schedulers disposed. cities={}", contexts.keySet());
    }
}
