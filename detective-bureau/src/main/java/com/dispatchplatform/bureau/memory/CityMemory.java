package com.dispatchplatform.bureau.memory;

import com.dispatchplatform.common.ledger.PredictionLedger;
import com.dispatchplatform.common.memory.BoundedRing;
import com.dispatchplatform.common.model.Incident;
import com.dispatchplatform.common.model.Pattern;
import com.dispatchplatform.common.model.Prediction;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Shared working memory of one city's bureau.
 *
 * <p>Single writer: every mutating method is called from the city's serialized scheduler.
 * Readers on any thread see snapshots (immutable lists, a volatile ledger reference and
 * concurrent maps), never a partially applied update.
 *
 * <p>Hotspot and address counters are kept for at most {@code placeCap} places each; the place
 * recorded least recently is forgotten first.
 */
public class CityMemory {

    private static final int PREDICTION_HISTORY = 50;
    private static final int DEFAULT_PLACE_CAP = 500;

    private final String city;
    private final BoundedRing<Incident> incidents;
    private final BoundedRing<Prediction> predictionHistory = new BoundedRing<>(PREDICTION_HISTORY);
    private final int patternCap;
    private final int placeCap;
    private final Map<String, Hotspot> hotspots = new ConcurrentHashMap<>();
    private final Map<String, Integer> addressHistory = new ConcurrentHashMap<>();
    // writer-only, access ordered
    private final LinkedHashMap<String, Boolean> hotspotRecency = new LinkedHashMap<>(16, 0.75f, true);
    private final LinkedHashMap<String, Boolean> addressRecency = new LinkedHashMap<>(16, 0.75f, true);

    private volatile List<Pattern> patterns = List.of();
    private volatile PredictionLedger ledger = PredictionLedger.empty();

    public CityMemory(String city, int incidentCapacity, int patternCap) {
        this(city, incidentCapacity, patternCap, DEFAULT_PLACE_CAP);
    }

    public CityMemory(String city, int incidentCapacity, int patternCap, int placeCap) {
        if (placeCap <= 0) throw new IllegalArgumentException("placeCap must be positive: " + placeCap);
        this.city       = city;
        this.incidents  = new BoundedRing<>(incidentCapacity);
        this.patternCap = patternCap;
        this.placeCap   = placeCap;
    }

    public String city() {
        return city;
    }

    // ── incidents ─────────────────────────────────────────────────────────────

    /** Appends the incident and bumps its hotspot and address counters. */
    public void record(Incident incident) {
        incidents.append(incident);
        String hotspotKey = incident.hotspotKey();
        hotspots.compute(hotspotKey, (key, current) -> current == null
            ? new Hotspot(orUnknown(incident.borough()), orUnknown(incident.location()), 1)
            : current.increment());
        touch(hotspots, hotspotRecency, hotspotKey);
        if (incident.hasKnownLocation()) {
            String addressKey = addressKey(incident.location());
            addressHistory.merge(addressKey, 1, Integer::sum);
            touch(addressHistory, addressRecency, addressKey);
        }
    }

    /** Replaces the stored copy of an incident, e.g. after prediction-hit annotation. */
    public void annotate(Incident incident) {
        incidents.replaceFirst(i -> i.id() == incident.id(), incident);
    }

    /** Oldest first. */
    public List<Incident> incidents() {
        return incidents.snapshot();
    }

    public List<Incident> newestIncidents(int n) {
        return incidents.newestFirst(n);
    }

    public int incidentCount() {
        return incidents.size();
    }

    /** Number of recorded incidents at {@code location}, compared case-insensitively. */
    public int addressCount(String location) {
        if (location == null) return 0;
        return addressHistory.getOrDefault(addressKey(location), 0);
    }

    /** Hotspots ordered by count descending, at most {@code limit}. */
    public List<Hotspot> topHotspots(int limit) {
        return hotspots.values().stream()
            .sorted(Comparator.comparingInt(Hotspot::count).reversed())
            .limit(limit)
            .toList();
    }

    // ── patterns ──────────────────────────────────────────────────────────────

    public List<Pattern> patterns() {
        return patterns;
    }

    public List<Pattern> activePatterns() {
        return patterns.stream().filter(Pattern::isActive).toList();
    }

    /**
     * Merges into an active pattern that already links one of the new pattern's incidents,
     * otherwise appends. The oldest patterns are evicted beyond the cap.
     */
    public Pattern addOrRelink(Pattern detected) {
        List<Pattern> next = new ArrayList<>(patterns);
        for (int i = 0; i < next.size(); i++) {
            Pattern existing = next.get(i);
            if (existing.isActive() && existing.sharesIncidentWith(detected.linkedIncidentIds())) {
                Pattern relinked = existing.relink(detected.linkedIncidentIds(), detected.confidence(),
                    detected.lastLinkedAt());
                next.set(i, relinked);
                patterns = List.copyOf(next);
                return relinked;
            }
        }
        next.add(detected);
        while (next.size() > patternCap) {
            next.remove(0);
        }
        patterns = List.copyOf(next);
        return detected;
    }

    /** Expires active patterns with no newly linked incident within {@code validity}. */
    public List<Pattern> expireStalePatterns(Instant now, Duration validity) {
        List<Pattern> expired = new ArrayList<>();
        List<Pattern> next = new ArrayList<>(patterns.size());
        for (Pattern p : patterns) {
            if (p.isStale(now, validity)) {
                Pattern e = p.expire();
                expired.add(e);
                next.add(e);
            } else {
                next.add(p);
            }
        }
        if (!expired.isEmpty()) patterns = List.copyOf(next);
        return expired;
    }

    // ── predictions ───────────────────────────────────────────────────────────

    public PredictionLedger ledger() {
        return ledger;
    }

    public void applyLedger(PredictionLedger next) {
        this.ledger = next;
    }

    /** Remembers an issued prediction for the history view. */
    public void trackIssued(Prediction prediction) {
        predictionHistory.append(prediction);
    }

    /** Updates the history entry of a prediction that has just resolved. */
    public void trackResolved(Prediction prediction) {
        predictionHistory.replaceFirst(p -> p.id().equals(prediction.id()), prediction);
    }

    /** Issued predictions, newest first, with their latest status. */
    public List<Prediction> recentPredictions(int n) {
        return predictionHistory.newestFirst(n);
    }

    // ── private ───────────────────────────────────────────────────────────────

    private void touch(Map<String, ?> counters, LinkedHashMap<String, Boolean> recency, String key) {
        recency.put(key, Boolean.TRUE);
        while (recency.size() > placeCap) {
            String eldest = recency.keySet().iterator().next();
            recency.remove(eldest);
            counters.remove(eldest);
        }
    }

    private static String addressKey(String location) {
        return location.trim().toLowerCase(Locale.ROOT);
    }

    private static String orUnknown(String value) {
        return value == null ? Incident.UNKNOWN : value;
    }
}
