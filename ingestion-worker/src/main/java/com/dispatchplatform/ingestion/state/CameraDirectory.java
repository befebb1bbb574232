package com.dispatchplatform.ingestion.state;

import com.dispatchplatform.common.model.Camera;
import com.dispatchplatform.common.model.Incident;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Traffic cameras for one city. Replaced wholesale when the directory is (re)loaded; reads
 * see a consistent list.
 */
public class CameraDirectory {

    private volatile List<Camera> cameras = List.of();

    public void replace(List<Camera> loaded) {
        cameras = List.copyOf(loaded);
    }

    public int size() {
        return cameras.size();
    }

    public List<Camera> all() {
        return cameras;
    }

    /**
     * Picks a camera for an incident: narrows to cameras whose area contains the borough, then
     * prefers one whose name shares a location word longer than two characters. Falls back to
     * the first camera of the narrowed set.
     */
    public Optional<Camera> findCamera(String location, String borough) {
        List<Camera> candidates = cameras;
        if (candidates.isEmpty()) return Optional.empty();

        if (isKnown(borough)) {
            String boroughLower = borough.toLowerCase(Locale.ROOT);
            List<Camera> inBorough = candidates.stream()
                .filter(c -> c.area() != null && c.area().toLowerCase(Locale.ROOT).contains(boroughLower))
                .toList();
            if (!inBorough.isEmpty()) candidates = inBorough;
        }

        if (isKnown(location)) {
            List<String> words = List.of(location.toLowerCase(Locale.ROOT).split("[\\s&@]+")).stream()
                .filter(w -> w.length() > 2)
                .toList();
            Optional<Camera> byName = candidates.stream()
                .filter(c -> {
                    String name = c.location() == null ? "" : c.location().toLowerCase(Locale.ROOT);
                    return words.stream().anyMatch(name::contains);
                })
                .findFirst();
            if (byName.isPresent()) return byName;
        }
        return Optional.of(candidates.get(0));
    }

    private static boolean isKnown(String value) {
        return value != null && !value.isBlank() && !Incident.UNKNOWN.equalsIgnoreCase(value);
    }
}
