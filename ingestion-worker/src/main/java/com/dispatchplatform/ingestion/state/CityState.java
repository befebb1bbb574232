package com.dispatchplatform.ingestion.state;

import com.dispatchplatform.common.memory.BoundedRing;
import com.dispatchplatform.common.model.Incident;
import com.dispatchplatform.common.model.Transcript;

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Per-city ingestion state: bounded rings of recent incidents and transcripts, the camera
 * directory and the incident id counter.
 *
 * <p>Writes happen only on the owning city's serialized scheduler. Reads are snapshot-based.
 */
public class CityState {

    private final String city;
    private final BoundedRing<Incident> incidents;
    private final BoundedRing<Transcript> transcripts;
    private final CameraDirectory cameras = new CameraDirectory();
    private final AtomicLong incidentIds = new AtomicLong();

    public CityState(String city, int incidentCapacity, int transcriptCapacity) {
        this.city        = city;
        this.incidents   = new BoundedRing<>(incidentCapacity);
        this.transcripts = new BoundedRing<>(transcriptCapacity);
    }

    /** Strictly increasing, never repeats within this process. */
    public long nextIncidentId() {
        return incidentIds.incrementAndGet();
    }

    public void appendIncident(Incident incident) {
        if (!city.equals(incident.city())) {
            throw new IllegalArgumentException("Incident for " + incident.city() + " appended to " + city);
        }
        incidents.append(incident);
    }

    public void appendTranscript(Transcript transcript) {
        transcripts.append(transcript);
    }

    /** Newest first. */
    public List<Incident> recentIncidents(int n) {
        return incidents.newestFirst(n);
    }

    /** Newest first. */
    public List<Transcript> recentTranscripts(int n) {
        return transcripts.newestFirst(n);
    }

    public int incidentCount() {
        return incidents.size();
    }

    public long lastIncidentId() {
        return incidentIds.get();
    }

    public CameraDirectory cameras() {
        return cameras;
    }

    public String city() {
        return city;
    }
}
