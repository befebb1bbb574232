package com.dispatchplatform.ingestion.status;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/** Process-wide ingestion counters. */
@Component
public class IngestionStats {

    private final AtomicLong chunks           = new AtomicLong();
    private final AtomicLong calls            = new AtomicLong();
    private final AtomicLong transcripts      = new AtomicLong();
    private final AtomicLong filtered         = new AtomicLong();
    private final AtomicLong duplicates       = new AtomicLong();
    private final AtomicLong incidents        = new AtomicLong();
    private final AtomicLong rejected         = new AtomicLong();
    private final AtomicLong extractionErrors = new AtomicLong();
    private final AtomicLong droppedFeeds     = new AtomicLong();

    public void recordChunk()           { chunks.incrementAndGet(); }
    public void recordCall()            { calls.incrementAndGet(); }
    public void recordTranscript()      { transcripts.incrementAndGet(); }
    public void recordFiltered()        { filtered.incrementAndGet(); }
    public void recordDuplicate()       { duplicates.incrementAndGet(); }
    public void recordIncident()        { incidents.incrementAndGet(); }
    public void recordRejected()        { rejected.incrementAndGet(); }
    public void recordExtractionError() { extractionErrors.incrementAndGet(); }
    public void recordDroppedFeed()     { droppedFeeds.incrementAndGet(); }

    public long incidents() {
        return incidents.get();
    }

    public long transcripts() {
        return transcripts.get();
    }

    public Map<String, Long> snapshot() {
        Map<String, Long> out = new LinkedHashMap<>();
        out.put("chunks", chunks.get());
        out.put("calls", calls.get());
        out.put("transcripts", transcripts.get());
        out.put("filtered", filtered.get());
        out.put("duplicates", duplicates.get());
        out.put("incidents", incidents.get());
        out.put("rejected", rejected.get());
        out.put("extractionErrors", extractionErrors.get());
        out.put("droppedFeeds", droppedFeeds.get());
        return out;
    }
}
