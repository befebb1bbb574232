package com.dispatchplatform.ingestion.pipeline;

/** What became of one {@link AudioUnit}. */
public enum IngestOutcome {
    /** Too little audio, unknown city or no speech recognised. */
    SKIPPED,
    FILTERED,
    /** Filtered, and the source feed is producing garbage: replace it. */
    DROP_FEED,
    DUPLICATE,
    NO_INCIDENT,
    EXTRACTION_FAILED,
    INCIDENT,
    FAILED
}
