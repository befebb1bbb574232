package com.dispatchplatform.ingestion.extract;

import com.dispatchplatform.common.model.IncidentCandidate;

/**
 * Outcome of one extraction call. Callers handle all three variants:
 * <ul>
 *   <li>{@link Accepted}: the service reported an incident;</li>
 *   <li>{@link Rejected}: the service answered and reported no incident;</li>
 *   <li>{@link ParseError}: no usable answer (network failure, timeout, malformed payload).</li>
 * </ul>
 */
public sealed interface ExtractionResult
        permits ExtractionResult.Accepted, ExtractionResult.Rejected, ExtractionResult.ParseError {

    record Accepted(IncidentCandidate candidate) implements ExtractionResult {}

    record Rejected(String reason) implements ExtractionResult {}

    record ParseError(String detail) implements ExtractionResult {}
}
