package com.dispatchplatform.ingestion.stream;

import com.dispatchplatform.common.model.SourceFeed;
import reactor.core.publisher.Flux;

/**
 * Opens the long-lived audio stream of a feed. The flux emits raw fragments as they arrive,
 * completes when the server ends the stream and errors on connection failure or non-200 status.
 */
@FunctionalInterface
public interface AudioStreamSource {

    Flux<byte[]> open(SourceFeed feed);
}
