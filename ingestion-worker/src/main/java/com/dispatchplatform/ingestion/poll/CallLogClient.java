package com.dispatchplatform.ingestion.poll;

import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/** A source of discrete radio calls with downloadable audio. */
public interface CallLogClient {

    String name();

    String city();

    /** Calls the source reports as newer than {@code highWaterMark}. Errors on transport or auth failure. */
    Mono<List<CallRecord>> fetchSince(Instant highWaterMark);

    /** The record's audio URL, looked up if the listing did not carry one. Empty when none exists. */
    Mono<String> resolveAudioUrl(CallRecord call);

    Mono<byte[]> download(String audioUrl);
}
