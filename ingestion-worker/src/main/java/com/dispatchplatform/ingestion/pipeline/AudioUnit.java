package com.dispatchplatform.ingestion.pipeline;

import com.dispatchplatform.common.model.SourceFeed;

import java.time.Instant;

/** One unit of audio to transcribe: a stream chunk or a downloaded call clip. */
public record AudioUnit(SourceFeed feed, byte[] audio, Instant receivedAt) {

    public static AudioUnit of(SourceFeed feed, byte[] audio) {
        return new AudioUnit(feed, audio, Instant.now());
    }
}
