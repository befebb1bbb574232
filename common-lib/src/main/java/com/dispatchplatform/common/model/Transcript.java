package com.dispatchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Text recognised from one audio chunk or one call. Immutable.
 *
 * @param sourceLabel feed display name or talkgroup description, used in published events
 */
public record Transcript(
    @JsonProperty("text")         String text,
    @JsonProperty("sourceFeedId") String sourceFeedId,
    @JsonProperty("sourceLabel")  String sourceLabel,
    @JsonProperty("city")         String city,
    @JsonProperty("capturedAt")   Instant capturedAt
) {
    public static Transcript of(String text, SourceFeed feed, Instant capturedAt) {
        return new Transcript(text, feed.id(), feed.displayName(), feed.city(), capturedAt);
    }
}
