package com.dispatchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One configured external audio source for one city.
 * Built from configuration at startup and never mutated.
 */
public record SourceFeed(
    @JsonProperty("id")          String id,
    @JsonProperty("displayName") String displayName,
    @JsonProperty("city")        String city,
    @JsonProperty("kind")        FeedKind kind
) {
    public static SourceFeed stream(String id, String displayName, String city) {
        return new SourceFeed(id, displayName, city, FeedKind.STREAM);
    }

    public static SourceFeed poll(String id, String displayName, String city) {
        return new SourceFeed(id, displayName, city, FeedKind.POLL);
    }
}
