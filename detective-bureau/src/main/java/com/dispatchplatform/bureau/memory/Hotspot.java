package com.dispatchplatform.bureau.memory;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Rolling incident count for one {@code borough-location} key. */
public record Hotspot(
    @JsonProperty("borough")  String borough,
    @JsonProperty("location") String location,
    @JsonProperty("count")    int count
) {
    Hotspot increment() {
        return new Hotspot(borough, location, count + 1);
    }
}
