package com.dispatchplatform.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Traffic camera directory entry. {@code area} is the borough/district the camera sits in. */
public record Camera(
    @JsonProperty("id")       String id,
    @JsonProperty("location") String location,
    @JsonProperty("area")     String area,
    @JsonProperty("lat")      double lat,
    @JsonProperty("lng")      double lng,
    @JsonProperty("imageUrl") String imageUrl
) {}
