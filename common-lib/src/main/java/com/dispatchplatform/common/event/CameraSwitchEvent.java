package com.dispatchplatform.common.event;

import com.dispatchplatform.common.model.Camera;
import com.dispatchplatform.common.model.Priority;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record CameraSwitchEvent(
    @JsonProperty("camera")    Camera camera,
    @JsonProperty("reason")    String reason,
    @JsonProperty("priority")  Priority priority,
    @JsonProperty("city")      String city,
    @JsonProperty("timestamp") Instant timestamp
) implements DispatchEvent {

    @Override @JsonIgnore
    public DispatchChannel channel() { return DispatchChannel.CAMERAS; }

    @Override @JsonIgnore
    public String eventName() { return "camera_switch"; }
}
