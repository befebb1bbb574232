package com.dispatchplatform.common.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.time.Instant;

/**
 * Payload published on the bus. Serialized with a {@code type} discriminator so subscribers in
 * other processes can rebuild the concrete record.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = IncidentEvent.class,      name = "incident"),
    @JsonSubTypes.Type(value = TranscriptEvent.class,    name = "transcript"),
    @JsonSubTypes.Type(value = CameraSwitchEvent.class,  name = "camera_switch"),
    @JsonSubTypes.Type(value = AgentInsightEvent.class,  name = "agent_insight"),
    @JsonSubTypes.Type(value = PredictionEvent.class,    name = "prediction"),
    @JsonSubTypes.Type(value = PredictionHitEvent.class, name = "prediction_hit")
})
public interface DispatchEvent {

    String city();

    Instant timestamp();

    /** Channel this event is published on. Not serialized. */
    DispatchChannel channel();

    /** Event name for downstream clients, matching the {@code type} discriminator. */
    String eventName();
}
