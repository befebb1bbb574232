package com.dispatchplatform.common.event;

import com.dispatchplatform.common.model.Transcript;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record TranscriptEvent(
    @JsonProperty("text")      String text,
    @JsonProperty("source")    String source,
    @JsonProperty("city")      String city,
    @JsonProperty("timestamp") Instant timestamp
) implements DispatchEvent {

    public static TranscriptEvent of(Transcript transcript) {
        return new TranscriptEvent(transcript.text(), transcript.sourceLabel(), transcript.city(),
            transcript.capturedAt());
    }

    @Override @JsonIgnore
    public DispatchChannel channel() { return DispatchChannel.TRANSCRIPTS; }

    @Override @JsonIgnore
    public String eventName() { return "transcript"; }
}
