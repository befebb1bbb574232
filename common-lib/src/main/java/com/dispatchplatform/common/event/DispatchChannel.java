package com.dispatchplatform.common.event;

/** Bus channels. The wire name is shared by every process that publishes or subscribes. */
public enum DispatchChannel {
    INCIDENTS("dispatch:incidents"),
    TRANSCRIPTS("dispatch:transcripts"),
    CAMERAS("dispatch:cameras"),
    AGENT_INSIGHTS("dispatch:agent_insights"),
    PREDICTIONS("dispatch:predictions");

    private final String wireName;

    DispatchChannel(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
