package com.dispatchplatform.bureau.agent;

import java.util.Locale;

public enum Urgency {
    CRITICAL, HIGH, MEDIUM, LOW;

    /** Lowercase form carried in {@code agent_insight} events. */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
