package com.dispatchplatform.common.model;

import java.util.Locale;

public enum Priority {
    CRITICAL,
    HIGH,
    MEDIUM,
    LOW;

    /** Lenient parse of extraction output. Unknown or missing values map to {@link #MEDIUM}. */
    public static Priority parse(String raw) {
        if (raw == null || raw.isBlank()) return MEDIUM;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return MEDIUM;
        }
    }
}
