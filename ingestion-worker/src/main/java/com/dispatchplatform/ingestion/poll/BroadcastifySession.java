package com.dispatchplatform.ingestion.poll;

import java.time.Instant;

/** Broadcastify user session obtained from {@code /common/v1/auth}. */
public record BroadcastifySession(String userId, String userToken, Instant expiresAt) {

    public boolean isValidAt(Instant now) {
        return now.isBefore(expiresAt);
    }
}
