package com.dispatchplatform.ingestion.stream;

import com.dispatchplatform.ingestion.config.IngestionProperties;

import java.time.Duration;

/** Timing and sizing of live stream handling. */
public record StreamSettings(
    Duration chunkDuration,
    int minChunkBytes,
    Duration livenessInterval,
    Duration silenceThreshold,
    Duration reconnectDelay,
    Duration errorReconnectDelay
) {
    public static StreamSettings from(IngestionProperties.Streams streams) {
        return new StreamSettings(streams.getChunkDuration(), streams.getMinChunkBytes(),
            streams.getLivenessInterval(), streams.getSilenceThreshold(),
            streams.getReconnectDelay(), streams.getErrorReconnectDelay());
    }
}
