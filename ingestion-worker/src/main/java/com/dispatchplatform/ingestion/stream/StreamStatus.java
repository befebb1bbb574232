package com.dispatchplatform.ingestion.stream;

public enum StreamStatus {
    CONNECTING,
    STREAMING,
    SILENT,
    RECONNECTING,
    STOPPED
}
