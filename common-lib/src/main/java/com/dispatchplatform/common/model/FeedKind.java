package com.dispatchplatform.common.model;

/** How a feed delivers audio: one continuous stream, or discrete calls fetched by polling. */
public enum FeedKind {
    STREAM,
    POLL
}
