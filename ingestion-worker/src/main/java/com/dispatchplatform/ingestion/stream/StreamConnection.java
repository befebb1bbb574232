package com.dispatchplatform.ingestion.stream;

import com.dispatchplatform.common.model.SourceFeed;
import reactor.core.Disposable;

import java.io.ByteArrayOutputStream;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One attempt at a live connection to a feed. Owned by a single {@link StreamConnector} and
 * replaced, never reused, on reconnect. Callbacks from a replaced connection are ignored by the
 * connector, which is how an outstanding attempt is cancelled.
 */
public class StreamConnection {

    private final SourceFeed feed;
    private final AtomicReference<StreamStatus> status = new AtomicReference<>(StreamStatus.CONNECTING);
    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private volatile Instant lastDataAt;
    private volatile Instant chunkStartedAt;
    private volatile Disposable transport;
    private volatile Disposable liveness;

    public StreamConnection(SourceFeed feed, Instant openedAt) {
        this.feed           = feed;
        this.lastDataAt     = openedAt;
        this.chunkStartedAt = openedAt;
    }

    public SourceFeed feed() {
        return feed;
    }

    public StreamStatus status() {
        return status.get();
    }

    public Instant lastDataAt() {
        return lastDataAt;
    }

    /** Atomic status change; returns false when the connection was not in {@code expected}. */
    boolean transition(StreamStatus expected, StreamStatus next) {
        return status.compareAndSet(expected, next);
    }

    /**
     * Moves to {@code next} from a live status (connecting or streaming). Returns false if the
     * connection has already left those, so each failure episode is handled once.
     */
    boolean terminate(StreamStatus next) {
        StreamStatus current = status.get();
        while (current == StreamStatus.CONNECTING || current == StreamStatus.STREAMING) {
            if (status.compareAndSet(current, next)) return true;
            current = status.get();
        }
        return false;
    }

    synchronized void append(byte[] bytes, Instant at) {
        buffer.write(bytes, 0, bytes.length);
        lastDataAt = at;
    }

    Instant chunkStartedAt() {
        return chunkStartedAt;
    }

    /** Returns buffered bytes and starts a new chunk at {@code at}. */
    synchronized byte[] drain(Instant at) {
        byte[] chunk = buffer.toByteArray();
        buffer.reset();
        chunkStartedAt = at;
        return chunk;
    }

    synchronized int bufferedBytes() {
        return buffer.size();
    }

    void attach(Disposable transport, Disposable liveness) {
        this.transport = transport;
        this.liveness  = liveness;
        if (isClosed()) close();
    }

    boolean isClosed() {
        StreamStatus s = status.get();
        return s != StreamStatus.CONNECTING && s != StreamStatus.STREAMING;
    }

    void close() {
        Disposable t = transport;
        Disposable l = liveness;
        if (t != null) t.dispose();
        if (l != null) l.dispose();
    }
}
