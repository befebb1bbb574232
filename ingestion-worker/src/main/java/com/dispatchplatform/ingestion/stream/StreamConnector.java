package com.dispatchplatform.ingestion.stream;

import com.dispatchplatform.common.model.SourceFeed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Keeps one live feed connected: buffers incoming audio into fixed-duration chunks, detects
 * silence and reconnects after a delay when the stream goes quiet, ends or fails after audio
 * has flowed. A connection that fails before its first fragment is not retried; it is reported
 * to the {@link ConnectFailureListener} so the owner can give the slot to another feed.
 *
 * <p>Each (re)connect creates a fresh {@link StreamConnection}. Callbacks carry the connection
 * they were registered for and are ignored once it is no longer current. All timers run on the
 * injected scheduler, so tests drive the connector with virtual time.
 */
public class StreamConnector {

    private static final Logger log = LoggerFactory.getLogger(StreamConnector.class);

    /** Receives every chunk worth transcribing. */
    @FunctionalInterface
    public interface ChunkListener {
        void onChunk(SourceFeed feed, byte[] audio);
    }

    /** Told when a connection fails before any audio arrived. */
    @FunctionalInterface
    public interface ConnectFailureListener {
        void onConnectFailed(SourceFeed feed, Throwable error);
    }

    private final SourceFeed feed;
    private final AudioStreamSource source;
    private final StreamSettings settings;
    private final Scheduler scheduler;
    private final ChunkListener listener;
    private final ConnectFailureListener connectFailures;

    private final AtomicReference<StreamConnection> current = new AtomicReference<>();
    private final AtomicReference<Disposable> pendingReconnect = new AtomicReference<>();
    private final AtomicLong reconnects = new AtomicLong();
    private volatile boolean stopped;

    public StreamConnector(SourceFeed feed, AudioStreamSource source, StreamSettings settings,
                           Scheduler scheduler, ChunkListener listener,
                           ConnectFailureListener connectFailures) {
        this.feed            = feed;
        this.source          = source;
        this.settings        = settings;
        this.scheduler       = scheduler;
        this.listener        = listener;
        this.connectFailures = connectFailures;
    }

    public SourceFeed feed() {
        return feed;
    }

    public StreamStatus status() {
        if (stopped) return StreamStatus.STOPPED;
        StreamConnection conn = current.get();
        return conn == null ? StreamStatus.CONNECTING : conn.status();
    }

    public long reconnectCount() {
        return reconnects.get();
    }

    public boolean isStopped() {
        return stopped;
    }

    /** Opens a new connection, replacing and closing any previous one. No-op once stopped. */
    public StreamConnection connect() {
        if (stopped) return current.get();

        StreamConnection conn = new StreamConnection(feed, now());
        StreamConnection previous = current.getAndSet(conn);
        if (previous != null) {
            previous.terminate(StreamStatus.STOPPED);
            previous.close();
        }
        log.info("[Stream] Connecting. feed={} name={} city={}", feed.id(), feed.displayName(), feed.city());

        Disposable liveness = Flux.interval(settings.livenessInterval(), scheduler)
            .subscribe(tick -> checkLiveness(conn));
        Disposable transport = source.open(feed)
            .subscribe(
                bytes -> onData(conn, bytes),
                error -> onError(conn, error),
                () -> onEnded(conn)
            );
        conn.attach(transport, liveness);
        return conn;
    }

    /** Stops for good: closes the connection and cancels any scheduled reconnect. */
    public void stop() {
        stopped = true;
        Disposable reconnect = pendingReconnect.getAndSet(null);
        if (reconnect != null) reconnect.dispose();
        StreamConnection conn = current.get();
        if (conn != null) {
            conn.terminate(StreamStatus.STOPPED);
            conn.transition(StreamStatus.SILENT, StreamStatus.STOPPED);
            conn.transition(StreamStatus.RECONNECTING, StreamStatus.STOPPED);
            conn.close();
        }
        log.info("[Stream] Stopped. feed={}", feed.id());
    }

    // ── callbacks ────────────────────────────────────────────────────────────

    void onData(StreamConnection conn, byte[] bytes) {
        if (!isCurrent(conn) || conn.isClosed()) return;

        Instant now = now();
        if (conn.transition(StreamStatus.CONNECTING, StreamStatus.STREAMING)) {
            log.info("[Stream] Connected. feed={} name={}", feed.id(), feed.displayName());
        }
        conn.append(bytes, now);

        if (Duration.between(conn.chunkStartedAt(), now).compareTo(settings.chunkDuration()) >= 0) {
            byte[] chunk = conn.drain(now);
            if (chunk.length > settings.minChunkBytes()) {
                log.debug("[Stream] Chunk ready. feed={} bytes={}", feed.id(), chunk.length);
                listener.onChunk(feed, chunk);
            }
        }
    }

    void checkLiveness(StreamConnection conn) {
        if (!isCurrent(conn)) return;

        Duration silentFor = Duration.between(conn.lastDataAt(), now());
        if (silentFor.compareTo(settings.silenceThreshold()) <= 0) return;
        if (!conn.terminate(StreamStatus.SILENT)) return;

        log.warn("[Stream] Silent, reconnecting. feed={} silentSeconds={}", feed.id(), silentFor.toSeconds());
        conn.transition(StreamStatus.SILENT, StreamStatus.RECONNECTING);
        conn.close();
        scheduleReconnect(settings.reconnectDelay());
    }

    void onError(StreamConnection conn, Throwable error) {
        if (!isCurrent(conn)) return;

        if (conn.transition(StreamStatus.CONNECTING, StreamStatus.STOPPED)) {
            log.error("[Stream] Connect failed. feed={} error={}", feed.id(), error.getMessage());
            conn.close();
            connectFailures.onConnectFailed(feed, error);
            return;
        }
        if (!conn.terminate(StreamStatus.RECONNECTING)) return;

        log.error("[Stream] Stream failed, reconnecting. feed={} error={}", feed.id(), error.getMessage());
        conn.close();
        scheduleReconnect(settings.errorReconnectDelay());
    }

    void onEnded(StreamConnection conn) {
        if (!isCurrent(conn) || !conn.terminate(StreamStatus.RECONNECTING)) return;

        log.info("[Stream] Stream ended, reconnecting. feed={}", feed.id());
        conn.close();
        scheduleReconnect(settings.reconnectDelay());
    }

    // ── private ──────────────────────────────────────────────────────────────

    private void scheduleReconnect(Duration delay) {
        if (stopped) return;
        reconnects.incrementAndGet();
        Disposable task = scheduler.schedule(this::connect, delay.toMillis(), TimeUnit.MILLISECONDS);
        Disposable previous = pendingReconnect.getAndSet(task);
        if (previous != null) previous.dispose();
    }

    private boolean isCurrent(StreamConnection conn) {
        return !stopped && current.get() == conn;
    }

    private Instant now() {
        return Instant.ofEpochMilli(scheduler.now(TimeUnit.MILLISECONDS));
    }
}
