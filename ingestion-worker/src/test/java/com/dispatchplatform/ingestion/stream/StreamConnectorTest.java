package com.dispatchplatform.ingestion.stream;

import com.dispatchplatform.common.model.SourceFeed;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StreamConnectorTest {

    private static final SourceFeed FEED = SourceFeed.stream("40184", "NYPD Citywide 1", "nyc");
    private static final StreamSettings SETTINGS = new StreamSettings(
        Duration.ofSeconds(15), 5000, Duration.ofSeconds(30), Duration.ofSeconds(90),
        Duration.ofSeconds(3), Duration.ofSeconds(5));

    private VirtualTimeScheduler scheduler;
    private FakeAudioSource source;
    private List<byte[]> chunks;
    private List<Throwable> connectFailures;
    private StreamConnector connector;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        source    = new FakeAudioSource();
        chunks    = new ArrayList<>();
        connectFailures = new ArrayList<>();
        connector = new StreamConnector(FEED, source, SETTINGS, scheduler,
            (feed, audio) -> chunks.add(audio), (feed, error) -> connectFailures.add(error));
    }

    // ── chunking ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("chunking")
    class Chunking {

        @Test
        @DisplayName("first fragment moves the connection to STREAMING")
        void firstFragmentStreams() {
            connector.connect();
            assertEquals(StreamStatus.CONNECTING, connector.status());

            source.emit(0, 100);

            assertEquals(StreamStatus.STREAMING, connector.status());
        }

        @Test
        @DisplayName("buffer is flushed once the chunk duration has elapsed")
        void flushAfterDuration() {
            connector.connect();
            source.emit(0, 3000);
            scheduler.advanceTimeBy(Duration.ofSeconds(10));
            source.emit(0, 1000);
            assertTrue(chunks.isEmpty());

            scheduler.advanceTimeBy(Duration.ofSeconds(5));
            source.emit(0, 2000);

            assertEquals(1, chunks.size());
            assertEquals(6000, chunks.get(0).length);
        }

        @Test
        @DisplayName("chunks of 5000 bytes or less are discarded, not carried over")
        void smallChunkDiscarded() {
            connector.connect();
            source.emit(0, 2000);
            scheduler.advanceTimeBy(Duration.ofSeconds(15));
            source.emit(0, 3000);
            assertTrue(chunks.isEmpty());

            scheduler.advanceTimeBy(Duration.ofSeconds(15));
            source.emit(0, 5001);

            assertEquals(1, chunks.size());
            assertEquals(5001, chunks.get(0).length);
        }
    }

    // ── reconnects ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("reconnects")
    class Reconnects {

        @Test
        @DisplayName("silence beyond the threshold reconnects exactly once, after 3s")
        void silenceReconnectsOnce() {
            connector.connect();
            source.emit(0, 100);

            scheduler.advanceTimeBy(Duration.ofSeconds(90));
            assertEquals(StreamStatus.STREAMING, connector.status());

            scheduler.advanceTimeBy(Duration.ofSeconds(30));
            assertEquals(StreamStatus.RECONNECTING, connector.status());
            assertEquals(1, connector.reconnectCount());

            // late failure of the closed connection is not a second episode
            source.fail(0);
            assertEquals(1, connector.reconnectCount());

            scheduler.advanceTimeBy(Duration.ofSeconds(2));
            assertEquals(1, source.openCount());
            scheduler.advanceTimeBy(Duration.ofSeconds(1));
            assertEquals(2, source.openCount());
            assertEquals(StreamStatus.CONNECTING, connector.status());
        }

        @Test
        @DisplayName("transport error reconnects after 5s")
        void errorReconnects() {
            connector.connect();
            source.emit(0, 100);
            source.fail(0);
            assertEquals(StreamStatus.RECONNECTING, connector.status());

            scheduler.advanceTimeBy(Duration.ofSeconds(4));
            assertEquals(1, source.openCount());
            scheduler.advanceTimeBy(Duration.ofSeconds(1));
            assertEquals(2, source.openCount());
        }

        @Test
        @DisplayName("stream end reconnects after 3s")
        void endReconnects() {
            connector.connect();
            source.emit(0, 100);
            source.end(0);

            scheduler.advanceTimeBy(Duration.ofSeconds(3));
            assertEquals(2, source.openCount());
            assertEquals(1, connector.reconnectCount());
        }

        @Test
        @DisplayName("fragments from a replaced connection are ignored")
        void staleConnectionIgnored() {
            connector.connect();
            source.emit(0, 100);
            source.fail(0);
            scheduler.advanceTimeBy(Duration.ofSeconds(5));

            source.emit(0, 9000);
            scheduler.advanceTimeBy(Duration.ofSeconds(15));
            source.emit(0, 9000);

            assertTrue(chunks.isEmpty());
            assertEquals(StreamStatus.CONNECTING, connector.status());
        }

        @Test
        @DisplayName("stop cancels a pending reconnect")
        void stopCancelsReconnect() {
            connector.connect();
            source.emit(0, 100);
            source.fail(0);
            connector.stop();

            scheduler.advanceTimeBy(Duration.ofMinutes(1));

            assertEquals(1, source.openCount());
            assertEquals(StreamStatus.STOPPED, connector.status());
            assertTrue(connector.isStopped());
        }
    }

    // ── connect failures ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("connect failures")
    class ConnectFailures {

        @Test
        @DisplayName("a failure before any audio is reported once and never retried")
        void failureBeforeAudio() {
            connector.connect();
            source.fail(0);

            assertEquals(1, connectFailures.size());
            assertEquals(StreamStatus.STOPPED, connector.status());

            scheduler.advanceTimeBy(Duration.ofMinutes(1));

            assertEquals(1, source.openCount());
            assertEquals(0, connector.reconnectCount());
        }

        @Test
        @DisplayName("a refused request is a connect failure")
        void refusedRequest() {
            source.refuse(FEED.id());

            connector.connect();
            scheduler.advanceTimeBy(Duration.ofMinutes(1));

            assertEquals(1, connectFailures.size());
            assertTrue(connectFailures.get(0).getMessage().contains("HTTP 404"));
            assertEquals(List.of(FEED.id()), source.openedFeeds());
        }

        @Test
        @DisplayName("a failure after audio has flowed reconnects instead")
        void failureAfterAudio() {
            connector.connect();
            source.emit(0, 100);
            source.fail(0);

            assertTrue(connectFailures.isEmpty());
            assertEquals(1, connector.reconnectCount());
        }
    }
}
