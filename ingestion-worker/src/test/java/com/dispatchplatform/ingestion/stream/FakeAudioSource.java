package com.dispatchplatform.ingestion.stream;

import com.dispatchplatform.common.exception.ExternalServiceException;
import com.dispatchplatform.common.model.SourceFeed;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/** Hands out one controllable sink per opened connection; refused feeds fail with HTTP 404. */
class FakeAudioSource implements AudioStreamSource {

    private final List<Sinks.Many<byte[]>> opened = new ArrayList<>();
    private final List<String> openedFeeds = new ArrayList<>();
    private final Set<String> refused = new HashSet<>();

    @Override
    public synchronized Flux<byte[]> open(SourceFeed feed) {
        if (refused.contains(feed.id())) {
            openedFeeds.add(feed.id());
            return Flux.error(new ExternalServiceException("stream", "HTTP 404 for feed " + feed.id()));
        }
        Sinks.Many<byte[]> sink = Sinks.many().unicast().onBackpressureBuffer();
        opened.add(sink);
        openedFeeds.add(feed.id());
        return sink.asFlux();
    }

    synchronized void refuse(String feedId) {
        refused.add(feedId);
    }

    synchronized int openCount() {
        return opened.size();
    }

    synchronized List<String> openedFeeds() {
        return new ArrayList<>(openedFeeds);
    }

    void emit(int connection, int bytes) {
        opened.get(connection).tryEmitNext(new byte[bytes]);
    }

    void fail(int connection) {
        opened.get(connection).tryEmitError(new IllegalStateException("connection reset"));
    }

    void end(int connection) {
        opened.get(connection).tryEmitComplete();
    }
}
