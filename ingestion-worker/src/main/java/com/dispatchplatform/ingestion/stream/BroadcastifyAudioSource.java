package com.dispatchplatform.ingestion.stream;

import com.dispatchplatform.common.exception.ExternalServiceException;
import com.dispatchplatform.common.model.SourceFeed;
import com.dispatchplatform.ingestion.config.IngestionProperties;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;

/** Broadcastify live audio: {@code GET /{feedId}.mp3} with the premium account's Basic credentials. */
@Component
public class BroadcastifyAudioSource implements AudioStreamSource {

    private final WebClient streamWebClient;
    private final IngestionProperties.Streams settings;

    public BroadcastifyAudioSource(WebClient streamWebClient, IngestionProperties properties) {
        this.streamWebClient = streamWebClient;
        this.settings        = properties.getStreams();
    }

    @Override
    public Flux<byte[]> open(SourceFeed feed) {
        return streamWebClient.get()
            .uri("/{feedId}.mp3", feed.id())
            .headers(h -> h.setBasicAuth(settings.getUsername(), settings.getPassword()))
            .exchangeToFlux(response -> {
                if (response.statusCode().value() != HttpStatus.OK.value()) {
                    return response.releaseBody().thenMany(Flux.error(new ExternalServiceException("stream",
                        "HTTP " + response.statusCode().value() + " for feed " + feed.id())));
                }
                return response.bodyToFlux(DataBuffer.class).map(BroadcastifyAudioSource::toBytes);
            });
    }

    private static byte[] toBytes(DataBuffer buffer) {
        try {
            byte[] bytes = new byte[buffer.readableByteCount()];
            buffer.read(bytes);
            return bytes;
        } finally {
            DataBufferUtils.release(buffer);
        }
    }
}
