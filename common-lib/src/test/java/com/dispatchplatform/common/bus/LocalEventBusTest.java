package com.dispatchplatform.common.bus;

import com.dispatchplatform.common.event.AgentInsightEvent;
import com.dispatchplatform.common.event.DispatchChannel;
import com.dispatchplatform.common.event.DispatchEvent;
import com.dispatchplatform.common.event.TranscriptEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;

class LocalEventBusTest {

    @Test
    @DisplayName("subscribers only receive events from their own channel")
    void channelIsolation() {
        LocalEventBus bus = new LocalEventBus();
        TranscriptEvent transcript = new TranscriptEvent("shots fired", "NYPD Citywide 1", "nyc", Instant.now());
        AgentInsightEvent insight = new AgentInsightEvent("CHASE", "🚔", 4L, "suspect heading north",
            "critical", "nyc", Instant.now());

        StepVerifier.create(bus.subscribe(DispatchChannel.TRANSCRIPTS).take(1))
            .then(() -> bus.publish(insight).block())
            .then(() -> bus.publish(transcript).block())
            .expectNext(transcript)
            .expectComplete()
            .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("every local subscriber receives a published event")
    void fanOut() {
        LocalEventBus bus = new LocalEventBus();
        DispatchEvent event = new TranscriptEvent("engine 7 on scene", "Minneapolis Fire", "mpls", Instant.now());

        Flux<DispatchEvent> first = bus.subscribe(DispatchChannel.TRANSCRIPTS).take(1).cache();
        Flux<DispatchEvent> second = bus.subscribe(DispatchChannel.TRANSCRIPTS).take(1).cache();
        first.subscribe();
        second.subscribe();

        bus.publish(event).block();

        StepVerifier.create(first).expectNext(event).verifyComplete();
        StepVerifier.create(second).expectNext(event).verifyComplete();
    }
}
