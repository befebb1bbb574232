package com.dispatchplatform.ingestion.transcribe;

import reactor.core.publisher.Mono;

/** Converts raw audio bytes to text. Completes empty when nothing usable was recognised or the call failed. */
@FunctionalInterface
public interface SpeechToTextClient {

    Mono<String> transcribe(byte[] audio, String vocabularyHint);
}
