package com.dispatchplatform.common.ai;

import reactor.core.publisher.Mono;

/**
 * Text completion against the external understanding service used for extraction and for the
 * bureau agents. Implementations bound every call with a timeout and signal failures as errors;
 * callers decide how to degrade.
 */
@FunctionalInterface
public interface ReasoningClient {

    Mono<String> complete(ReasoningRequest request);
}
