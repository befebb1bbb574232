package com.dispatchplatform.common.ai;

/**
 * One completion request to the external reasoning service.
 *
 * @param system    system prompt, may be {@code null}
 * @param prompt    user message
 * @param maxTokens response token cap
 * @param purpose   short label used in logs, e.g. {@code extraction} or {@code CHASE}
 */
public record ReasoningRequest(String system, String prompt, int maxTokens, String purpose) {

    public static ReasoningRequest of(String purpose, String system, String prompt, int maxTokens) {
        return new ReasoningRequest(system, prompt, maxTokens, purpose);
    }
}
