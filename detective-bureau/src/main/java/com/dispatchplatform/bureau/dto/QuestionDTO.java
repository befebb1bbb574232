package com.dispatchplatform.bureau.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Body of an ask request. {@code incidentId} optionally focuses the question on one incident. */
public record QuestionDTO(
    @JsonProperty("question")   String question,
    @JsonProperty("incidentId") Long incidentId
) {}
