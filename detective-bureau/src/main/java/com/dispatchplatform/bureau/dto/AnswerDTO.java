package com.dispatchplatform.bureau.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** Reply to a free-form question. Exactly one of {@code answer} and {@code error} is set. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AnswerDTO(
    @JsonProperty("agent")     String agent,
    @JsonProperty("agentIcon") String agentIcon,
    @JsonProperty("answer")    String answer,
    @JsonProperty("error")     String error,
    @JsonProperty("timestamp") Instant timestamp
) {}
