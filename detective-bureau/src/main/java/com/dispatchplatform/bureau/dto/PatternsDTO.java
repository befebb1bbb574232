package com.dispatchplatform.bureau.dto;

import com.dispatchplatform.common.model.Pattern;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record PatternsDTO(
    @JsonProperty("active") List<Pattern> active,
    @JsonProperty("total")  int total
) {}
