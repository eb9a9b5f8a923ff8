package com.filerepo.extraction.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

public record SearchRequest(
    @NotBlank
    String query,

    @JsonProperty("top_k")
    Integer topK
) {}
