package com.filerepo.extraction.controller;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EmbeddingPageItem(
    @JsonProperty("page_id")
    int pageId,

    String ocr,

    @JsonProperty("has_vector")
    boolean hasVector
) {}
