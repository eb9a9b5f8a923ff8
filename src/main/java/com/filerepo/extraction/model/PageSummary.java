package com.filerepo.extraction.model;

public record PageSummary(
    int pageId,
    String ocrText,
    boolean hasVector
) {}
