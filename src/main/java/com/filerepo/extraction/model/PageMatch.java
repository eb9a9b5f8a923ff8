package com.filerepo.extraction.model;

public record PageMatch(
    String fileId,
    int pageId,
    double score,
    String ocrText
) {}
