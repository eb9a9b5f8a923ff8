package com.filerepo.extraction.controller;

import com.filerepo.extraction.exception.ErrorKind;

public record ErrorResponse(
    String error,
    ErrorKind kind,
    boolean retryable,
    int status,
    long timestamp
) {}
