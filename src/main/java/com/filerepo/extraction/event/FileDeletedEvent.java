package com.filerepo.extraction.event;

public record FileDeletedEvent(String fileId) {}
