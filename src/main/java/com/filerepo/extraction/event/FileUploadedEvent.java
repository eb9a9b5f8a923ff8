package com.filerepo.extraction.event;

public record FileUploadedEvent(String tenantId, String fileId) {}
