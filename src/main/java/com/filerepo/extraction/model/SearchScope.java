package com.filerepo.extraction.model;

import java.util.Objects;

/**
 * Boundary of a similarity search: one file's pages, or every file the tenant currently owns.
 */
public record SearchScope(
    Type type,
    String id
) {
    public enum Type { FILE, TENANT }

    public SearchScope {
        Objects.requireNonNull(type, "type");
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Scope id cannot be empty");
        }
    }

    public static SearchScope ofFile(String fileId) {
        return new SearchScope(Type.FILE, fileId);
    }

    public static SearchScope ofTenant(String tenantId) {
        return new SearchScope(Type.TENANT, tenantId);
    }
}
