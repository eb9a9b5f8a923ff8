package com.filerepo.extraction.client;

import java.util.List;

/**
 * Read-only view of the file-management collaborator that owns file records and bytes.
 */
public interface FileCatalog {

    /**
     * @throws com.filerepo.extraction.exception.EntityNotFoundException if the file is unknown or deleted
     */
    byte[] getFileBytes(String fileId);

    boolean fileExists(String fileId);

    List<String> listFilesForTenant(String tenantId);

    default boolean isOwnedBy(String tenantId, String fileId) {
        return listFilesForTenant(tenantId).contains(fileId);
    }
}
