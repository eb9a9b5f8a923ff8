package com.filerepo.extraction.service;

import com.filerepo.extraction.controller.DeleteEmbeddingsResponse;
import com.filerepo.extraction.controller.FileEmbeddingsResponse;
import com.filerepo.extraction.controller.IndexResponse;
import com.filerepo.extraction.controller.IndexingStatusResponse;

/**
 * Tenant-facing entry points over a single file's page embeddings.
 */
public interface FileEmbeddingService {

    IndexResponse index(String tenantId, String fileId);

    /**
     * Queues indexing on the background executor and returns immediately.
     */
    void indexAsync(String tenantId, String fileId);

    FileEmbeddingsResponse getEmbeddings(String tenantId, String fileId);

    IndexingStatusResponse getStatus(String tenantId, String fileId);

    /**
     * Cascade from file deletion. Safe to call for a file that was never indexed.
     *
     * @throws com.filerepo.extraction.exception.FileStillPresentException if the file has not been deleted
     */
    DeleteEmbeddingsResponse deleteFile(String fileId);
}
