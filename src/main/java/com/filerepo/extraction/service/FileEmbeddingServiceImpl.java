package com.filerepo.extraction.service;

import com.filerepo.extraction.client.FileCatalog;
import com.filerepo.extraction.controller.DeleteEmbeddingsResponse;
import com.filerepo.extraction.controller.EmbeddingPageItem;
import com.filerepo.extraction.controller.FileEmbeddingsResponse;
import com.filerepo.extraction.controller.IndexResponse;
import com.filerepo.extraction.controller.IndexingStatusResponse;
import com.filerepo.extraction.event.FileUploadedEvent;
import com.filerepo.extraction.exception.EntityNotFoundException;
import com.filerepo.extraction.exception.FileStillPresentException;
import com.filerepo.extraction.model.IndexingResult;
import com.filerepo.extraction.model.IndexingStatus;
import com.filerepo.extraction.repository.EmbeddingStore;
import com.filerepo.extraction.repository.IndexingRunRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class FileEmbeddingServiceImpl implements FileEmbeddingService {

    private final IndexingPipeline indexingPipeline;
    private final EmbeddingStore embeddingStore;
    private final IndexingRunRepository runRepository;
    private final FileCatalog fileCatalog;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    public IndexResponse index(String tenantId, String fileId) {
        requireOwnership(tenantId, fileId);
        IndexingResult result = indexingPipeline.indexFile(fileId);
        return new IndexResponse(
            result.fileId(),
            result.outcome(),
            result.pagesProcessed(),
            result.pagesTotal(),
            result.failedPages(),
            result.message()
        );
    }

    @Override
    public void indexAsync(String tenantId, String fileId) {
        requireOwnership(tenantId, fileId);
        log.debug("Queueing indexing of file {} for tenant {}", fileId, tenantId);
        eventPublisher.publishEvent(new FileUploadedEvent(tenantId, fileId));
    }

    @Override
    public FileEmbeddingsResponse getEmbeddings(String tenantId, String fileId) {
        requireOwnership(tenantId, fileId);
        List<EmbeddingPageItem> pages = embeddingStore.get(fileId).stream()
            .map(page -> new EmbeddingPageItem(page.pageId(), page.ocrText(), page.hasVector()))
            .toList();
        return new FileEmbeddingsResponse(fileId, pages);
    }

    @Override
    public IndexingStatusResponse getStatus(String tenantId, String fileId) {
        requireOwnership(tenantId, fileId);
        return runRepository.findByFileId(fileId)
            .map(run -> new IndexingStatusResponse(
                run.fileId(),
                run.status(),
                run.currentPage(),
                run.totalPages(),
                run.errorMessage(),
                run.attempts(),
                run.startedAt(),
                run.updatedAt()))
            .orElseGet(() -> new IndexingStatusResponse(
                fileId, IndexingStatus.NOT_INDEXED, 0, null, null, 0, null, null));
    }

    @Override
    @Transactional
    public DeleteEmbeddingsResponse deleteFile(String fileId) {
        if (fileCatalog.fileExists(fileId)) {
            log.warn("File {}: deletion hook called for a live file, embeddings kept", fileId);
            throw new FileStillPresentException(fileId);
        }
        int removed = embeddingStore.deleteByFile(fileId);
        runRepository.deleteByFileId(fileId);
        log.info("File {}: embeddings removed on deletion ({} pages)", fileId, removed);
        return new DeleteEmbeddingsResponse(fileId, removed);
    }

    private void requireOwnership(String tenantId, String fileId) {
        if (!fileCatalog.isOwnedBy(tenantId, fileId)) {
            log.warn("File {} not found for tenant {}", fileId, tenantId);
            throw new EntityNotFoundException(fileId);
        }
    }
}
