package com.filerepo.extraction.listener;

import com.filerepo.extraction.event.FileDeletedEvent;
import com.filerepo.extraction.event.FileUploadedEvent;
import com.filerepo.extraction.exception.AlreadyIndexingException;
import com.filerepo.extraction.exception.ExtractionException;
import com.filerepo.extraction.model.IndexingResult;
import com.filerepo.extraction.service.FileEmbeddingService;
import com.filerepo.extraction.service.IndexingPipeline;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

@Component
@Slf4j
@RequiredArgsConstructor
public class FileEventListener {

    private final IndexingPipeline indexingPipeline;
    private final FileEmbeddingService fileEmbeddingService;

    @Async("indexingTaskExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleFileUploaded(FileUploadedEvent event) {
        log.info("Starting async indexing for file {} (tenant {})", event.fileId(), event.tenantId());
        try {
            IndexingResult result = indexingPipeline.indexFile(event.fileId());
            log.debug("Async indexing of file {} finished: {}", event.fileId(), result.outcome());
        } catch (AlreadyIndexingException e) {
            log.info("File {} is already being indexed, upload event skipped", event.fileId());
        } catch (ExtractionException e) {
            log.warn("Async indexing of file {} failed ({}, retryable={}): {}",
                event.fileId(), e.getKind(), e.isRetryable(), e.getMessage());
        }
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void handleFileDeleted(FileDeletedEvent event) {
        fileEmbeddingService.deleteFile(event.fileId());
    }
}
