package com.filerepo.extraction.service;

import com.filerepo.extraction.client.FileCatalog;
import com.filerepo.extraction.controller.FileEmbeddingsResponse;
import com.filerepo.extraction.controller.IndexResponse;
import com.filerepo.extraction.controller.IndexingStatusResponse;
import com.filerepo.extraction.event.FileUploadedEvent;
import com.filerepo.extraction.exception.EntityNotFoundException;
import com.filerepo.extraction.exception.FileStillPresentException;
import com.filerepo.extraction.model.IndexingOutcome;
import com.filerepo.extraction.model.IndexingResult;
import com.filerepo.extraction.model.IndexingRun;
import com.filerepo.extraction.model.IndexingStatus;
import com.filerepo.extraction.model.PageSummary;
import com.filerepo.extraction.repository.EmbeddingStore;
import com.filerepo.extraction.repository.IndexingRunRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class FileEmbeddingServiceTest {

    @Mock
    private IndexingPipeline indexingPipeline;
    @Mock
    private EmbeddingStore embeddingStore;
    @Mock
    private IndexingRunRepository runRepository;
    @Mock
    private FileCatalog fileCatalog;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private FileEmbeddingServiceImpl fileEmbeddingService;

    @Test
    @DisplayName("Index returns the pipeline result for an owned file")
    void shouldIndexOwnedFile() {
        when(fileCatalog.isOwnedBy("t1", "f1")).thenReturn(true);
        when(indexingPipeline.indexFile("f1")).thenReturn(
            new IndexingResult("f1", IndexingOutcome.PARTIALLY_INDEXED, 2, 3, List.of(2), "1 of 3 pages failed"));

        IndexResponse response = fileEmbeddingService.index("t1", "f1");

        assertThat(response.outcome()).isEqualTo(IndexingOutcome.PARTIALLY_INDEXED);
        assertThat(response.pagesProcessed()).isEqualTo(2);
        assertThat(response.pagesTotal()).isEqualTo(3);
        assertThat(response.failedPages()).containsExactly(2);
    }

    @Test
    @DisplayName("Index of a file the tenant does not own is not found and never starts a run")
    void shouldRejectForeignFile() {
        when(fileCatalog.isOwnedBy("t1", "f9")).thenReturn(false);

        assertThatThrownBy(() -> fileEmbeddingService.index("t1", "f9"))
            .isInstanceOf(EntityNotFoundException.class);
        verifyNoInteractions(indexingPipeline);
    }

    @Test
    @DisplayName("Async index publishes an upload event instead of indexing inline")
    void shouldPublishEventForAsyncIndex() {
        when(fileCatalog.isOwnedBy("t1", "f1")).thenReturn(true);

        fileEmbeddingService.indexAsync("t1", "f1");

        verify(eventPublisher).publishEvent(new FileUploadedEvent("t1", "f1"));
        verifyNoInteractions(indexingPipeline);
    }

    @Test
    @DisplayName("Embeddings summary lists pages without vectors")
    void shouldListPageSummaries() {
        when(fileCatalog.isOwnedBy("t1", "f1")).thenReturn(true);
        when(embeddingStore.get("f1")).thenReturn(List.of(
            new PageSummary(1, "Hello", true),
            new PageSummary(2, "", false)));

        FileEmbeddingsResponse response = fileEmbeddingService.getEmbeddings("t1", "f1");

        assertThat(response.fileId()).isEqualTo("f1");
        assertThat(response.pages()).extracting("pageId", "ocr", "hasVector")
            .containsExactly(
                tuple(1, "Hello", true),
                tuple(2, "", false));
    }

    @Test
    @DisplayName("Status of a never-indexed file is NOT_INDEXED")
    void shouldReportNotIndexed() {
        when(fileCatalog.isOwnedBy("t1", "f1")).thenReturn(true);
        when(runRepository.findByFileId("f1")).thenReturn(Optional.empty());

        IndexingStatusResponse status = fileEmbeddingService.getStatus("t1", "f1");

        assertThat(status.status()).isEqualTo(IndexingStatus.NOT_INDEXED);
        assertThat(status.attempts()).isZero();
    }

    @Test
    @DisplayName("Status reflects the stored run record")
    void shouldReportRunState() {
        OffsetDateTime now = OffsetDateTime.now();
        when(fileCatalog.isOwnedBy("t1", "f1")).thenReturn(true);
        when(runRepository.findByFileId("f1")).thenReturn(Optional.of(
            new IndexingRun("f1", IndexingStatus.EMBEDDING, 4, 10, null, 2, now, now)));

        IndexingStatusResponse status = fileEmbeddingService.getStatus("t1", "f1");

        assertThat(status.status()).isEqualTo(IndexingStatus.EMBEDDING);
        assertThat(status.currentPage()).isEqualTo(4);
        assertThat(status.totalPages()).isEqualTo(10);
        assertThat(status.attempts()).isEqualTo(2);
    }

    @Test
    @DisplayName("Deletion removes page rows and the run record")
    void shouldCascadeDeletion() {
        when(fileCatalog.fileExists("f1")).thenReturn(false);
        when(embeddingStore.deleteByFile("f1")).thenReturn(3);

        assertThat(fileEmbeddingService.deleteFile("f1").pagesDeleted()).isEqualTo(3);
        verify(runRepository).deleteByFileId("f1");
    }

    @Test
    @DisplayName("Deleting a file without embeddings is a no-op, not an error")
    void shouldTolerateDeletingUnindexedFile() {
        when(fileCatalog.fileExists("f1")).thenReturn(false);
        when(embeddingStore.deleteByFile("f1")).thenReturn(0);

        assertThat(fileEmbeddingService.deleteFile("f1").pagesDeleted()).isZero();
    }

    @Test
    @DisplayName("The deletion hook refuses a file that is still live and keeps its index")
    void shouldRefuseDeletingLiveFile() {
        when(fileCatalog.fileExists("live")).thenReturn(true);

        assertThatThrownBy(() -> fileEmbeddingService.deleteFile("live"))
            .isInstanceOf(FileStillPresentException.class)
            .hasMessageContaining("live");

        verifyNoInteractions(embeddingStore, runRepository);
    }
}
