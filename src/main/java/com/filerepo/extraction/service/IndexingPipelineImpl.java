package com.filerepo.extraction.service;

import com.filerepo.extraction.client.FileCatalog;
import com.filerepo.extraction.config.IndexingProperties;
import com.filerepo.extraction.embedding.Embedder;
import com.filerepo.extraction.exception.AlreadyIndexingException;
import com.filerepo.extraction.exception.ExtractionException;
import com.filerepo.extraction.exception.IndexingTimedOutException;
import com.filerepo.extraction.exception.InvalidArgumentException;
import com.filerepo.extraction.exception.RunSupersededException;
import com.filerepo.extraction.extractor.PageExtractor;
import com.filerepo.extraction.model.IndexingOutcome;
import com.filerepo.extraction.model.IndexingResult;
import com.filerepo.extraction.model.IndexingStatus;
import com.filerepo.extraction.model.PageImage;
import com.filerepo.extraction.model.PageRow;
import com.filerepo.extraction.model.RecognizedText;
import com.filerepo.extraction.ocr.TextRecognizer;
import com.filerepo.extraction.repository.EmbeddingStore;
import com.filerepo.extraction.repository.IndexingRunRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

@Slf4j
@Service
public class IndexingPipelineImpl implements IndexingPipeline {

    private final FileCatalog fileCatalog;
    private final PageExtractor pageExtractor;
    private final TextRecognizer textRecognizer;
    private final Embedder embedder;
    private final EmbeddingStore embeddingStore;
    private final IndexingRunRepository runRepository;
    private final IndexingProperties properties;
    private final AsyncTaskExecutor pageExecutor;

    public IndexingPipelineImpl(
        FileCatalog fileCatalog,
        PageExtractor pageExtractor,
        TextRecognizer textRecognizer,
        Embedder embedder,
        EmbeddingStore embeddingStore,
        IndexingRunRepository runRepository,
        IndexingProperties properties,
        @Qualifier("pageTaskExecutor") AsyncTaskExecutor pageExecutor
    ) {
        this.fileCatalog = fileCatalog;
        this.pageExtractor = pageExtractor;
        this.textRecognizer = textRecognizer;
        this.embedder = embedder;
        this.embeddingStore = embeddingStore;
        this.runRepository = runRepository;
        this.properties = properties;
        this.pageExecutor = pageExecutor;
    }

    @Override
    public IndexingResult indexFile(String fileId) {
        if (fileId == null || fileId.isBlank()) {
            throw new InvalidArgumentException("File id cannot be empty");
        }

        int attempt = runRepository.claim(fileId).orElseThrow(() -> {
            log.warn("File {}: rejected, another indexing run is active", fileId);
            return new AlreadyIndexingException(fileId);
        }).attempts();

        log.info("File {}: indexing run {} started", fileId, attempt);
        Run run = new Run(fileId, attempt, Instant.now().plus(properties.deadline()));

        IndexingResult result;
        try {
            result = execute(run);
        } catch (RuntimeException e) {
            log.error("File {}: indexing run {} failed: {}", fileId, attempt, e.getMessage());
            finish(run, IndexingStatus.FAILED, e.getMessage());
            throw e;
        } finally {
            run.cancelled.set(true);
        }

        if (result.outcome() == IndexingOutcome.FAILED) {
            log.error("File {}: {}", fileId, result.message());
            finish(run, IndexingStatus.FAILED, result.message());
        } else {
            log.info("File {}: {} ({}/{} pages embedded)",
                fileId, result.outcome(), result.pagesProcessed(), result.pagesTotal());
            finish(run, IndexingStatus.INDEXED, result.failedPages().isEmpty() ? null : result.message());
        }
        return result;
    }

    private IndexingResult execute(Run run) {
        String fileId = run.fileId;
        byte[] content = fileCatalog.getFileBytes(fileId);
        List<PageImage> pages = pageExtractor.extractPages(content);
        int total = pages.size();

        if (total == 0) {
            advance(run, IndexingStatus.PERSISTING, 0, 0);
            embeddingStore.put(fileId, List.of());
            return IndexingResult.empty(fileId);
        }

        advance(run, IndexingStatus.RECOGNIZING, 0, total);
        Map<Integer, RecognizedText> recognized = runStage(run, pages, IndexingStatus.RECOGNIZING,
            page -> recognize(fileId, page));

        List<PageImage> toEmbed = pages.stream()
            .filter(page -> recognized.containsKey(page.pageNumber()))
            .filter(page -> !recognized.get(page.pageNumber()).isBlank())
            .toList();

        advance(run, IndexingStatus.EMBEDDING, 0, total);
        Map<Integer, float[]> vectors = runStage(run, toEmbed, IndexingStatus.EMBEDDING,
            page -> embed(fileId, page.pageNumber(), recognized.get(page.pageNumber()).text()));

        List<PageRow> rows = new ArrayList<>();
        List<Integer> failedPages = new ArrayList<>();
        int processed = 0;

        for (PageImage page : pages) {
            int pageId = page.pageNumber();
            RecognizedText text = recognized.get(pageId);
            if (text == null) {
                failedPages.add(pageId);
            } else if (text.isBlank()) {
                if (properties.retainBlankPages()) {
                    rows.add(PageRow.blank(pageId, text.text()));
                }
            } else if (vectors.containsKey(pageId)) {
                rows.add(new PageRow(pageId, vectors.get(pageId), text.text()));
                processed++;
            } else {
                failedPages.add(pageId);
            }
        }

        if (failedPages.size() == total) {
            return new IndexingResult(fileId, IndexingOutcome.FAILED, 0, total, failedPages,
                "All " + total + " pages failed; previous embeddings kept");
        }

        checkDeadline(run);
        advance(run, IndexingStatus.PERSISTING, total, total);
        embeddingStore.put(fileId, rows);

        if (failedPages.isEmpty()) {
            return new IndexingResult(fileId, IndexingOutcome.INDEXED, processed, total, failedPages,
                "Indexed " + total + " pages");
        }
        return new IndexingResult(fileId, IndexingOutcome.PARTIALLY_INDEXED, processed, total, failedPages,
            failedPages.size() + " of " + total + " pages failed");
    }

    /**
     * Fans {@code task} out over {@code pages} and waits for all of them within the run deadline.
     * Pages whose task yields null are left out of the returned map. Once the run is cancelled, queued
     * tasks skip the model call and running ones are interrupted.
     */
    private <T> Map<Integer, T> runStage(
        Run run,
        List<PageImage> pages,
        IndexingStatus stage,
        Function<PageImage, T> task
    ) {
        int total = pages.size();
        AtomicInteger completed = new AtomicInteger();

        List<Future<T>> futures = new ArrayList<>(total);
        for (PageImage page : pages) {
            futures.add(pageExecutor.submit(() -> {
                if (run.cancelled.get()) {
                    return null;
                }
                T value = task.apply(page);
                if (!run.cancelled.get()) {
                    runRepository.updateProgress(run.fileId, run.attempt, stage, completed.incrementAndGet(), total);
                }
                return value;
            }));
        }

        Map<Integer, T> results = new TreeMap<>();
        for (int i = 0; i < total; i++) {
            T value = await(run, futures, futures.get(i));
            if (value != null) {
                results.put(pages.get(i).pageNumber(), value);
            }
        }
        return results;
    }

    private <T> T await(Run run, List<? extends Future<?>> stage, Future<T> future) {
        long remainingMillis = Duration.between(Instant.now(), run.deadline).toMillis();
        try {
            return future.get(Math.max(remainingMillis, 0), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            cancel(run, stage);
            throw new IndexingTimedOutException(run.fileId, properties.deadline());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            cancel(run, stage);
            throw new IllegalStateException("Interrupted while indexing file " + run.fileId, e);
        } catch (ExecutionException e) {
            cancel(run, stage);
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new IllegalStateException("Indexing of file " + run.fileId + " failed", e.getCause());
        }
    }

    private static void cancel(Run run, List<? extends Future<?>> futures) {
        run.cancelled.set(true);
        futures.forEach(future -> future.cancel(true));
    }

    private void advance(Run run, IndexingStatus status, int currentPage, int totalPages) {
        if (!runRepository.updateProgress(run.fileId, run.attempt, status, currentPage, totalPages)) {
            log.warn("File {}: run {} no longer holds the file, stopping before {}", run.fileId, run.attempt, status);
            throw new RunSupersededException(run.fileId);
        }
    }

    private void finish(Run run, IndexingStatus status, String message) {
        if (!runRepository.finish(run.fileId, run.attempt, status, message)) {
            log.warn("File {}: run {} no longer holds the file, {} not recorded", run.fileId, run.attempt, status);
        }
    }

    private void checkDeadline(Run run) {
        if (Instant.now().isAfter(run.deadline)) {
            throw new IndexingTimedOutException(run.fileId, properties.deadline());
        }
    }

    private RecognizedText recognize(String fileId, PageImage page) {
        try {
            return textRecognizer.recognize(page);
        } catch (ExtractionException e) {
            log.warn("File {}: OCR failed for page {}: {}", fileId, page.pageNumber(), e.getMessage());
            return null;
        }
    }

    private float[] embed(String fileId, int pageId, String text) {
        try {
            return embedder.embed(text);
        } catch (ExtractionException e) {
            log.warn("File {}: embedding failed for page {}: {}", fileId, pageId, e.getMessage());
            return null;
        }
    }

    /**
     * One claimed run. {@code attempt} is the claim token; {@code cancelled} stops page tasks still queued
     * or running once the run has ended.
     */
    private static final class Run {
        private final String fileId;
        private final int attempt;
        private final Instant deadline;
        private final AtomicBoolean cancelled = new AtomicBoolean();

        private Run(String fileId, int attempt, Instant deadline) {
            this.fileId = fileId;
            this.attempt = attempt;
            this.deadline = deadline;
        }
    }
}
