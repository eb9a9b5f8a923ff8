package com.filerepo.extraction.controller;

import com.filerepo.extraction.service.FileEmbeddingService;
import com.filerepo.extraction.service.SearchService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/v2/tenants/{tenantId}/embeddings")
@RequiredArgsConstructor
public class EmbeddingController {

    private final FileEmbeddingService fileEmbeddingService;
    private final SearchService searchService;

    @PostMapping("/search")
    public ResponseEntity<SearchResponse> searchTenant(
        @PathVariable String tenantId,
        @Valid @RequestBody SearchRequest request) {

        return ResponseEntity.ok(searchService.searchTenant(tenantId, request.query(), request.topK()));
    }

    @PostMapping("/search/{fileId}")
    public ResponseEntity<SearchResponse> searchFile(
        @PathVariable String tenantId,
        @PathVariable String fileId,
        @Valid @RequestBody SearchRequest request) {

        return ResponseEntity.ok(searchService.searchFile(tenantId, fileId, request.query(), request.topK()));
    }

    @PostMapping("/{fileId}")
    public ResponseEntity<IndexResponse> index(
        @PathVariable String tenantId,
        @PathVariable String fileId,
        @RequestParam(name = "async", defaultValue = "false") boolean async) {

        if (async) {
            fileEmbeddingService.indexAsync(tenantId, fileId);
            return ResponseEntity.accepted().build();
        }
        return ResponseEntity.ok(fileEmbeddingService.index(tenantId, fileId));
    }

    @GetMapping("/{fileId}")
    public ResponseEntity<FileEmbeddingsResponse> getEmbeddings(
        @PathVariable String tenantId,
        @PathVariable String fileId) {

        return ResponseEntity.ok(fileEmbeddingService.getEmbeddings(tenantId, fileId));
    }

    @GetMapping("/{fileId}/status")
    public ResponseEntity<IndexingStatusResponse> getStatus(
        @PathVariable String tenantId,
        @PathVariable String fileId) {

        return ResponseEntity.ok(fileEmbeddingService.getStatus(tenantId, fileId));
    }

    @DeleteMapping("/{fileId}")
    public ResponseEntity<DeleteEmbeddingsResponse> deleteEmbeddings(
        @PathVariable String tenantId,
        @PathVariable String fileId) {

        return ResponseEntity.ok(fileEmbeddingService.deleteFile(fileId));
    }
}
