package com.nevis.hybrid.controller;

import com.nevis.hybrid.service.HybridStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/search")
@RequiredArgsConstructor
public class SearchController {

    private final HybridStore hybridStore;

    @PostMapping
    public CompletableFuture<ResponseEntity<SearchResponse>> search(@Valid @RequestBody SearchRequest request) {
        return hybridStore.search(request.query(), request.toOptions())
            .thenApply(results -> ResponseEntity.ok(new SearchResponse(results)));
    }

    @PostMapping("/embedding")
    public CompletableFuture<ResponseEntity<SearchResponse>> searchByEmbedding(
        @Valid @RequestBody EmbeddingSearchRequest request) {

        return hybridStore.searchByEmbedding(request.embedding(), request.toOptions())
            .thenApply(results -> ResponseEntity.ok(new SearchResponse(results)));
    }

    @PostMapping("/text")
    public CompletableFuture<ResponseEntity<SearchResponse>> textSearch(@Valid @RequestBody SearchRequest request) {
        return hybridStore.textSearch(request.query(), request.toOptions())
            .thenApply(results -> ResponseEntity.ok(new SearchResponse(results)));
    }

    @PostMapping("/hybrid")
    public CompletableFuture<ResponseEntity<SearchResponse>> hybridSearch(
        @Valid @RequestBody HybridSearchRequest request) {

        return hybridStore.hybridSearch(request.query(), request.toOptions())
            .thenApply(results -> ResponseEntity.ok(new SearchResponse(results)));
    }
}
