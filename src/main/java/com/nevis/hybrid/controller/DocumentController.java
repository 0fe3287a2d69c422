package com.nevis.hybrid.controller;

import com.nevis.hybrid.exception.DocumentNotFoundException;
import com.nevis.hybrid.model.StoreStats;
import com.nevis.hybrid.service.HybridStore;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.concurrent.CompletableFuture;

@RestController
@RequiredArgsConstructor
public class DocumentController {

    private final HybridStore hybridStore;

    @PostMapping("/documents")
    public CompletableFuture<ResponseEntity<InsertDocumentsResponse>> insertDocuments(
        @Valid @RequestBody InsertDocumentsRequest request) {

        return hybridStore.insert(request.documents().stream().map(DocumentRequest::toNewDocument).toList())
            .thenApply(ids -> ResponseEntity.status(HttpStatus.CREATED).body(new InsertDocumentsResponse(ids)));
    }

    @GetMapping("/documents/{id}")
    public CompletableFuture<ResponseEntity<DocumentResponse>> getDocument(@PathVariable String id) {
        return hybridStore.get(id)
            .thenApply(document -> document
                .map(DocumentResponse::from)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new DocumentNotFoundException(id)));
    }

    @PatchMapping("/documents/{id}")
    public CompletableFuture<ResponseEntity<DocumentResponse>> updateDocument(
        @PathVariable String id,
        @RequestBody UpdateDocumentRequest request) {

        return hybridStore.update(id, request.toUpdate())
            .thenApply(document -> ResponseEntity.ok(DocumentResponse.from(document)));
    }

    @DeleteMapping("/documents/{id}")
    public CompletableFuture<ResponseEntity<Void>> deleteDocument(@PathVariable String id) {
        return hybridStore.delete(id).thenApply(ignored -> ResponseEntity.noContent().<Void>build());
    }

    @PostMapping("/documents/delete-by-filter")
    public CompletableFuture<ResponseEntity<DeleteByFilterResponse>> deleteByFilter(@RequestBody FilterRequest request) {
        return hybridStore.deleteByFilter(FilterRequest.toFilter(request))
            .thenApply(deleted -> ResponseEntity.ok(new DeleteByFilterResponse(deleted)));
    }

    @DeleteMapping("/documents")
    public CompletableFuture<ResponseEntity<Void>> clearDocuments() {
        return hybridStore.clear().thenApply(ignored -> ResponseEntity.noContent().<Void>build());
    }

    @GetMapping("/stats")
    public CompletableFuture<ResponseEntity<StoreStats>> stats() {
        return hybridStore.stats().thenApply(ResponseEntity::ok);
    }
}
