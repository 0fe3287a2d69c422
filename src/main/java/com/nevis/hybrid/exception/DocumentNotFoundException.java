package com.nevis.hybrid.exception;

import lombok.Getter;

@Getter
public class DocumentNotFoundException extends HybridStoreException {

    private final String documentId;

    public DocumentNotFoundException(String documentId) {
        super(ErrorKind.NOT_FOUND, "Document not found: " + documentId);
        this.documentId = documentId;
    }
}
