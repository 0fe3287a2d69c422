package com.nevis.hybrid.exception;

import lombok.Getter;

@Getter
public class DuplicateDocumentException extends HybridStoreException {

    private final String documentId;

    public DuplicateDocumentException(String documentId, Throwable cause) {
        super(ErrorKind.CONFLICT, "Document already exists: " + documentId, cause);
        this.documentId = documentId;
    }
}
