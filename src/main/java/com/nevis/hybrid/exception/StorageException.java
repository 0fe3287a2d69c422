package com.nevis.hybrid.exception;

import lombok.Getter;

import java.util.List;

/**
 * Storage backend failure, wrapped with the operation and the document ids it touched.
 */
@Getter
public class StorageException extends HybridStoreException {

    private final String operation;
    private final List<String> documentIds;

    public StorageException(String operation, List<String> documentIds, Throwable cause) {
        super(ErrorKind.STORAGE, describe(operation, documentIds, cause), cause);
        this.operation = operation;
        this.documentIds = List.copyOf(documentIds);
    }

    private static String describe(String operation, List<String> documentIds, Throwable cause) {
        String ids = documentIds.isEmpty() ? "" : " " + documentIds;
        return "Storage operation '" + operation + "' failed" + ids + ": " + cause.getMessage();
    }
}
